package com.canonicalsync.core.client;

import com.canonicalsync.core.model.GitRepositoryConfig;

import java.util.List;

/**
 * Read access to the Git host holding an environment's workflow files.
 * Implementations throw UpstreamUnavailableException when the host cannot be reached.
 */
public interface GitClient {

    /**
     * Resolve the commit sha at the head of a branch.
     */
    String headCommit(GitRepositoryConfig repository, String branch);

    /**
     * List file paths directly under a folder at the given commit.
     */
    List<String> listFiles(GitRepositoryConfig repository, String folder, String commitSha);

    /**
     * Read a file's raw bytes at the given commit.
     */
    byte[] readFile(GitRepositoryConfig repository, String path, String commitSha);
}
