package com.canonicalsync.api.client;

import com.canonicalsync.core.client.GitClient;
import com.canonicalsync.core.exception.NotFoundException;
import com.canonicalsync.core.exception.SyncConfigurationException;
import com.canonicalsync.core.exception.UpstreamUnavailableException;
import com.canonicalsync.core.exception.WorkflowFetchException;
import com.canonicalsync.core.model.GitRepositoryConfig;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;

/**
 * Git client backed by the GitHub REST API (commits and contents endpoints).
 */
public class GitHubGitClient implements GitClient {

    private static final String UPSTREAM = "github";

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final String apiUrl;
    private final Duration requestTimeout;

    public GitHubGitClient(HttpClient httpClient, ObjectMapper objectMapper, String apiUrl, Duration requestTimeout) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.apiUrl = apiUrl.endsWith("/") ? apiUrl.substring(0, apiUrl.length() - 1) : apiUrl;
        this.requestTimeout = requestTimeout;
    }

    @Override
    public String headCommit(GitRepositoryConfig repository, String branch) {
        String uri = repoApi(repository) + "/commits/" + encode(branch);
        JsonNode commit = readJson(requireSuccess(send(repository, uri), uri));
        String sha = commit.path("sha").asText(null);
        if (sha == null || sha.isBlank()) {
            throw new UpstreamUnavailableException(UPSTREAM, "no commit sha for branch " + branch, null);
        }
        return sha;
    }

    @Override
    public List<String> listFiles(GitRepositoryConfig repository, String folder, String commitSha) {
        String uri = repoApi(repository) + "/contents/" + folder + "?ref=" + encode(commitSha);
        HttpResponse<String> response = send(repository, uri);
        if (response.statusCode() == 404) {
            // Folder not created yet
            return List.of();
        }

        JsonNode entries = readJson(requireSuccess(response, uri));
        List<String> paths = new ArrayList<>();
        for (JsonNode entry : entries) {
            if ("file".equals(entry.path("type").asText())) {
                paths.add(entry.path("path").asText());
            }
        }
        return paths;
    }

    @Override
    public byte[] readFile(GitRepositoryConfig repository, String path, String commitSha) {
        String uri = repoApi(repository) + "/contents/" + path + "?ref=" + encode(commitSha);
        HttpResponse<String> response = send(repository, uri);
        int status = response.statusCode();
        if (status == 404) {
            throw new NotFoundException("GitFile", path);
        }
        if (status < 200 || status >= 300) {
            throw new WorkflowFetchException(UPSTREAM, path, "HTTP " + status, null);
        }

        JsonNode file;
        try {
            file = objectMapper.readTree(response.body());
        } catch (IOException e) {
            throw new WorkflowFetchException(UPSTREAM, path, "malformed contents body", e);
        }
        String content = file.path("content").asText("");
        if (!"base64".equals(file.path("encoding").asText())) {
            return content.getBytes(StandardCharsets.UTF_8);
        }
        return Base64.getMimeDecoder().decode(content);
    }

    /**
     * Owner and repository name from an https or ssh GitHub URL.
     */
    static String[] ownerAndName(String repoUrl) {
        String trimmed = repoUrl.trim();
        if (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        if (trimmed.endsWith(".git")) {
            trimmed = trimmed.substring(0, trimmed.length() - 4);
        }
        String[] parts = trimmed.replace(':', '/').split("/");
        if (parts.length < 2 || parts[parts.length - 1].isBlank() || parts[parts.length - 2].isBlank()) {
            throw new SyncConfigurationException(repoUrl, List.of("repository url is not a GitHub repository"));
        }
        return new String[] { parts[parts.length - 2], parts[parts.length - 1] };
    }

    private String repoApi(GitRepositoryConfig repository) {
        String[] ownerAndName = ownerAndName(repository.repoUrl());
        return apiUrl + "/repos/" + ownerAndName[0] + "/" + ownerAndName[1];
    }

    private HttpResponse<String> send(GitRepositoryConfig repository, String uri) {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
            .uri(URI.create(uri))
            .timeout(requestTimeout)
            .header("Accept", "application/vnd.github+json")
            .GET();
        if (repository.accessToken() != null && !repository.accessToken().isBlank()) {
            builder.header("Authorization", "Bearer " + repository.accessToken());
        }

        try {
            return httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new UpstreamUnavailableException(UPSTREAM, "request to " + uri + " failed", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new UpstreamUnavailableException(UPSTREAM, "interrupted calling " + uri, e);
        }
    }

    private String requireSuccess(HttpResponse<String> response, String uri) {
        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            throw new UpstreamUnavailableException(UPSTREAM, "HTTP " + status + " from " + uri, null);
        }
        return response.body();
    }

    private JsonNode readJson(String body) {
        try {
            return objectMapper.readTree(body);
        } catch (IOException e) {
            throw new UpstreamUnavailableException(UPSTREAM, "malformed response body", e);
        }
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
