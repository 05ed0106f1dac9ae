package com.canonicalsync.engine.persistence;

import com.canonicalsync.core.exception.DuplicateActiveJobException;
import com.canonicalsync.core.model.SyncJob;
import com.canonicalsync.core.model.SyncJobKind;
import com.canonicalsync.core.model.SyncJobStatus;
import com.canonicalsync.core.repository.EnvironmentRepository;
import com.canonicalsync.core.repository.SyncJobRepository;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of SyncJobRepository.
 * For demonstration and testing purposes.
 *
 * Writes are serialized on the job map so the one-active-job rule holds
 * under concurrent callers, mirroring the partial unique index of the JDBC store.
 * Finishing a job advances the environment timestamp under the same lock.
 */
public class InMemorySyncJobRepository implements SyncJobRepository {

    private final Map<UUID, SyncJob> jobs = new ConcurrentHashMap<>();
    private final EnvironmentRepository environmentRepository;

    public InMemorySyncJobRepository(EnvironmentRepository environmentRepository) {
        this.environmentRepository = environmentRepository;
    }

    @Override
    public void create(SyncJob job) {
        synchronized (jobs) {
            if (job.status().isActive()
                    && findActive(job.tenantId(), job.environmentId(), job.jobKind()).isPresent()) {
                throw new DuplicateActiveJobException(job.tenantId(), job.environmentId(), job.jobKind());
            }
            jobs.put(job.jobId(), job);
        }
    }

    @Override
    public boolean update(SyncJob job, SyncJobStatus expectedStatus) {
        synchronized (jobs) {
            SyncJob current = jobs.get(job.jobId());
            if (current == null || current.status() != expectedStatus) {
                return false;
            }
            jobs.put(job.jobId(), job);
            return true;
        }
    }

    @Override
    public boolean finish(SyncJob job, SyncJobStatus expectedStatus) {
        synchronized (jobs) {
            if (!update(job, expectedStatus)) {
                return false;
            }
            environmentRepository.markSynced(job.tenantId(), job.environmentId(), job.jobKind(), job.updatedAt());
            return true;
        }
    }

    @Override
    public Optional<SyncJob> findById(UUID jobId) {
        return Optional.ofNullable(jobs.get(jobId));
    }

    @Override
    public Optional<SyncJob> findActive(String tenantId, String environmentId, SyncJobKind jobKind) {
        return jobs.values().stream()
            .filter(j -> matches(j, tenantId, environmentId, jobKind))
            .filter(j -> j.status().isActive())
            .findFirst();
    }

    @Override
    public Optional<SyncJob> findLatest(String tenantId, String environmentId, SyncJobKind jobKind) {
        return jobs.values().stream()
            .filter(j -> matches(j, tenantId, environmentId, jobKind))
            .max(Comparator.comparing(SyncJob::createdAt));
    }

    @Override
    public List<SyncJob> findStale(Instant olderThan, int limit) {
        return jobs.values().stream()
            .filter(j -> j.status().isActive())
            .filter(j -> j.updatedAt().isBefore(olderThan))
            .sorted(Comparator.comparing(SyncJob::updatedAt))
            .limit(limit)
            .toList();
    }

    private static boolean matches(SyncJob job, String tenantId, String environmentId, SyncJobKind jobKind) {
        return job.tenantId().equals(tenantId)
            && job.environmentId().equals(environmentId)
            && job.jobKind() == jobKind;
    }
}
