package com.canonicalsync.engine.persistence;

import com.canonicalsync.core.model.Environment;
import com.canonicalsync.core.model.SyncJobKind;
import com.canonicalsync.core.model.SyncTimestamps;
import com.canonicalsync.core.repository.EnvironmentRepository;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of EnvironmentRepository.
 * For demonstration and testing purposes.
 */
public class InMemoryEnvironmentRepository implements EnvironmentRepository {

    private record Key(String tenantId, String environmentId) {}

    private record TimestampKey(String tenantId, String environmentId, SyncJobKind jobKind) {}

    private final Map<Key, Environment> environments = new ConcurrentHashMap<>();
    private final Map<TimestampKey, SyncTimestamps> timestamps = new ConcurrentHashMap<>();

    /**
     * Register or replace an environment.
     */
    public void save(Environment environment) {
        environments.put(new Key(environment.tenantId(), environment.environmentId()), environment);
    }

    @Override
    public Optional<Environment> findById(String tenantId, String environmentId) {
        return Optional.ofNullable(environments.get(new Key(tenantId, environmentId)));
    }

    @Override
    public List<Environment> findByTenant(String tenantId) {
        return environments.values().stream()
            .filter(e -> e.tenantId().equals(tenantId))
            .sorted(Comparator.comparing(Environment::environmentId))
            .toList();
    }

    @Override
    public List<Environment> findAll() {
        return environments.values().stream()
            .sorted(Comparator.comparing(Environment::tenantId).thenComparing(Environment::environmentId))
            .toList();
    }

    @Override
    public Optional<SyncTimestamps> findSyncTimestamps(String tenantId, String environmentId, SyncJobKind jobKind) {
        return Optional.ofNullable(timestamps.get(new TimestampKey(tenantId, environmentId, jobKind)));
    }

    @Override
    public void markSyncAttempted(String tenantId, String environmentId, SyncJobKind jobKind, Instant at) {
        timestamps.compute(new TimestampKey(tenantId, environmentId, jobKind), (key, existing) ->
            new SyncTimestamps(tenantId, environmentId, jobKind, at, existing != null ? existing.lastSyncAt() : null));
    }

    @Override
    public void markSynced(String tenantId, String environmentId, SyncJobKind jobKind, Instant at) {
        timestamps.compute(new TimestampKey(tenantId, environmentId, jobKind), (key, existing) ->
            new SyncTimestamps(tenantId, environmentId, jobKind,
                existing != null ? existing.lastSyncAttemptedAt() : null, at));
    }
}
