package com.canonicalsync.engine.persistence;

import com.canonicalsync.core.model.MappingStatus;
import com.canonicalsync.core.model.WorkflowEnvironmentMapping;
import com.canonicalsync.core.repository.WorkflowMappingRepository;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of WorkflowMappingRepository.
 * For demonstration and testing purposes.
 */
public class InMemoryWorkflowMappingRepository implements WorkflowMappingRepository {

    private record Key(String tenantId, String environmentId, String runtimeInstanceId) {}

    private final Map<Key, WorkflowEnvironmentMapping> mappings = new ConcurrentHashMap<>();

    @Override
    public void upsert(WorkflowEnvironmentMapping mapping) {
        mappings.put(keyOf(mapping), mapping);
    }

    @Override
    public Optional<WorkflowEnvironmentMapping> findByRuntimeInstance(
            String tenantId, String environmentId, String runtimeInstanceId) {
        return Optional.ofNullable(mappings.get(new Key(tenantId, environmentId, runtimeInstanceId)));
    }

    @Override
    public List<WorkflowEnvironmentMapping> findByEnvironment(String tenantId, String environmentId) {
        return mappings.values().stream()
            .filter(m -> m.tenantId().equals(tenantId) && m.environmentId().equals(environmentId))
            .sorted(Comparator.comparing(WorkflowEnvironmentMapping::runtimeInstanceId))
            .toList();
    }

    @Override
    public List<WorkflowEnvironmentMapping> findByCanonicalId(String tenantId, String environmentId, String canonicalId) {
        return findByEnvironment(tenantId, environmentId).stream()
            .filter(m -> Objects.equals(m.canonicalId(), canonicalId))
            .toList();
    }

    @Override
    public boolean updateStatus(
            String tenantId, String environmentId, String runtimeInstanceId,
            MappingStatus status, Instant lastSyncedAt) {
        return mappings.computeIfPresent(
            new Key(tenantId, environmentId, runtimeInstanceId),
            (key, existing) -> existing.withStatus(status, lastSyncedAt)) != null;
    }

    private static Key keyOf(WorkflowEnvironmentMapping mapping) {
        return new Key(mapping.tenantId(), mapping.environmentId(), mapping.runtimeInstanceId());
    }
}
