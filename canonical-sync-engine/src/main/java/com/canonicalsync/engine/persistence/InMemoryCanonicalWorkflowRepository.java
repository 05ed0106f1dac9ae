package com.canonicalsync.engine.persistence;

import com.canonicalsync.core.model.CanonicalWorkflow;
import com.canonicalsync.core.repository.CanonicalWorkflowRepository;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of CanonicalWorkflowRepository.
 * For demonstration and testing purposes.
 */
public class InMemoryCanonicalWorkflowRepository implements CanonicalWorkflowRepository {

    private record Key(String tenantId, String canonicalId) {}

    private final Map<Key, CanonicalWorkflow> workflows = new ConcurrentHashMap<>();

    @Override
    public boolean createIfAbsent(CanonicalWorkflow workflow) {
        return workflows.putIfAbsent(new Key(workflow.tenantId(), workflow.canonicalId()), workflow) == null;
    }

    @Override
    public Optional<CanonicalWorkflow> findById(String tenantId, String canonicalId) {
        return Optional.ofNullable(workflows.get(new Key(tenantId, canonicalId)));
    }

    @Override
    public List<CanonicalWorkflow> findActive(String tenantId) {
        return workflows.values().stream()
            .filter(w -> w.tenantId().equals(tenantId))
            .filter(w -> !w.isDeleted())
            .sorted(Comparator.comparing(CanonicalWorkflow::canonicalId))
            .toList();
    }

    @Override
    public boolean markDeleted(String tenantId, String canonicalId, Instant deletedAt) {
        Key key = new Key(tenantId, canonicalId);
        CanonicalWorkflow existing = workflows.get(key);
        if (existing == null || existing.isDeleted()) {
            return false;
        }
        return workflows.replace(key, existing, existing.withDeletedAt(deletedAt));
    }
}
