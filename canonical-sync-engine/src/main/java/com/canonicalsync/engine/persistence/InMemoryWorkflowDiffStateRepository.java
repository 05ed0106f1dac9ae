package com.canonicalsync.engine.persistence;

import com.canonicalsync.core.model.WorkflowDiffState;
import com.canonicalsync.core.repository.WorkflowDiffStateRepository;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of WorkflowDiffStateRepository.
 * For demonstration and testing purposes.
 */
public class InMemoryWorkflowDiffStateRepository implements WorkflowDiffStateRepository {

    private record Key(String tenantId, String sourceEnvironmentId, String targetEnvironmentId, String canonicalId) {}

    private final Map<Key, WorkflowDiffState> states = new ConcurrentHashMap<>();

    @Override
    public void upsert(WorkflowDiffState state) {
        states.put(new Key(state.tenantId(), state.sourceEnvironmentId(),
            state.targetEnvironmentId(), state.canonicalId()), state);
    }

    @Override
    public Optional<WorkflowDiffState> find(
            String tenantId, String sourceEnvironmentId, String targetEnvironmentId, String canonicalId) {
        return Optional.ofNullable(states.get(new Key(tenantId, sourceEnvironmentId, targetEnvironmentId, canonicalId)));
    }

    @Override
    public List<WorkflowDiffState> findByPair(String tenantId, String sourceEnvironmentId, String targetEnvironmentId) {
        return states.values().stream()
            .filter(s -> s.tenantId().equals(tenantId)
                && s.sourceEnvironmentId().equals(sourceEnvironmentId)
                && s.targetEnvironmentId().equals(targetEnvironmentId))
            .sorted(Comparator.comparing(WorkflowDiffState::canonicalId))
            .toList();
    }

    @Override
    public void delete(String tenantId, String sourceEnvironmentId, String targetEnvironmentId, String canonicalId) {
        states.remove(new Key(tenantId, sourceEnvironmentId, targetEnvironmentId, canonicalId));
    }
}
