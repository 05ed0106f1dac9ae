package com.canonicalsync.engine.persistence;

import com.canonicalsync.core.model.CanonicalGitState;
import com.canonicalsync.core.repository.CanonicalGitStateRepository;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of CanonicalGitStateRepository.
 * For demonstration and testing purposes.
 */
public class InMemoryCanonicalGitStateRepository implements CanonicalGitStateRepository {

    private record Key(String tenantId, String environmentId, String canonicalId) {}

    private final Map<Key, CanonicalGitState> states = new ConcurrentHashMap<>();

    @Override
    public void upsert(CanonicalGitState state) {
        states.put(new Key(state.tenantId(), state.environmentId(), state.canonicalId()), state);
    }

    @Override
    public Optional<CanonicalGitState> find(String tenantId, String environmentId, String canonicalId) {
        return Optional.ofNullable(states.get(new Key(tenantId, environmentId, canonicalId)));
    }

    @Override
    public List<CanonicalGitState> findByContentHash(String tenantId, String environmentId, String contentHash) {
        return findByEnvironment(tenantId, environmentId).stream()
            .filter(s -> contentHash.equals(s.gitContentHash()))
            .toList();
    }

    @Override
    public List<CanonicalGitState> findByEnvironment(String tenantId, String environmentId) {
        return states.values().stream()
            .filter(s -> s.tenantId().equals(tenantId) && s.environmentId().equals(environmentId))
            .sorted(Comparator.comparing(CanonicalGitState::canonicalId))
            .toList();
    }
}
