package org.nowstart.stratagem.repository;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.stratagem.pipeline.PipelineState;
import org.springframework.stereotype.Repository;

/**
 * Process-local checkpoint store holding serialized JSON, so loads never share objects with a live session.
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class InMemoryCheckpointStore implements CheckpointStore {

    private final ConcurrentMap<String, StoredCheckpoint> checkpoints = new ConcurrentHashMap<>();
    private final CheckpointSerializer checkpointSerializer;

    @Override
    public void save(String sessionId, PipelineState state) {
        checkpoints.compute(sessionId, (key, previous) ->
                new StoredCheckpoint(checkpointSerializer.serialize(state), state.getUpdatedAt()));
        log.debug("event=checkpoint_saved session={} status={} cursor={}",
                sessionId, state.getStatus(), state.getStepCursor());
    }

    @Override
    public Optional<PipelineState> load(String sessionId) {
        StoredCheckpoint stored = checkpoints.get(sessionId);
        if (stored == null) {
            return Optional.empty();
        }
        return Optional.of(checkpointSerializer.deserialize(stored.json()));
    }

    @Override
    public void delete(String sessionId) {
        checkpoints.remove(sessionId);
    }

    @Override
    public boolean exists(String sessionId) {
        return checkpoints.containsKey(sessionId);
    }

    @Override
    public int evictExpired(Instant now, Duration ttl) {
        Instant cutoff = now.minus(ttl);
        int removed = 0;
        for (Map.Entry<String, StoredCheckpoint> entry : checkpoints.entrySet()) {
            if (entry.getValue().updatedAt().isBefore(cutoff) && checkpoints.remove(entry.getKey(), entry.getValue())) {
                removed++;
            }
        }
        return removed;
    }

    @Override
    public Set<String> keys() {
        return Set.copyOf(checkpoints.keySet());
    }

    private record StoredCheckpoint(String json, Instant updatedAt) {
    }
}
