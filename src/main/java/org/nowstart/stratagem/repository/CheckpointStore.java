package org.nowstart.stratagem.repository;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.Set;
import org.nowstart.stratagem.pipeline.PipelineState;

/**
 * Keyed snapshots of pipeline state. Calls on one key are serialized; calls on different keys are independent.
 */
public interface CheckpointStore {

    void save(String sessionId, PipelineState state);

    Optional<PipelineState> load(String sessionId);

    void delete(String sessionId);

    boolean exists(String sessionId);

    /**
     * Removes checkpoints whose last update is older than {@code ttl}.
     *
     * @return number of removed checkpoints
     */
    int evictExpired(Instant now, Duration ttl);

    Set<String> keys();
}
