package org.nowstart.stratagem.repository;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import org.junit.jupiter.api.Test;
import org.nowstart.stratagem.data.type.NodeName;
import org.nowstart.stratagem.pipeline.PipelineState;
import org.nowstart.stratagem.pipeline.PipelineTestFixtures;
import org.nowstart.stratagem.strategy.StrategyFixtures;

class InMemoryCheckpointStoreTest {

    private final InMemoryCheckpointStore store = new InMemoryCheckpointStore(new CheckpointSerializer());

    @Test
    void load_returnsSnapshotDetachedFromLiveState() {
        PipelineState state = PipelineTestFixtures.newState("session-1", "text");
        store.save("session-1", state);

        PipelineTestFixtures.writeAs(state, NodeName.TRANSLATE,
                () -> state.getPayload().setSpec(StrategyFixtures.maCrossSpec("AAPL")));

        PipelineState loaded = store.load("session-1").orElseThrow();
        assertThat(loaded).isNotSameAs(state);
        assertThat(loaded.getPayload().getSpec()).isNull();
        assertThat(store.exists("session-1")).isTrue();
        assertThat(store.load("missing")).isEmpty();
    }

    @Test
    void delete_removesKey() {
        store.save("a", PipelineTestFixtures.newState("a", "text"));
        store.save("b", PipelineTestFixtures.newState("b", "text"));

        store.delete("a");

        assertThat(store.keys()).containsExactly("b");
        assertThat(store.exists("a")).isFalse();
    }

    @Test
    void evictExpired_removesOnlyCheckpointsOlderThanTtl() {
        store.save("a", PipelineTestFixtures.newState("a", "text"));
        store.save("b", PipelineTestFixtures.newState("b", "text"));
        Duration ttl = Duration.ofHours(24);

        assertThat(store.evictExpired(PipelineTestFixtures.NOW.plus(Duration.ofHours(1)), ttl)).isZero();
        assertThat(store.evictExpired(PipelineTestFixtures.NOW.plus(Duration.ofHours(25)), ttl)).isEqualTo(2);
        assertThat(store.keys()).isEmpty();
    }
}
