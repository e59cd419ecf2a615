package org.nowstart.stratagem.repository;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import org.junit.jupiter.api.Test;
import org.nowstart.stratagem.data.type.NodeName;
import org.nowstart.stratagem.data.type.SessionStatus;
import org.nowstart.stratagem.pipeline.PipelineState;
import org.nowstart.stratagem.pipeline.PipelineTestFixtures;
import org.nowstart.stratagem.strategy.StrategyFixtures;
import org.nowstart.stratagem.strategy.StrategySpec;
import org.nowstart.stratagem.strategy.Trade;
import org.nowstart.stratagem.strategy.ValidationResult;

class CheckpointSerializerTest {

    private final CheckpointSerializer serializer = new CheckpointSerializer();

    @Test
    void serialize_keepsPersistentSlotsAndDropsComputedArtifacts() {
        PipelineState state = PipelineTestFixtures.newState("session-1", "ma cross on AAPL");
        StrategySpec spec = StrategyFixtures.maCrossSpec("AAPL");
        Trade trade = Trade.open(StrategyFixtures.START, 100.0, "Entry")
                .close(StrategyFixtures.START.plusDays(3), 110.0, "Exit");
        PipelineTestFixtures.writeAs(state, NodeName.TRANSLATE, () -> state.getPayload().setSpec(spec));
        PipelineTestFixtures.writeAs(state, NodeName.VALIDATE,
                () -> state.getPayload().setValidationResult(ValidationResult.of(List.of(), List.of("short window"))));
        PipelineTestFixtures.writeAs(state, NodeName.FETCH_DATA,
                () -> state.getPayload().setPriceSeries(StrategyFixtures.wave("AAPL", 30)));
        PipelineTestFixtures.writeAs(state, NodeName.TRADES, () -> state.getPayload().setTrades(List.of(trade)));

        String json = serializer.serialize(state);
        PipelineState restored = serializer.deserialize(json);

        assertThat(json).contains("\"version\":1").doesNotContain("price_series").doesNotContain("backtest_run");
        assertThat(restored.getSessionId()).isEqualTo("session-1");
        assertThat(restored.getStatus()).isEqualTo(SessionStatus.RUNNING);
        assertThat(restored.getStepCursor()).isNull();
        assertThat(restored.getCreatedAt()).isEqualTo(PipelineTestFixtures.NOW);
        assertThat(restored.getPayload().getUserText()).isEqualTo("ma cross on AAPL");
        assertThat(restored.getPayload().getModel()).isEqualTo("gpt-4o-mini");
        assertThat(restored.getPayload().getSpec()).isEqualTo(spec);
        assertThat(restored.getPayload().getValidationResult().warnings()).containsExactly("short window");
        assertThat(restored.getPayload().getTrades()).containsExactly(trade);
        assertThat(restored.getPayload().getPriceSeries()).isNull();
        assertThat(restored.getPayload().getFeatures()).isNull();
        assertThat(restored.getPayload().getBacktestRun()).isNull();
    }

    @Test
    void deserialize_rejectsUnknownVersion() {
        String json = serializer.serialize(PipelineTestFixtures.newState("session-2", "text"))
                .replace("\"version\":1", "\"version\":99");

        assertThatThrownBy(() -> serializer.deserialize(json))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("version=99");
    }

    @Test
    void deserialize_wrapsMalformedJson() {
        assertThatThrownBy(() -> serializer.deserialize("{not json"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageStartingWith("Failed to read checkpoint");
    }
}
