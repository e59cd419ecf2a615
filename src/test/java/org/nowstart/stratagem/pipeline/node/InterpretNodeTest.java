package org.nowstart.stratagem.pipeline.node;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.nowstart.stratagem.data.exception.InvalidInputException;
import org.nowstart.stratagem.data.type.NodeName;
import org.nowstart.stratagem.pipeline.NodeOutcome;
import org.nowstart.stratagem.pipeline.PipelineRetryPolicies;
import org.nowstart.stratagem.pipeline.PipelineState;
import org.nowstart.stratagem.pipeline.PipelineTestFixtures;
import org.nowstart.stratagem.pipeline.collaborator.StrategyInterpreter;
import org.nowstart.stratagem.strategy.StrategyFixtures;
import org.nowstart.stratagem.strategy.StrategySpec;

@ExtendWith(MockitoExtension.class)
class InterpretNodeTest {

    @Mock
    private StrategyInterpreter strategyInterpreter;

    private final StrategySpec spec = StrategyFixtures.maCrossSpec("AAPL");

    @Test
    void run_storesInterpretation() {
        when(strategyInterpreter.interpret("buy AAPL", spec, "gpt-4o-mini")).thenReturn("Buys AAPL on a golden cross.");
        PipelineState state = stateWithSpec();

        NodeOutcome outcome = PipelineTestFixtures.runNode(node(), state, duration -> {
        });

        assertThat(outcome.isSoftFailure()).isFalse();
        assertThat(state.getPayload().getInterpretation()).isEqualTo("Buys AAPL on a golden cross.");
    }

    @Test
    void run_fallsBackToSummaryWhenModelFails() {
        when(strategyInterpreter.interpret(anyString(), any(), anyString()))
                .thenThrow(new InvalidInputException("Model returned an empty response"));
        PipelineState state = stateWithSpec();

        NodeOutcome outcome = PipelineTestFixtures.runNode(node(), state, duration -> {
        });

        assertThat(outcome.isSoftFailure()).isTrue();
        assertThat(outcome.warnings()).containsExactly("Interpretation generation failed: Model returned an empty response");
        assertThat(state.getPayload().getInterpretation())
                .isEqualTo("Backtest AAPL from 2020-01-01 to 2021-06-01 with 1 entry rule(s) and 1 exit rule(s).");
    }

    private PipelineState stateWithSpec() {
        PipelineState state = PipelineTestFixtures.newState("s-1", "buy AAPL");
        PipelineTestFixtures.writeAs(state, NodeName.TRANSLATE, () -> state.getPayload().setSpec(spec));
        return state;
    }

    private InterpretNode node() {
        return new InterpretNode(strategyInterpreter, new PipelineRetryPolicies(PipelineTestFixtures.properties(false)));
    }
}
