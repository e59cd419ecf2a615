package org.nowstart.stratagem.pipeline.node;

import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.stratagem.data.exception.StateConsistencyException;
import org.nowstart.stratagem.data.type.NodeName;
import org.nowstart.stratagem.pipeline.NodeContext;
import org.nowstart.stratagem.pipeline.NodeOutcome;
import org.nowstart.stratagem.pipeline.PayloadField;
import org.nowstart.stratagem.pipeline.PipelineNode;
import org.nowstart.stratagem.pipeline.PipelinePayload;
import org.nowstart.stratagem.pipeline.PipelineRetryPolicies;
import org.nowstart.stratagem.pipeline.PipelineState;
import org.nowstart.stratagem.pipeline.collaborator.StrategyInterpreter;
import org.nowstart.stratagem.strategy.StrategySpec;
import org.springframework.stereotype.Component;

/**
 * Explains the parsed strategy back to the user. A failed explanation does not stop the run.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class InterpretNode implements PipelineNode {

    private final StrategyInterpreter strategyInterpreter;
    private final PipelineRetryPolicies retryPolicies;

    @Override
    public NodeName name() {
        return NodeName.INTERPRET;
    }

    @Override
    public Set<PayloadField> requires() {
        return Set.of(PayloadField.SPEC);
    }

    @Override
    public NodeOutcome run(PipelineState state, NodeContext context) {
        PipelinePayload payload = state.getPayload();
        StrategySpec spec = payload.getSpec();
        try {
            String interpretation = context.retry(
                    retryPolicies.llmCall(),
                    () -> strategyInterpreter.interpret(payload.getUserText(), spec, payload.getModel())
            );
            payload.setInterpretation(interpretation);
            return NodeOutcome.success();
        } catch (StateConsistencyException e) {
            throw e;
        } catch (RuntimeException e) {
            log.warn("event=interpretation_failed session={} reason={}", state.getSessionId(), e.getMessage());
            payload.setInterpretation(defaultInterpretation(spec));
            return NodeOutcome.softFailure("Interpretation generation failed: " + e.getMessage());
        }
    }

    static String defaultInterpretation(StrategySpec spec) {
        return "Backtest " + spec.ticker()
                + " from " + spec.startDate()
                + " to " + spec.endDate()
                + " with " + spec.entryRules().size() + " entry rule(s)"
                + (spec.entrySequential() ? " evaluated in sequence" : "")
                + " and " + spec.exitRules().size() + " exit rule(s).";
    }
}
