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
import org.nowstart.stratagem.pipeline.collaborator.ResultExplainer;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class ExplainNode implements PipelineNode {

    private final ResultExplainer resultExplainer;
    private final PipelineRetryPolicies retryPolicies;

    @Override
    public NodeName name() {
        return NodeName.EXPLAIN;
    }

    @Override
    public Set<PayloadField> requires() {
        return Set.of(PayloadField.SPEC, PayloadField.METRICS);
    }

    @Override
    public NodeOutcome run(PipelineState state, NodeContext context) {
        PipelinePayload payload = state.getPayload();
        try {
            String explanation = context.retry(
                    retryPolicies.llmCall(),
                    () -> resultExplainer.explain(payload.getSpec(), payload.getMetrics(), payload.getModel())
            );
            payload.setExplanation(explanation);
            return NodeOutcome.success();
        } catch (StateConsistencyException e) {
            throw e;
        } catch (RuntimeException e) {
            log.warn("event=explanation_failed session={} reason={}", state.getSessionId(), e.getMessage());
            payload.setExplanation("(Explanation unavailable: " + e.getMessage() + ")");
            return NodeOutcome.softFailure("Explanation generation failed: " + e.getMessage());
        }
    }
}
