package org.nowstart.stratagem.pipeline.node;

import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.nowstart.stratagem.data.type.NodeName;
import org.nowstart.stratagem.pipeline.NodeContext;
import org.nowstart.stratagem.pipeline.NodeOutcome;
import org.nowstart.stratagem.pipeline.PayloadField;
import org.nowstart.stratagem.pipeline.PipelineNode;
import org.nowstart.stratagem.pipeline.PipelinePayload;
import org.nowstart.stratagem.pipeline.PipelineState;
import org.nowstart.stratagem.strategy.StrategyValidator;
import org.nowstart.stratagem.strategy.ValidationResult;
import org.springframework.stereotype.Component;

/**
 * Data-dependent checks before the backtest. Warnings such as "no entries on this history" let the run continue.
 */
@Component
@RequiredArgsConstructor
public class PreQaNode implements PipelineNode {

    private final StrategyValidator strategyValidator;

    @Override
    public NodeName name() {
        return NodeName.PRE_QA;
    }

    @Override
    public Set<PayloadField> requires() {
        return Set.of(PayloadField.SPEC, PayloadField.FEATURES);
    }

    @Override
    public NodeOutcome run(PipelineState state, NodeContext context) {
        PipelinePayload payload = state.getPayload();
        ValidationResult result = strategyValidator.validateWithData(payload.getSpec(), payload.getFeatures());
        payload.setDataValidationResult(result);
        return NodeOutcome.fromValidation(result);
    }
}
