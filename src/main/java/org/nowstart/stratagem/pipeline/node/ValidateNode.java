package org.nowstart.stratagem.pipeline.node;

import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.nowstart.stratagem.data.type.NodeName;
import org.nowstart.stratagem.pipeline.NodeContext;
import org.nowstart.stratagem.pipeline.NodeOutcome;
import org.nowstart.stratagem.pipeline.PayloadField;
import org.nowstart.stratagem.pipeline.PipelineNode;
import org.nowstart.stratagem.pipeline.PipelineState;
import org.nowstart.stratagem.strategy.StrategyValidator;
import org.nowstart.stratagem.strategy.ValidationResult;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class ValidateNode implements PipelineNode {

    private final StrategyValidator strategyValidator;

    @Override
    public NodeName name() {
        return NodeName.VALIDATE;
    }

    @Override
    public Set<PayloadField> requires() {
        return Set.of(PayloadField.SPEC);
    }

    @Override
    public NodeOutcome run(PipelineState state, NodeContext context) {
        ValidationResult result = strategyValidator.validateStructure(state.getPayload().getSpec());
        state.getPayload().setValidationResult(result);
        return NodeOutcome.fromValidation(result);
    }
}
