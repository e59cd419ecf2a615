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
import org.nowstart.stratagem.strategy.FeatureCalculator;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class AddFeaturesNode implements PipelineNode {

    private final FeatureCalculator featureCalculator;

    @Override
    public NodeName name() {
        return NodeName.ADD_FEATURES;
    }

    @Override
    public Set<PayloadField> requires() {
        return Set.of(PayloadField.SPEC, PayloadField.PRICE_SERIES);
    }

    @Override
    public NodeOutcome run(PipelineState state, NodeContext context) {
        PipelinePayload payload = state.getPayload();
        payload.setFeatures(featureCalculator.compute(payload.getPriceSeries(), payload.getSpec()));
        return NodeOutcome.success();
    }
}
