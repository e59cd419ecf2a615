package org.nowstart.stratagem.pipeline.node;

import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.stratagem.data.type.NodeName;
import org.nowstart.stratagem.pipeline.NodeContext;
import org.nowstart.stratagem.pipeline.NodeOutcome;
import org.nowstart.stratagem.pipeline.PayloadField;
import org.nowstart.stratagem.pipeline.PipelineNode;
import org.nowstart.stratagem.pipeline.PipelinePayload;
import org.nowstart.stratagem.pipeline.PipelineRetryPolicies;
import org.nowstart.stratagem.pipeline.PipelineState;
import org.nowstart.stratagem.pipeline.collaborator.StrategyTranslator;
import org.nowstart.stratagem.strategy.StrategySpec;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class TranslateNode implements PipelineNode {

    private final StrategyTranslator strategyTranslator;
    private final PipelineRetryPolicies retryPolicies;

    @Override
    public NodeName name() {
        return NodeName.TRANSLATE;
    }

    @Override
    public Set<PayloadField> requires() {
        return Set.of(PayloadField.USER_TEXT, PayloadField.MODEL);
    }

    @Override
    public NodeOutcome run(PipelineState state, NodeContext context) {
        PipelinePayload payload = state.getPayload();
        StrategySpec spec = context.retry(
                retryPolicies.llmCall(),
                () -> strategyTranslator.translate(payload.getUserText(), payload.getModel())
        );
        payload.setSpec(spec);
        log.info("event=strategy_translated session={} ticker={} start={} end={} entry_rules={} exit_rules={}",
                state.getSessionId(),
                spec.ticker(),
                spec.startDate(),
                spec.endDate(),
                spec.entryRules().size(),
                spec.exitRules().size());
        return NodeOutcome.success();
    }
}
