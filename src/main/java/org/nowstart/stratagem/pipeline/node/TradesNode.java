package org.nowstart.stratagem.pipeline.node;

import java.util.List;
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
import org.nowstart.stratagem.pipeline.PipelineState;
import org.nowstart.stratagem.strategy.Backtester;
import org.springframework.stereotype.Component;

/**
 * Trade log for display. Failures leave an empty log and a warning.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TradesNode implements PipelineNode {

    private final Backtester backtester;

    @Override
    public NodeName name() {
        return NodeName.TRADES;
    }

    @Override
    public Set<PayloadField> requires() {
        return Set.of(PayloadField.SPEC, PayloadField.FEATURES);
    }

    @Override
    public NodeOutcome run(PipelineState state, NodeContext context) {
        PipelinePayload payload = state.getPayload();
        try {
            payload.setTrades(backtester.extractTrades(payload.getFeatures(), payload.getSpec()));
            return NodeOutcome.success();
        } catch (StateConsistencyException e) {
            throw e;
        } catch (RuntimeException e) {
            log.warn("event=trade_extraction_failed session={} reason={}", state.getSessionId(), e.getMessage());
            payload.setTrades(List.of());
            return NodeOutcome.softFailure("Trade extraction failed: " + e.getMessage());
        }
    }
}
