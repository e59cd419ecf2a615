package org.nowstart.stratagem.pipeline.node;

import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.stratagem.data.type.NodeName;
import org.nowstart.stratagem.pipeline.NodeContext;
import org.nowstart.stratagem.pipeline.NodeOutcome;
import org.nowstart.stratagem.pipeline.PayloadField;
import org.nowstart.stratagem.pipeline.PipelineNode;
import org.nowstart.stratagem.pipeline.PipelineState;
import org.nowstart.stratagem.strategy.BacktestMetrics;
import org.nowstart.stratagem.strategy.MetricsCalculator;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class MetricsNode implements PipelineNode {

    private final MetricsCalculator metricsCalculator;

    @Override
    public NodeName name() {
        return NodeName.METRICS;
    }

    @Override
    public Set<PayloadField> requires() {
        return Set.of(PayloadField.BACKTEST_RUN);
    }

    @Override
    public NodeOutcome run(PipelineState state, NodeContext context) {
        BacktestMetrics metrics = metricsCalculator.compute(state.getPayload().getBacktestRun());
        state.getPayload().setMetrics(metrics);
        log.info("event=backtest_metrics session={} cagr={} max_drawdown={} sharpe={} num_trades={}",
                state.getSessionId(), metrics.cagr(), metrics.maxDrawdown(), metrics.sharpe(), metrics.numTrades());
        return NodeOutcome.success();
    }
}
