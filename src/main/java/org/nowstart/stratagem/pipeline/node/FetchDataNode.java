package org.nowstart.stratagem.pipeline.node;

import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.stratagem.data.type.NodeName;
import org.nowstart.stratagem.pipeline.NodeContext;
import org.nowstart.stratagem.pipeline.NodeOutcome;
import org.nowstart.stratagem.pipeline.PayloadField;
import org.nowstart.stratagem.pipeline.PipelineNode;
import org.nowstart.stratagem.pipeline.PipelineRetryPolicies;
import org.nowstart.stratagem.pipeline.PipelineState;
import org.nowstart.stratagem.pipeline.collaborator.PriceDataSource;
import org.nowstart.stratagem.strategy.DateRange;
import org.nowstart.stratagem.strategy.PriceSeries;
import org.nowstart.stratagem.strategy.StrategySpec;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class FetchDataNode implements PipelineNode {

    private final PriceDataSource priceDataSource;
    private final PipelineRetryPolicies retryPolicies;

    @Override
    public NodeName name() {
        return NodeName.FETCH_DATA;
    }

    @Override
    public Set<PayloadField> requires() {
        return Set.of(PayloadField.SPEC);
    }

    @Override
    public NodeOutcome run(PipelineState state, NodeContext context) {
        StrategySpec spec = state.getPayload().getSpec();
        PriceSeries series = context.retry(
                retryPolicies.dataFetch(),
                () -> priceDataSource.fetch(spec.ticker(), DateRange.of(spec))
        );
        if (series == null || series.isEmpty()) {
            return NodeOutcome.hardFailure(
                    "No price data returned for ticker " + spec.ticker() + " between " + spec.startDate() + " and " + spec.endDate(),
                    null);
        }

        state.getPayload().setPriceSeries(series);
        log.info("event=price_data_fetched session={} ticker={} rows={}", state.getSessionId(), spec.ticker(), series.size());
        return NodeOutcome.success();
    }
}
