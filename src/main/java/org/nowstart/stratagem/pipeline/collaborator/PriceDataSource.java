package org.nowstart.stratagem.pipeline.collaborator;

import org.nowstart.stratagem.strategy.DateRange;
import org.nowstart.stratagem.strategy.PriceSeries;

public interface PriceDataSource {

    PriceSeries fetch(String ticker, DateRange range);
}
