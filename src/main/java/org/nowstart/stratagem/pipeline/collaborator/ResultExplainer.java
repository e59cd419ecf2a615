package org.nowstart.stratagem.pipeline.collaborator;

import org.nowstart.stratagem.strategy.BacktestMetrics;
import org.nowstart.stratagem.strategy.StrategySpec;

public interface ResultExplainer {

    String explain(StrategySpec spec, BacktestMetrics metrics, String model);
}
