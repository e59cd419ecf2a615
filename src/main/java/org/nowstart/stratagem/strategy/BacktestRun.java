package org.nowstart.stratagem.strategy;

import java.time.LocalDate;
import java.util.List;

/**
 * Daily backtest columns aligned with the feature frame rows.
 */
public record BacktestRun(
        List<LocalDate> dates,
        double[] close,
        double[] positions,
        double[] strategyReturns,
        double[] equityCurve
) {

    public BacktestRun {
        dates = List.copyOf(dates);
    }

    public int size() {
        return positions.length;
    }
}
