package org.nowstart.stratagem.strategy;

import org.springframework.stereotype.Component;

@Component
public class MetricsCalculator {

    public BacktestMetrics compute(BacktestRun run) {
        return new BacktestMetrics(
                cagr(run.equityCurve()),
                maxDrawdown(run.equityCurve()),
                sharpe(run.strategyReturns()),
                countEntries(run.positions())
        );
    }

    public double cagr(double[] equity) {
        if (equity.length == 0) {
            return 0.0;
        }
        double start = equity[0];
        double end = equity[equity.length - 1];
        if (start <= 0.0 || end <= 0.0) {
            return 0.0;
        }
        double years = (double) equity.length / FeatureCalculator.TRADING_DAYS_PER_YEAR;
        return Math.pow(end / start, 1.0 / years) - 1.0;
    }

    /**
     * Most negative peak-to-trough decline, as a fraction (e.g. -0.25).
     */
    public double maxDrawdown(double[] equity) {
        double peak = Double.NEGATIVE_INFINITY;
        double worst = 0.0;
        for (double value : equity) {
            peak = Math.max(peak, value);
            worst = Math.min(worst, value / peak - 1.0);
        }
        return worst;
    }

    public double sharpe(double[] dailyReturns) {
        int n = dailyReturns.length;
        if (n < 2) {
            return 0.0;
        }

        double mean = 0.0;
        for (double value : dailyReturns) {
            mean += value;
        }
        mean /= n;

        double squares = 0.0;
        for (double value : dailyReturns) {
            squares += (value - mean) * (value - mean);
        }
        double std = Math.sqrt(squares / (n - 1));
        if (std == 0.0) {
            return 0.0;
        }
        return mean / std * Math.sqrt(FeatureCalculator.TRADING_DAYS_PER_YEAR);
    }

    // a position that is already open on the first row is not counted
    int countEntries(double[] positions) {
        int entries = 0;
        for (int i = 1; i < positions.length; i++) {
            if (positions[i] == 1.0 && positions[i - 1] != 1.0) {
                entries++;
            }
        }
        return entries;
    }
}
