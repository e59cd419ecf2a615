package org.nowstart.stratagem.strategy;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeSet;
import org.springframework.stereotype.Component;

@Component
public class FeatureCalculator {

    static final int TRADING_DAYS_PER_YEAR = 252;

    public FeatureFrame compute(PriceSeries series, StrategySpec spec) {
        double[] close = series.closes();
        double[] returns = simpleReturns(close);

        TreeSet<Integer> maWindows = new TreeSet<>();
        TreeSet<Integer> volWindows = new TreeSet<>();
        for (StrategyRule rule : spec.allRules()) {
            if (rule instanceof CrossoverRule crossover) {
                maWindows.add(crossover.fastMa());
                maWindows.add(crossover.slowMa());
            } else if (rule instanceof VolFilterRule volFilter) {
                volWindows.add(volFilter.window());
            }
        }

        Map<Integer, double[]> movingAverages = new LinkedHashMap<>();
        for (int window : maWindows) {
            movingAverages.put(window, rollingMean(close, window));
        }

        Map<Integer, double[]> realizedVol = new LinkedHashMap<>();
        Map<Integer, double[]> realizedVolMedian = new LinkedHashMap<>();
        for (int window : volWindows) {
            double[] rv = annualizedRollingStd(returns, window);
            realizedVol.put(window, rv);
            realizedVolMedian.put(window, rollingMedian(rv, TRADING_DAYS_PER_YEAR));
        }

        return new FeatureFrame(series.dates(), close, returns, movingAverages, realizedVol, realizedVolMedian);
    }

    public double[] simpleReturns(double[] close) {
        double[] returns = new double[close.length];
        for (int i = 1; i < close.length; i++) {
            double previous = close[i - 1];
            returns[i] = previous == 0.0 ? 0.0 : close[i] / previous - 1.0;
        }
        return returns;
    }

    /**
     * Trailing mean over up to {@code window} values; early rows use what is available.
     */
    public double[] rollingMean(double[] values, int window) {
        int n = values.length;
        double[] mean = fillNaN(n);
        if (window <= 0) {
            return mean;
        }

        double sum = 0.0;
        for (int i = 0; i < n; i++) {
            sum += values[i];
            if (i >= window) {
                sum -= values[i - window];
            }
            mean[i] = sum / Math.min(i + 1, window);
        }
        return mean;
    }

    /**
     * Sample standard deviation over up to {@code window} returns, scaled by sqrt(252). NaN with fewer than two values.
     */
    public double[] annualizedRollingStd(double[] returns, int window) {
        int n = returns.length;
        double[] std = fillNaN(n);
        if (window <= 0) {
            return std;
        }

        double scale = Math.sqrt(TRADING_DAYS_PER_YEAR);
        for (int i = 0; i < n; i++) {
            int start = Math.max(0, i - window + 1);
            int count = i - start + 1;
            if (count < 2) {
                continue;
            }

            double mean = 0.0;
            for (int j = start; j <= i; j++) {
                mean += returns[j];
            }
            mean /= count;

            double squares = 0.0;
            for (int j = start; j <= i; j++) {
                double diff = returns[j] - mean;
                squares += diff * diff;
            }
            std[i] = Math.sqrt(squares / (count - 1)) * scale;
        }
        return std;
    }

    /**
     * Trailing median over up to {@code window} finite values. NaN when the window holds none.
     */
    public double[] rollingMedian(double[] values, int window) {
        int n = values.length;
        double[] median = fillNaN(n);
        for (int i = 0; i < n; i++) {
            int start = Math.max(0, i - window + 1);
            double[] finite = Arrays.stream(values, start, i + 1)
                    .filter(Double::isFinite)
                    .sorted()
                    .toArray();
            if (finite.length == 0) {
                continue;
            }

            int mid = finite.length / 2;
            median[i] = finite.length % 2 == 1
                    ? finite[mid]
                    : (finite[mid - 1] + finite[mid]) / 2.0;
        }
        return median;
    }

    private double[] fillNaN(int size) {
        double[] values = new double[size];
        Arrays.fill(values, Double.NaN);
        return values;
    }
}
