package org.nowstart.stratagem.strategy;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * Price series plus the indicator columns a strategy needs, aligned by row index.
 */
public record FeatureFrame(
        List<LocalDate> dates,
        double[] close,
        double[] returns,
        Map<Integer, double[]> movingAverages,
        Map<Integer, double[]> realizedVol,
        Map<Integer, double[]> realizedVolMedian
) {

    public FeatureFrame {
        dates = List.copyOf(dates);
        movingAverages = Map.copyOf(movingAverages);
        realizedVol = Map.copyOf(realizedVol);
        realizedVolMedian = Map.copyOf(realizedVolMedian);
    }

    public int size() {
        return close.length;
    }

    public boolean isEmpty() {
        return close.length == 0;
    }

    public double[] movingAverage(int window) {
        return movingAverages.get(window);
    }

    public double[] realizedVol(int window) {
        return realizedVol.get(window);
    }

    public double[] realizedVolMedian(int window) {
        return realizedVolMedian.get(window);
    }
}
