package org.nowstart.stratagem.strategy;

import java.time.LocalDate;
import java.util.List;

public record PriceSeries(String ticker, List<PriceBar> bars) {

    public PriceSeries {
        bars = bars == null ? List.of() : List.copyOf(bars);
    }

    public int size() {
        return bars.size();
    }

    public boolean isEmpty() {
        return bars.isEmpty();
    }

    public List<LocalDate> dates() {
        return bars.stream().map(PriceBar::date).toList();
    }

    public double[] closes() {
        return bars.stream().mapToDouble(PriceBar::close).toArray();
    }
}
