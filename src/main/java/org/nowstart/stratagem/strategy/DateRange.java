package org.nowstart.stratagem.strategy;

import java.time.LocalDate;

/**
 * Half-open trading date range: {@code start} inclusive, {@code end} exclusive.
 */
public record DateRange(LocalDate start, LocalDate end) {

    public static DateRange of(StrategySpec spec) {
        return new DateRange(spec.startDate(), spec.endDate());
    }
}
