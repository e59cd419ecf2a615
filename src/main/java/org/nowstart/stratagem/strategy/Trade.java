package org.nowstart.stratagem.strategy;

import java.time.LocalDate;

public record Trade(
        LocalDate entryDate,
        double entryPrice,
        String entryReason,
        LocalDate exitDate,
        Double exitPrice,
        String exitReason,
        Double pnlPct
) {

    public static Trade open(LocalDate entryDate, double entryPrice, String entryReason) {
        return new Trade(entryDate, entryPrice, entryReason, null, null, null, null);
    }

    public Trade close(LocalDate date, double price, String reason) {
        return new Trade(entryDate, entryPrice, entryReason, date, price, reason, (price / entryPrice - 1.0) * 100.0);
    }
}
