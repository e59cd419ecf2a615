package org.nowstart.stratagem.strategy;

/**
 * Annualised realised volatility over {@code window} days compared against its trailing 1-year median.
 */
public record VolFilterRule(
        int window,
        String threshold,
        VolRelation relation,
        Integer lookaheadDays,
        Integer durationDays
) implements StrategyRule {

    public static final String MEDIAN_1Y = "median_1y";

    public static VolFilterRule of(int window, VolRelation relation) {
        return new VolFilterRule(window, MEDIAN_1Y, relation, null, null);
    }
}
