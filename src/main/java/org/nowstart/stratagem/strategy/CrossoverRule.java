package org.nowstart.stratagem.strategy;

/**
 * Fast moving average relative to slow moving average. {@code ABOVE} means fast &gt; slow.
 */
public record CrossoverRule(
        int fastMa,
        int slowMa,
        CrossoverDirection direction,
        Integer lookaheadDays,
        Integer durationDays
) implements StrategyRule {

    public static CrossoverRule of(int fastMa, int slowMa, CrossoverDirection direction) {
        return new CrossoverRule(fastMa, slowMa, direction, null, null);
    }
}
