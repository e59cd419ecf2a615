package org.nowstart.stratagem.strategy;

import java.util.List;
import java.util.Locale;

/**
 * Evaluates strategy rules against a {@link FeatureFrame} row by row. Missing indicator values never satisfy a rule.
 */
public class RuleEvaluator {

    private final FeatureFrame frame;

    public RuleEvaluator(FeatureFrame frame) {
        this.frame = frame;
    }

    public boolean entrySignal(StrategySpec spec, int row) {
        if (spec.entrySequential()) {
            return sequentialEntry(spec.entryRules(), row);
        }
        return allHold(spec.entryRules(), row);
    }

    public boolean exitSignal(StrategySpec spec, int row) {
        for (StrategyRule rule : spec.exitRules()) {
            if (holds(rule, row)) {
                return true;
            }
        }
        return false;
    }

    public boolean allHold(List<StrategyRule> rules, int row) {
        for (StrategyRule rule : rules) {
            if (!holds(rule, row)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Rule value at {@code row} honouring its window: a duration requires every one of the trailing days to hold,
     * a lookahead accepts any day up to that many rows ahead. Duration wins when both are set.
     */
    public boolean holds(StrategyRule rule, int row) {
        Integer duration = rule.durationDays();
        if (duration != null) {
            if (row < duration - 1) {
                return false;
            }
            for (int offset = 0; offset < duration; offset++) {
                if (!holdsAt(rule, row - offset)) {
                    return false;
                }
            }
            return true;
        }

        Integer lookahead = rule.lookaheadDays();
        if (lookahead != null) {
            for (int offset = 0; offset <= lookahead; offset++) {
                int index = row + offset;
                if (index >= frame.size()) {
                    break;
                }
                if (holdsAt(rule, index)) {
                    return true;
                }
            }
            return false;
        }

        return holdsAt(rule, row);
    }

    /**
     * First rule must hold on {@code row}; each later rule on the same row, or within its lookahead window if it has one.
     */
    public boolean sequentialEntry(List<StrategyRule> rules, int row) {
        if (rules.isEmpty() || !holdsAt(rules.get(0), row)) {
            return false;
        }
        for (StrategyRule rule : rules.subList(1, rules.size())) {
            if (firstTriggerRow(rule, row) < 0) {
                return false;
            }
        }
        return true;
    }

    /**
     * Row at which a sequential follow-up rule first holds, or -1.
     */
    public int firstTriggerRow(StrategyRule rule, int row) {
        int lookahead = rule.lookaheadDays() == null ? 0 : rule.lookaheadDays();
        for (int offset = 0; offset <= lookahead; offset++) {
            int index = row + offset;
            if (index >= frame.size()) {
                break;
            }
            if (holdsAt(rule, index)) {
                return index;
            }
        }
        return -1;
    }

    /**
     * Point-in-time value of a rule, ignoring lookahead and duration.
     */
    public boolean holdsAt(StrategyRule rule, int row) {
        if (row < 0 || row >= frame.size()) {
            return false;
        }
        if (rule instanceof CrossoverRule crossover) {
            double[] fast = frame.movingAverage(crossover.fastMa());
            double[] slow = frame.movingAverage(crossover.slowMa());
            if (fast == null || slow == null || Double.isNaN(fast[row]) || Double.isNaN(slow[row])) {
                return false;
            }
            return crossover.direction() == CrossoverDirection.ABOVE ? fast[row] > slow[row] : fast[row] < slow[row];
        }
        if (rule instanceof VolFilterRule volFilter) {
            double[] rv = frame.realizedVol(volFilter.window());
            double[] median = frame.realizedVolMedian(volFilter.window());
            if (rv == null || median == null || Double.isNaN(rv[row]) || Double.isNaN(median[row])) {
                return false;
            }
            return volFilter.relation() == VolRelation.BELOW ? rv[row] < median[row] : rv[row] > median[row];
        }
        return false;
    }

    public String describe(StrategyRule rule, int row, boolean entry) {
        String action = entry ? "Entry" : "Exit";
        if (rule instanceof CrossoverRule crossover) {
            return String.format(Locale.ROOT, "%s: %d-day MA (%.2f) crossed %s %d-day MA (%.2f)",
                    action,
                    crossover.fastMa(),
                    frame.movingAverage(crossover.fastMa())[row],
                    crossover.direction().value(),
                    crossover.slowMa(),
                    frame.movingAverage(crossover.slowMa())[row]);
        }
        if (rule instanceof VolFilterRule volFilter) {
            return String.format(Locale.ROOT, "%s: %d-day RV (%.2f%%) %s 1Y median (%.2f%%)",
                    action,
                    volFilter.window(),
                    frame.realizedVol(volFilter.window())[row] * 100.0,
                    volFilter.relation().value(),
                    frame.realizedVolMedian(volFilter.window())[row] * 100.0);
        }
        return action + ": rule triggered";
    }
}
