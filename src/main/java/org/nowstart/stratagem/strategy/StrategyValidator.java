package org.nowstart.stratagem.strategy;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.springframework.stereotype.Component;

@Component
public class StrategyValidator {

    static final int MIN_STABLE_MA_WINDOW = 5;
    static final int MAX_RESPONSIVE_MA_WINDOW = 200;
    static final int MAX_RESPONSIVE_VOL_WINDOW = FeatureCalculator.TRADING_DAYS_PER_YEAR * 5;

    /**
     * Checks that need no price data. Contradictory entry rules are errors, extreme windows are warnings.
     */
    public ValidationResult validateStructure(StrategySpec spec) {
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        if (spec.startDate() == null || spec.endDate() == null || !spec.startDate().isBefore(spec.endDate())) {
            errors.add("Start date must be before end date.");
        }
        if (spec.entryRules().isEmpty()) {
            errors.add("At least one entry rule is required.");
        }
        if (spec.exitRules().isEmpty()) {
            errors.add("At least one exit rule is required.");
        }
        if (spec.metrics().isEmpty()) {
            warnings.add("No metrics specified; default metrics will be used.");
        }

        Map<String, Set<CrossoverDirection>> crossoverEntries = new LinkedHashMap<>();
        Map<String, Set<VolRelation>> volEntries = new LinkedHashMap<>();

        for (StrategyRule rule : spec.allRules()) {
            boolean entryRule = spec.entryRules().contains(rule);
            if (rule instanceof CrossoverRule crossover) {
                if (crossover.fastMa() <= 0 || crossover.slowMa() <= 0) {
                    errors.add("Moving average windows must be positive integers.");
                }
                if (crossover.fastMa() == crossover.slowMa()) {
                    errors.add("Fast and slow moving averages must differ.");
                }
                if (crossover.fastMa() < MIN_STABLE_MA_WINDOW || crossover.slowMa() < MIN_STABLE_MA_WINDOW) {
                    warnings.add("Very small moving average windows (under 5 days) may be unstable or overly reactive.");
                }
                if (crossover.fastMa() > MAX_RESPONSIVE_MA_WINDOW || crossover.slowMa() > MAX_RESPONSIVE_MA_WINDOW) {
                    warnings.add("Very large moving average windows (over 200 days) may make the strategy slow and unresponsive.");
                }
                Set<CrossoverDirection> directions = crossoverEntries.computeIfAbsent(
                        crossover.fastMa() + ":" + crossover.slowMa(),
                        key -> EnumSet.noneOf(CrossoverDirection.class)
                );
                if (entryRule) {
                    directions.add(crossover.direction());
                }
            } else if (rule instanceof VolFilterRule volFilter) {
                if (volFilter.window() <= 1) {
                    errors.add("Volatility window must be greater than 1.");
                }
                if (volFilter.window() > MAX_RESPONSIVE_VOL_WINDOW) {
                    warnings.add("Very large volatility windows may dilute signal responsiveness.");
                }
                Set<VolRelation> relations = volEntries.computeIfAbsent(
                        volFilter.window() + ":" + volFilter.threshold(),
                        key -> EnumSet.noneOf(VolRelation.class)
                );
                if (entryRule) {
                    relations.add(volFilter.relation());
                }
            }
        }

        for (Set<CrossoverDirection> directions : crossoverEntries.values()) {
            if (directions.size() > 1) {
                errors.add("Entry rules require the same moving averages to be both above and below each other, which is impossible.");
            }
        }
        for (Set<VolRelation> relations : volEntries.values()) {
            if (relations.size() > 1) {
                errors.add("Entry rules require volatility to be both above and below the same threshold, which is impossible.");
            }
        }

        return ValidationResult.of(errors, warnings);
    }

    /**
     * Checks against the fetched history: enough rows for the lookbacks, and whether entries and exits ever fire.
     */
    public ValidationResult validateWithData(StrategySpec spec, FeatureFrame frame) {
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        if (frame == null || frame.isEmpty()) {
            errors.add("No price data is available for the requested period.");
            return ValidationResult.of(errors, warnings);
        }

        int n = frame.size();
        int requiredLength = requiredHistory(spec);
        if (requiredLength > 0 && n < requiredLength) {
            warnings.add("Strategy uses long lookback windows (up to " + requiredLength + " days) but only " + n
                    + " data points are available. Early signal values may be unreliable.");
        }

        RuleEvaluator evaluator = new RuleEvaluator(frame);
        boolean anyEntry = false;
        boolean anyExit = false;
        for (int i = 0; i < n && !(anyEntry && anyExit); i++) {
            anyEntry |= evaluator.entrySignal(spec, i);
            anyExit |= evaluator.exitSignal(spec, i);
        }

        if (!anyEntry) {
            warnings.add("Given the historical data and rules, this strategy is unlikely to generate any entries. It may produce zero trades.");
        }
        if (anyEntry && !anyExit) {
            warnings.add("Entry conditions can occur, but exit conditions never trigger on this data. Positions may never close once opened.");
        }

        return ValidationResult.of(errors, warnings);
    }

    int requiredHistory(StrategySpec spec) {
        int maxMa = 0;
        int maxVol = 0;
        int maxLookahead = 0;
        int maxDuration = 0;
        for (StrategyRule rule : spec.allRules()) {
            if (rule instanceof CrossoverRule crossover) {
                maxMa = Math.max(maxMa, Math.max(crossover.fastMa(), crossover.slowMa()));
            } else if (rule instanceof VolFilterRule volFilter) {
                maxVol = Math.max(maxVol, volFilter.window());
            }
            if (rule.lookaheadDays() != null) {
                maxLookahead = Math.max(maxLookahead, rule.lookaheadDays());
            }
            if (rule.durationDays() != null) {
                maxDuration = Math.max(maxDuration, rule.durationDays());
            }
        }

        int required = 0;
        if (maxMa > 0) {
            required = Math.max(required, maxMa + 10);
        }
        if (maxVol > 0) {
            required = Math.max(required, maxVol + FeatureCalculator.TRADING_DAYS_PER_YEAR);
        }
        if (maxLookahead > 0) {
            required = Math.max(required, maxLookahead + 10);
        }
        if (maxDuration > 0) {
            required = Math.max(required, maxDuration + 10);
        }
        return required;
    }
}
