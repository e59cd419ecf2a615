package org.nowstart.stratagem.strategy;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

public record StrategySpec(
        String ticker,
        LocalDate startDate,
        LocalDate endDate,
        List<StrategyRule> entryRules,
        List<StrategyRule> exitRules,
        List<String> metrics,
        boolean entrySequential
) {

    public static final List<String> DEFAULT_METRICS = List.of("cagr", "max_drawdown", "sharpe");

    public StrategySpec {
        entryRules = entryRules == null ? List.of() : List.copyOf(entryRules);
        exitRules = exitRules == null ? List.of() : List.copyOf(exitRules);
        metrics = metrics == null ? List.of() : List.copyOf(metrics);
    }

    @JsonIgnore
    public List<StrategyRule> allRules() {
        List<StrategyRule> rules = new ArrayList<>(entryRules);
        rules.addAll(exitRules);
        return rules;
    }
}
