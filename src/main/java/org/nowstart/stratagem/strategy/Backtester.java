package org.nowstart.stratagem.strategy;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Long-only close-to-close backtest. A position taken at a close earns the next day's return.
 */
@Component
public class Backtester {

    static final String OPEN_AT_END_REASON = "End of backtest period (still holding)";

    public BacktestRun run(FeatureFrame frame, StrategySpec spec) {
        int n = frame.size();
        RuleEvaluator evaluator = new RuleEvaluator(frame);
        double[] positions = new double[n];
        double[] strategyReturns = new double[n];
        double[] equity = new double[n];

        double position = 0.0;
        for (int i = 0; i < n; i++) {
            if (position == 0.0 && evaluator.entrySignal(spec, i)) {
                position = 1.0;
            } else if (position == 1.0 && evaluator.exitSignal(spec, i)) {
                position = 0.0;
            }
            positions[i] = position;
        }

        double[] returns = frame.returns();
        double value = 1.0;
        for (int i = 0; i < n; i++) {
            double held = i == 0 ? 0.0 : positions[i - 1];
            strategyReturns[i] = held * returns[i];
            value *= 1.0 + strategyReturns[i];
            equity[i] = value;
        }

        return new BacktestRun(frame.dates(), frame.close(), positions, strategyReturns, equity);
    }

    public List<Trade> extractTrades(FeatureFrame frame, StrategySpec spec) {
        int n = frame.size();
        RuleEvaluator evaluator = new RuleEvaluator(frame);
        List<LocalDate> dates = frame.dates();
        double[] close = frame.close();
        List<Trade> trades = new ArrayList<>();
        Trade current = null;

        for (int i = 0; i < n; i++) {
            if (current == null) {
                List<String> entryReasons = entryReasons(evaluator, spec, i);
                if (entryReasons != null) {
                    String reason = entryReasons.isEmpty() ? "All entry rules satisfied" : String.join(" | ", entryReasons);
                    current = Trade.open(dates.get(i), close[i], reason);
                }
                continue;
            }

            for (StrategyRule rule : spec.exitRules()) {
                if (evaluator.holds(rule, i)) {
                    trades.add(current.close(dates.get(i), close[i], evaluator.describe(rule, i, false)));
                    current = null;
                    break;
                }
            }
        }

        if (current != null) {
            trades.add(current.close(dates.get(n - 1), close[n - 1], OPEN_AT_END_REASON));
        }
        return trades;
    }

    // null when the entry does not fire on this row
    private List<String> entryReasons(RuleEvaluator evaluator, StrategySpec spec, int row) {
        List<String> reasons = new ArrayList<>();
        if (spec.entrySequential()) {
            if (!evaluator.sequentialEntry(spec.entryRules(), row)) {
                return null;
            }
            reasons.add(evaluator.describe(spec.entryRules().get(0), row, true));
            for (StrategyRule rule : spec.entryRules().subList(1, spec.entryRules().size())) {
                reasons.add(evaluator.describe(rule, evaluator.firstTriggerRow(rule, row), true));
            }
            return reasons;
        }

        for (StrategyRule rule : spec.entryRules()) {
            if (!evaluator.holds(rule, row)) {
                return null;
            }
            reasons.add(evaluator.describe(rule, row, true));
        }
        return reasons;
    }
}
