package org.nowstart.stratagem.strategy;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class BacktesterTest {

    private final Backtester backtester = new Backtester();
    private final FeatureCalculator featureCalculator = new FeatureCalculator();

    @Test
    void run_appliesPositionFromPreviousClose() {
        FeatureFrame frame = frame(
                new double[]{100.0, 101.0, 102.0, 101.0, 100.0, 99.0},
                new double[]{2.0, 3.0, 3.0, 1.0, 1.0, 1.0}
        );

        BacktestRun run = backtester.run(frame, spec());

        assertThat(run.positions()).containsExactly(0.0, 1.0, 1.0, 0.0, 0.0, 0.0);
        assertThat(run.strategyReturns()[1]).isZero();
        assertThat(run.strategyReturns()[2]).isCloseTo(102.0 / 101.0 - 1.0, within(1e-12));
        assertThat(run.strategyReturns()[3]).isCloseTo(101.0 / 102.0 - 1.0, within(1e-12));
        assertThat(run.strategyReturns()[4]).isZero();
        assertThat(run.equityCurve()[5]).isCloseTo(1.0, within(1e-12));
        assertThat(run.size()).isEqualTo(6);
    }

    @Test
    void extractTrades_recordsReasonsAndPnl() {
        FeatureFrame frame = frame(
                new double[]{100.0, 101.0, 102.0, 103.0, 100.0, 99.0},
                new double[]{2.0, 3.0, 3.0, 1.0, 1.0, 1.0}
        );

        List<Trade> trades = backtester.extractTrades(frame, spec());

        assertThat(trades).singleElement().satisfies(trade -> {
            assertThat(trade.entryDate()).isEqualTo(StrategyFixtures.START.plusDays(1));
            assertThat(trade.entryPrice()).isEqualTo(101.0);
            assertThat(trade.entryReason()).isEqualTo("Entry: 5-day MA (3.00) crossed above 20-day MA (2.00)");
            assertThat(trade.exitDate()).isEqualTo(StrategyFixtures.START.plusDays(3));
            assertThat(trade.exitPrice()).isEqualTo(103.0);
            assertThat(trade.exitReason()).isEqualTo("Exit: 5-day MA (1.00) crossed below 20-day MA (2.00)");
            assertThat(trade.pnlPct()).isCloseTo((103.0 / 101.0 - 1.0) * 100.0, within(1e-9));
        });
    }

    @Test
    void extractTrades_closesOpenPositionOnLastRow() {
        FeatureFrame frame = frame(
                new double[]{100.0, 101.0, 102.0, 104.0},
                new double[]{2.0, 3.0, 3.0, 3.0}
        );

        List<Trade> trades = backtester.extractTrades(frame, spec());

        assertThat(trades).singleElement().satisfies(trade -> {
            assertThat(trade.exitDate()).isEqualTo(StrategyFixtures.START.plusDays(3));
            assertThat(trade.exitPrice()).isEqualTo(104.0);
            assertThat(trade.exitReason()).isEqualTo(Backtester.OPEN_AT_END_REASON);
        });
    }

    @Test
    void extractTrades_sequentialEntryDescribesEachRuleAtItsTrigger() {
        StrategySpec sequential = new StrategySpec(
                "AAPL",
                StrategyFixtures.START,
                StrategyFixtures.START.plusYears(1),
                List.of(
                        CrossoverRule.of(5, 20, CrossoverDirection.ABOVE),
                        new CrossoverRule(5, 20, CrossoverDirection.BELOW, 3, null)
                ),
                List.of(new CrossoverRule(5, 20, CrossoverDirection.BELOW, null, 3)),
                StrategySpec.DEFAULT_METRICS,
                true
        );
        FeatureFrame frame = frame(
                new double[]{100.0, 101.0, 102.0, 103.0, 104.0},
                new double[]{3.0, 3.0, 1.0, 3.0, 3.0}
        );

        List<Trade> trades = backtester.extractTrades(frame, sequential);

        assertThat(trades).hasSize(1);
        assertThat(trades.get(0).entryDate()).isEqualTo(StrategyFixtures.START);
        assertThat(trades.get(0).entryReason()).isEqualTo(
                "Entry: 5-day MA (3.00) crossed above 20-day MA (2.00)"
                        + " | Entry: 5-day MA (1.00) crossed below 20-day MA (2.00)");
    }

    @Test
    void run_onWaveProducesRoundTrips() {
        StrategySpec spec = StrategyFixtures.maCrossSpec("AAPL");
        FeatureFrame frame = featureCalculator.compute(StrategyFixtures.wave("AAPL", 240), spec);

        BacktestRun run = backtester.run(frame, spec);
        List<Trade> trades = backtester.extractTrades(frame, spec);

        assertThat(trades).hasSizeGreaterThanOrEqualTo(3);
        assertThat(trades).allSatisfy(trade -> assertThat(trade.exitDate()).isAfterOrEqualTo(trade.entryDate()));
        assertThat(new MetricsCalculator().countEntries(run.positions())).isEqualTo(trades.size());
    }

    private StrategySpec spec() {
        return new StrategySpec(
                "AAPL",
                StrategyFixtures.START,
                StrategyFixtures.START.plusYears(1),
                List.of(CrossoverRule.of(5, 20, CrossoverDirection.ABOVE)),
                List.of(CrossoverRule.of(5, 20, CrossoverDirection.BELOW)),
                StrategySpec.DEFAULT_METRICS,
                false
        );
    }

    // slow average pinned at 2.0 so the fast column alone decides the signal
    private FeatureFrame frame(double[] close, double[] fast) {
        double[] slow = new double[close.length];
        Arrays.fill(slow, 2.0);
        return new FeatureFrame(
                StrategyFixtures.dates(close.length),
                close,
                featureCalculator.simpleReturns(close),
                Map.of(5, fast, 20, slow),
                Map.of(),
                Map.of()
        );
    }
}
