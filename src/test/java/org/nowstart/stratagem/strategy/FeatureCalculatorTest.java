package org.nowstart.stratagem.strategy;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import java.util.List;
import org.junit.jupiter.api.Test;

class FeatureCalculatorTest {

    private final FeatureCalculator calculator = new FeatureCalculator();

    @Test
    void simpleReturns_startsAtZeroAndGuardsZeroPrices() {
        double[] returns = calculator.simpleReturns(new double[]{100.0, 110.0, 99.0, 0.0, 5.0});

        assertThat(returns[0]).isZero();
        assertThat(returns[1]).isCloseTo(0.10, within(1e-12));
        assertThat(returns[2]).isCloseTo(-0.10, within(1e-12));
        assertThat(returns[3]).isCloseTo(-1.0, within(1e-12));
        assertThat(returns[4]).isZero();
    }

    @Test
    void rollingMean_usesAvailableRowsBeforeWindowFills() {
        double[] mean = calculator.rollingMean(new double[]{1.0, 2.0, 3.0, 4.0}, 2);

        assertThat(mean).containsExactly(1.0, 1.5, 2.5, 3.5);
    }

    @Test
    void annualizedRollingStd_isSampleStdScaledBySqrt252() {
        double[] std = calculator.annualizedRollingStd(new double[]{0.0, 0.01, -0.01}, 3);

        assertThat(std[0]).isNaN();
        assertThat(std[1]).isCloseTo(Math.sqrt(0.00005) * Math.sqrt(252), within(1e-12));
        assertThat(std[2]).isCloseTo(0.01 * Math.sqrt(252), within(1e-12));
    }

    @Test
    void rollingMedian_skipsMissingValues() {
        double[] median = calculator.rollingMedian(new double[]{Double.NaN, 3.0, 1.0, 2.0}, 3);

        assertThat(median[0]).isNaN();
        assertThat(median[1]).isEqualTo(3.0);
        assertThat(median[2]).isEqualTo(2.0);
        assertThat(median[3]).isEqualTo(2.0);
    }

    @Test
    void compute_buildsColumnsForEveryRuleWindow() {
        StrategySpec spec = new StrategySpec(
                "AAPL",
                StrategyFixtures.START,
                StrategyFixtures.START.plusYears(1),
                List.of(CrossoverRule.of(5, 20, CrossoverDirection.ABOVE), VolFilterRule.of(10, VolRelation.BELOW)),
                List.of(CrossoverRule.of(5, 50, CrossoverDirection.BELOW)),
                StrategySpec.DEFAULT_METRICS,
                false
        );
        PriceSeries series = StrategyFixtures.wave("AAPL", 80);

        FeatureFrame frame = calculator.compute(series, spec);

        assertThat(frame.size()).isEqualTo(80);
        assertThat(frame.dates()).isEqualTo(series.dates());
        assertThat(frame.movingAverages()).containsOnlyKeys(5, 20, 50);
        assertThat(frame.realizedVol()).containsOnlyKeys(10);
        assertThat(frame.realizedVolMedian()).containsOnlyKeys(10);
        assertThat(frame.movingAverage(5)[79]).isCloseTo(
                (series.closes()[75] + series.closes()[76] + series.closes()[77] + series.closes()[78] + series.closes()[79]) / 5.0,
                within(1e-9));
        assertThat(frame.realizedVolMedian(10)[79]).isPositive();
    }
}
