package org.nowstart.stratagem.strategy;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.nowstart.stratagem.data.exception.InvalidInputException;

class StrategySpecParserTest {

    private final StrategySpecParser parser = new StrategySpecParser();

    @Test
    void parse_readsRulesWithTemporalFields() {
        String json = """
                {
                  "ticker": " aapl ",
                  "start_date": "2020-01-01",
                  "end_date": "2024-01-01",
                  "entry_rules": [
                    {"type": "crossover", "fast_ma": 10, "slow_ma": 50, "direction": "above"},
                    {"type": "vol_filter", "window": 20, "threshold": "median_1y", "relation": "below", "lookahead_days": 3}
                  ],
                  "exit_rules": [
                    {"type": "crossover", "fast_ma": "10", "slow_ma": "50", "direction": "BELOW", "duration_days": 2}
                  ],
                  "entry_sequential": true
                }
                """;

        StrategySpec spec = parser.parse(json);

        assertThat(spec.ticker()).isEqualTo("AAPL");
        assertThat(spec.startDate()).isEqualTo(LocalDate.of(2020, 1, 1));
        assertThat(spec.endDate()).isEqualTo(LocalDate.of(2024, 1, 1));
        assertThat(spec.entrySequential()).isTrue();
        assertThat(spec.metrics()).isEqualTo(StrategySpec.DEFAULT_METRICS);
        assertThat(spec.entryRules()).containsExactly(
                new CrossoverRule(10, 50, CrossoverDirection.ABOVE, null, null),
                new VolFilterRule(20, VolFilterRule.MEDIAN_1Y, VolRelation.BELOW, 3, null)
        );
        assertThat(spec.exitRules()).containsExactly(new CrossoverRule(10, 50, CrossoverDirection.BELOW, null, 2));
    }

    @Test
    void parse_keepsExplicitEmptyMetrics() {
        String json = """
                {"ticker": "SPY", "start_date": "2020-01-01", "end_date": "2021-01-01", "metrics": [],
                 "entry_rules": [{"type": "vol_filter", "window": 20}],
                 "exit_rules": [{"type": "vol_filter", "window": 20, "relation": "above"}]}
                """;

        StrategySpec spec = parser.parse(json);

        assertThat(spec.metrics()).isEmpty();
        assertThat(spec.entryRules().get(0)).isEqualTo(VolFilterRule.of(20, VolRelation.BELOW));
    }

    @Test
    void parse_rejectsPlaceholderDates() {
        String json = """
                {"ticker": "AAPL", "start_date": "YYYY-MM-DD", "end_date": "2024-01-01",
                 "entry_rules": [{"type": "crossover", "fast_ma": 10, "slow_ma": 50, "direction": "above"}],
                 "exit_rules": [{"type": "crossover", "fast_ma": 10, "slow_ma": 50, "direction": "below"}]}
                """;

        assertThatThrownBy(() -> parser.parse(json))
                .isInstanceOf(InvalidInputException.class)
                .hasMessageContaining("LLM generated invalid start_date")
                .hasMessageContaining("missing dates");
    }

    @Test
    void parse_rejectsMalformedOrIncompleteOutput() {
        assertThatThrownBy(() -> parser.parse("{not json"))
                .isInstanceOf(InvalidInputException.class)
                .hasMessageContaining("malformed JSON");
        assertThatThrownBy(() -> parser.parse("[]"))
                .isInstanceOf(InvalidInputException.class);
        assertThatThrownBy(() -> parser.parse(" "))
                .isInstanceOf(InvalidInputException.class);
        assertThatThrownBy(() -> parser.parse("""
                {"ticker": "AAPL", "start_date": "2020-01-01", "end_date": "2024-01-01",
                 "entry_rules": [{"type": "crossover", "fast_ma": 10, "slow_ma": 50, "direction": "above"}],
                 "exit_rules": []}
                """))
                .isInstanceOf(InvalidInputException.class)
                .hasMessage("At least one exit rule is required.");
    }

    @Test
    void parse_rejectsUnknownRuleTypeAndMissingWindows() {
        assertThatThrownBy(() -> parser.parse("""
                {"ticker": "AAPL", "start_date": "2020-01-01", "end_date": "2024-01-01",
                 "entry_rules": [{"type": "rsi", "window": 14}],
                 "exit_rules": [{"type": "crossover", "fast_ma": 10, "slow_ma": 50, "direction": "below"}]}
                """))
                .isInstanceOf(InvalidInputException.class)
                .hasMessage("Unknown rule type: rsi");
        assertThatThrownBy(() -> parser.parse("""
                {"ticker": "AAPL", "start_date": "2020-01-01", "end_date": "2024-01-01",
                 "entry_rules": [{"type": "crossover", "slow_ma": 50, "direction": "above"}],
                 "exit_rules": [{"type": "crossover", "fast_ma": 10, "slow_ma": 50, "direction": "below"}]}
                """))
                .isInstanceOf(InvalidInputException.class)
                .hasMessageContaining("fast_ma is required");
    }

    @Test
    void specJson_roundTripsPolymorphicRules() throws Exception {
        StrategySpec spec = new StrategySpec(
                "MSFT",
                LocalDate.of(2019, 6, 1),
                LocalDate.of(2023, 6, 1),
                List.of(new CrossoverRule(10, 50, CrossoverDirection.ABOVE, 5, null)),
                List.of(VolFilterRule.of(20, VolRelation.ABOVE)),
                StrategySpec.DEFAULT_METRICS,
                false
        );

        String json = StrategyJson.MAPPER.writeValueAsString(spec);

        assertThat(json).contains("\"type\":\"crossover\"", "\"fast_ma\":10", "\"lookahead_days\":5", "\"start_date\":\"2019-06-01\"");
        assertThat(parser.parse(json)).isEqualTo(spec);
    }
}
