package org.nowstart.stratagem.service;

final class LlmPrompts {

    static final String TRANSLATION_SYSTEM = """
            You convert a natural-language description of a single-asset, long-only daily backtest
            into one JSON object with this shape:

            {
              "ticker": "AAPL",
              "start_date": "YYYY-MM-DD",
              "end_date": "YYYY-MM-DD",
              "entry_rules": [
                {"type": "crossover", "fast_ma": 10, "slow_ma": 50, "direction": "above", "lookahead_days": 3},
                {"type": "vol_filter", "window": 20, "threshold": "median_1y", "relation": "below"}
              ],
              "exit_rules": [
                {"type": "crossover", "fast_ma": 10, "slow_ma": 50, "direction": "below", "duration_days": 2}
              ],
              "entry_sequential": false,
              "metrics": ["cagr", "max_drawdown", "sharpe"]
            }

            Supported rules:
            - "crossover": fast moving average compared with slow moving average ("above" or "below").
            - "vol_filter": annualised realised volatility over "window" days compared with its 1-year median.

            Constraints:
            - One ticker, long-only, no leverage. Approximate unsupported requests with the supported rules
              but never change numbers or dates the user gave.
            - Dates are ISO 8601. Always emit at least one entry rule and one exit rule.
            - Default metrics are ["cagr", "max_drawdown", "sharpe"].
            - Keep user parameters exactly as written, even when they look unusual.
            - Do not add or drop rules.

            Temporal fields:
            - "lookahead_days" when a condition must happen "within N days".
            - "duration_days" when a condition must hold "for N consecutive days".
            - "entry_sequential": true only when entry conditions happen in order ("first A, then B within N days").
              The first entry rule then has no lookahead and later rules carry their windows.

            Output the JSON object only.
            """;

    static final String TRANSLATION_USER = "User strategy description:\n\n\"\"\"%s\"\"\"\n";

    static final String INTERPRETATION_SYSTEM = """
            You explain how a trading strategy description was read into a structured specification.
            Summarise in plain language: the ticker and period, each entry rule, each exit rule,
            and any timing constraints (lookahead windows, consecutive-day durations, sequential entry).
            Point out assumptions or parts of the description that could not be represented.
            Be brief and direct.
            """;

    static final String INTERPRETATION_USER = """
            Original user description:

            "%s"

            Parsed specification:

            %s
            """;

    static final String EXPLANATION_SYSTEM = """
            You explain backtest results to a non-expert.
            Given a strategy specification and its metrics (CAGR, max drawdown, Sharpe ratio, number of trades),
            describe what the strategy did, how it performed, and the main risks visible in the numbers.
            Use at most three short paragraphs. Do not give investment advice.
            """;

    private LlmPrompts() {
    }
}
