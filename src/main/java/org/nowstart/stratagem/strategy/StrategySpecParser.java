package org.nowstart.stratagem.strategy;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.nowstart.stratagem.data.exception.InvalidInputException;
import org.springframework.stereotype.Component;

/**
 * Turns model-produced JSON into a {@link StrategySpec}. Anything unusable is an {@link InvalidInputException}.
 */
@Component
public class StrategySpecParser {

    private static final String MISSING_DATES_HINT = "Your prompt is missing dates. "
            + "Please include explicit dates in your strategy description, for example: "
            + "'Backtest AAPL from 2020-01-01 to 2024-01-01'";

    public StrategySpec parse(String json) {
        if (json == null || json.isBlank()) {
            throw new InvalidInputException("Model returned an empty strategy specification");
        }

        JsonNode root;
        try {
            root = StrategyJson.MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new InvalidInputException("Model returned malformed JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new InvalidInputException("Model output is not a JSON object");
        }
        return parse(root);
    }

    public StrategySpec parse(JsonNode root) {
        LocalDate startDate = parseDate(root, "start_date");
        LocalDate endDate = parseDate(root, "end_date");

        List<StrategyRule> entryRules = parseRules(root.path("entry_rules"));
        List<StrategyRule> exitRules = parseRules(root.path("exit_rules"));
        if (entryRules.isEmpty()) {
            throw new InvalidInputException("At least one entry rule is required.");
        }
        if (exitRules.isEmpty()) {
            throw new InvalidInputException("At least one exit rule is required.");
        }

        String ticker = root.path("ticker").asText("").trim().toUpperCase(Locale.ROOT);
        if (ticker.isBlank()) {
            throw new InvalidInputException("Strategy specification has no ticker");
        }

        List<String> metrics = new ArrayList<>();
        JsonNode metricsNode = root.get("metrics");
        if (metricsNode == null || metricsNode.isNull()) {
            metrics.addAll(StrategySpec.DEFAULT_METRICS);
        } else {
            metricsNode.forEach(metric -> metrics.add(metric.asText()));
        }

        return new StrategySpec(
                ticker,
                startDate,
                endDate,
                entryRules,
                exitRules,
                metrics,
                root.path("entry_sequential").asBoolean(false)
        );
    }

    private LocalDate parseDate(JsonNode root, String field) {
        String value = root.path(field).asText("").trim();
        if (value.isEmpty() || value.toUpperCase(Locale.ROOT).contains("YYYY")) {
            throw new InvalidInputException("LLM generated invalid " + field + ". " + MISSING_DATES_HINT);
        }
        try {
            return LocalDate.parse(value);
        } catch (DateTimeParseException e) {
            throw new InvalidInputException("Invalid date format in spec: " + field + "=" + value, e);
        }
    }

    private List<StrategyRule> parseRules(JsonNode rulesNode) {
        List<StrategyRule> rules = new ArrayList<>();
        if (rulesNode == null || !rulesNode.isArray()) {
            return rules;
        }
        for (JsonNode ruleNode : rulesNode) {
            rules.add(parseRule(ruleNode));
        }
        return rules;
    }

    private StrategyRule parseRule(JsonNode ruleNode) {
        String type = ruleNode.path("type").asText("");
        Integer lookahead = optionalInt(ruleNode, "lookahead_days");
        Integer duration = optionalInt(ruleNode, "duration_days");

        try {
            return switch (type) {
                case "crossover" -> new CrossoverRule(
                        requiredInt(ruleNode, "fast_ma"),
                        requiredInt(ruleNode, "slow_ma"),
                        CrossoverDirection.from(ruleNode.path("direction").asText(null)),
                        lookahead,
                        duration
                );
                case "vol_filter" -> new VolFilterRule(
                        requiredInt(ruleNode, "window"),
                        ruleNode.path("threshold").asText(VolFilterRule.MEDIAN_1Y),
                        VolRelation.from(ruleNode.path("relation").asText(null)),
                        lookahead,
                        duration
                );
                default -> throw new InvalidInputException("Unknown rule type: " + type);
            };
        } catch (IllegalArgumentException e) {
            throw new InvalidInputException("Invalid " + type + " rule: " + e.getMessage(), e);
        }
    }

    private int requiredInt(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || !(value.isNumber() || value.isTextual())) {
            throw new IllegalArgumentException(field + " is required");
        }
        return value.isNumber() ? value.asInt() : Integer.parseInt(value.asText().trim());
    }

    private Integer optionalInt(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        return value.asInt();
    }
}
