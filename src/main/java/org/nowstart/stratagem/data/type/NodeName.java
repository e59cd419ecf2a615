package org.nowstart.stratagem.data.type;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Arrays;
import java.util.Locale;

/**
 * Workflow steps in their fixed linear order.
 */
public enum NodeName {
    TRANSLATE("translate"),
    INTERPRET("interpret"),
    VALIDATE("validate"),
    FETCH_DATA("fetch_data"),
    ADD_FEATURES("add_features"),
    PRE_QA("pre_qa"),
    BACKTEST("backtest"),
    METRICS("metrics"),
    TRADES("trades"),
    EXPLAIN("explain");

    private final String id;

    NodeName(String id) {
        this.id = id;
    }

    @JsonValue
    public String id() {
        return id;
    }

    @JsonCreator
    public static NodeName fromId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("node id is required");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(node -> node.id.equals(normalized))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown node id=" + value));
    }

    @Override
    public String toString() {
        return id;
    }
}
