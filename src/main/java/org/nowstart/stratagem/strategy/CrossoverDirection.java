package org.nowstart.stratagem.strategy;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum CrossoverDirection {
    ABOVE,
    BELOW;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static CrossoverDirection from(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("direction is required");
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
