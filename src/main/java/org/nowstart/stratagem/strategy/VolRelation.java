package org.nowstart.stratagem.strategy;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum VolRelation {
    BELOW,
    ABOVE;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static VolRelation from(String value) {
        if (value == null || value.isBlank()) {
            return BELOW;
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
