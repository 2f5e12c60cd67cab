package io.convotest.core.experiment;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum VariantType {
    PROMPT,
    TOOL,
    CONFIG;

    @JsonValue
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static VariantType fromKey(String key) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("variant type must not be blank");
        }
        return valueOf(key.trim().toUpperCase(Locale.ROOT));
    }
}
