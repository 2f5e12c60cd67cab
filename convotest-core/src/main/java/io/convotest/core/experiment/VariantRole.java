package io.convotest.core.experiment;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum VariantRole {
    CONTROL,
    TREATMENT;

    @JsonValue
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static VariantRole fromKey(String key) {
        if (key == null || key.isBlank()) {
            return TREATMENT;
        }
        return valueOf(key.trim().toUpperCase(Locale.ROOT));
    }
}
