package io.convotest.core.classify;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum ResponseCategory {
    PROVIDE_DATA,
    CONFIRM_OR_DENY,
    SELECT_FROM_OPTIONS,
    ACKNOWLEDGE,
    CLARIFY_REQUEST,
    EXPRESS_PREFERENCE;

    @JsonValue
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ResponseCategory fromKey(String key) {
        return valueOf(key.trim().toUpperCase(Locale.ROOT));
    }
}
