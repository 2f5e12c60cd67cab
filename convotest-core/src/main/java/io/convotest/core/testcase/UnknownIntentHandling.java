package io.convotest.core.testcase;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum UnknownIntentHandling {
    FAIL,
    CLARIFY,
    GENERIC;

    @JsonValue
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static UnknownIntentHandling fromKey(String key) {
        return valueOf(key.trim().toUpperCase(Locale.ROOT));
    }
}
