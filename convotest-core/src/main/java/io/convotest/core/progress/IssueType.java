package io.convotest.core.progress;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum IssueType {
    REPEATING,
    STUCK,
    UNKNOWN_INTENT,
    ERROR,
    UNEXPECTED_RESPONSE;

    @JsonValue
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static IssueType fromKey(String key) {
        return valueOf(key.trim().replace('-', '_').toUpperCase(Locale.ROOT));
    }
}
