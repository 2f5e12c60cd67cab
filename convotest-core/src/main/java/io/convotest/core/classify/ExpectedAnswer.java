package io.convotest.core.classify;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum ExpectedAnswer {
    YES,
    NO,
    EITHER;

    @JsonValue
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ExpectedAnswer fromKey(String key) {
        return valueOf(key.trim().toUpperCase(Locale.ROOT));
    }
}
