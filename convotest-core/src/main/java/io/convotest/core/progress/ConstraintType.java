package io.convotest.core.progress;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum ConstraintType {
    MUST_HAPPEN,
    MUST_NOT_HAPPEN,
    MAX_TURNS,
    MAX_TIME;

    @JsonValue
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ConstraintType fromKey(String key) {
        return valueOf(key.trim().replace('-', '_').toUpperCase(Locale.ROOT));
    }
}
