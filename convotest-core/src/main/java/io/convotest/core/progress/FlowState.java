package io.convotest.core.progress;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum FlowState {
    START,
    GREETING,
    COLLECTING_PARENT_INFO,
    COLLECTING_CHILD_INFO,
    COLLECTING_HISTORY,
    COLLECTING_INSURANCE,
    COLLECTING_SPECIAL_INFO,
    SCHEDULING,
    BOOKING,
    CONFIRMATION,
    TRANSFER,
    ENDED,
    ERROR;

    @JsonValue
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static FlowState fromKey(String key) {
        return valueOf(key.trim().replace('-', '_').toUpperCase(Locale.ROOT));
    }
}
