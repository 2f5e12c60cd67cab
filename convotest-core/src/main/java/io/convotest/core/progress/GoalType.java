package io.convotest.core.progress;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum GoalType {
    DATA_COLLECTION,
    BOOKING_CONFIRMED,
    TRANSFER_INITIATED,
    CONVERSATION_ENDED,
    ERROR_HANDLED,
    CUSTOM;

    @JsonValue
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static GoalType fromKey(String key) {
        return valueOf(key.trim().replace('-', '_').toUpperCase(Locale.ROOT));
    }
}
