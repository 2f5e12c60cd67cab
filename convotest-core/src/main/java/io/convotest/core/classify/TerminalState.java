package io.convotest.core.classify;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum TerminalState {
    NONE,
    BOOKING_CONFIRMED,
    TRANSFER_INITIATED,
    CONVERSATION_ENDED,
    ERROR_TERMINAL;

    @JsonValue
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static TerminalState fromKey(String key) {
        return valueOf(key.trim().toUpperCase(Locale.ROOT));
    }
}
