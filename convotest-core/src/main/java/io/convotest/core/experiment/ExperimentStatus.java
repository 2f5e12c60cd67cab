package io.convotest.core.experiment;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum ExperimentStatus {
    DRAFT,
    RUNNING,
    PAUSED,
    COMPLETED,
    ABORTED;

    public boolean isFinal() {
        return this == COMPLETED || this == ABORTED;
    }

    @JsonValue
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ExperimentStatus fromKey(String key) {
        if (key == null || key.isBlank()) {
            return DRAFT;
        }
        return valueOf(key.trim().toUpperCase(Locale.ROOT));
    }
}
