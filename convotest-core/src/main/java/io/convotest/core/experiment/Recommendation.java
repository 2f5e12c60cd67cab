package io.convotest.core.experiment;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum Recommendation {
    CONTINUE,
    ADOPT_TREATMENT,
    KEEP_CONTROL,
    NO_DIFFERENCE;

    @JsonValue
    public String key() {
        return name().toLowerCase(Locale.ROOT).replace('_', '-');
    }
}
