package io.convotest.core.progress;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum CollectableField {
    PARENT_NAME,
    PARENT_NAME_SPELLING,
    PARENT_PHONE,
    PARENT_EMAIL,
    PARENT_DOB,
    CHILD_COUNT,
    CHILD_NAMES,
    CHILD_DOB,
    IS_NEW_PATIENT,
    PREVIOUS_VISIT,
    PREVIOUS_ORTHO,
    INSURANCE,
    SPECIAL_NEEDS,
    TIME_PREFERENCE,
    LOCATION_PREFERENCE,
    CARD_REMINDER,
    ADDRESS_PROVIDED,
    PARKING_INFO,
    HOURS_INFO;

    @JsonValue
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static CollectableField fromKey(String key) {
        return valueOf(key.trim().toUpperCase(Locale.ROOT));
    }
}
