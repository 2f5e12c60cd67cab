package io.convotest.core.classify;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum DataField {
    CALLER_NAME,
    CALLER_NAME_SPELLING,
    CALLER_PHONE,
    CALLER_EMAIL,
    PARENT_DOB,
    CHILD_COUNT,
    CHILD_NAME,
    CHILD_NAME_SPELLING,
    CHILD_DOB,
    CHILD_AGE,
    NEW_PATIENT_STATUS,
    PREVIOUS_VISIT,
    PREVIOUS_ORTHO_TREATMENT,
    INSURANCE_INFO,
    INSURANCE_MEMBER_ID,
    SPECIAL_NEEDS,
    MEDICAL_CONDITIONS,
    CARD_REMINDER,
    TIME_PREFERENCE,
    LOCATION_PREFERENCE,
    DAY_PREFERENCE,
    OTHER,
    UNKNOWN;

    @JsonValue
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static DataField fromKey(String key) {
        return valueOf(key.trim().toUpperCase(Locale.ROOT));
    }
}
