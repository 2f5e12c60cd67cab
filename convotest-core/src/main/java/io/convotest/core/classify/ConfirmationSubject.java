package io.convotest.core.classify;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum ConfirmationSubject {
    INFORMATION_CORRECT,
    PHONE_NUMBER_CORRECT,
    PROCEED_ANYWAY,
    BOOKING_DETAILS,
    WANTS_ADDRESS,
    WANTS_PARKING_INFO,
    SPELLING_CORRECT,
    INSURANCE_CARD_REMINDER,
    PREVIOUS_VISIT,
    PREVIOUS_TREATMENT,
    HAS_INSURANCE,
    WANTS_TIME_SLOT,
    READY_TO_BOOK,
    MEDICAL_CONDITIONS,
    SPECIAL_NEEDS,
    GENERAL;

    @JsonValue
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ConfirmationSubject fromKey(String key) {
        return valueOf(key.trim().toUpperCase(Locale.ROOT));
    }
}
