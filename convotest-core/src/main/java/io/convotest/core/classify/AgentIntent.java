package io.convotest.core.classify;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import io.convotest.core.progress.CollectableField;
import java.util.Locale;
import java.util.Optional;

public enum AgentIntent {
    GREETING(null),
    SAYING_GOODBYE(null),
    ASKING_PARENT_NAME(CollectableField.PARENT_NAME),
    ASKING_SPELL_NAME(CollectableField.PARENT_NAME_SPELLING),
    ASKING_SPELL_CHILD_NAME(CollectableField.CHILD_NAMES),
    ASKING_PHONE(CollectableField.PARENT_PHONE),
    ASKING_EMAIL(CollectableField.PARENT_EMAIL),
    ASKING_PARENT_DOB(CollectableField.PARENT_DOB),
    ASKING_CHILD_COUNT(CollectableField.CHILD_COUNT),
    ASKING_CHILD_NAME(CollectableField.CHILD_NAMES),
    ASKING_CHILD_DOB(CollectableField.CHILD_DOB),
    ASKING_CHILD_AGE(CollectableField.CHILD_DOB),
    ASKING_NEW_PATIENT(CollectableField.IS_NEW_PATIENT),
    ASKING_PREVIOUS_VISIT(CollectableField.PREVIOUS_VISIT),
    ASKING_PREVIOUS_ORTHO(CollectableField.PREVIOUS_ORTHO),
    ASKING_INSURANCE(CollectableField.INSURANCE),
    ASKING_INSURANCE_MEMBER_ID(null),
    ASKING_SPECIAL_NEEDS(CollectableField.SPECIAL_NEEDS),
    ASKING_MEDICAL_CONDITIONS(CollectableField.SPECIAL_NEEDS),
    ASKING_TIME_PREFERENCE(CollectableField.TIME_PREFERENCE),
    ASKING_LOCATION_PREFERENCE(CollectableField.LOCATION_PREFERENCE),
    CONFIRMING_INFORMATION(null),
    CONFIRMING_SPELLING(null),
    ASKING_PROCEED_CONFIRMATION(null),
    REMINDING_BRING_CARD(CollectableField.CARD_REMINDER),
    SEARCHING_AVAILABILITY(null),
    OFFERING_TIME_SLOTS(null),
    CONFIRMING_BOOKING(null),
    OFFERING_ADDRESS(null),
    PROVIDING_ADDRESS(CollectableField.ADDRESS_PROVIDED),
    PROVIDING_PARKING_INFO(CollectableField.PARKING_INFO),
    PROVIDING_ADDRESS_AND_PARKING(CollectableField.ADDRESS_PROVIDED),
    PROVIDING_HOURS_INFO(CollectableField.HOURS_INFO),
    INITIATING_TRANSFER(null),
    HANDLING_ERROR(null),
    ASKING_CLARIFICATION(null),
    UNKNOWN(null);

    private final CollectableField field;

    AgentIntent(CollectableField field) {
        this.field = field;
    }

    public Optional<CollectableField> collectableField() {
        return Optional.ofNullable(field);
    }

    public boolean endsConversation() {
        return this == SAYING_GOODBYE || this == CONFIRMING_BOOKING || this == INITIATING_TRANSFER;
    }

    @JsonValue
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static AgentIntent fromKey(String key) {
        return valueOf(key.trim().toUpperCase(Locale.ROOT));
    }
}
