package io.convotest.core.respond;

import io.convotest.core.classify.AgentIntent;
import io.convotest.core.persona.ChildData;
import io.convotest.core.persona.DataInventory;
import io.convotest.core.persona.DateRange;
import io.convotest.core.persona.Persona;
import java.time.Clock;
import java.time.LocalDate;
import java.util.Objects;

public final class TemplateResponseGenerator {
    static final String GREETING = "Hi, I need to schedule an orthodontic appointment for my child";
    static final String NO_INFORMATION = "Sorry, I don't have that information";

    private final Clock clock;

    public TemplateResponseGenerator(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public String generate(AgentIntent intent, Persona persona, int childIndex) {
        DataInventory inventory = persona.inventory();
        ChildData child = inventory.child(childIndex);
        return switch (intent) {
            case ASKING_PARENT_NAME -> inventory.parentFullName();
            case ASKING_SPELL_NAME -> PersonaDataMapper.spell(inventory.parentFullName());
            case ASKING_SPELL_CHILD_NAME -> child == null ? NO_INFORMATION : PersonaDataMapper.spell(child.fullName());
            case ASKING_PHONE -> inventory.parentPhone();
            case ASKING_EMAIL -> inventory.parentEmail() == null || inventory.parentEmail().isBlank()
                ? "I don't have an email"
                : inventory.parentEmail();
            case ASKING_CHILD_COUNT -> childCount(inventory.children().size());
            case ASKING_CHILD_NAME -> child == null ? NO_INFORMATION : child.fullName();
            case ASKING_CHILD_DOB -> child == null || child.dateOfBirth() == null
                ? "I'm not sure"
                : child.dateOfBirth().format(PersonaDataMapper.SPOKEN_DATE);
            case ASKING_CHILD_AGE -> child == null || child.dateOfBirth() == null
                ? "I'm not sure"
                : child.ageOn(LocalDate.now(clock)) + " years old";
            case ASKING_NEW_PATIENT -> newPatient(child);
            case ASKING_PREVIOUS_VISIT -> Boolean.TRUE.equals(inventory.previousVisitToOffice())
                ? "Yes, we've visited before"
                : "No, this is our first time";
            case ASKING_PREVIOUS_ORTHO -> previousOrtho(inventory, child);
            case ASKING_INSURANCE -> insurance(inventory);
            case ASKING_INSURANCE_MEMBER_ID -> inventory.insuranceId() == null || inventory.insuranceId().isBlank()
                ? "I don't have it with me right now"
                : inventory.insuranceId();
            case ASKING_SPECIAL_NEEDS, ASKING_MEDICAL_CONDITIONS ->
                child == null || child.specialNeeds() == null || child.specialNeeds().isBlank()
                    ? "No special needs or conditions"
                    : child.specialNeeds();
            case ASKING_TIME_PREFERENCE -> timePreference(inventory);
            case ASKING_LOCATION_PREFERENCE -> inventory.preferredLocation() == null || inventory.preferredLocation().isBlank()
                ? "Either location is fine"
                : inventory.preferredLocation();
            case CONFIRMING_INFORMATION -> "Yes, that's correct";
            case CONFIRMING_SPELLING -> "Yes, that's right";
            case ASKING_PROCEED_CONFIRMATION -> "Yes, please proceed";
            case REMINDING_BRING_CARD -> "Okay, I'll bring the insurance card";
            case OFFERING_TIME_SLOTS -> "Yes, that time works";
            case CONFIRMING_BOOKING -> "Yes, please book that";
            case OFFERING_ADDRESS -> "Yes, please";
            case PROVIDING_ADDRESS, PROVIDING_PARKING_INFO, PROVIDING_ADDRESS_AND_PARKING, PROVIDING_HOURS_INFO ->
                "Thank you";
            case SEARCHING_AVAILABILITY -> "Okay, thank you";
            case SAYING_GOODBYE -> "Thank you, goodbye!";
            case INITIATING_TRANSFER -> "Okay, I'll hold";
            case HANDLING_ERROR -> "Can you please try again?";
            case ASKING_CLARIFICATION -> "Sorry, could you repeat that?";
            case GREETING -> GREETING;
            case ASKING_PARENT_DOB, UNKNOWN -> "Yes";
        };
    }

    private static String childCount(int count) {
        if (count == 1) {
            return "One child";
        }
        if (count == 2) {
            return "Two children";
        }
        return count + " children";
    }

    private static String newPatient(ChildData child) {
        if (child == null) {
            return "Yes, new patient";
        }
        return child.newPatient() ? "Yes, this would be our first visit" : "No, we've been here before";
    }

    private static String previousOrtho(DataInventory inventory, ChildData child) {
        if (Boolean.TRUE.equals(inventory.previousOrthoTreatment())) {
            return "Yes, had braces before";
        }
        if (child != null && Boolean.TRUE.equals(child.hadBracesBefore())) {
            return "Yes, they had braces before at a different orthodontist";
        }
        return "No, no previous orthodontic treatment";
    }

    private static String insurance(DataInventory inventory) {
        if (!Boolean.TRUE.equals(inventory.hasInsurance())) {
            return "No insurance";
        }
        if (inventory.insuranceProvider() == null || inventory.insuranceProvider().isBlank()) {
            return "I'm not sure about insurance";
        }
        return inventory.insuranceProvider();
    }

    private static String timePreference(DataInventory inventory) {
        DateRange range = inventory.preferredDateRange();
        if (range != null && range.start() != null && range.end() != null) {
            return "Any time between " + range.start().format(PersonaDataMapper.SPOKEN_DATE)
                + " and " + range.end().format(PersonaDataMapper.SPOKEN_DATE);
        }
        String timeOfDay = inventory.preferredTimeOfDay();
        if (timeOfDay != null && !timeOfDay.isBlank() && !"any".equalsIgnoreCase(timeOfDay)) {
            return timeOfDay.substring(0, 1).toUpperCase() + timeOfDay.substring(1) + " works best";
        }
        return "Any time works for us";
    }
}
