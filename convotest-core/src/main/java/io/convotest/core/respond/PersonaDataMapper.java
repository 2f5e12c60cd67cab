package io.convotest.core.respond;

import io.convotest.core.classify.DataField;
import io.convotest.core.persona.ChildData;
import io.convotest.core.persona.DataInventory;
import io.convotest.core.persona.Persona;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

public final class PersonaDataMapper {
    static final DateTimeFormatter SPOKEN_DATE = DateTimeFormatter.ofPattern("MMMM d, yyyy", Locale.US);
    private static final DateTimeFormatter SHORT_DATE = DateTimeFormatter.ofPattern("MMM d", Locale.US);
    private static final String[] COUNT_WORDS = {"No children", "One child", "Two children", "Three children"};

    private final DataInventory inventory;
    private final int childIndex;
    private final LocalDate today;

    public PersonaDataMapper(Persona persona, int childIndex, LocalDate today) {
        this.inventory = Objects.requireNonNull(persona, "persona must not be null").inventory();
        this.childIndex = childIndex;
        this.today = Objects.requireNonNull(today, "today must not be null");
    }

    public String getData(DataField field) {
        ChildData child = inventory.child(childIndex);
        return switch (field) {
            case CALLER_NAME -> inventory.parentFullName();
            case CALLER_NAME_SPELLING -> spell(inventory.parentFullName());
            case CALLER_PHONE -> blankToNull(inventory.parentPhone());
            case CALLER_EMAIL -> email();
            case CHILD_COUNT -> childCount();
            case CHILD_NAME -> child == null ? null : child.fullName();
            case CHILD_NAME_SPELLING -> child == null ? null : spell(child.fullName());
            case CHILD_DOB -> child == null || child.dateOfBirth() == null ? null : child.dateOfBirth().format(SPOKEN_DATE);
            case CHILD_AGE -> child == null || child.dateOfBirth() == null ? null : child.ageOn(today) + " years old";
            case NEW_PATIENT_STATUS -> child == null || child.newPatient() ? "Yes, a new patient" : "No, an existing patient";
            case PREVIOUS_VISIT -> Boolean.TRUE.equals(inventory.previousVisitToOffice())
                ? "Yes, we have been there before"
                : "No, this is our first visit";
            case PREVIOUS_ORTHO_TREATMENT -> child != null && Boolean.TRUE.equals(child.hadBracesBefore())
                ? "Yes, had braces before"
                : child == null ? "No previous treatment" : "No previous orthodontic treatment";
            case INSURANCE_INFO -> insurance();
            case INSURANCE_MEMBER_ID -> blankToNull(inventory.insuranceId());
            case SPECIAL_NEEDS, MEDICAL_CONDITIONS -> child == null || isBlank(child.specialNeeds())
                ? "No special needs"
                : child.specialNeeds();
            case TIME_PREFERENCE -> timePreference();
            case LOCATION_PREFERENCE -> isBlank(inventory.preferredLocation())
                ? "Either location works"
                : inventory.preferredLocation();
            case DAY_PREFERENCE -> dayPreference();
            case PARENT_DOB, CARD_REMINDER, OTHER, UNKNOWN -> null;
        };
    }

    public List<String> getAll(List<DataField> fields) {
        List<String> values = new ArrayList<>();
        for (DataField field : fields) {
            String value = getData(field);
            if (value != null && !value.isEmpty()) {
                values.add(value);
            }
        }
        return values;
    }

    private String email() {
        if (!isBlank(inventory.parentEmail())) {
            return inventory.parentEmail();
        }
        String first = inventory.parentFirstName().toLowerCase(Locale.ROOT).replaceAll("[^a-z]", "");
        return (first.isEmpty() ? "user" : first) + "@email.com";
    }

    private String childCount() {
        int count = inventory.children().size();
        return count < COUNT_WORDS.length ? COUNT_WORDS[count] : count + " children";
    }

    private String insurance() {
        if (!Boolean.TRUE.equals(inventory.hasInsurance())) {
            return "No insurance";
        }
        if (isBlank(inventory.insuranceProvider())) {
            return "I'm not sure of the insurance";
        }
        return inventory.insuranceProvider();
    }

    private String timePreference() {
        String time = inventory.preferredTimeOfDay();
        if ("morning".equalsIgnoreCase(time)) {
            return "Morning works best";
        }
        if ("afternoon".equalsIgnoreCase(time)) {
            return "Afternoon works best";
        }
        if ("any".equalsIgnoreCase(time)) {
            return "Any time works";
        }
        if (inventory.preferredDateRange() != null
            && inventory.preferredDateRange().start() != null
            && inventory.preferredDateRange().end() != null) {
            return "Between " + inventory.preferredDateRange().start().format(SHORT_DATE)
                + " and " + inventory.preferredDateRange().end().format(SHORT_DATE);
        }
        return "Any time works for me";
    }

    private String dayPreference() {
        List<String> days = inventory.preferredDays();
        if (days.isEmpty()) {
            return "Any day works";
        }
        if (days.size() == 1) {
            return days.get(0);
        }
        return String.join(", ", days.subList(0, days.size() - 1)) + " or " + days.get(days.size() - 1);
    }

    // "Ann Lee" -> "A-N-N- -L-E-E"
    static String spell(String name) {
        StringBuilder spelled = new StringBuilder();
        for (int i = 0; i < name.length(); i++) {
            if (i > 0) {
                spelled.append('-');
            }
            spelled.append(name.charAt(i));
        }
        return spelled.toString().toUpperCase(Locale.ROOT);
    }

    private static String blankToNull(String value) {
        return isBlank(value) ? null : value;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
