package io.convotest.core.persona;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum FieldType {
    @JsonProperty("firstName") FIRST_NAME,
    @JsonProperty("lastName") LAST_NAME,
    @JsonProperty("fullName") FULL_NAME,
    @JsonProperty("phone") PHONE,
    @JsonProperty("email") EMAIL,
    @JsonProperty("date") DATE,
    @JsonProperty("dateOfBirth") DATE_OF_BIRTH,
    @JsonProperty("boolean") BOOLEAN,
    @JsonProperty("insuranceProvider") INSURANCE_PROVIDER,
    @JsonProperty("insuranceId") INSURANCE_ID,
    @JsonProperty("location") LOCATION,
    @JsonProperty("timeOfDay") TIME_OF_DAY,
    @JsonProperty("specialNeeds") SPECIAL_NEEDS
}
