package io.convotest.core.persona;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.time.LocalDate;
import java.time.Period;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ChildData(
    String firstName,
    String lastName,
    LocalDate dateOfBirth,
    @JsonAlias({"isNewPatient"}) boolean newPatient,
    Boolean hadBracesBefore,
    String specialNeeds
) {
    public ChildData {
        firstName = firstName == null ? "" : firstName.trim();
        lastName = lastName == null ? "" : lastName.trim();
    }

    public String fullName() {
        return (firstName + " " + lastName).trim();
    }

    public int ageOn(LocalDate today) {
        if (dateOfBirth == null) {
            return 0;
        }
        return Period.between(dateOfBirth, today).getYears();
    }
}
