package io.convotest.core.persona;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.time.LocalDate;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record FieldConstraints(
    LocalDate minDate,
    LocalDate maxDate,
    Integer minAge,
    Integer maxAge,
    String phoneFormat,
    List<String> options,
    Double probability,
    String prefix,
    String suffix
) {
    public FieldConstraints {
        options = options == null ? List.of() : List.copyOf(options);
        prefix = prefix == null ? "" : prefix;
        suffix = suffix == null ? "" : suffix;
    }

    public static FieldConstraints none() {
        return new FieldConstraints(null, null, null, null, null, List.of(), null, "", "");
    }

    public static FieldConstraints ages(int minAge, int maxAge) {
        return new FieldConstraints(null, null, minAge, maxAge, null, List.of(), null, "", "");
    }

    public static FieldConstraints options(List<String> options) {
        return new FieldConstraints(null, null, null, null, null, options, null, "", "");
    }

    public static FieldConstraints probability(double probability) {
        return new FieldConstraints(null, null, null, null, null, List.of(), probability, "", "");
    }
}
