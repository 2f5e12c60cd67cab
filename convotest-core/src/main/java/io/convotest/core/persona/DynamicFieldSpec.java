package io.convotest.core.persona;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.Objects;

@JsonIgnoreProperties(ignoreUnknown = true)
public record DynamicFieldSpec(FieldType fieldType, FieldConstraints constraints) {
    public DynamicFieldSpec {
        Objects.requireNonNull(fieldType, "fieldType must not be null");
        constraints = constraints == null ? FieldConstraints.none() : constraints;
    }

    public static DynamicFieldSpec of(FieldType fieldType) {
        return new DynamicFieldSpec(fieldType, FieldConstraints.none());
    }
}
