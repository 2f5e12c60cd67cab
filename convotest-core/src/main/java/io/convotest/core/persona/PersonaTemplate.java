package io.convotest.core.persona;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

@JsonIgnoreProperties(ignoreUnknown = true)
public record PersonaTemplate(Persona base, Map<String, DynamicFieldSpec> dynamicFields) {
    public PersonaTemplate {
        Objects.requireNonNull(base, "base must not be null");
        dynamicFields = dynamicFields == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(dynamicFields));
    }

    public static PersonaTemplate fixed(Persona persona) {
        return new PersonaTemplate(persona, Map.of());
    }

    public boolean hasDynamicFields() {
        return !dynamicFields.isEmpty();
    }
}
