package io.convotest.core.persona;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.Objects;

@JsonIgnoreProperties(ignoreUnknown = true)
public record Persona(String name, String description, DataInventory inventory, PersonaTraits traits) {
    public Persona {
        name = name == null ? "" : name.trim();
        description = description == null ? "" : description;
        Objects.requireNonNull(inventory, "inventory must not be null");
        traits = traits == null ? PersonaTraits.defaults() : traits;
    }
}
