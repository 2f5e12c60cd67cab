package io.convotest.core.persona;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record PersonaTraits(Verbosity verbosity, boolean providesExtraInfo) {
    public PersonaTraits {
        verbosity = verbosity == null ? Verbosity.NORMAL : verbosity;
    }

    public static PersonaTraits defaults() {
        return new PersonaTraits(Verbosity.NORMAL, false);
    }
}
