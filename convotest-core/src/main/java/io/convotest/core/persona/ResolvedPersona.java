package io.convotest.core.persona;

import java.util.Objects;

public record ResolvedPersona(PersonaTemplate template, Persona persona, ResolutionMetadata metadata) {
    public ResolvedPersona {
        Objects.requireNonNull(persona, "persona must not be null");
        Objects.requireNonNull(metadata, "metadata must not be null");
    }
}
