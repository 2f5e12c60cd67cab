package io.convotest.core.persona;

import java.time.Instant;
import java.util.List;

public record ResolutionMetadata(long seed, Instant resolvedAt, List<String> dynamicFields) {
    public ResolutionMetadata {
        dynamicFields = dynamicFields == null ? List.of() : List.copyOf(dynamicFields);
    }
}
