package io.convotest.core.runner;

import java.util.Objects;

public record ExperimentContext(String experimentId) {
    public ExperimentContext {
        Objects.requireNonNull(experimentId, "experimentId must not be null");
        if (experimentId.isBlank()) {
            throw new IllegalArgumentException("experimentId must not be blank");
        }
    }
}
