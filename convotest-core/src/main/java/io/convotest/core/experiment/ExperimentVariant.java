package io.convotest.core.experiment;

import java.util.Objects;

public record ExperimentVariant(String variantId, VariantRole role, int weight) {
    public ExperimentVariant {
        Objects.requireNonNull(variantId, "variantId must not be null");
        role = role == null ? VariantRole.TREATMENT : role;
        if (weight < 0) {
            throw new IllegalArgumentException("weight must not be negative");
        }
    }

    public ExperimentVariant withWeight(int value) {
        return new ExperimentVariant(variantId, role, value);
    }
}
