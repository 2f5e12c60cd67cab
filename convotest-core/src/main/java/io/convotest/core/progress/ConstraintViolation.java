package io.convotest.core.progress;

import java.util.Objects;

public record ConstraintViolation(TestConstraint constraint, String message, Integer turnNumber) {
    public ConstraintViolation {
        Objects.requireNonNull(constraint, "constraint must not be null");
        message = message == null ? "" : message;
    }

    public boolean isCritical() {
        return constraint.severity() == Severity.CRITICAL;
    }
}
