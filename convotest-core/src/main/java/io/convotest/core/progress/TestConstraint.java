package io.convotest.core.progress;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.util.Objects;
import java.util.function.Predicate;

public record TestConstraint(
    ConstraintType type,
    String description,
    @JsonIgnore Predicate<GoalContext> condition,
    Integer maxTurns,
    Long maxTimeMs,
    Severity severity
) {
    public TestConstraint {
        Objects.requireNonNull(type, "type must not be null");
        description = description == null ? "" : description;
        severity = severity == null ? Severity.MEDIUM : severity;
    }
}
