package io.convotest.core.progress;

import java.util.Map;
import java.util.Objects;

public record ProgressIssue(
    IssueType type,
    String description,
    int turnNumber,
    Severity severity,
    Map<String, Object> context
) {
    public ProgressIssue {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(severity, "severity must not be null");
        description = description == null ? "" : description;
        context = context == null ? Map.of() : Map.copyOf(context);
    }

    public static ProgressIssue of(IssueType type, Severity severity, String description, int turnNumber) {
        return new ProgressIssue(type, description, turnNumber, severity, Map.of());
    }

    public boolean isCritical() {
        return severity == Severity.CRITICAL;
    }
}
