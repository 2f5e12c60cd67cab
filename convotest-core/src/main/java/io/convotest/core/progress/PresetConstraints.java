package io.convotest.core.progress;

import io.convotest.core.conversation.TurnRole;
import java.util.List;
import java.util.regex.Pattern;

public final class PresetConstraints {
    private static final Pattern ERROR_WORDING = Pattern.compile(
        "\\b(error|failed|problem|sorry.*trouble)\\b",
        Pattern.CASE_INSENSITIVE
    );
    private static final Pattern INTERNAL_WORDING = Pattern.compile(
        "\\b(null|undefined|exception|stack|trace|\\[object)\\b",
        Pattern.CASE_INSENSITIVE
    );

    private PresetConstraints() {
    }

    public static TestConstraint noErrors() {
        return new TestConstraint(
            ConstraintType.MUST_NOT_HAPPEN,
            "No error messages should appear in agent responses",
            ctx -> agentSaid(ctx, ERROR_WORDING),
            null,
            null,
            Severity.CRITICAL
        );
    }

    public static TestConstraint noInternalExposure() {
        return new TestConstraint(
            ConstraintType.MUST_NOT_HAPPEN,
            "No internal system information should be exposed",
            ctx -> agentSaid(ctx, INTERNAL_WORDING),
            null,
            null,
            Severity.CRITICAL
        );
    }

    public static TestConstraint maxTurns(int turns) {
        return new TestConstraint(
            ConstraintType.MAX_TURNS,
            "Conversation should complete within " + turns + " turns",
            null,
            turns,
            null,
            Severity.HIGH
        );
    }

    public static TestConstraint maxTime(long ms) {
        return new TestConstraint(
            ConstraintType.MAX_TIME,
            "Conversation should complete within " + (ms / 1000.0) + " seconds",
            null,
            null,
            ms,
            Severity.MEDIUM
        );
    }

    public static List<TestConstraint> defaults() {
        return List.of(noErrors(), noInternalExposure());
    }

    private static boolean agentSaid(GoalContext ctx, Pattern pattern) {
        return ctx.conversationHistory().stream()
            .anyMatch(turn -> turn.role() == TurnRole.ASSISTANT && pattern.matcher(turn.content()).find());
    }
}
