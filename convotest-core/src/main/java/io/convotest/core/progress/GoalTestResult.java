package io.convotest.core.progress;

import io.convotest.core.conversation.ConversationTurn;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

public record GoalTestResult(
    boolean passed,
    List<GoalResult> goalResults,
    List<ConstraintViolation> constraintViolations,
    String summary,
    ProgressState progress,
    List<ConversationTurn> transcript,
    int turnCount,
    long durationMs,
    List<ProgressIssue> issues,
    String error
) {
    public GoalTestResult {
        goalResults = goalResults == null ? List.of() : List.copyOf(goalResults);
        constraintViolations = constraintViolations == null ? List.of() : List.copyOf(constraintViolations);
        summary = summary == null ? "" : summary;
        Objects.requireNonNull(progress, "progress must not be null");
        transcript = transcript == null ? List.of() : List.copyOf(transcript);
        issues = issues == null ? List.of() : List.copyOf(issues);
    }

    /**
     * Marks the result failed because the conversation was cut short, whatever the goals say.
     */
    public GoalTestResult withError(String message) {
        ProgressIssue issue = ProgressIssue.of(IssueType.ERROR, Severity.CRITICAL, "Test execution error: " + message, turnCount);
        List<ProgressIssue> withIssue = new ArrayList<>(issues);
        withIssue.add(issue);
        String failedSummary = summary.startsWith("TEST PASSED")
            ? "TEST FAILED" + summary.substring("TEST PASSED".length())
            : summary;
        return new GoalTestResult(
            false,
            goalResults,
            constraintViolations,
            failedSummary + " | Error: " + message,
            progress,
            transcript,
            turnCount,
            durationMs,
            withIssue,
            message
        );
    }

    public long goalsPassed() {
        return goalResults.stream().filter(GoalResult::passed).count();
    }

    public double goalCompletionRate() {
        return goalResults.isEmpty() ? 0.0 : (double) goalsPassed() / goalResults.size();
    }
}
