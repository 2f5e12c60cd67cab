package io.convotest.core.experiment;

public record RunMetrics(
    boolean passed,
    int turnCount,
    long durationMs,
    double goalCompletionRate,
    int constraintViolations,
    boolean errorOccurred,
    int goalsCompleted,
    int goalsTotal,
    int issuesDetected
) {
    public double avgTurnDurationMs() {
        return turnCount > 0 ? (double) durationMs / turnCount : 0.0;
    }
}
