package io.convotest.core.observability;

public record RunSummary(
    int testsStarted,
    int testsPassed,
    int testsFailed,
    double passRate,
    double p50DurationMs,
    double p95DurationMs,
    int rollbackFailures,
    int flushFailures,
    int auditEvents
) {
}
