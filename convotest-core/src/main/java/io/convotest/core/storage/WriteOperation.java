package io.convotest.core.storage;

import java.time.Instant;
import java.util.Objects;

public sealed interface WriteOperation {
    String runId();

    String testId();

    String kind();

    record TestResultWrite(
        String runId,
        String testId,
        String testName,
        String category,
        String status,
        Instant startedAt,
        Instant completedAt,
        long durationMs,
        String errorMessage
    ) implements WriteOperation {
        public TestResultWrite {
            Objects.requireNonNull(runId, "runId must not be null");
            Objects.requireNonNull(testId, "testId must not be null");
            testName = testName == null ? testId : testName;
            status = status == null ? "failed" : status;
        }

        @Override
        public String kind() {
            return "test_result";
        }
    }

    record TranscriptWrite(String runId, String testId, String transcriptJson) implements WriteOperation {
        public TranscriptWrite {
            Objects.requireNonNull(runId, "runId must not be null");
            Objects.requireNonNull(testId, "testId must not be null");
            transcriptJson = transcriptJson == null ? "[]" : transcriptJson;
        }

        @Override
        public String kind() {
            return "transcript";
        }
    }

    record FindingWrite(
        String runId,
        String testId,
        String type,
        String severity,
        String title,
        String description,
        String affectedStep,
        String agentQuestion,
        String expectedBehavior,
        String actualBehavior,
        String recommendation
    ) implements WriteOperation {
        public FindingWrite {
            Objects.requireNonNull(runId, "runId must not be null");
            Objects.requireNonNull(testId, "testId must not be null");
            Objects.requireNonNull(type, "type must not be null");
            severity = severity == null ? "medium" : severity;
            title = title == null ? "" : title;
            description = description == null ? "" : description;
        }

        @Override
        public String kind() {
            return "finding";
        }
    }

    record ApiCallWrite(
        String runId,
        String testId,
        String stepId,
        String toolName,
        String requestJson,
        String responseJson,
        Long durationMs,
        String status,
        Instant timestamp
    ) implements WriteOperation {
        public ApiCallWrite {
            Objects.requireNonNull(runId, "runId must not be null");
            Objects.requireNonNull(testId, "testId must not be null");
            Objects.requireNonNull(toolName, "toolName must not be null");
            status = status == null ? "completed" : status;
        }

        @Override
        public String kind() {
            return "api_call";
        }
    }

    record GoalTestResultWrite(
        String runId,
        String testId,
        boolean passed,
        int turnCount,
        long durationMs,
        Instant startedAt,
        Instant completedAt,
        String goalResultsJson,
        String constraintViolationsJson,
        String summary,
        String resolvedPersonaJson,
        Long personaSeed
    ) implements WriteOperation {
        public GoalTestResultWrite {
            Objects.requireNonNull(runId, "runId must not be null");
            Objects.requireNonNull(testId, "testId must not be null");
            goalResultsJson = goalResultsJson == null ? "[]" : goalResultsJson;
            constraintViolationsJson = constraintViolationsJson == null ? "[]" : constraintViolationsJson;
            summary = summary == null ? "" : summary;
        }

        @Override
        public String kind() {
            return "goal_test_result";
        }
    }

    record ProgressSnapshotWrite(
        String runId,
        String testId,
        int turnNumber,
        String collectedFieldsJson,
        String pendingFieldsJson,
        String issuesJson,
        Instant capturedAt
    ) implements WriteOperation {
        public ProgressSnapshotWrite {
            Objects.requireNonNull(runId, "runId must not be null");
            Objects.requireNonNull(testId, "testId must not be null");
            collectedFieldsJson = collectedFieldsJson == null ? "{}" : collectedFieldsJson;
            pendingFieldsJson = pendingFieldsJson == null ? "[]" : pendingFieldsJson;
            issuesJson = issuesJson == null ? "[]" : issuesJson;
        }

        @Override
        public String kind() {
            return "progress_snapshot";
        }
    }
}
