package io.convotest.core.runner;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.convotest.core.agent.ToolCall;
import io.convotest.core.conversation.ConversationTurn;
import io.convotest.core.persona.ResolvedPersona;
import io.convotest.core.progress.CollectableField;
import io.convotest.core.progress.ConstraintViolation;
import io.convotest.core.progress.GoalResult;
import io.convotest.core.progress.GoalTestResult;
import io.convotest.core.progress.IssueType;
import io.convotest.core.progress.ProgressIssue;
import io.convotest.core.progress.ProgressState;
import io.convotest.core.progress.Severity;
import io.convotest.core.storage.WriteOperation.ApiCallWrite;
import io.convotest.core.storage.WriteOperation.FindingWrite;
import io.convotest.core.storage.WriteOperation.GoalTestResultWrite;
import io.convotest.core.storage.WriteOperation.ProgressSnapshotWrite;
import io.convotest.core.storage.WriteOperation.TestResultWrite;
import io.convotest.core.storage.WriteOperation.TranscriptWrite;
import io.convotest.core.testcase.GoalTestCase;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

final class ResultRecords {
    private final ObjectMapper mapper;

    ResultRecords() {
        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
        this.mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    TestResultWrite testResult(
        String runId,
        String testId,
        GoalTestCase testCase,
        GoalTestResult result,
        Instant completedAt
    ) {
        return new TestResultWrite(
            runId,
            testId,
            testCase.name(),
            testCase.category().key(),
            result.passed() ? "passed" : "failed",
            completedAt.minusMillis(result.durationMs()),
            completedAt,
            result.durationMs(),
            result.error()
        );
    }

    TranscriptWrite transcript(String runId, String testId, List<ConversationTurn> transcript) throws JsonProcessingException {
        return new TranscriptWrite(runId, testId, mapper.writeValueAsString(transcript));
    }

    List<FindingWrite> findings(String runId, String testId, GoalTestResult result) {
        List<FindingWrite> findings = new ArrayList<>();
        for (GoalResult goal : result.goalResults()) {
            if (goal.passed()) {
                continue;
            }
            String recommendation = goal.details() != null && !goal.details().missing().isEmpty()
                ? "Missing fields: " + String.join(", ", goal.details().missing().stream().map(CollectableField::key).toList())
                : "Review conversation flow";
            findings.add(new FindingWrite(
                runId, testId, "prompt-issue", "high",
                "Goal failed: " + goal.goalId(), goal.message(),
                null, null, null, null, recommendation
            ));
        }
        for (ConstraintViolation violation : result.constraintViolations()) {
            boolean critical = violation.isCritical();
            findings.add(new FindingWrite(
                runId, testId, critical ? "bug" : "enhancement", critical ? "critical" : "medium",
                "Constraint violated: " + violation.constraint().description(), violation.message(),
                violation.turnNumber() == null ? null : "turn-" + violation.turnNumber(),
                null, null, null, "Review constraint and fix behavior"
            ));
        }
        for (ProgressIssue issue : result.issues()) {
            findings.add(new FindingWrite(
                runId, testId, issue.type() == IssueType.ERROR ? "bug" : "prompt-issue", severity(issue.severity()),
                "Issue: " + issue.type().key(), issue.description(),
                "turn-" + issue.turnNumber(), null, null, null, null
            ));
        }
        return findings;
    }

    GoalTestResultWrite goalTestResult(
        String runId,
        String testId,
        GoalTestResult result,
        ResolvedPersona resolved,
        Instant completedAt
    ) throws JsonProcessingException {
        return new GoalTestResultWrite(
            runId,
            testId,
            result.passed(),
            result.turnCount(),
            result.durationMs(),
            completedAt.minusMillis(result.durationMs()),
            completedAt,
            mapper.writeValueAsString(result.goalResults()),
            mapper.writeValueAsString(result.constraintViolations()),
            result.summary(),
            resolved == null ? null : mapper.writeValueAsString(resolved.persona()),
            resolved == null ? null : resolved.metadata().seed()
        );
    }

    ProgressSnapshotWrite snapshot(String runId, String testId, int turn, ProgressState state, Instant at)
        throws JsonProcessingException {
        return new ProgressSnapshotWrite(
            runId,
            testId,
            turn,
            mapper.writeValueAsString(List.copyOf(state.collectedFields().values())),
            mapper.writeValueAsString(state.pendingFields()),
            mapper.writeValueAsString(state.issues()),
            at
        );
    }

    ApiCallWrite apiCall(String runId, String testId, String stepId, ToolCall call, Instant at) {
        return new ApiCallWrite(
            runId,
            testId,
            stepId,
            call.toolName(),
            json(call.input()),
            json(call.output()),
            call.durationMs(),
            call.status(),
            at
        );
    }

    private static String json(JsonNode node) {
        return node == null || node.isNull() || node.isMissingNode() ? null : node.toString();
    }

    private static String severity(Severity severity) {
        return severity.key();
    }
}
