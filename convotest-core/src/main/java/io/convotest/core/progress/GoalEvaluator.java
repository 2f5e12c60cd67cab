package io.convotest.core.progress;

import io.convotest.core.classify.AgentIntent;
import io.convotest.core.conversation.ConversationTurn;
import io.convotest.core.testcase.GoalTestCase;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

public final class GoalEvaluator {

    public GoalTestResult evaluateTest(
        GoalTestCase testCase,
        ProgressState progress,
        List<ConversationTurn> transcript,
        long durationMs
    ) {
        GoalContext context = context(progress, transcript, durationMs);
        List<GoalResult> goalResults = new ArrayList<>();
        for (ConversationGoal goal : testCase.goals()) {
            goalResults.add(evaluateGoal(goal, context, progress));
        }
        List<ConstraintViolation> violations = new ArrayList<>();
        for (TestConstraint constraint : testCase.constraints()) {
            ConstraintViolation violation = checkConstraint(constraint, context, progress, durationMs);
            if (violation != null) {
                violations.add(violation);
            }
        }
        boolean passed = determinePassFail(testCase.goals(), goalResults, violations);
        return new GoalTestResult(
            passed,
            goalResults,
            violations,
            summarize(passed, goalResults, violations, progress),
            progress,
            transcript,
            progress.turnNumber(),
            durationMs,
            progress.issues(),
            null
        );
    }

    public GoalTestResult failedExecution(GoalTestCase testCase, String errorMessage, long durationMs, Instant at) {
        String description = "Test execution error: " + errorMessage;
        ProgressIssue issue = ProgressIssue.of(IssueType.ERROR, Severity.CRITICAL, description, 0);
        List<String> goalIds = testCase.goals().stream().map(ConversationGoal::id).toList();
        List<GoalResult> goalResults = testCase.goals().stream()
            .map(goal -> GoalResult.of(goal.id(), false, description))
            .toList();
        return new GoalTestResult(
            false,
            goalResults,
            List.of(),
            "Test failed due to error: " + errorMessage,
            ProgressState.failed(goalIds, issue, at),
            List.of(),
            0,
            durationMs,
            List.of(issue),
            errorMessage
        );
    }

    public String failureReport(GoalTestResult result) {
        if (result.passed()) {
            return "Test passed - no failures to report";
        }
        List<String> lines = new ArrayList<>(List.of("=== FAILURE REPORT ===", ""));

        List<GoalResult> failed = result.goalResults().stream().filter(r -> !r.passed()).toList();
        if (!failed.isEmpty()) {
            lines.add("FAILED GOALS:");
            for (GoalResult goal : failed) {
                lines.add("  - " + goal.goalId() + ": " + goal.message());
                if (goal.details() != null && !goal.details().missing().isEmpty()) {
                    lines.add("    Missing fields: " + keys(goal.details().missing()));
                }
            }
            lines.add("");
        }
        if (!result.constraintViolations().isEmpty()) {
            lines.add("CONSTRAINT VIOLATIONS:");
            for (ConstraintViolation violation : result.constraintViolations()) {
                lines.add("  - [" + violation.constraint().severity().key() + "] " + violation.message());
                if (violation.turnNumber() != null) {
                    lines.add("    At turn: " + violation.turnNumber());
                }
            }
            lines.add("");
        }
        if (!result.issues().isEmpty()) {
            lines.add("DETECTED ISSUES:");
            for (ProgressIssue issue : result.issues()) {
                lines.add("  - [" + issue.severity().key() + "] " + issue.type().key() + ": " + issue.description());
                lines.add("    At turn: " + issue.turnNumber());
            }
            lines.add("");
        }
        lines.add("FINAL STATE:");
        lines.add("  Turns: " + result.turnCount());
        lines.add("  Duration: " + result.durationMs() + "ms");
        lines.add("  Flow state: " + result.progress().currentFlowState().key());
        lines.add("  Fields collected: " + result.progress().collectedFields().size());
        lines.add("  Fields pending: " + result.progress().pendingFields().size());
        return String.join("\n", lines);
    }

    static GoalResult dataCollection(ConversationGoal goal, ProgressState progress) {
        List<CollectableField> required = goal.requiredFields();
        List<CollectableField> collected = required.stream().filter(progress::hasCollected).toList();
        List<CollectableField> missing = required.stream().filter(f -> !progress.hasCollected(f)).toList();
        String message = missing.isEmpty()
            ? "All " + required.size() + " required fields collected"
            : "Missing " + missing.size() + " of " + required.size() + " fields: " + keys(missing);
        return new GoalResult(goal.id(), missing.isEmpty(), message, new GoalResult.Details(required, collected, missing));
    }

    private GoalResult evaluateGoal(ConversationGoal goal, GoalContext context, ProgressState progress) {
        if (progress.completedGoals().contains(goal.id())) {
            return GoalResult.of(goal.id(), true, "Goal completed during conversation");
        }
        return switch (goal.type()) {
            case DATA_COLLECTION -> dataCollection(goal, progress);
            case BOOKING_CONFIRMED -> GoalResult.of(goal.id(), context.agentConfirmedBooking(),
                context.agentConfirmedBooking() ? "Agent confirmed the booking" : "Booking was not confirmed");
            case TRANSFER_INITIATED -> GoalResult.of(goal.id(), context.agentInitiatedTransfer(),
                context.agentInitiatedTransfer() ? "Agent transferred to live agent" : "Transfer was not initiated");
            case CONVERSATION_ENDED -> GoalResult.of(goal.id(), progress.conversationEnded(),
                progress.conversationEnded()
                    ? "Conversation ended properly with goodbye"
                    : "Conversation did not end properly");
            case ERROR_HANDLED -> errorHandled(goal, progress);
            case CUSTOM -> custom(goal, context, progress);
        };
    }

    private GoalResult errorHandled(ConversationGoal goal, ProgressState progress) {
        boolean hadErrors = progress.errorIssueCount() > 0;
        boolean handled = progress.lastAgentIntent() != AgentIntent.HANDLING_ERROR
            || !progress.completedGoals().isEmpty();
        String message = hadErrors
            ? (handled ? "Errors were handled gracefully" : "Errors were not handled properly")
            : "No errors occurred";
        return GoalResult.of(goal.id(), !hadErrors || handled, message);
    }

    private GoalResult custom(ConversationGoal goal, GoalContext context, ProgressState progress) {
        if (goal.successCriteria() != null) {
            boolean passed = goal.successCriteria().test(context);
            return GoalResult.of(goal.id(), passed, passed ? "Custom criteria met" : "Custom criteria not met");
        }
        return CustomGoalHeuristics.evaluate(goal, progress);
    }

    private ConstraintViolation checkConstraint(
        TestConstraint constraint,
        GoalContext context,
        ProgressState progress,
        long durationMs
    ) {
        int transcriptTurn = 2 * progress.turnNumber();
        return switch (constraint.type()) {
            case MUST_HAPPEN -> constraint.condition() != null && !constraint.condition().test(context)
                ? new ConstraintViolation(constraint, "Required condition not met: " + constraint.description(), null)
                : null;
            case MUST_NOT_HAPPEN -> constraint.condition() != null && constraint.condition().test(context)
                ? new ConstraintViolation(constraint, "Forbidden condition occurred: " + constraint.description(), transcriptTurn)
                : null;
            case MAX_TURNS -> constraint.maxTurns() != null && progress.turnNumber() > constraint.maxTurns()
                ? new ConstraintViolation(
                    constraint,
                    "Exceeded max turns: " + progress.turnNumber() + " > " + constraint.maxTurns(),
                    transcriptTurn)
                : null;
            case MAX_TIME -> constraint.maxTimeMs() != null && durationMs > constraint.maxTimeMs()
                ? new ConstraintViolation(
                    constraint,
                    "Exceeded max time: " + durationMs + "ms > " + constraint.maxTimeMs() + "ms",
                    null)
                : null;
        };
    }

    private boolean determinePassFail(
        List<ConversationGoal> goals,
        List<GoalResult> results,
        List<ConstraintViolation> violations
    ) {
        if (violations.stream().anyMatch(ConstraintViolation::isCritical)) {
            return false;
        }
        for (ConversationGoal goal : goals) {
            if (!goal.required()) {
                continue;
            }
            boolean passed = results.stream().anyMatch(r -> r.goalId().equals(goal.id()) && r.passed());
            if (!passed) {
                return false;
            }
        }
        return true;
    }

    private String summarize(
        boolean passed,
        List<GoalResult> results,
        List<ConstraintViolation> violations,
        ProgressState progress
    ) {
        List<String> parts = new ArrayList<>();
        parts.add(passed ? "TEST PASSED" : "TEST FAILED");
        long achieved = results.stream().filter(GoalResult::passed).count();
        parts.add("Goals: " + achieved + "/" + results.size() + " achieved");
        List<GoalResult> failed = results.stream().filter(r -> !r.passed()).toList();
        if (!failed.isEmpty()) {
            parts.add("Failed goals: " + failed.stream().map(GoalResult::goalId).collect(Collectors.joining(", ")));
        }
        if (!violations.isEmpty()) {
            parts.add("Violations: " + violations.size());
            List<ConstraintViolation> critical = violations.stream().filter(ConstraintViolation::isCritical).toList();
            if (!critical.isEmpty()) {
                parts.add("Critical: " + critical.stream()
                    .map(v -> v.constraint().description())
                    .collect(Collectors.joining("; ")));
            }
        }
        parts.add("Turns: " + progress.turnNumber());
        parts.add("Fields collected: " + progress.collectedFields().size());
        if (!progress.issues().isEmpty()) {
            parts.add("Issues detected: " + progress.issues().size());
        }
        return String.join(" | ", parts);
    }

    private static GoalContext context(ProgressState progress, List<ConversationTurn> transcript, long durationMs) {
        return new GoalContext(
            progress.collectedFields(),
            transcript,
            progress.agentConfirmedBooking(),
            progress.agentInitiatedTransfer(),
            progress.turnNumber(),
            durationMs
        );
    }

    private static String keys(List<CollectableField> fields) {
        return fields.stream().map(CollectableField::key).collect(Collectors.joining(", "));
    }
}
