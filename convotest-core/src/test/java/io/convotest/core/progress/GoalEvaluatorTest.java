package io.convotest.core.progress;

import static org.assertj.core.api.Assertions.assertThat;

import io.convotest.core.classify.AgentIntent;
import io.convotest.core.classify.IntentDetectionResult;
import io.convotest.core.conversation.ConversationTurn;
import io.convotest.core.persona.DataInventory;
import io.convotest.core.persona.Persona;
import io.convotest.core.testcase.GoalTestCase;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.Test;

class GoalEvaluatorTest {
    private final Clock clock = Clock.fixed(Instant.parse("2026-05-10T08:00:00Z"), ZoneOffset.UTC);
    private final GoalEvaluator evaluator = new GoalEvaluator();

    @Test
    void shouldPassWhenRequiredGoalsPassAndNoCriticalViolation() {
        GoalTestCase testCase = GoalTestCase.builder("T-1", persona())
            .goal(ConversationGoal.collect("phone", "Phone", CollectableField.PARENT_PHONE))
            .goal(ConversationGoal.bookingConfirmed("booked"))
            .goal(ConversationGoal.conversationEnded("bye"))
            .build();
        ProgressTracker tracker = new ProgressTracker(testCase.goals(), clock);
        tracker.updateProgress(intent(AgentIntent.ASKING_PHONE), "555-123-4567", 1);
        tracker.updateProgress(intent(AgentIntent.CONFIRMING_BOOKING), "Great", 2);

        GoalTestResult result = evaluator.evaluateTest(testCase, tracker.getState(), transcript("All booked for Monday."), 1200);

        assertThat(result.passed()).isTrue();
        assertThat(result.goalResults()).extracting(GoalResult::passed).containsExactly(true, true, false);
        assertThat(result.summary()).startsWith("TEST PASSED | Goals: 2/3 achieved | Failed goals: bye");
        assertThat(result.turnCount()).isEqualTo(2);
        assertThat(result.error()).isNull();
    }

    @Test
    void shouldListMissingFieldsForIncompleteCollection() {
        GoalTestCase testCase = GoalTestCase.builder("T-2", persona())
            .goal(ConversationGoal.collect("contact", "Contact", CollectableField.PARENT_PHONE, CollectableField.PARENT_EMAIL))
            .build();
        ProgressTracker tracker = new ProgressTracker(testCase.goals(), clock);
        tracker.updateProgress(intent(AgentIntent.ASKING_PHONE), "555-123-4567", 1);

        GoalTestResult result = evaluator.evaluateTest(testCase, tracker.getState(), transcript("What is your phone?"), 500);

        assertThat(result.passed()).isFalse();
        GoalResult contact = result.goalResults().get(0);
        assertThat(contact.message()).isEqualTo("Missing 1 of 2 fields: parent_email");
        assertThat(contact.details().collected()).containsExactly(CollectableField.PARENT_PHONE);
        assertThat(contact.details().missing()).containsExactly(CollectableField.PARENT_EMAIL);
    }

    @Test
    void shouldFailOnCriticalViolationEvenWhenGoalsPass() {
        GoalTestCase testCase = GoalTestCase.builder("T-3", persona())
            .goal(ConversationGoal.bookingConfirmed("booked"))
            .build();
        ProgressTracker tracker = new ProgressTracker(testCase.goals(), clock);
        tracker.updateProgress(intent(AgentIntent.CONFIRMING_BOOKING), "ok", 1);

        GoalTestResult result = evaluator.evaluateTest(
            testCase,
            tracker.getState(),
            transcript("Sorry, an error occurred but you are booked."),
            300
        );

        assertThat(result.goalResults()).allMatch(GoalResult::passed);
        assertThat(result.passed()).isFalse();
        assertThat(result.constraintViolations()).hasSize(1);
        ConstraintViolation violation = result.constraintViolations().get(0);
        assertThat(violation.isCritical()).isTrue();
        assertThat(violation.message()).startsWith("Forbidden condition occurred: No error messages");
        assertThat(violation.turnNumber()).isEqualTo(2);
        assertThat(result.summary()).contains("Critical: No error messages should appear in agent responses");
    }

    @Test
    void shouldNotFailOnNonCriticalViolation() {
        GoalTestCase testCase = GoalTestCase.builder("T-4", persona())
            .goal(ConversationGoal.bookingConfirmed("booked"))
            .constraints(List.of(PresetConstraints.maxTurns(1), PresetConstraints.maxTime(1000)))
            .build();
        ProgressTracker tracker = new ProgressTracker(testCase.goals(), clock);
        tracker.updateProgress(intent(AgentIntent.GREETING), "hi", 1);
        tracker.updateProgress(intent(AgentIntent.CONFIRMING_BOOKING), "ok", 2);

        GoalTestResult result = evaluator.evaluateTest(testCase, tracker.getState(), transcript("Booked."), 2500);

        assertThat(result.passed()).isTrue();
        assertThat(result.constraintViolations()).extracting(ConstraintViolation::message)
            .containsExactly("Exceeded max turns: 2 > 1", "Exceeded max time: 2500ms > 1000ms");
    }

    @Test
    void shouldFailEveryGoalOnExecutionError() {
        GoalTestCase testCase = GoalTestCase.builder("T-5", persona())
            .goal(ConversationGoal.bookingConfirmed("booked"))
            .goal(ConversationGoal.conversationEnded("bye"))
            .build();

        GoalTestResult result = evaluator.failedExecution(testCase, "connection refused", 40, clock.instant());

        assertThat(result.passed()).isFalse();
        assertThat(result.error()).isEqualTo("connection refused");
        assertThat(result.summary()).isEqualTo("Test failed due to error: connection refused");
        assertThat(result.goalResults()).extracting(GoalResult::message)
            .containsOnly("Test execution error: connection refused");
        assertThat(result.progress().currentFlowState()).isEqualTo(FlowState.ERROR);
        assertThat(result.progress().failedGoals()).containsExactly("booked", "bye");
        assertThat(result.issues()).singleElement().satisfies(issue -> {
            assertThat(issue.type()).isEqualTo(IssueType.ERROR);
            assertThat(issue.isCritical()).isTrue();
        });
    }

    @Test
    void shouldRenderFailureReport() {
        GoalTestCase testCase = GoalTestCase.builder("T-6", persona())
            .goal(ConversationGoal.collect("contact", "Contact", CollectableField.PARENT_PHONE))
            .build();
        ProgressTracker tracker = new ProgressTracker(testCase.goals(), clock);
        tracker.updateProgress(intent(AgentIntent.GREETING), "hi", 1);

        GoalTestResult result = evaluator.evaluateTest(
            testCase,
            tracker.getState(),
            transcript("Got a null reference exception at line 3"),
            100
        );
        String report = evaluator.failureReport(result);

        assertThat(report).startsWith("=== FAILURE REPORT ===");
        assertThat(report).contains("FAILED GOALS:");
        assertThat(report).contains("  - contact: Missing 1 of 1 fields: parent_phone");
        assertThat(report).contains("    Missing fields: parent_phone");
        assertThat(report).contains("CONSTRAINT VIOLATIONS:");
        assertThat(report).contains("Flow state: " + FlowState.GREETING.key());
        assertThat(report).contains("Fields pending: 1");
    }

    @Test
    void shouldReportNothingForPassedTest() {
        GoalTestCase testCase = GoalTestCase.builder("T-7", persona())
            .goal(ConversationGoal.bookingConfirmed("booked"))
            .build();
        ProgressTracker tracker = new ProgressTracker(testCase.goals(), clock);
        tracker.markBookingConfirmed();

        GoalTestResult result = evaluator.evaluateTest(testCase, tracker.getState(), transcript("Booked."), 10);

        assertThat(evaluator.failureReport(result)).isEqualTo("Test passed - no failures to report");
    }

    private List<ConversationTurn> transcript(String agentSays) {
        return List.of(
            ConversationTurn.user("Hi, I need an appointment", clock.instant(), null),
            ConversationTurn.assistant(agentSays, clock.instant(), 120, null)
        );
    }

    private static IntentDetectionResult intent(AgentIntent intent) {
        return new IntentDetectionResult(intent, 0.9, true, true, "test");
    }

    private static Persona persona() {
        DataInventory inventory = new DataInventory(
            "Dana", "Smith", "555-000-1111", "dana@example.com", List.of(),
            true, "Aetna", null, null, null, null, null, null, null
        );
        return new Persona("Dana Smith", "", inventory, null);
    }
}
