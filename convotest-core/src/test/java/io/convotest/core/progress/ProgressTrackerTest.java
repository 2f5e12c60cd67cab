package io.convotest.core.progress;

import static org.assertj.core.api.Assertions.assertThat;

import io.convotest.core.classify.AgentIntent;
import io.convotest.core.classify.IntentDetectionResult;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.Test;

class ProgressTrackerTest {
    private final Clock clock = Clock.fixed(Instant.parse("2026-05-10T08:00:00Z"), ZoneOffset.UTC);

    @Test
    void shouldKeepTheFirstCollectedValue() {
        ProgressTracker tracker = new ProgressTracker(
            List.of(ConversationGoal.collect("contact", "Contact details", CollectableField.PARENT_PHONE, CollectableField.PARENT_EMAIL)),
            clock
        );

        tracker.updateProgress(intent(AgentIntent.ASKING_PHONE, 0.9), "555-123-4567", 1);
        tracker.markFieldCollected(CollectableField.PARENT_PHONE, "555-999-0000", 2);

        assertThat(tracker.getCollectedFields().get(CollectableField.PARENT_PHONE).value()).isEqualTo("555-123-4567");
        assertThat(tracker.getCollectedFields().get(CollectableField.PARENT_PHONE).collectedAtTurn()).isEqualTo(1);
        assertThat(tracker.getPendingFields()).containsExactly(CollectableField.PARENT_EMAIL);
        assertThat(tracker.areGoalsComplete()).isFalse();

        tracker.markFieldCollected(CollectableField.PARENT_EMAIL, "dana@example.com", 2);

        assertThat(tracker.getPendingFields()).isEmpty();
        assertThat(tracker.areGoalsComplete()).isTrue();
        assertThat(tracker.getState().completedGoals()).containsExactly("contact");
        assertThat(tracker.getState().activeGoals()).isEmpty();
    }

    @Test
    void shouldFlagRepeatedQuestionsAtTheTranscriptTurn() {
        ProgressTracker tracker = new ProgressTracker(List.of(ConversationGoal.bookingConfirmed("booked")), clock);

        tracker.updateProgress(intent(AgentIntent.ASKING_PHONE, 0.9), "555-123-4567", 1);
        assertThat(tracker.getIssues()).isEmpty();

        tracker.updateProgress(intent(AgentIntent.ASKING_PHONE, 0.9), "555-123-4567", 2);

        assertThat(tracker.getIssues()).hasSize(1);
        ProgressIssue issue = tracker.getIssues().get(0);
        assertThat(issue.type()).isEqualTo(IssueType.REPEATING);
        assertThat(issue.severity()).isEqualTo(Severity.MEDIUM);
        assertThat(issue.turnNumber()).isEqualTo(4);
        assertThat(issue.context()).containsEntry("intent", AgentIntent.ASKING_PHONE.key());
    }

    @Test
    void shouldReportStuckConversationWhenNothingIsCollected() {
        ProgressTracker tracker = new ProgressTracker(
            List.of(ConversationGoal.collect("name", "Parent name", CollectableField.PARENT_NAME)),
            clock
        );

        for (int turn = 1; turn <= 5; turn++) {
            tracker.updateProgress(intent(AgentIntent.GREETING, 0.8), "hello", turn);
        }

        List<ProgressIssue> stuck = tracker.getIssues().stream()
            .filter(issue -> issue.type() == IssueType.STUCK)
            .toList();
        assertThat(stuck).hasSize(1);
        assertThat(stuck.get(0).severity()).isEqualTo(Severity.HIGH);
        assertThat(stuck.get(0).description()).isEqualTo("No data collected after 5 conversation turns");
        assertThat(tracker.shouldAbort()).isFalse();
    }

    @Test
    void shouldCompleteBookingGoalFromConfirmingIntent() {
        ProgressTracker tracker = new ProgressTracker(List.of(ConversationGoal.bookingConfirmed("booked")), clock);

        tracker.updateProgress(intent(AgentIntent.OFFERING_TIME_SLOTS, 0.8), "Monday works", 1);
        assertThat(tracker.getState().currentFlowState()).isEqualTo(FlowState.BOOKING);
        assertThat(tracker.areGoalsComplete()).isFalse();

        tracker.updateProgress(intent(AgentIntent.CONFIRMING_BOOKING, 0.95), "Thanks", 2);

        ProgressState state = tracker.getState();
        assertThat(state.currentFlowState()).isEqualTo(FlowState.CONFIRMATION);
        assertThat(state.bookingConfirmed()).isTrue();
        assertThat(state.intentHistory()).containsExactly(AgentIntent.OFFERING_TIME_SLOTS, AgentIntent.CONFIRMING_BOOKING);
        assertThat(tracker.areGoalsComplete()).isTrue();
    }

    @Test
    void shouldTreatMarkedTransferAsCompletedTransferGoal() {
        ProgressTracker tracker = new ProgressTracker(
            List.of(ConversationGoal.transferInitiated("transfer"), ConversationGoal.conversationEnded("bye")),
            clock
        );

        tracker.markTransferInitiated();

        assertThat(tracker.getState().currentFlowState()).isEqualTo(FlowState.TRANSFER);
        assertThat(tracker.areGoalsComplete()).isTrue();
        assertThat(tracker.getState().completedGoals()).containsExactly("transfer");
    }

    @Test
    void shouldAbortOnlyOnCriticalIssues() {
        ProgressTracker tracker = new ProgressTracker(List.of(ConversationGoal.bookingConfirmed("booked")), clock);

        tracker.updateProgress(intent(AgentIntent.UNKNOWN, 0.3), "what?", 1);

        assertThat(tracker.getIssues()).extracting(ProgressIssue::type).containsExactly(IssueType.UNKNOWN_INTENT);
        assertThat(tracker.shouldAbort()).isFalse();

        tracker.recordIssue(ProgressIssue.of(IssueType.ERROR, Severity.CRITICAL, "agent crashed", 2));

        assertThat(tracker.shouldAbort()).isTrue();
        assertThat(tracker.getCriticalIssues()).extracting(ProgressIssue::description).containsExactly("agent crashed");
    }

    @Test
    void shouldSkipIssueDetectionWhenDisabled() {
        ProgressTracker tracker = new ProgressTracker(
            List.of(ConversationGoal.bookingConfirmed("booked")),
            new ProgressTracker.Settings(5, 2, false),
            clock
        );

        tracker.updateProgress(intent(AgentIntent.UNKNOWN, 0.1), "?", 1);
        tracker.updateProgress(intent(AgentIntent.UNKNOWN, 0.1), "?", 2);

        assertThat(tracker.getIssues()).isEmpty();
    }

    @Test
    void shouldEvaluateCustomGoalsWithCriteriaAndHeuristics() {
        ConversationGoal byCriteria = ConversationGoal.custom(
            "has-phone",
            "Phone collected",
            ctx -> ctx.hasCollected(CollectableField.PARENT_PHONE)
        );
        ConversationGoal byHeuristic = new ConversationGoal("probe-intent", GoalType.CUSTOM, null, null, 1, true, null);
        ProgressTracker tracker = new ProgressTracker(List.of(byCriteria, byHeuristic), clock);

        tracker.updateProgress(intent(AgentIntent.GREETING, 0.8), "hi", 1);
        assertThat(tracker.getState().completedGoals()).isEmpty();

        tracker.updateProgress(intent(AgentIntent.ASKING_PHONE, 0.9), "555-123-4567", 2);

        assertThat(tracker.getState().completedGoals()).containsExactly("has-phone", "probe-intent");
    }

    private static IntentDetectionResult intent(AgentIntent intent, double confidence) {
        return new IntentDetectionResult(intent, confidence, true, true, "test");
    }
}
