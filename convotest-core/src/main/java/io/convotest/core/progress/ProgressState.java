package io.convotest.core.progress;

import io.convotest.core.classify.AgentIntent;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record ProgressState(
    Map<CollectableField, CollectedValue> collectedFields,
    List<CollectableField> pendingFields,
    List<String> completedGoals,
    List<String> activeGoals,
    List<String> failedGoals,
    FlowState currentFlowState,
    int turnNumber,
    AgentIntent lastAgentIntent,
    List<AgentIntent> intentHistory,
    boolean bookingConfirmed,
    boolean transferInitiated,
    Instant startedAt,
    Instant lastActivityAt,
    List<ProgressIssue> issues
) {
    public ProgressState {
        collectedFields = collectedFields == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(collectedFields));
        pendingFields = pendingFields == null ? List.of() : List.copyOf(pendingFields);
        completedGoals = completedGoals == null ? List.of() : List.copyOf(completedGoals);
        activeGoals = activeGoals == null ? List.of() : List.copyOf(activeGoals);
        failedGoals = failedGoals == null ? List.of() : List.copyOf(failedGoals);
        currentFlowState = currentFlowState == null ? FlowState.START : currentFlowState;
        lastAgentIntent = lastAgentIntent == null ? AgentIntent.UNKNOWN : lastAgentIntent;
        intentHistory = intentHistory == null ? List.of() : List.copyOf(intentHistory);
        issues = issues == null ? List.of() : List.copyOf(issues);
    }

    public static ProgressState failed(List<String> goalIds, ProgressIssue issue, Instant at) {
        return new ProgressState(
            Map.of(),
            List.of(),
            List.of(),
            List.of(),
            goalIds,
            FlowState.ERROR,
            0,
            AgentIntent.UNKNOWN,
            List.of(),
            false,
            false,
            at,
            at,
            List.of(issue)
        );
    }

    public boolean hasCollected(CollectableField field) {
        return collectedFields.containsKey(field);
    }

    public boolean agentConfirmedBooking() {
        return bookingConfirmed
            || lastAgentIntent == AgentIntent.CONFIRMING_BOOKING
            || currentFlowState == FlowState.CONFIRMATION;
    }

    public boolean agentInitiatedTransfer() {
        return transferInitiated
            || lastAgentIntent == AgentIntent.INITIATING_TRANSFER
            || currentFlowState == FlowState.TRANSFER;
    }

    public boolean conversationEnded() {
        return currentFlowState == FlowState.ENDED || lastAgentIntent == AgentIntent.SAYING_GOODBYE;
    }

    public long errorIssueCount() {
        return issues.stream().filter(issue -> issue.type() == IssueType.ERROR).count();
    }
}
