package io.convotest.core.progress;

import io.convotest.core.classify.AgentIntent;
import io.convotest.core.classify.IntentDetectionResult;
import io.convotest.core.conversation.ConversationTurn;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class ProgressTracker {
    private static final Logger LOG = LoggerFactory.getLogger(ProgressTracker.class);
    private static final Map<AgentIntent, FlowState> FLOW_STATES = new EnumMap<>(AgentIntent.class);

    static {
        FLOW_STATES.put(AgentIntent.GREETING, FlowState.GREETING);
        FLOW_STATES.put(AgentIntent.ASKING_PARENT_NAME, FlowState.COLLECTING_PARENT_INFO);
        FLOW_STATES.put(AgentIntent.ASKING_SPELL_NAME, FlowState.COLLECTING_PARENT_INFO);
        FLOW_STATES.put(AgentIntent.ASKING_PHONE, FlowState.COLLECTING_PARENT_INFO);
        FLOW_STATES.put(AgentIntent.ASKING_EMAIL, FlowState.COLLECTING_PARENT_INFO);
        FLOW_STATES.put(AgentIntent.ASKING_PARENT_DOB, FlowState.COLLECTING_PARENT_INFO);
        FLOW_STATES.put(AgentIntent.ASKING_CHILD_COUNT, FlowState.COLLECTING_CHILD_INFO);
        FLOW_STATES.put(AgentIntent.ASKING_CHILD_NAME, FlowState.COLLECTING_CHILD_INFO);
        FLOW_STATES.put(AgentIntent.ASKING_SPELL_CHILD_NAME, FlowState.COLLECTING_CHILD_INFO);
        FLOW_STATES.put(AgentIntent.ASKING_CHILD_DOB, FlowState.COLLECTING_CHILD_INFO);
        FLOW_STATES.put(AgentIntent.ASKING_CHILD_AGE, FlowState.COLLECTING_CHILD_INFO);
        FLOW_STATES.put(AgentIntent.ASKING_NEW_PATIENT, FlowState.COLLECTING_HISTORY);
        FLOW_STATES.put(AgentIntent.ASKING_PREVIOUS_VISIT, FlowState.COLLECTING_HISTORY);
        FLOW_STATES.put(AgentIntent.ASKING_PREVIOUS_ORTHO, FlowState.COLLECTING_HISTORY);
        FLOW_STATES.put(AgentIntent.ASKING_INSURANCE, FlowState.COLLECTING_INSURANCE);
        FLOW_STATES.put(AgentIntent.ASKING_INSURANCE_MEMBER_ID, FlowState.COLLECTING_INSURANCE);
        FLOW_STATES.put(AgentIntent.ASKING_SPECIAL_NEEDS, FlowState.COLLECTING_SPECIAL_INFO);
        FLOW_STATES.put(AgentIntent.ASKING_MEDICAL_CONDITIONS, FlowState.COLLECTING_SPECIAL_INFO);
        FLOW_STATES.put(AgentIntent.ASKING_TIME_PREFERENCE, FlowState.SCHEDULING);
        FLOW_STATES.put(AgentIntent.ASKING_LOCATION_PREFERENCE, FlowState.SCHEDULING);
        FLOW_STATES.put(AgentIntent.OFFERING_TIME_SLOTS, FlowState.BOOKING);
        FLOW_STATES.put(AgentIntent.CONFIRMING_BOOKING, FlowState.CONFIRMATION);
        FLOW_STATES.put(AgentIntent.INITIATING_TRANSFER, FlowState.TRANSFER);
        FLOW_STATES.put(AgentIntent.SAYING_GOODBYE, FlowState.ENDED);
    }

    public record Settings(int stuckThresholdTurns, int maxRepetitionCount, boolean detectIssues) {
        public static Settings defaults() {
            return new Settings(5, 2, true);
        }
    }

    private final List<ConversationGoal> goals;
    private final Settings settings;
    private final Clock clock;

    private final Map<CollectableField, CollectedValue> collected = new LinkedHashMap<>();
    private final List<CollectableField> pending = new ArrayList<>();
    private final List<String> completedGoals = new ArrayList<>();
    private final List<String> activeGoals = new ArrayList<>();
    private final List<String> failedGoals = new ArrayList<>();
    private final List<AgentIntent> intentHistory = new ArrayList<>();
    private final List<ProgressIssue> issues = new ArrayList<>();
    private FlowState flowState = FlowState.START;
    private AgentIntent lastIntent = AgentIntent.UNKNOWN;
    private int turnNumber;
    private boolean bookingConfirmed;
    private boolean transferInitiated;
    private final Instant startedAt;
    private Instant lastActivityAt;

    public ProgressTracker(List<ConversationGoal> goals, Clock clock) {
        this(goals, Settings.defaults(), clock);
    }

    public ProgressTracker(List<ConversationGoal> goals, Settings settings, Clock clock) {
        this.goals = List.copyOf(Objects.requireNonNull(goals, "goals must not be null"));
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.startedAt = clock.instant();
        this.lastActivityAt = startedAt;
        this.pending.addAll(requiredFields(this.goals));
        for (ConversationGoal goal : this.goals) {
            activeGoals.add(goal.id());
        }
    }

    public void updateProgress(IntentDetectionResult intent, String userReply, int turn) {
        AgentIntent primary = intent.primaryIntent();
        turnNumber = turn;
        lastActivityAt = clock.instant();
        intentHistory.add(primary);
        lastIntent = primary;

        Optional<CollectableField> field = primary.collectableField();
        if (field.isPresent()) {
            collect(field.get(), userReply, turn);
        }

        updateFlowState(primary);
        if (settings.detectIssues()) {
            detectIssues(intent, turn);
        }
        evaluateGoals();
    }

    public void markFieldCollected(CollectableField field, String value, int turn) {
        if (collect(field, value, turn)) {
            LOG.debug("Field {} collected at turn {}", field.key(), turn);
            evaluateGoals();
        }
    }

    public void markBookingConfirmed() {
        bookingConfirmed = true;
        flowState = FlowState.CONFIRMATION;
        evaluateGoals();
    }

    public void markTransferInitiated() {
        transferInitiated = true;
        flowState = FlowState.TRANSFER;
        evaluateGoals();
    }

    public void recordIssue(ProgressIssue issue) {
        issues.add(Objects.requireNonNull(issue, "issue must not be null"));
        if (issue.isCritical()) {
            LOG.warn("Critical issue at transcript turn {}: {}", issue.turnNumber(), issue.description());
        }
    }

    public boolean areGoalsComplete() {
        return goals.stream()
            .filter(ConversationGoal::required)
            .allMatch(goal -> completedGoals.contains(goal.id()));
    }

    public boolean hasFailedGoals() {
        return !failedGoals.isEmpty();
    }

    public boolean shouldAbort() {
        return issues.stream().anyMatch(ProgressIssue::isCritical);
    }

    public List<CollectableField> getPendingFields() {
        return List.copyOf(pending);
    }

    public Map<CollectableField, CollectedValue> getCollectedFields() {
        return Map.copyOf(collected);
    }

    public List<ProgressIssue> getIssues() {
        return List.copyOf(issues);
    }

    public List<ProgressIssue> getCriticalIssues() {
        return issues.stream().filter(ProgressIssue::isCritical).toList();
    }

    public ProgressState getState() {
        return new ProgressState(
            collected,
            pending,
            completedGoals,
            activeGoals,
            failedGoals,
            flowState,
            turnNumber,
            lastIntent,
            intentHistory,
            bookingConfirmed,
            transferInitiated,
            startedAt,
            lastActivityAt,
            issues
        );
    }

    public GoalContext goalContext(List<ConversationTurn> history) {
        ProgressState state = getState();
        return new GoalContext(
            collected,
            history,
            state.agentConfirmedBooking(),
            state.agentInitiatedTransfer(),
            turnNumber,
            clock.millis() - startedAt.toEpochMilli()
        );
    }

    private boolean collect(CollectableField field, String value, int turn) {
        if (collected.containsKey(field)) {
            return false;
        }
        collected.put(field, new CollectedValue(field, value, turn, false, value));
        pending.remove(field);
        return true;
    }

    private void updateFlowState(AgentIntent intent) {
        if (intent == AgentIntent.CONFIRMING_BOOKING) {
            bookingConfirmed = true;
        }
        if (intent == AgentIntent.INITIATING_TRANSFER) {
            transferInitiated = true;
        }
        FlowState next = FLOW_STATES.get(intent);
        if (next != null) {
            flowState = next;
        }
    }

    private void detectIssues(IntentDetectionResult intent, int turn) {
        int transcriptTurn = 2 * turn;
        AgentIntent primary = intent.primaryIntent();
        if (isRepeating(primary)) {
            issues.add(new ProgressIssue(
                IssueType.REPEATING,
                "Agent asked for " + primary.key() + " again",
                transcriptTurn,
                Severity.MEDIUM,
                Map.of("intent", primary.key())
            ));
        }
        if (turnNumber >= settings.stuckThresholdTurns() && collected.isEmpty()) {
            issues.add(ProgressIssue.of(
                IssueType.STUCK,
                Severity.HIGH,
                "No data collected after " + turn + " conversation turns",
                transcriptTurn
            ));
        }
        if (primary == AgentIntent.UNKNOWN && intent.confidence() < 0.5) {
            issues.add(new ProgressIssue(
                IssueType.UNKNOWN_INTENT,
                "Could not determine agent intent",
                transcriptTurn,
                Severity.LOW,
                Map.of("confidence", intent.confidence())
            ));
        }
    }

    // The current intent is already in the history, so this is "the last N intents are all this one".
    private boolean isRepeating(AgentIntent intent) {
        int window = settings.maxRepetitionCount();
        if (intentHistory.size() < window) {
            return false;
        }
        return intentHistory.subList(intentHistory.size() - window, intentHistory.size())
            .stream()
            .allMatch(recent -> recent == intent);
    }

    private void evaluateGoals() {
        ProgressState state = getState();
        for (ConversationGoal goal : goals) {
            if (completedGoals.contains(goal.id()) || failedGoals.contains(goal.id())) {
                continue;
            }
            if (evaluate(goal, state).passed()) {
                completedGoals.add(goal.id());
                activeGoals.remove(goal.id());
                LOG.debug("Goal {} completed at turn {}", goal.id(), turnNumber);
            }
        }
    }

    private GoalResult evaluate(ConversationGoal goal, ProgressState state) {
        return switch (goal.type()) {
            case DATA_COLLECTION -> GoalEvaluator.dataCollection(goal, state);
            case BOOKING_CONFIRMED -> GoalResult.of(goal.id(), state.agentConfirmedBooking(),
                state.agentConfirmedBooking() ? "Booking confirmed" : "Booking not yet confirmed");
            case TRANSFER_INITIATED -> GoalResult.of(goal.id(), state.agentInitiatedTransfer(),
                state.agentInitiatedTransfer() ? "Transfer initiated" : "No transfer detected");
            case CONVERSATION_ENDED -> GoalResult.of(goal.id(), state.conversationEnded(),
                state.conversationEnded() ? "Conversation ended properly" : "Conversation not ended");
            case CUSTOM -> goal.successCriteria() != null
                ? GoalResult.of(goal.id(), goal.successCriteria().test(goalContext(List.of())), "Custom goal evaluation")
                : CustomGoalHeuristics.evaluate(goal, state);
            case ERROR_HANDLED -> GoalResult.of(goal.id(), false, "Judged after the conversation");
        };
    }

    private static List<CollectableField> requiredFields(List<ConversationGoal> goals) {
        Set<CollectableField> fields = new LinkedHashSet<>();
        for (ConversationGoal goal : goals) {
            if (goal.type() == GoalType.DATA_COLLECTION) {
                fields.addAll(goal.requiredFields());
            }
        }
        return new ArrayList<>(fields);
    }
}
