package io.convotest.core.progress;

import java.util.List;
import java.util.Locale;
import java.util.function.Predicate;

final class CustomGoalHeuristics {
    private static final List<Rule> RULES = List.of(
        rule(List.of("recognize-existing", "existing"), ProgressState::agentInitiatedTransfer,
            "Existing patient recognized (transfer initiated)", "Existing patient not yet recognized"),
        rule(List.of("recognize-age", "age-invalid"), ProgressState::agentInitiatedTransfer,
            "Age out of range recognized (transfer initiated)", "Age validation not triggered"),
        rule(List.of("recover", "gibberish"), CustomGoalHeuristics::movedOnWithoutErrors,
            "Recovered from unexpected input", "Did not recover from unexpected input"),
        rule(List.of("handle-empty", "empty-input"), CustomGoalHeuristics::movedOnWithoutErrors,
            "Empty input handled gracefully", "Empty input not handled properly"),
        rule(List.of("process-long", "long-input"), CustomGoalHeuristics::movedOnWithoutErrors,
            "Long input processed successfully", "Long input caused errors"),
        rule(List.of("handle-correction", "correction"),
            s -> s.hasCollected(CollectableField.CHILD_COUNT) || s.turnNumber() > 3,
            "User correction handled", "User correction not processed"),
        rule(List.of("acknowledge-cancel", "cancel"), ProgressState::conversationEnded,
            "Cancellation acknowledged", "Cancellation not acknowledged"),
        rule(List.of("clarify-scope", "scope"), ProgressState::agentInitiatedTransfer,
            "Scope clarified (transfer for non-ortho)", "Scope not clarified"),
        rule(List.of("clarify-child", "child-count"), s -> s.hasCollected(CollectableField.CHILD_COUNT),
            "Child count clarified", "Child count not clarified"),
        rule(List.of("probe-intent", "probe"), s -> !s.collectedFields().isEmpty() || s.turnNumber() > 2,
            "Intent probed successfully", "Intent not probed"),
        rule(List.of("handle-three", "three-children"),
            s -> s.hasCollected(CollectableField.CHILD_COUNT)
                || s.hasCollected(CollectableField.CHILD_NAMES)
                || s.bookingConfirmed(),
            "Multiple children handled", "Multiple children not fully processed"),
        rule(List.of("disclose-out", "out-of-network"),
            s -> s.hasCollected(CollectableField.INSURANCE) || s.turnNumber() > 5,
            "Out-of-network status disclosed", "Out-of-network disclosure not made"),
        rule(List.of("confirm-spelling", "spelling"),
            s -> s.hasCollected(CollectableField.PARENT_NAME_SPELLING) || s.hasCollected(CollectableField.PARENT_NAME),
            "Spelling confirmed", "Spelling not confirmed"),
        rule(List.of("continue-to-booking", "continue-booking"),
            s -> !s.collectedFields().isEmpty() || s.bookingConfirmed(),
            "Continued to booking", "Did not continue to booking"),
        rule(List.of("detect-silence", "still-there", "silence"), s -> s.turnNumber() >= 2,
            "Silence handling triggered", "Silence not detected"),
        rule(List.of("note-previous", "previous-treatment"), s -> s.hasCollected(CollectableField.PREVIOUS_ORTHO),
            "Previous treatment noted", "Previous treatment not asked about")
    );

    private CustomGoalHeuristics() {
    }

    static GoalResult evaluate(ConversationGoal goal, ProgressState state) {
        String id = goal.id().toLowerCase(Locale.ROOT);
        for (Rule rule : RULES) {
            if (rule.keywords().stream().anyMatch(id::contains)) {
                boolean passed = rule.check().test(state);
                return GoalResult.of(goal.id(), passed, passed ? rule.passMessage() : rule.failMessage());
            }
        }
        boolean progressed = state.turnNumber() > 2
            || !state.collectedFields().isEmpty()
            || state.bookingConfirmed()
            || state.transferInitiated();
        return GoalResult.of(
            goal.id(),
            progressed,
            progressed
                ? "Custom goal evaluated: conversation progressed (" + state.turnNumber() + " turns, "
                    + state.collectedFields().size() + " fields)"
                : "No success criteria defined for custom goal: " + goal.description()
        );
    }

    private static boolean movedOnWithoutErrors(ProgressState state) {
        return state.turnNumber() > 1 && state.errorIssueCount() == 0;
    }

    private static Rule rule(List<String> keywords, Predicate<ProgressState> check, String pass, String fail) {
        return new Rule(keywords, check, pass, fail);
    }

    private record Rule(List<String> keywords, Predicate<ProgressState> check, String passMessage, String failMessage) {
    }
}
