package io.convotest.core.progress;

import java.util.List;

public record GoalResult(String goalId, boolean passed, String message, Details details) {
    public GoalResult {
        message = message == null ? "" : message;
    }

    public static GoalResult of(String goalId, boolean passed, String message) {
        return new GoalResult(goalId, passed, message, null);
    }

    public record Details(List<CollectableField> required, List<CollectableField> collected, List<CollectableField> missing) {
        public Details {
            required = required == null ? List.of() : List.copyOf(required);
            collected = collected == null ? List.of() : List.copyOf(collected);
            missing = missing == null ? List.of() : List.copyOf(missing);
        }
    }
}
