package io.convotest.core.progress;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;

public record ConversationGoal(
    String id,
    GoalType type,
    String description,
    List<CollectableField> requiredFields,
    int priority,
    boolean required,
    Predicate<GoalContext> successCriteria
) {
    public ConversationGoal {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("goal id must not be blank");
        }
        Objects.requireNonNull(type, "type must not be null");
        description = description == null ? id : description;
        requiredFields = requiredFields == null ? List.of() : List.copyOf(requiredFields);
    }

    public static ConversationGoal collect(String id, String description, CollectableField... fields) {
        return new ConversationGoal(id, GoalType.DATA_COLLECTION, description, Arrays.asList(fields), 1, true, null);
    }

    public static ConversationGoal bookingConfirmed(String id) {
        return new ConversationGoal(id, GoalType.BOOKING_CONFIRMED, "Agent confirms the booking", List.of(), 1, true, null);
    }

    public static ConversationGoal transferInitiated(String id) {
        return new ConversationGoal(id, GoalType.TRANSFER_INITIATED, "Agent transfers to a live agent", List.of(), 1, true, null);
    }

    public static ConversationGoal conversationEnded(String id) {
        return new ConversationGoal(id, GoalType.CONVERSATION_ENDED, "Agent ends the conversation", List.of(), 2, false, null);
    }

    public static ConversationGoal custom(String id, String description, Predicate<GoalContext> criteria) {
        return new ConversationGoal(id, GoalType.CUSTOM, description, List.of(), 1, true, criteria);
    }

    public ConversationGoal optional() {
        return new ConversationGoal(id, type, description, requiredFields, priority, false, successCriteria);
    }
}
