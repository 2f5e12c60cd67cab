package io.convotest.core.progress;

import io.convotest.core.conversation.ConversationTurn;
import java.util.List;
import java.util.Map;

public record GoalContext(
    Map<CollectableField, CollectedValue> collectedData,
    List<ConversationTurn> conversationHistory,
    boolean agentConfirmedBooking,
    boolean agentInitiatedTransfer,
    int turnCount,
    long elapsedTimeMs
) {
    public GoalContext {
        collectedData = collectedData == null ? Map.of() : Map.copyOf(collectedData);
        conversationHistory = conversationHistory == null ? List.of() : List.copyOf(conversationHistory);
    }

    public boolean hasCollected(CollectableField field) {
        return collectedData.containsKey(field);
    }
}
