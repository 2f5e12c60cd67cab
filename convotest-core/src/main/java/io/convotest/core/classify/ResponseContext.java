package io.convotest.core.classify;

import io.convotest.core.conversation.ConversationTurn;
import java.util.List;
import java.util.Set;

public record ResponseContext(
    String testId,
    int currentChildIndex,
    Set<DataField> providedFields,
    List<ConversationTurn> history,
    int turnNumber,
    boolean bookingCompleted
) {
    public ResponseContext {
        testId = testId == null ? "" : testId;
        providedFields = providedFields == null ? Set.of() : Set.copyOf(providedFields);
        history = history == null ? List.of() : List.copyOf(history);
    }
}
