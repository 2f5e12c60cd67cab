package io.convotest.core.classify;

import io.convotest.core.conversation.ConversationTurn;
import io.convotest.core.persona.Persona;
import io.convotest.core.progress.CollectableField;
import java.util.List;

/**
 * Reads an agent utterance and writes the simulated caller's reply. The runner picks one
 * implementation when it is built and only talks to this contract afterwards.
 */
public interface ResponseClassifier {
    String name();

    Classification classify(String agentUtterance, List<ConversationTurn> history, Persona persona);

    default Classification classify(
        String agentUtterance,
        List<ConversationTurn> history,
        Persona persona,
        List<CollectableField> pendingFields
    ) {
        return classify(agentUtterance, history, persona);
    }

    boolean isTerminal(Classification classification);

    IntentDetectionResult toLegacyIntent(Classification classification);

    String generateResponse(Classification classification, Persona persona, ResponseContext context);
}
