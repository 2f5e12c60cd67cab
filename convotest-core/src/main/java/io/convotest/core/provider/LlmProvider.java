package io.convotest.core.provider;

import io.convotest.core.model.ChatMessage;
import java.util.List;

public interface LlmProvider {
    String name();

    LlmResponse chat(String model, List<ChatMessage> messages, double temperature, int maxTokens);
}
