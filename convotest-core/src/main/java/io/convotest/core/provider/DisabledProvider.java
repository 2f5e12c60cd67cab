package io.convotest.core.provider;

import io.convotest.core.model.ChatMessage;
import java.util.List;
import java.util.Map;

/**
 * Placeholder used when a provider has no credentials. Always answers with an error so
 * fallback chains skip it and callers drop back to templates.
 */
public final class DisabledProvider implements LlmProvider {
    private final String name;
    private final String reason;

    public DisabledProvider(String name, String reason) {
        this.name = name;
        this.reason = reason == null || reason.isBlank() ? "provider is disabled" : reason;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public LlmResponse chat(String model, List<ChatMessage> messages, double temperature, int maxTokens) {
        return new LlmResponse(
            LlmResponse.ERROR_PREFIX + " provider " + name + " is not configured (" + reason + ")",
            Map.of("provider", name, "disabled", true)
        );
    }
}
