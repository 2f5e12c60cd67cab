package io.convotest.core.provider;

import io.convotest.core.model.ChatMessage;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class FallbackLlmProvider implements LlmProvider {
    private static final Logger LOG = LoggerFactory.getLogger(FallbackLlmProvider.class);
    private static final int MAX_LOGGED_ERROR = 300;

    private final String name;
    private final List<LlmProvider> chain;

    public FallbackLlmProvider(String name, List<LlmProvider> chain) {
        this.name = name;
        this.chain = List.copyOf(chain);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public LlmResponse chat(String model, List<ChatMessage> messages, double temperature, int maxTokens) {
        LlmResponse failure = null;
        LlmResponse disabled = null;
        for (LlmProvider provider : chain) {
            LlmResponse response = provider.chat(model, messages, temperature, maxTokens);
            if (!response.isError()) {
                LOG.debug("Provider {} served request for chain {}", provider.name(), name);
                return response.withUsage("served_by", provider.name());
            }
            if (response.disabled()) {
                LOG.debug("Skipping unconfigured provider {} in chain {}", provider.name(), name);
                disabled = response;
            } else {
                LOG.warn("Provider {} failed in chain {}: {}", provider.name(), name, abbreviate(response.content()));
                failure = response;
            }
        }
        if (failure != null) {
            return failure;
        }
        return disabled != null ? disabled : LlmResponse.error("no providers in fallback chain " + name);
    }

    private static String abbreviate(String value) {
        return value.length() <= MAX_LOGGED_ERROR ? value : value.substring(0, MAX_LOGGED_ERROR) + "...";
    }
}
