package io.convotest.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ProvidersConfig(
    ProviderConfig openai,
    ProviderConfig openrouter
) {

    public ProvidersConfig {
        openai = openai == null ? ProviderConfig.defaults() : openai;
        openrouter = openrouter == null ? ProviderConfig.defaults() : openrouter;
    }

    public static ProvidersConfig defaults() {
        return new ProvidersConfig(ProviderConfig.defaults(), ProviderConfig.defaults());
    }
}
