package io.convotest.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ClassifierSettings(
    @JsonAlias({"use_llm"}) boolean useLlm,
    @JsonAlias({"llm_confidence_threshold"}) double llmConfidenceThreshold,
    @JsonAlias({"cache_ttl_ms"}) long cacheTtlMs,
    @JsonAlias({"cache_max_entries"}) int cacheMaxEntries,
    String provider,
    String model
) {

    public static ClassifierSettings defaults() {
        return new ClassifierSettings(false, 0.75, 300_000, 100, "openai", "gpt-4o-mini");
    }
}
