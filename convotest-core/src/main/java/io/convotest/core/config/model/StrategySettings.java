package io.convotest.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record StrategySettings(
    @JsonAlias({"use_llm_for_complex"}) boolean useLlmForComplex,
    double temperature,
    @JsonAlias({"max_tokens"}) int maxTokens,
    String provider,
    String model,
    @JsonAlias({"cancel_test_ids"}) List<String> cancelTestIds,
    @JsonAlias({"silence_test_ids"}) List<String> silenceTestIds
) {

    public StrategySettings {
        cancelTestIds = cancelTestIds == null ? List.of() : List.copyOf(cancelTestIds);
        silenceTestIds = silenceTestIds == null ? List.of() : List.copyOf(silenceTestIds);
    }

    public static StrategySettings defaults() {
        return new StrategySettings(
            false,
            0.7,
            256,
            "openai",
            "gpt-4o-mini",
            List.of("GOAL-ERR-004"),
            List.of("GOAL-ERR-007")
        );
    }
}
