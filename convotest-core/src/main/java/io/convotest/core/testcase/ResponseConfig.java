package io.convotest.core.testcase;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ResponseConfig(
    @JsonAlias({"max_turns"}) int maxTurns,
    @JsonAlias({"use_llm_responses"}) boolean useLlmResponses,
    @JsonAlias({"handle_unknown_intents"}) UnknownIntentHandling handleUnknownIntents
) {
    public static final int DEFAULT_MAX_TURNS = 25;

    public ResponseConfig {
        maxTurns = maxTurns <= 0 ? DEFAULT_MAX_TURNS : maxTurns;
        handleUnknownIntents = handleUnknownIntents == null ? UnknownIntentHandling.CLARIFY : handleUnknownIntents;
    }

    public static ResponseConfig defaults() {
        return new ResponseConfig(DEFAULT_MAX_TURNS, false, UnknownIntentHandling.CLARIFY);
    }

    public ResponseConfig withMaxTurns(int turns) {
        return new ResponseConfig(turns, useLlmResponses, handleUnknownIntents);
    }
}
