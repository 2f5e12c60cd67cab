package io.convotest.core.classify;

import java.util.Objects;

public record IntentDetectionResult(
    AgentIntent primaryIntent,
    double confidence,
    boolean question,
    boolean requiresUserResponse,
    String reasoning
) {
    public IntentDetectionResult {
        Objects.requireNonNull(primaryIntent, "primaryIntent must not be null");
        reasoning = reasoning == null ? "" : reasoning;
    }
}
