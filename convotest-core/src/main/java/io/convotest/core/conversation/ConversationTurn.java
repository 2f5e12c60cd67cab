package io.convotest.core.conversation;

import java.time.Instant;
import java.util.Objects;

public record ConversationTurn(
    TurnRole role,
    String content,
    Instant timestamp,
    Long responseTimeMs,
    String stepId,
    Boolean validationPassed,
    String validationMessage
) {
    public static final String ERROR_PREFIX = "[ERROR] ";

    public ConversationTurn {
        Objects.requireNonNull(role, "role must not be null");
        content = content == null ? "" : content;
        timestamp = timestamp == null ? Instant.EPOCH : timestamp;
        stepId = stepId == null ? "" : stepId;
    }

    public static ConversationTurn user(String content, Instant timestamp, String stepId) {
        return new ConversationTurn(TurnRole.USER, content, timestamp, null, stepId, null, null);
    }

    public static ConversationTurn assistant(String content, Instant timestamp, long responseTimeMs, String stepId) {
        return new ConversationTurn(TurnRole.ASSISTANT, content, timestamp, responseTimeMs, stepId, null, null);
    }

    public static ConversationTurn error(String message, Instant timestamp, String stepId) {
        return new ConversationTurn(TurnRole.ASSISTANT, ERROR_PREFIX + message, timestamp, 0L, stepId, false, message);
    }

    public boolean isError() {
        return Boolean.FALSE.equals(validationPassed) && content.startsWith(ERROR_PREFIX);
    }
}
