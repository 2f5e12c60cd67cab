package io.convotest.core.agent;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Objects;

public record ToolCall(String toolName, JsonNode input, JsonNode output, String status, Long durationMs) {
    public ToolCall {
        Objects.requireNonNull(toolName, "toolName must not be null");
        status = status == null || status.isBlank() ? "completed" : status;
    }
}
