package io.convotest.core.agent;

import java.util.List;

public record AgentReply(String text, String sessionId, long responseTimeMs, List<ToolCall> toolCalls) {
    public AgentReply {
        text = text == null ? "" : text;
        sessionId = sessionId == null ? "" : sessionId;
        toolCalls = toolCalls == null ? List.of() : List.copyOf(toolCalls);
    }
}
