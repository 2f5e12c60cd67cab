package io.convotest.core.provider;

import java.util.HashMap;
import java.util.Map;

public record LlmResponse(String content, Map<String, Object> usage) {
    public static final String ERROR_PREFIX = "Error calling LLM:";

    public LlmResponse {
        content = content == null ? "" : content;
        usage = usage == null ? Map.of() : Map.copyOf(usage);
    }

    public static LlmResponse error(String message) {
        return new LlmResponse(ERROR_PREFIX + " " + message, Map.of());
    }

    public LlmResponse withUsage(String key, Object value) {
        Map<String, Object> merged = new HashMap<>(usage);
        merged.put(key, value);
        return new LlmResponse(content, merged);
    }

    public boolean disabled() {
        return Boolean.TRUE.equals(usage.get("disabled"));
    }

    public boolean isError() {
        return content.startsWith(ERROR_PREFIX);
    }
}
