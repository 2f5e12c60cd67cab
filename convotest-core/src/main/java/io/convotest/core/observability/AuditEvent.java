package io.convotest.core.observability;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.time.Instant;
import java.util.Map;
import java.util.regex.Pattern;

public record AuditEvent(
    String id,
    Instant timestamp,
    String type,
    Map<String, Object> attributes
) {
    private static final Pattern NUMBER = Pattern.compile("-?\\d+(\\.\\d+)?");

    public AuditEvent {
        id = id == null ? "" : id.trim();
        timestamp = timestamp == null ? Instant.EPOCH : timestamp;
        type = type == null ? "" : type.trim();
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
    }

    public boolean isType(String candidate) {
        return candidate != null && candidate.equalsIgnoreCase(type);
    }

    @JsonIgnore
    public String runId() {
        Object value = attributes.get("run_id");
        return value == null ? null : String.valueOf(value);
    }

    @JsonIgnore
    public boolean passed() {
        return Boolean.parseBoolean(String.valueOf(attributes.get("passed")));
    }

    @JsonIgnore
    public double durationMs() {
        Object value = attributes.get("duration_ms");
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        if (value == null) {
            return -1;
        }
        String text = String.valueOf(value).trim();
        return NUMBER.matcher(text).matches() ? Double.parseDouble(text) : -1;
    }
}
