package io.convotest.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record BatchWriterSettings(
    @JsonAlias({"batch_size"}) int batchSize,
    @JsonAlias({"flush_interval_ms"}) long flushIntervalMs,
    boolean enabled
) {

    public static BatchWriterSettings defaults() {
        return new BatchWriterSettings(50, 1000, true);
    }
}
