package io.convotest.core.storage;

import java.time.Instant;

public record BatchWriterStats(
    long totalWrites,
    long batchesWritten,
    int currentQueueSize,
    Instant lastFlushTime,
    boolean enabled
) {
}
