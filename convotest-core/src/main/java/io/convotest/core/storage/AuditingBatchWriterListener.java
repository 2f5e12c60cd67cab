package io.convotest.core.storage;

import io.convotest.core.observability.EventTypes;
import io.convotest.core.observability.ObservabilityService;
import java.util.Map;
import java.util.Objects;

public final class AuditingBatchWriterListener implements BatchWriterListener {
    private final ObservabilityService observability;

    public AuditingBatchWriterListener(ObservabilityService observability) {
        this.observability = Objects.requireNonNull(observability, "observability must not be null");
    }

    @Override
    public void onFlush(int count) {
        observability.recordSafely(EventTypes.BATCH_FLUSHED, Map.of("count", count));
    }

    @Override
    public void onError(Exception error, int count) {
        observability.recordSafely(EventTypes.BATCH_FLUSH_FAILED, Map.of(
            "count", count,
            "error", String.valueOf(error.getMessage())
        ));
    }
}
