package io.convotest.core.observability;

public final class EventTypes {
    public static final String TEST_STARTED = "test_started";
    public static final String TEST_COMPLETED = "test_completed";
    public static final String TEST_FAILED = "test_failed";
    public static final String VARIANT_APPLIED = "variant_applied";
    public static final String VARIANT_ROLLED_BACK = "variant_rolled_back";
    public static final String VARIANT_ROLLBACK_FAILED = "variant_rollback_failed";
    public static final String BATCH_FLUSHED = "batch_flushed";
    public static final String BATCH_FLUSH_FAILED = "batch_flush_failed";
    public static final String EXPERIMENT_STATUS_CHANGED = "experiment_status_changed";

    private EventTypes() {
    }
}
