package io.convotest.core.observability;

import java.io.IOException;
import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class ObservabilityService {
    private static final Logger LOG = LoggerFactory.getLogger(ObservabilityService.class);
    private static final int MAX_EVENTS = 20_000;

    private final AuditStore store;
    private final Clock clock;

    public ObservabilityService(AuditStore store, Clock clock) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public synchronized AuditEvent record(String type, Map<String, Object> attributes) throws IOException {
        AuditEvent event = new AuditEvent(UUID.randomUUID().toString(), clock.instant(), type, attributes);
        store.append(event, MAX_EVENTS);
        return event;
    }

    public void recordSafely(String type, Map<String, Object> attributes) {
        try {
            record(type, attributes);
        } catch (IOException e) {
            LOG.error("Failed to record audit event {} {}: {}", type, attributes, e.getMessage(), e);
        }
    }

    public synchronized List<AuditEvent> recent(int limit) throws IOException {
        int safe = Math.max(1, limit);
        return store.load().stream()
            .sorted(Comparator.comparing(AuditEvent::timestamp).reversed())
            .limit(safe)
            .toList();
    }

    public synchronized List<AuditEvent> byType(String type) throws IOException {
        return byType(store.load(), type);
    }

    public synchronized List<AuditEvent> forRun(String runId) throws IOException {
        return store.load().stream()
            .filter(e -> runId != null && runId.equals(e.runId()))
            .sorted(Comparator.comparing(AuditEvent::timestamp))
            .toList();
    }

    public synchronized RunSummary summary() throws IOException {
        return summarize(store.load());
    }

    public synchronized RunSummary summary(String runId) throws IOException {
        return summarize(forRun(runId));
    }

    private RunSummary summarize(List<AuditEvent> all) {
        int started = byType(all, EventTypes.TEST_STARTED).size();
        List<AuditEvent> completed = byType(all, EventTypes.TEST_COMPLETED);
        int passed = (int) completed.stream().filter(AuditEvent::passed).count();
        int failed = completed.size() - passed + byType(all, EventTypes.TEST_FAILED).size();
        double passRate = completed.isEmpty() ? 0.0 : percentage(passed, completed.size());

        List<Double> durations = completed.stream()
            .map(AuditEvent::durationMs)
            .filter(v -> v >= 0)
            .sorted()
            .toList();

        return new RunSummary(
            started,
            passed,
            failed,
            round2(passRate),
            round2(percentile(durations, 50)),
            round2(percentile(durations, 95)),
            byType(all, EventTypes.VARIANT_ROLLBACK_FAILED).size(),
            byType(all, EventTypes.BATCH_FLUSH_FAILED).size(),
            all.size()
        );
    }

    private List<AuditEvent> byType(List<AuditEvent> events, String type) {
        return events.stream().filter(e -> e.isType(type)).toList();
    }

    private double percentile(List<Double> sorted, int percentile) {
        if (sorted.isEmpty()) {
            return 0.0;
        }
        int index = (int) Math.ceil((percentile / 100.0) * sorted.size()) - 1;
        index = Math.max(0, Math.min(sorted.size() - 1, index));
        return sorted.get(index);
    }

    private double percentage(int numerator, int denominator) {
        return denominator <= 0 ? 0.0 : (numerator * 100.0) / denominator;
    }

    private double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
