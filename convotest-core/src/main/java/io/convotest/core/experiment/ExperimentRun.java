package io.convotest.core.experiment;

import java.time.Instant;
import java.util.Objects;

public record ExperimentRun(
    Long id,
    String experimentId,
    String runId,
    String testId,
    String variantId,
    VariantRole variantRole,
    Instant startedAt,
    Instant completedAt,
    RunMetrics metrics
) {
    public ExperimentRun {
        Objects.requireNonNull(experimentId, "experimentId must not be null");
        Objects.requireNonNull(runId, "runId must not be null");
        Objects.requireNonNull(testId, "testId must not be null");
        Objects.requireNonNull(variantId, "variantId must not be null");
        Objects.requireNonNull(metrics, "metrics must not be null");
        variantRole = variantRole == null ? VariantRole.TREATMENT : variantRole;
    }

    public boolean passed() {
        return metrics.passed();
    }

    public boolean errorOccurred() {
        return metrics.errorOccurred();
    }
}
