package io.convotest.core.experiment;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

public record Experiment(
    String experimentId,
    String name,
    String description,
    String hypothesis,
    ExperimentStatus status,
    VariantType experimentType,
    List<ExperimentVariant> variants,
    List<String> testIds,
    int minSampleSize,
    int maxSampleSize,
    double significanceThreshold,
    Instant createdAt,
    Instant startedAt,
    Instant completedAt,
    String winningVariantId,
    String conclusion
) {
    public Experiment {
        Objects.requireNonNull(experimentId, "experimentId must not be null");
        name = name == null ? experimentId : name;
        description = description == null ? "" : description;
        hypothesis = hypothesis == null ? "" : hypothesis;
        status = status == null ? ExperimentStatus.DRAFT : status;
        variants = variants == null ? List.of() : List.copyOf(variants);
        testIds = testIds == null ? List.of() : List.copyOf(testIds);
    }

    public Optional<ExperimentVariant> control() {
        return variants.stream().filter(v -> v.role() == VariantRole.CONTROL).findFirst();
    }

    public List<ExperimentVariant> treatments() {
        return variants.stream().filter(v -> v.role() == VariantRole.TREATMENT).toList();
    }

    public Optional<ExperimentVariant> variant(String variantId) {
        return variants.stream().filter(v -> v.variantId().equals(variantId)).findFirst();
    }

    public boolean includesTest(String testId) {
        return testIds.contains(testId);
    }

    Experiment withStatus(
        ExperimentStatus newStatus,
        Instant newStartedAt,
        Instant newCompletedAt,
        String newWinner,
        String newConclusion
    ) {
        return new Experiment(
            experimentId,
            name,
            description,
            hypothesis,
            newStatus,
            experimentType,
            variants,
            testIds,
            minSampleSize,
            maxSampleSize,
            significanceThreshold,
            createdAt,
            newStartedAt,
            newCompletedAt,
            newWinner,
            newConclusion
        );
    }
}
