package io.convotest.core.experiment;

import java.util.List;
import java.util.Objects;

public record CreateExperimentRequest(
    String name,
    String description,
    String hypothesis,
    VariantType experimentType,
    String controlVariantId,
    List<String> treatmentVariantIds,
    List<String> testIds,
    Integer minSampleSize,
    Integer maxSampleSize,
    Double significanceThreshold
) {
    public CreateExperimentRequest {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(controlVariantId, "controlVariantId must not be null");
        treatmentVariantIds = treatmentVariantIds == null ? List.of() : List.copyOf(treatmentVariantIds);
        testIds = testIds == null ? List.of() : List.copyOf(testIds);
        if (treatmentVariantIds.isEmpty()) {
            throw new IllegalArgumentException("at least one treatment variant is required");
        }
        experimentType = experimentType == null ? VariantType.PROMPT : experimentType;
    }
}
