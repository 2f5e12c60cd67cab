package io.convotest.core.experiment;

import java.time.Instant;
import java.util.Objects;

public record Variant(
    String variantId,
    VariantType variantType,
    String targetFile,
    String name,
    String description,
    String content,
    String contentHash,
    String baselineVariantId,
    String sourceFixId,
    boolean baseline,
    Instant createdAt,
    String createdBy
) {
    public Variant {
        Objects.requireNonNull(variantId, "variantId must not be null");
        Objects.requireNonNull(variantType, "variantType must not be null");
        Objects.requireNonNull(targetFile, "targetFile must not be null");
        Objects.requireNonNull(content, "content must not be null");
        Objects.requireNonNull(contentHash, "contentHash must not be null");
        name = name == null ? variantId : name;
        description = description == null ? "" : description;
        createdBy = createdBy == null || createdBy.isBlank() ? "manual" : createdBy;
    }

    public Variant asBaseline(boolean value) {
        return new Variant(
            variantId,
            variantType,
            targetFile,
            name,
            description,
            content,
            contentHash,
            baselineVariantId,
            sourceFixId,
            value,
            createdAt,
            createdBy
        );
    }
}
