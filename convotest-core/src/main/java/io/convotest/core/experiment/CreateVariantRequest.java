package io.convotest.core.experiment;

import java.util.Objects;

public record CreateVariantRequest(
    VariantType variantType,
    String targetFile,
    String name,
    String description,
    String content,
    String baselineVariantId,
    String sourceFixId,
    String createdBy
) {
    public CreateVariantRequest {
        Objects.requireNonNull(variantType, "variantType must not be null");
        Objects.requireNonNull(targetFile, "targetFile must not be null");
        Objects.requireNonNull(content, "content must not be null");
    }

    public static CreateVariantRequest of(VariantType type, String targetFile, String name, String content) {
        return new CreateVariantRequest(type, targetFile, name, "", content, null, null, "manual");
    }
}
