package io.convotest.core.experiment;

public record VariantSelection(String variantId, VariantRole role, String targetFile) {
}
