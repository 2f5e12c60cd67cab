package io.convotest.core.experiment;

public record RunCount(String variantId, int count, int passCount) {
}
