package io.convotest.core.extract;

import io.convotest.core.progress.CollectableField;
import java.util.Objects;

public record ExtractedField(CollectableField field, String value) {
    public ExtractedField {
        Objects.requireNonNull(field, "field must not be null");
        value = value == null ? "" : value.trim();
    }
}
