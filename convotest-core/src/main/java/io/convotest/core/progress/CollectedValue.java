package io.convotest.core.progress;

import java.util.Objects;

public record CollectedValue(
    CollectableField field,
    String value,
    int collectedAtTurn,
    boolean confirmedByAgent,
    String userResponse
) {
    public CollectedValue {
        Objects.requireNonNull(field, "field must not be null");
        value = value == null ? "" : value;
        userResponse = userResponse == null ? "" : userResponse;
    }
}
