package io.convotest.core.model;

public enum MessageRole {
    SYSTEM,
    USER,
    ASSISTANT;

    public String wireValue() {
        return name().toLowerCase();
    }
}
