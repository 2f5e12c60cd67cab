package io.convotest.core.conversation;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum TurnRole {
    @JsonProperty("user") USER,
    @JsonProperty("assistant") ASSISTANT
}
