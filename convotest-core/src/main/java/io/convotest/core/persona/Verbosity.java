package io.convotest.core.persona;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum Verbosity {
    @JsonProperty("terse") TERSE,
    @JsonProperty("normal") NORMAL,
    @JsonProperty("verbose") VERBOSE
}
