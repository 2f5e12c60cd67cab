package io.convotest.core.agent;

import java.io.IOException;

public class AgentClientException extends IOException {
    private final int statusCode;

    public AgentClientException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public AgentClientException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
    }

    public int statusCode() {
        return statusCode;
    }
}
