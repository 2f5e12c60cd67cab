package io.convotest.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record AgentEndpointConfig(
    String endpoint,
    @JsonAlias({"api_key"}) String apiKey,
    @JsonAlias({"max_retries"}) int maxRetries,
    @JsonAlias({"retry_delay_ms"}) long retryDelayMs
) {

    public static AgentEndpointConfig defaults() {
        return new AgentEndpointConfig("http://localhost:3000/api/v1/prediction/agent", "", 3, 1000);
    }

    public boolean configured() {
        return endpoint != null && !endpoint.isBlank();
    }
}
