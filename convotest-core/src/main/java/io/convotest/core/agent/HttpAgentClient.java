package io.convotest.core.agent;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import io.convotest.core.config.model.AgentEndpointConfig;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.UUID;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class HttpAgentClient implements AgentClient {
    private static final Logger LOG = LoggerFactory.getLogger(HttpAgentClient.class);
    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

    private final HttpUrl endpoint;
    private final String apiKey;
    private final int maxAttempts;
    private final long retryDelayMs;
    private final OkHttpClient client;
    private final ObjectMapper mapper;
    private final AgentResponseParser parser;
    private final Clock clock;
    private String sessionId = UUID.randomUUID().toString();

    public HttpAgentClient(AgentEndpointConfig config, Duration turnTimeout, Clock clock) {
        this(config, new OkHttpClient.Builder()
            .connectTimeout(Duration.ofSeconds(10))
            .callTimeout(turnTimeout)
            .readTimeout(turnTimeout)
            .build(), clock);
    }

    public HttpAgentClient(AgentEndpointConfig config, OkHttpClient client, Clock clock) {
        Objects.requireNonNull(config, "config must not be null");
        if (!config.configured()) {
            throw new IllegalArgumentException("agent endpoint must not be blank");
        }
        this.endpoint = HttpUrl.get(config.endpoint());
        this.apiKey = config.apiKey() == null ? "" : config.apiKey();
        this.maxAttempts = Math.max(1, config.maxRetries());
        this.retryDelayMs = Math.max(0, config.retryDelayMs());
        this.client = Objects.requireNonNull(client, "client must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.mapper = new ObjectMapper();
        this.parser = new AgentResponseParser(mapper);
    }

    @Override
    public String newSession() {
        sessionId = UUID.randomUUID().toString();
        return sessionId;
    }

    @Override
    public String sessionId() {
        return sessionId;
    }

    @Override
    public AgentReply sendMessage(String text) throws AgentClientException {
        long started = clock.millis();
        AgentClientException lastError = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                JsonNode data = post(text);
                return new AgentReply(
                    parser.extractText(data),
                    sessionId,
                    clock.millis() - started,
                    parser.extractToolCalls(data)
                );
            } catch (AgentClientException e) {
                lastError = e;
                LOG.debug("Agent call attempt {}/{} failed: {}", attempt, maxAttempts, e.getMessage());
                if (attempt < maxAttempts) {
                    sleep(retryDelayMs * attempt);
                }
            }
        }
        throw lastError;
    }

    private JsonNode post(String text) throws AgentClientException {
        ObjectNode payload = mapper.createObjectNode();
        payload.put("question", text);
        payload.putObject("overrideConfig").put("sessionId", sessionId);

        Request.Builder request = new Request.Builder()
            .url(endpoint)
            .post(RequestBody.create(payload.toString(), JSON))
            .header("Accept", "application/json");
        if (!apiKey.isBlank()) {
            request.header("Authorization", "Bearer " + apiKey);
        }

        try (Response response = client.newCall(request.build()).execute()) {
            ResponseBody body = response.body();
            String raw = body == null ? "" : body.string();
            if (!response.isSuccessful()) {
                throw new AgentClientException(errorMessage(response.code(), raw), response.code());
            }
            return parse(raw);
        } catch (AgentClientException e) {
            throw e;
        } catch (IOException e) {
            throw new AgentClientException("Agent request failed: " + e.getMessage(), e);
        }
    }

    private JsonNode parse(String raw) {
        try {
            return mapper.readTree(raw);
        } catch (JsonProcessingException e) {
            return TextNode.valueOf(raw);
        }
    }

    private String errorMessage(int status, String raw) {
        JsonNode data = parse(raw);
        String message = data.path("message").asText("");
        return "Agent returned HTTP " + status + (message.isEmpty() ? "" : ": " + message);
    }

    private void sleep(long delayMs) {
        try {
            Thread.sleep(delayMs);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
        }
    }
}
