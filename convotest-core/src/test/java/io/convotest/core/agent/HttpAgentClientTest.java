package io.convotest.core.agent;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.convotest.core.config.model.AgentEndpointConfig;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class HttpAgentClientTest {

    private MockWebServer server;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    void shouldPostQuestionWithSessionAndParseReply() throws Exception {
        server.enqueue(new MockResponse()
            .setHeader("Content-Type", "application/json")
            .setBody("""
                {
                  "text": "What is the best phone number to reach you?",
                  "agentReasoning": [
                    { "usedTools": [ { "tool": "lookup_patient", "toolInput": {"name": "Dana"}, "toolOutput": "none" } ] }
                  ]
                }
                """));
        HttpAgentClient client = client("sk-agent", 1);
        String session = client.newSession();

        AgentReply reply = client.sendMessage("Hi, I'd like to book for my son");

        assertThat(reply.text()).isEqualTo("What is the best phone number to reach you?");
        assertThat(reply.sessionId()).isEqualTo(session);
        assertThat(reply.toolCalls()).singleElement().satisfies(call -> {
            assertThat(call.toolName()).isEqualTo("lookup_patient");
            assertThat(call.input().path("name").asText()).isEqualTo("Dana");
            assertThat(call.status()).isEqualTo("completed");
        });

        RecordedRequest request = server.takeRequest();
        assertThat(request.getMethod()).isEqualTo("POST");
        assertThat(request.getPath()).isEqualTo("/api/v1/prediction/agent");
        assertThat(request.getHeader("Authorization")).isEqualTo("Bearer sk-agent");
        String body = request.getBody().readUtf8();
        assertThat(body).contains("\"question\":\"Hi, I'd like to book for my son\"");
        assertThat(body).contains("\"sessionId\":\"" + session + "\"");
    }

    @Test
    void shouldRetryFailedAttempts() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(500).setBody("{\"message\":\"boom\"}"));
        server.enqueue(new MockResponse().setBody("{\"answer\":\"Hello there\"}"));
        HttpAgentClient client = client("", 2);

        AgentReply reply = client.sendMessage("Hi");

        assertThat(reply.text()).isEqualTo("Hello there");
        assertThat(server.getRequestCount()).isEqualTo(2);
        assertThat(server.takeRequest().getHeader("Authorization")).isNull();
    }

    @Test
    void shouldThrowWithStatusAfterLastAttempt() {
        server.enqueue(new MockResponse().setResponseCode(503).setBody("{\"message\":\"busy\"}"));
        server.enqueue(new MockResponse().setResponseCode(503).setBody("{\"message\":\"busy\"}"));
        HttpAgentClient client = client("", 2);

        assertThatThrownBy(() -> client.sendMessage("Hi"))
            .isInstanceOf(AgentClientException.class)
            .hasMessage("Agent returned HTTP 503: busy")
            .satisfies(e -> assertThat(((AgentClientException) e).statusCode()).isEqualTo(503));
        assertThat(server.getRequestCount()).isEqualTo(2);
    }

    @Test
    void shouldAcceptPlainTextBodiesAndPayloadSections() throws Exception {
        server.enqueue(new MockResponse().setBody("Thanks for calling!"));
        server.enqueue(new MockResponse().setBody("""
            {"text": "You're booked. PAYLOAD: {\\"slot\\": {\\"day\\": \\"Monday\\"}} end"}
            """));
        HttpAgentClient client = client("", 1);

        AgentReply plain = client.sendMessage("Bye");
        AgentReply withPayload = client.sendMessage("Monday please");

        assertThat(plain.text()).isEqualTo("Thanks for calling!");
        assertThat(plain.toolCalls()).isEmpty();
        assertThat(withPayload.toolCalls()).singleElement().satisfies(call -> {
            assertThat(call.toolName()).isEqualTo("flowise_payload");
            assertThat(call.output().path("slot").path("day").asText()).isEqualTo("Monday");
        });
    }

    @Test
    void shouldRejectBlankEndpoint() {
        AgentEndpointConfig config = new AgentEndpointConfig(" ", "", 1, 0);

        assertThatThrownBy(() -> new HttpAgentClient(config, Duration.ofSeconds(1), Clock.systemUTC()))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("agent endpoint must not be blank");
    }

    private HttpAgentClient client(String apiKey, int maxRetries) {
        AgentEndpointConfig config = new AgentEndpointConfig(
            server.url("/api/v1/prediction/agent").toString(),
            apiKey,
            maxRetries,
            0
        );
        return new HttpAgentClient(config, Duration.ofSeconds(5), Clock.systemUTC());
    }
}
