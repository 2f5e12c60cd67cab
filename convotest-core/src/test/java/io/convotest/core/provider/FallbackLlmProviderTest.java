package io.convotest.core.provider;

import static org.assertj.core.api.Assertions.assertThat;

import io.convotest.core.model.ChatMessage;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class FallbackLlmProviderTest {

    @Test
    void shouldUseNextProviderWhenFirstFails() {
        LlmProvider primary = new StubProvider("primary", "Error calling LLM: timeout");
        LlmProvider secondary = new StubProvider("secondary", "ok");

        FallbackLlmProvider provider = new FallbackLlmProvider("openai", List.of(primary, secondary));

        LlmResponse response = provider.chat("model", List.of(ChatMessage.user("hi")), 0.7, 50);

        assertThat(response.content()).isEqualTo("ok");
        assertThat(response.usage()).containsEntry("served_by", "secondary");
    }

    @Test
    void shouldReportDisabledWhenNoProviderIsConfigured() {
        FallbackLlmProvider provider = new FallbackLlmProvider(
            "openrouter",
            List.of(new DisabledProvider("openrouter", "missing API key"), new DisabledProvider("openai", "missing API key"))
        );

        LlmResponse response = provider.chat("model", List.of(ChatMessage.user("hi")), 0.7, 50);

        assertThat(response.disabled()).isTrue();
        assertThat(response.content()).contains("provider openai is not configured");
        assertThat(new FallbackLlmProvider("empty", List.of()).chat("m", List.of(), 0.1, 1).content())
            .isEqualTo("Error calling LLM: no providers in fallback chain empty");
    }

    @Test
    void shouldReturnLastErrorWhenEveryProviderFails() {
        FallbackLlmProvider provider = new FallbackLlmProvider(
            "openai",
            List.of(new DisabledProvider("openai", "no key"), new StubProvider("backup", "Error calling LLM: quota"))
        );

        LlmResponse response = provider.chat("model", List.of(ChatMessage.user("hi")), 0.7, 50);

        assertThat(response.isError()).isTrue();
        assertThat(response.content()).isEqualTo("Error calling LLM: quota");
    }

    @Test
    void registryShouldResolveUnknownNamesToDisabledProvider() {
        ProviderRegistry registry = ProviderRegistry.of(new StubProvider("Open-Router", "ok"), new StubProvider("openai", "ai"));

        assertThat(registry.names()).containsExactly("open_router", "openai");
        assertThat(registry.resolve("open_router").chat("m", List.of(), 0.1, 10).content()).isEqualTo("ok");
        assertThat(registry.resolve(" Open Router ").chat("m", List.of(), 0.1, 10).content()).isEqualTo("ok");
        LlmResponse missing = registry.resolve("anthropic").chat("m", List.of(), 0.1, 10);
        assertThat(missing.isError()).isTrue();
        assertThat(missing.usage()).containsEntry("disabled", true);
    }

    private record StubProvider(String name, String content) implements LlmProvider {
        @Override
        public LlmResponse chat(String model, List<ChatMessage> messages, double temperature, int maxTokens) {
            return new LlmResponse(content, Map.of());
        }
    }
}
