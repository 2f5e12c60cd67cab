package io.convotest.app;

import io.convotest.cli.CliContext;
import io.convotest.cli.ConvotestCliCommand;
import io.convotest.core.agent.AgentClientFactory;
import io.convotest.core.agent.HttpAgentClient;
import io.convotest.core.config.ConfigPaths;
import io.convotest.core.config.ConfigService;
import io.convotest.core.config.model.ConvotestConfig;
import io.convotest.core.config.model.ProviderConfig;
import io.convotest.core.provider.DisabledProvider;
import io.convotest.core.provider.FallbackLlmProvider;
import io.convotest.core.provider.LlmProvider;
import io.convotest.core.provider.OpenAiCompatProvider;
import io.convotest.core.provider.ProviderRegistry;
import io.convotest.core.runtime.ConvotestRuntime;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import picocli.CommandLine;

public final class ConvotestApplication {

    private ConvotestApplication() {
    }

    public static void main(String[] args) {
        ConfigService configService = new ConfigService();
        CliContext context = new CliContext(
            configService,
            ConfigPaths.defaultConfigPath(),
            ConvotestApplication::openRuntime
        );
        CommandLine commandLine = ConvotestCliCommand.commandLine(context);
        int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    private static ConvotestRuntime openRuntime(ConvotestConfig config, boolean forceLegacy) throws IOException {
        Clock clock = Clock.systemUTC();
        Duration turnTimeout = Duration.ofMillis(Math.max(1_000, config.runner().turnTimeoutMs()));
        AgentClientFactory agents = () -> new HttpAgentClient(config.agent(), turnTimeout, clock);
        return ConvotestRuntime.open(
            config,
            buildProviders(config),
            agents,
            Path.of("").toAbsolutePath(),
            forceLegacy
        );
    }

    private static ProviderRegistry buildProviders(ConvotestConfig config) {
        LlmProvider openai = buildOpenAiCompatProvider("openai", config.providers().openai(), "https://api.openai.com/v1");
        LlmProvider openrouter = buildOpenAiCompatProvider(
            "openrouter",
            config.providers().openrouter(),
            "https://openrouter.ai/api/v1"
        );
        return ProviderRegistry.of(
            new FallbackLlmProvider("openai", List.of(openai, openrouter)),
            new FallbackLlmProvider("openrouter", List.of(openrouter, openai))
        );
    }

    private static LlmProvider buildOpenAiCompatProvider(
        String name,
        ProviderConfig providerConfig,
        String defaultBase
    ) {
        if (providerConfig != null && providerConfig.configured()) {
            String apiBase = providerConfig.apiBase() == null || providerConfig.apiBase().isBlank()
                ? defaultBase
                : providerConfig.apiBase();
            return new OpenAiCompatProvider(name, providerConfig.apiKey(), apiBase, providerConfig.extraHeaders());
        }
        return new DisabledProvider(name, "missing API key");
    }
}
