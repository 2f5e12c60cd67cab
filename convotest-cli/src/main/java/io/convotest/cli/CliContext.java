package io.convotest.cli;

import io.convotest.core.config.ConfigService;
import io.convotest.core.config.model.ConvotestConfig;
import io.convotest.core.runtime.ConvotestRuntime;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Shared state for one CLI invocation. The root command may replace the config path before a
 * subcommand runs.
 */
public final class CliContext {
    private final ConfigService configService;
    private final Path defaultConfigPath;
    private final RuntimeFactory runtimeFactory;
    private volatile Path configOverride;

    public CliContext(ConfigService configService, Path defaultConfigPath, RuntimeFactory runtimeFactory) {
        this.configService = Objects.requireNonNull(configService, "configService must not be null");
        this.defaultConfigPath = Objects.requireNonNull(defaultConfigPath, "defaultConfigPath must not be null");
        this.runtimeFactory = Objects.requireNonNull(runtimeFactory, "runtimeFactory must not be null");
    }

    public ConfigService configService() {
        return configService;
    }

    public Path configPath() {
        Path override = configOverride;
        return override == null ? defaultConfigPath : override;
    }

    void overrideConfigPath(Path path) {
        this.configOverride = path;
    }

    public ConvotestConfig loadConfig() throws IOException {
        return configService.load(configPath());
    }

    public ConvotestRuntime openRuntime(boolean forceLegacy) throws IOException {
        return runtimeFactory.open(loadConfig(), forceLegacy);
    }
}
