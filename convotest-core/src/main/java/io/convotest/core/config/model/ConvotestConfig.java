package io.convotest.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ConvotestConfig(
    RunnerSettings runner,
    ClassifierSettings classifier,
    StrategySettings strategy,
    @JsonAlias({"batch_writer"}) BatchWriterSettings batchWriter,
    AgentEndpointConfig agent,
    ProvidersConfig providers,
    StorageConfig storage
) {

    public ConvotestConfig {
        runner = runner == null ? RunnerSettings.defaults() : runner;
        classifier = classifier == null ? ClassifierSettings.defaults() : classifier;
        strategy = strategy == null ? StrategySettings.defaults() : strategy;
        batchWriter = batchWriter == null ? BatchWriterSettings.defaults() : batchWriter;
        agent = agent == null ? AgentEndpointConfig.defaults() : agent;
        providers = providers == null ? ProvidersConfig.defaults() : providers;
        storage = storage == null ? StorageConfig.defaults() : storage;
    }

    public static ConvotestConfig defaults() {
        return new ConvotestConfig(
            RunnerSettings.defaults(),
            ClassifierSettings.defaults(),
            StrategySettings.defaults(),
            BatchWriterSettings.defaults(),
            AgentEndpointConfig.defaults(),
            ProvidersConfig.defaults(),
            StorageConfig.defaults()
        );
    }
}
