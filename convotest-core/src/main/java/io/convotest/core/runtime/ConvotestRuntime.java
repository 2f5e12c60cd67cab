package io.convotest.core.runtime;

import io.convotest.core.agent.AgentClientFactory;
import io.convotest.core.classify.CategoryResponseClassifier;
import io.convotest.core.classify.IntentDetector;
import io.convotest.core.classify.LegacyResponseClassifier;
import io.convotest.core.classify.ResponseClassifier;
import io.convotest.core.config.ConfigPaths;
import io.convotest.core.config.model.ConvotestConfig;
import io.convotest.core.experiment.ExperimentService;
import io.convotest.core.experiment.SqliteExperimentStore;
import io.convotest.core.experiment.VariantService;
import io.convotest.core.observability.FileAuditStore;
import io.convotest.core.observability.ObservabilityService;
import io.convotest.core.provider.ProviderRegistry;
import io.convotest.core.respond.ResponseStrategyEngine;
import io.convotest.core.respond.TemplateResponseGenerator;
import io.convotest.core.runner.GoalTestRunner;
import io.convotest.core.storage.AuditingBatchWriterListener;
import io.convotest.core.storage.BatchWriter;
import io.convotest.core.storage.BatchingResultRepository;
import io.convotest.core.storage.SqliteResultStore;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.SecureRandom;
import java.time.Clock;
import java.util.Objects;
import java.util.Random;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class ConvotestRuntime implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(ConvotestRuntime.class);

    private final ConvotestConfig config;
    private final Path workspace;
    private final ObservabilityService observability;
    private final SqliteResultStore resultStore;
    private final BatchWriter batchWriter;
    private final VariantService variantService;
    private final ExperimentService experimentService;
    private final ResponseClassifier classifier;
    private final GoalTestRunner runner;

    private ConvotestRuntime(
        ConvotestConfig config,
        Path workspace,
        ObservabilityService observability,
        SqliteResultStore resultStore,
        BatchWriter batchWriter,
        VariantService variantService,
        ExperimentService experimentService,
        ResponseClassifier classifier,
        GoalTestRunner runner
    ) {
        this.config = config;
        this.workspace = workspace;
        this.observability = observability;
        this.resultStore = resultStore;
        this.batchWriter = batchWriter;
        this.variantService = variantService;
        this.experimentService = experimentService;
        this.classifier = classifier;
        this.runner = runner;
    }

    public static ConvotestRuntime open(
        ConvotestConfig config,
        ProviderRegistry providers,
        AgentClientFactory agents,
        Path workingDirectory,
        boolean forceLegacy
    ) throws IOException {
        Objects.requireNonNull(config, "config must not be null");
        Objects.requireNonNull(providers, "providers must not be null");
        Objects.requireNonNull(agents, "agents must not be null");
        Objects.requireNonNull(workingDirectory, "workingDirectory must not be null");
        Clock clock = Clock.systemUTC();

        Path workspace = ConfigPaths.resolveWorkspace(config.storage().workspace()).toAbsolutePath().normalize();
        Files.createDirectories(workspace);

        ObservabilityService observability = new ObservabilityService(
            new FileAuditStore(workspace.resolve(config.storage().auditFile())),
            clock
        );
        SqliteResultStore resultStore = new SqliteResultStore(workspace.resolve(config.storage().resultsDb()));
        BatchWriter batchWriter = new BatchWriter(resultStore, config.batchWriter(), clock);
        batchWriter.addListener(new AuditingBatchWriterListener(observability));

        SqliteExperimentStore experimentStore = new SqliteExperimentStore(workspace.resolve(config.storage().experimentsDb()));
        VariantService variantService = new VariantService(experimentStore, workingDirectory, observability, clock);
        ExperimentService experimentService = new ExperimentService(
            experimentStore,
            variantService,
            observability,
            new SecureRandom(),
            clock
        );

        ResponseClassifier classifier = classifier(config, providers, clock, forceLegacy);
        GoalTestRunner runner = GoalTestRunner.builder(agents, classifier, new BatchingResultRepository(batchWriter))
            .settings(config.runner())
            .clock(clock)
            .observability(observability)
            .experiments(experimentService, variantService)
            .build();

        LOG.info("Runtime ready, workspace {}", workspace);
        return new ConvotestRuntime(
            config,
            workspace,
            observability,
            resultStore,
            batchWriter,
            variantService,
            experimentService,
            classifier,
            runner
        );
    }

    static ResponseClassifier classifier(
        ConvotestConfig config,
        ProviderRegistry providers,
        Clock clock,
        boolean forceLegacy
    ) {
        ResponseStrategyEngine strategy = new ResponseStrategyEngine(config.strategy(), providers, new Random(), clock);
        if (config.runner().useCategoryBasedSystem() && !forceLegacy) {
            return new CategoryResponseClassifier(config.classifier(), providers, strategy, clock);
        }
        return new LegacyResponseClassifier(
            new IntentDetector(config.classifier(), providers, clock),
            new TemplateResponseGenerator(clock),
            strategy
        );
    }

    public ConvotestConfig config() {
        return config;
    }

    public Path workspace() {
        return workspace;
    }

    public ObservabilityService observability() {
        return observability;
    }

    public SqliteResultStore resultStore() {
        return resultStore;
    }

    public BatchWriter batchWriter() {
        return batchWriter;
    }

    public VariantService variants() {
        return variantService;
    }

    public ExperimentService experiments() {
        return experimentService;
    }

    public ResponseClassifier classifier() {
        return classifier;
    }

    public GoalTestRunner runner() {
        return runner;
    }

    @Override
    public void close() throws IOException {
        batchWriter.close();
    }
}
