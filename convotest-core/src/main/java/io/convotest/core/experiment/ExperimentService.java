package io.convotest.core.experiment;

import io.convotest.core.observability.EventTypes;
import io.convotest.core.observability.ObservabilityService;
import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Random;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class ExperimentService {
    private static final Logger LOG = LoggerFactory.getLogger(ExperimentService.class);
    private static final DateTimeFormatter ID_DATE = DateTimeFormatter.ofPattern("yyyy-MM-dd").withZone(ZoneOffset.UTC);
    private static final int DEFAULT_MIN_SAMPLE_SIZE = 10;
    private static final int DEFAULT_MAX_SAMPLE_SIZE = 100;
    private static final double DEFAULT_SIGNIFICANCE = 0.05;

    private final ExperimentStore store;
    private final VariantService variants;
    private final ObservabilityService observability;
    private final Random random;
    private final Clock clock;

    public ExperimentService(
        ExperimentStore store,
        VariantService variants,
        ObservabilityService observability,
        Random random,
        Clock clock
    ) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.variants = Objects.requireNonNull(variants, "variants must not be null");
        this.observability = Objects.requireNonNull(observability, "observability must not be null");
        this.random = Objects.requireNonNull(random, "random must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public Experiment createExperiment(CreateExperimentRequest request) throws IOException {
        Objects.requireNonNull(request, "request must not be null");
        variants.requireVariant(request.controlVariantId());
        for (String treatment : request.treatmentVariantIds()) {
            variants.requireVariant(treatment);
        }
        if (new LinkedHashSet<>(request.treatmentVariantIds()).contains(request.controlVariantId())) {
            throw new IllegalArgumentException("control variant must not also be a treatment");
        }

        List<ExperimentVariant> roster = new ArrayList<>();
        roster.add(new ExperimentVariant(request.controlVariantId(), VariantRole.CONTROL, 50));
        int share = 50 / request.treatmentVariantIds().size();
        for (String treatment : request.treatmentVariantIds()) {
            roster.add(new ExperimentVariant(treatment, VariantRole.TREATMENT, share));
        }
        int total = roster.stream().mapToInt(ExperimentVariant::weight).sum();
        if (total != 100) {
            roster.set(0, roster.get(0).withWeight(roster.get(0).weight() + 100 - total));
        }

        Instant now = clock.instant();
        Experiment experiment = new Experiment(
            "EXP-" + ID_DATE.format(now) + "-" + UUID.randomUUID().toString().substring(0, 8),
            request.name(),
            request.description(),
            request.hypothesis(),
            ExperimentStatus.DRAFT,
            request.experimentType(),
            roster,
            request.testIds(),
            request.minSampleSize() == null ? DEFAULT_MIN_SAMPLE_SIZE : request.minSampleSize(),
            request.maxSampleSize() == null ? DEFAULT_MAX_SAMPLE_SIZE : request.maxSampleSize(),
            request.significanceThreshold() == null ? DEFAULT_SIGNIFICANCE : request.significanceThreshold(),
            now,
            null,
            null,
            null,
            null
        );
        store.saveExperiment(experiment);
        LOG.info("Created experiment {} with {} variants", experiment.experimentId(), roster.size());
        return experiment;
    }

    public Optional<Experiment> getExperiment(String experimentId) throws IOException {
        return store.findExperiment(experimentId);
    }

    public List<Experiment> getAllExperiments() throws IOException {
        return store.listExperiments();
    }

    public List<Experiment> getActiveExperiments() throws IOException {
        return store.listExperiments().stream().filter(e -> e.status() == ExperimentStatus.RUNNING).toList();
    }

    public List<Experiment> getExperimentsForTest(String testId) throws IOException {
        return store.listExperiments().stream().filter(e -> e.includesTest(testId)).toList();
    }

    public Experiment startExperiment(String experimentId) throws IOException {
        Experiment experiment = require(experimentId);
        if (experiment.status() != ExperimentStatus.DRAFT && experiment.status() != ExperimentStatus.PAUSED) {
            throw new IllegalStateException(
                "Cannot start experiment " + experimentId + " in " + experiment.status() + " status"
            );
        }
        Instant startedAt = experiment.startedAt() == null ? clock.instant() : experiment.startedAt();
        return transition(experiment, experiment.withStatus(ExperimentStatus.RUNNING, startedAt, null, null, null));
    }

    public Experiment pauseExperiment(String experimentId) throws IOException {
        Experiment experiment = require(experimentId);
        if (experiment.status() != ExperimentStatus.RUNNING) {
            throw new IllegalStateException(
                "Cannot pause experiment " + experimentId + " in " + experiment.status() + " status"
            );
        }
        return transition(experiment, experiment.withStatus(
            ExperimentStatus.PAUSED,
            experiment.startedAt(),
            null,
            null,
            null
        ));
    }

    public Experiment completeExperiment(String experimentId, String conclusion) throws IOException {
        Experiment experiment = require(experimentId);
        if (experiment.status().isFinal()) {
            throw new IllegalStateException(
                "Cannot complete experiment " + experimentId + " in " + experiment.status() + " status"
            );
        }
        ExperimentAnalysis analysis = ExperimentStatistics.analyze(experiment, store.runsFor(experimentId));
        String finalConclusion = conclusion == null || conclusion.isBlank() ? analysis.recommendationReason() : conclusion;
        return transition(experiment, experiment.withStatus(
            ExperimentStatus.COMPLETED,
            experiment.startedAt(),
            clock.instant(),
            analysis.recommendedWinner(),
            finalConclusion
        ));
    }

    public Experiment abortExperiment(String experimentId, String reason) throws IOException {
        Experiment experiment = require(experimentId);
        if (experiment.status().isFinal()) {
            throw new IllegalStateException(
                "Cannot abort experiment " + experimentId + " in " + experiment.status() + " status"
            );
        }
        return transition(experiment, experiment.withStatus(
            ExperimentStatus.ABORTED,
            experiment.startedAt(),
            clock.instant(),
            null,
            "Aborted: " + (reason == null ? "" : reason)
        ));
    }

    public VariantSelection selectVariant(String experimentId, String testId) throws IOException {
        Experiment experiment = require(experimentId);
        if (experiment.status() != ExperimentStatus.RUNNING) {
            throw new IllegalStateException("Experiment " + experimentId + " is not running");
        }
        double roll = random.nextDouble() * 100.0;
        double cumulative = 0.0;
        for (ExperimentVariant candidate : experiment.variants()) {
            cumulative += candidate.weight();
            if (roll <= cumulative) {
                Variant variant = variants.requireVariant(candidate.variantId());
                LOG.debug("Selected {} ({}) for test {} in {}", candidate.variantId(), candidate.role().key(), testId, experimentId);
                return new VariantSelection(candidate.variantId(), candidate.role(), variant.targetFile());
            }
        }
        ExperimentVariant control = experiment.control()
            .orElseThrow(() -> new IllegalStateException("No control variant found in " + experimentId));
        Variant variant = variants.requireVariant(control.variantId());
        return new VariantSelection(control.variantId(), VariantRole.CONTROL, variant.targetFile());
    }

    public long recordTestResult(
        String experimentId,
        String runId,
        String testId,
        VariantSelection selection,
        RunMetrics metrics
    ) throws IOException {
        Objects.requireNonNull(selection, "selection must not be null");
        Objects.requireNonNull(metrics, "metrics must not be null");
        Instant completedAt = clock.instant();
        ExperimentRun run = new ExperimentRun(
            null,
            experimentId,
            runId,
            testId,
            selection.variantId(),
            selection.role(),
            completedAt.minusMillis(metrics.durationMs()),
            completedAt,
            metrics
        );
        return store.appendRun(run);
    }

    public List<ExperimentRun> getRuns(String experimentId) throws IOException {
        return store.runsFor(experimentId);
    }

    public List<RunCount> getRunCounts(String experimentId) throws IOException {
        return store.countRuns(experimentId);
    }

    public ExperimentAnalysis getExperimentStats(String experimentId) throws IOException {
        return ExperimentStatistics.analyze(require(experimentId), store.runsFor(experimentId));
    }

    public Variant adoptWinner(String experimentId) throws IOException {
        Experiment experiment = require(experimentId);
        if (experiment.winningVariantId() == null) {
            throw new IllegalStateException("No winning variant to adopt for " + experimentId);
        }
        Variant winner = variants.requireVariant(experiment.winningVariantId());
        variants.setAsBaseline(winner.variantId());
        variants.applyVariant(winner.variantId());
        variants.commitApplied(winner.targetFile());
        LOG.info("Adopted variant {} as baseline for {}", winner.variantId(), winner.targetFile());
        return winner.asBaseline(true);
    }

    public ExperimentSummary getExperimentSummary(String experimentId) throws IOException {
        Experiment experiment = require(experimentId);
        List<RunCount> counts = store.countRuns(experimentId);
        int controlSamples = 0;
        int treatmentSamples = 0;
        for (RunCount count : counts) {
            Optional<ExperimentVariant> member = experiment.variant(count.variantId());
            if (member.isEmpty()) {
                continue;
            }
            if (member.get().role() == VariantRole.CONTROL) {
                controlSamples += count.count();
            } else {
                treatmentSamples += count.count();
            }
        }

        ExperimentAnalysis analysis = null;
        if (experiment.status() == ExperimentStatus.RUNNING || experiment.status() == ExperimentStatus.COMPLETED) {
            analysis = ExperimentStatistics.analyze(experiment, store.runsFor(experimentId));
        }
        VariantComparison lead = analysis == null || analysis.comparisons().isEmpty()
            ? null
            : analysis.comparisons().stream()
                .min((a, b) -> Double.compare(a.pValue(), b.pValue()))
                .orElse(null);

        return new ExperimentSummary(
            experiment.experimentId(),
            experiment.name(),
            experiment.status(),
            experiment.hypothesis(),
            experiment.createdAt(),
            experiment.startedAt(),
            experiment.completedAt(),
            controlSamples,
            treatmentSamples,
            experiment.minSampleSize(),
            lead == null ? null : lead.controlPassRate(),
            lead == null ? null : lead.treatmentPassRate(),
            lead == null ? null : lead.passRateLift(),
            lead == null ? null : lead.pValue(),
            lead == null ? null : lead.significant(),
            analysis == null ? null : analysis.recommendation(),
            experiment.winningVariantId(),
            experiment.conclusion()
        );
    }

    private Experiment require(String experimentId) throws IOException {
        return store.findExperiment(experimentId)
            .orElseThrow(() -> new IllegalArgumentException("Experiment " + experimentId + " not found"));
    }

    private Experiment transition(Experiment from, Experiment to) throws IOException {
        store.saveExperiment(to);
        LOG.info("Experiment {} moved from {} to {}", to.experimentId(), from.status().key(), to.status().key());
        observability.recordSafely(EventTypes.EXPERIMENT_STATUS_CHANGED, Map.of(
            "experiment_id", to.experimentId(),
            "from", from.status().key(),
            "to", to.status().key()
        ));
        return to;
    }
}
