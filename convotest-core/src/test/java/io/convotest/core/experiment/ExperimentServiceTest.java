package io.convotest.core.experiment;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import io.convotest.core.observability.EventTypes;
import io.convotest.core.observability.FileAuditStore;
import io.convotest.core.observability.ObservabilityService;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Random;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ExperimentServiceTest {

    @TempDir
    Path tempDir;

    private Path workDir;
    private FixedRandom random;
    private ObservabilityService observability;
    private VariantService variants;
    private ExperimentService service;

    @BeforeEach
    void setUp() throws Exception {
        workDir = Files.createDirectories(tempDir.resolve("work"));
        Clock clock = Clock.fixed(Instant.parse("2026-05-10T08:00:00Z"), ZoneOffset.UTC);
        SqliteExperimentStore store = new SqliteExperimentStore(tempDir.resolve("experiments.db"));
        observability = new ObservabilityService(new FileAuditStore(tempDir.resolve("audit.jsonl")), clock);
        variants = new VariantService(store, workDir, observability, clock);
        random = new FixedRandom();
        service = new ExperimentService(store, variants, observability, random, clock);
    }

    @Test
    void shouldSplitWeightsEvenlyAndGiveRemainderToControl() throws Exception {
        Variant control = variant("control");
        Variant a = variant("a");
        Variant b = variant("b");
        Variant c = variant("c");

        Experiment experiment = service.createExperiment(request(control, List.of(a.variantId(), b.variantId(), c.variantId())));

        assertThat(experiment.experimentId()).startsWith("EXP-2026-05-10-");
        assertThat(experiment.status()).isEqualTo(ExperimentStatus.DRAFT);
        assertThat(experiment.variants()).extracting(ExperimentVariant::weight).containsExactly(52, 16, 16, 16);
        assertThat(experiment.minSampleSize()).isEqualTo(10);
        assertThat(experiment.maxSampleSize()).isEqualTo(100);
        assertThat(experiment.significanceThreshold()).isEqualTo(0.05);
        assertThat(service.getExperiment(experiment.experimentId())).map(Experiment::variants).contains(experiment.variants());
    }

    @Test
    void shouldEnforceStatusTransitions() throws Exception {
        Experiment experiment = service.createExperiment(request(variant("control"), List.of(variant("t").variantId())));
        String id = experiment.experimentId();

        assertThat(service.startExperiment(id).status()).isEqualTo(ExperimentStatus.RUNNING);
        assertThatThrownBy(() -> service.startExperiment(id))
            .isInstanceOf(IllegalStateException.class)
            .hasMessage("Cannot start experiment " + id + " in RUNNING status");
        assertThat(service.getActiveExperiments()).extracting(Experiment::experimentId).containsExactly(id);

        assertThat(service.pauseExperiment(id).status()).isEqualTo(ExperimentStatus.PAUSED);
        assertThat(service.getActiveExperiments()).isEmpty();
        assertThat(service.startExperiment(id).status()).isEqualTo(ExperimentStatus.RUNNING);

        Experiment aborted = service.abortExperiment(id, "prompt file moved");
        assertThat(aborted.status()).isEqualTo(ExperimentStatus.ABORTED);
        assertThat(aborted.conclusion()).isEqualTo("Aborted: prompt file moved");
        assertThat(aborted.completedAt()).isNotNull();
        assertThatThrownBy(() -> service.completeExperiment(id, null)).isInstanceOf(IllegalStateException.class);

        assertThat(observability.byType(EventTypes.EXPERIMENT_STATUS_CHANGED)).hasSize(4);
    }

    @Test
    void shouldSelectVariantByWeightOnlyWhileRunning() throws Exception {
        Variant control = variant("control");
        Variant treatment = variant("treatment");
        Experiment experiment = service.createExperiment(request(control, List.of(treatment.variantId())));
        String id = experiment.experimentId();

        assertThatThrownBy(() -> service.selectVariant(id, "T1"))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("not running");

        service.startExperiment(id);
        random.next = 0.30;
        VariantSelection low = service.selectVariant(id, "T1");
        random.next = 0.75;
        VariantSelection high = service.selectVariant(id, "T1");

        assertThat(low.variantId()).isEqualTo(control.variantId());
        assertThat(low.role()).isEqualTo(VariantRole.CONTROL);
        assertThat(low.targetFile()).isEqualTo("prompts/system.md");
        assertThat(high.variantId()).isEqualTo(treatment.variantId());
        assertThat(high.role()).isEqualTo(VariantRole.TREATMENT);
    }

    @Test
    void shouldRecordRunsAndSummarize() throws Exception {
        Variant control = variant("control");
        Variant treatment = variant("treatment");
        Experiment experiment = service.createExperiment(request(control, List.of(treatment.variantId())));
        String id = experiment.experimentId();
        service.startExperiment(id);

        VariantSelection controlSelection = new VariantSelection(control.variantId(), VariantRole.CONTROL, "prompts/system.md");
        VariantSelection treatmentSelection = new VariantSelection(treatment.variantId(), VariantRole.TREATMENT, "prompts/system.md");
        for (int i = 0; i < 3; i++) {
            service.recordTestResult(id, "run-1", "T" + i, controlSelection, metrics(i == 0));
            service.recordTestResult(id, "run-1", "T" + i, treatmentSelection, metrics(true));
        }

        List<RunCount> counts = service.getRunCounts(id);
        assertThat(counts).extracting(RunCount::count).containsOnly(3);
        assertThat(service.getRuns(id)).hasSize(6);

        ExperimentSummary summary = service.getExperimentSummary(id);
        assertThat(summary.controlSamples()).isEqualTo(3);
        assertThat(summary.treatmentSamples()).isEqualTo(3);
        assertThat(summary.controlPassRate()).isCloseTo(1.0 / 3.0, within(1e-9));
        assertThat(summary.treatmentPassRate()).isEqualTo(1.0);
        assertThat(summary.recommendation()).isEqualTo(Recommendation.CONTINUE);

        Experiment completed = service.completeExperiment(id, null);
        assertThat(completed.status()).isEqualTo(ExperimentStatus.COMPLETED);
        assertThat(completed.winningVariantId()).isNull();
        assertThat(completed.conclusion()).startsWith("Insufficient samples");
    }

    @Test
    void shouldAdoptWinnerAsBaselineAndWriteItsContent() throws Exception {
        Variant control = variant("control");
        Variant treatment = variant("treatment");
        CreateExperimentRequest request = new CreateExperimentRequest(
            "brevity", null, null, VariantType.PROMPT, control.variantId(), List.of(treatment.variantId()),
            List.of("T1"), 2, 10, 0.05
        );
        String id = service.createExperiment(request).experimentId();
        service.startExperiment(id);
        VariantSelection controlSelection = new VariantSelection(control.variantId(), VariantRole.CONTROL, "prompts/system.md");
        VariantSelection treatmentSelection = new VariantSelection(treatment.variantId(), VariantRole.TREATMENT, "prompts/system.md");
        for (int i = 0; i < 20; i++) {
            service.recordTestResult(id, "run-1", "T1", controlSelection, metrics(i < 4));
            service.recordTestResult(id, "run-1", "T1", treatmentSelection, metrics(i < 19));
        }

        Experiment completed = service.completeExperiment(id, null);
        assertThat(completed.winningVariantId()).isEqualTo(treatment.variantId());

        Variant adopted = service.adoptWinner(id);

        assertThat(adopted.baseline()).isTrue();
        assertThat(Files.readString(workDir.resolve("prompts/system.md"))).isEqualTo("content of treatment");
        assertThat(variants.getBaseline("prompts/system.md")).map(Variant::variantId).contains(treatment.variantId());
        assertThat(variants.hasActiveVariant("prompts/system.md")).isFalse();
    }

    @Test
    void shouldRejectControlThatIsAlsoTreatment() throws Exception {
        Variant control = variant("control");

        assertThatThrownBy(() -> service.createExperiment(request(control, List.of(control.variantId()))))
            .isInstanceOf(IllegalArgumentException.class);
    }

    private Variant variant(String name) throws Exception {
        return variants.createVariant(
            CreateVariantRequest.of(VariantType.PROMPT, "prompts/system.md", name, "content of " + name)
        );
    }

    private static CreateExperimentRequest request(Variant control, List<String> treatments) {
        return new CreateExperimentRequest(
            "brevity",
            "shorter system prompt",
            "fewer turns to book",
            VariantType.PROMPT,
            control.variantId(),
            treatments,
            List.of("T1"),
            null,
            null,
            null
        );
    }

    private static RunMetrics metrics(boolean passed) {
        return new RunMetrics(passed, 5, 2000, passed ? 1.0 : 0.0, 0, false, passed ? 2 : 0, 2, 0);
    }

    private static final class FixedRandom extends Random {
        private double next = 0.0;

        @Override
        public double nextDouble() {
            return next;
        }
    }
}
