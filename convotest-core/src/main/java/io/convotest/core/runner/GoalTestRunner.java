package io.convotest.core.runner;

import io.convotest.core.agent.AgentClient;
import io.convotest.core.agent.AgentClientException;
import io.convotest.core.agent.AgentClientFactory;
import io.convotest.core.agent.AgentReply;
import io.convotest.core.agent.ToolCall;
import io.convotest.core.classify.Classification;
import io.convotest.core.classify.DataField;
import io.convotest.core.classify.ResponseClassifier;
import io.convotest.core.classify.ResponseContext;
import io.convotest.core.config.model.RunnerSettings;
import io.convotest.core.conversation.ConversationTurn;
import io.convotest.core.conversation.TurnRole;
import io.convotest.core.experiment.ExperimentService;
import io.convotest.core.experiment.RunMetrics;
import io.convotest.core.experiment.VariantSelection;
import io.convotest.core.experiment.VariantService;
import io.convotest.core.extract.ExtractedField;
import io.convotest.core.extract.VolunteeredDataExtractor;
import io.convotest.core.observability.EventTypes;
import io.convotest.core.observability.ObservabilityService;
import io.convotest.core.persona.Persona;
import io.convotest.core.persona.PersonaResolver;
import io.convotest.core.persona.PersonaTemplate;
import io.convotest.core.persona.ResolvedPersona;
import io.convotest.core.progress.GoalEvaluator;
import io.convotest.core.progress.GoalTestResult;
import io.convotest.core.progress.ProgressTracker;
import io.convotest.core.storage.ResultRepository;
import io.convotest.core.testcase.GoalTestCase;
import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drives goal-oriented conversations against the agent under test.
 *
 * <p>Each execution gets its own agent session, progress tracker and transcript. The loop classifies
 * the agent's latest message, answers it from the persona and stops when the goals are complete, a
 * goal has failed, the agent reaches a terminal state or the turn limit is hit. Callers always get a
 * {@link GoalTestResult}; errors inside a conversation end up in the result, not as exceptions.
 *
 * <p>Under an experiment the selected variant is applied before the conversation and rolled back
 * after it, with apply, run and rollback serialized per target file.
 */
public final class GoalTestRunner {
    private static final Logger LOG = LoggerFactory.getLogger(GoalTestRunner.class);

    private final AgentClientFactory agents;
    private final ResponseClassifier classifier;
    private final ResultRepository results;
    private final PersonaResolver personaResolver;
    private final VolunteeredDataExtractor extractor;
    private final GoalEvaluator evaluator;
    private final RunnerSettings settings;
    private final Clock clock;
    private final ObservabilityService observability;
    private final ExperimentService experiments;
    private final VariantService variants;
    private final ResultRecords records = new ResultRecords();

    private GoalTestRunner(Builder builder) {
        this.agents = builder.agents;
        this.classifier = builder.classifier;
        this.results = builder.results;
        this.clock = builder.clock;
        this.personaResolver = builder.personaResolver == null ? new PersonaResolver(clock) : builder.personaResolver;
        this.extractor = builder.extractor == null ? VolunteeredDataExtractor.fromClasspath() : builder.extractor;
        this.evaluator = builder.evaluator;
        this.settings = builder.settings;
        this.observability = builder.observability;
        this.experiments = builder.experiments;
        this.variants = builder.variants;
        LOG.info("Goal test runner using {} classifier", classifier.name());
    }

    public static Builder builder(AgentClientFactory agents, ResponseClassifier classifier, ResultRepository results) {
        return new Builder(agents, classifier, results);
    }

    public String classifierName() {
        return classifier.name();
    }

    public GoalTestResult runTest(GoalTestCase testCase, String runId) {
        return runTest(testCase, runId, null);
    }

    public GoalTestResult runTest(GoalTestCase testCase, String runId, String testIdOverride) {
        Objects.requireNonNull(testCase, "testCase must not be null");
        Objects.requireNonNull(runId, "runId must not be null");
        String testId = testIdOverride == null || testIdOverride.isBlank() ? testCase.id() : testIdOverride;
        return execute(testCase, runId, testId);
    }

    public GoalTestResult runTest(
        GoalTestCase testCase,
        String runId,
        String testIdOverride,
        ExperimentContext experiment
    ) throws IOException {
        if (experiment == null) {
            return runTest(testCase, runId, testIdOverride);
        }
        return runTestWithExperiment(testCase, runId, testIdOverride, experiment);
    }

    public GoalTestResult runTestWithExperiment(
        GoalTestCase testCase,
        String runId,
        String testIdOverride,
        ExperimentContext experiment
    ) throws IOException {
        Objects.requireNonNull(testCase, "testCase must not be null");
        Objects.requireNonNull(experiment, "experiment must not be null");
        if (experiments == null || variants == null) {
            throw new IllegalStateException("Experiment services are not configured on this runner");
        }
        String testId = testIdOverride == null || testIdOverride.isBlank() ? testCase.id() : testIdOverride;
        String experimentId = experiment.experimentId();

        VariantSelection selection = experiments.selectVariant(experimentId, testId);
        LOG.info("Selected variant {} ({}) for {}", selection.variantId(), selection.role().key(), testId);

        ReentrantLock lock = variants.lockFor(selection.targetFile());
        lock.lock();
        try {
            variants.applyVariant(selection.variantId());
            long started = clock.millis();
            GoalTestResult result;
            boolean errorOccurred = false;
            try {
                result = execute(testCase, runId, testId);
            } catch (RuntimeException e) {
                errorOccurred = true;
                LOG.error("Test {} failed under experiment {}: {}", testId, experimentId, e.getMessage(), e);
                result = evaluator.failedExecution(testCase, e.getMessage(), clock.millis() - started, clock.instant());
            } finally {
                rollback(selection.targetFile());
            }
            recordRun(experimentId, runId, testId, selection, result, errorOccurred || result.error() != null);
            return result;
        } finally {
            lock.unlock();
        }
    }

    public List<GoalTestResult> runTests(List<GoalTestCase> testCases, String runId) {
        return runAll(testCases, testCase -> () -> {
            GoalTestResult result = runTest(testCase, runId);
            LOG.info("{}: {} - {}", testCase.id(), result.passed() ? "PASSED" : "FAILED", result.summary());
            return result;
        });
    }

    public List<GoalTestResult> runTestsWithExperiment(List<GoalTestCase> testCases, String runId, String experimentId) {
        ExperimentContext experiment = new ExperimentContext(experimentId);
        return runAll(testCases, testCase -> () -> {
            long started = clock.millis();
            try {
                GoalTestResult result = runTestWithExperiment(testCase, runId, null, experiment);
                LOG.info("{}: {} - {}", testCase.id(), result.passed() ? "PASSED" : "FAILED", result.summary());
                return result;
            } catch (IOException | RuntimeException e) {
                LOG.error("Experiment setup failed for {}: {}", testCase.id(), e.getMessage(), e);
                return evaluator.failedExecution(testCase, e.getMessage(), clock.millis() - started, clock.instant());
            }
        });
    }

    private List<GoalTestResult> runAll(
        List<GoalTestCase> testCases,
        Function<GoalTestCase, Callable<GoalTestResult>> task
    ) {
        Objects.requireNonNull(testCases, "testCases must not be null");
        if (testCases.isEmpty()) {
            return List.of();
        }
        int workers = Math.max(1, Math.min(settings.concurrency(), testCases.size()));
        ExecutorService pool = Executors.newFixedThreadPool(workers);
        try {
            List<Future<GoalTestResult>> futures = new ArrayList<>();
            for (GoalTestCase testCase : testCases) {
                futures.add(pool.submit(task.apply(testCase)));
            }
            List<GoalTestResult> collected = new ArrayList<>();
            for (int i = 0; i < testCases.size(); i++) {
                collected.add(await(testCases.get(i), futures.get(i)));
            }
            return collected;
        } finally {
            pool.shutdownNow();
        }
    }

    private GoalTestResult await(GoalTestCase testCase, Future<GoalTestResult> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return evaluator.failedExecution(testCase, "Interrupted while waiting for test", 0, clock.instant());
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            LOG.error("Test {} crashed: {}", testCase.id(), cause.getMessage(), cause);
            return evaluator.failedExecution(testCase, String.valueOf(cause.getMessage()), 0, clock.instant());
        }
    }

    private GoalTestResult execute(GoalTestCase testCase, String runId, String testId) {
        long started = clock.millis();
        List<ConversationTurn> transcript = new ArrayList<>();
        ResolvedPersona resolved = null;
        ProgressTracker tracker = null;
        GoalTestResult result;
        record(EventTypes.TEST_STARTED, Map.of("run_id", runId, "test_id", testId));

        try {
            PersonaTemplate template = testCase.persona();
            Persona persona;
            if (template.hasDynamicFields()) {
                resolved = personaResolver.resolve(template);
                persona = resolved.persona();
                LOG.info(
                    "Resolved {} dynamic fields for {} (seed: {})",
                    resolved.metadata().dynamicFields().size(),
                    testId,
                    resolved.metadata().seed()
                );
            } else {
                persona = template.base();
            }
            tracker = new ProgressTracker(testCase.goals(), clock);

            AgentClient agent = agents.create();
            agent.newSession();
            String initialMessage = testCase.initialMessage().render(persona);
            AgentReply initialReply = send(agent, initialMessage, transcript, "initial", runId, testId);
            if (initialReply == null) {
                result = evaluator.failedExecution(
                    testCase,
                    "Failed to get initial response from agent",
                    clock.millis() - started,
                    clock.instant()
                );
            } else {
                converse(testCase, persona, agent, tracker, transcript, initialMessage, runId, testId);
                result = evaluator.evaluateTest(testCase, tracker.getState(), List.copyOf(transcript), clock.millis() - started);
            }
        } catch (IOException | RuntimeException e) {
            LOG.error("Test {} execution error: {}", testId, e.getMessage(), e);
            String message = String.valueOf(e.getMessage());
            long duration = clock.millis() - started;
            result = tracker == null
                ? evaluator.failedExecution(testCase, message, duration, clock.instant())
                : evaluator.evaluateTest(testCase, tracker.getState(), List.copyOf(transcript), duration).withError(message);
        }

        persist(runId, testId, testCase, result, transcript, resolved);
        if (result.error() != null) {
            record(EventTypes.TEST_FAILED, Map.of("run_id", runId, "test_id", testId, "error", result.error()));
        } else {
            record(EventTypes.TEST_COMPLETED, Map.of(
                "run_id", runId,
                "test_id", testId,
                "passed", result.passed(),
                "duration_ms", result.durationMs()
            ));
        }
        return result;
    }

    private void converse(
        GoalTestCase testCase,
        Persona persona,
        AgentClient agent,
        ProgressTracker tracker,
        List<ConversationTurn> transcript,
        String initialMessage,
        String runId,
        String testId
    ) throws IOException {
        int turn = 1;
        int childIndex = 0;
        Set<DataField> providedFields = EnumSet.noneOf(DataField.class);
        markVolunteered(tracker, initialMessage, turn);

        while (!shouldStop(tracker, turn, testCase)) {
            ConversationTurn lastAgentTurn = lastAgentTurn(transcript);
            if (lastAgentTurn == null) {
                break;
            }

            Classification classification = classifier.classify(
                lastAgentTurn.content(),
                List.copyOf(transcript),
                persona,
                tracker.getPendingFields()
            );
            if (classifier.isTerminal(classification)) {
                LOG.info("Terminal state {} for {} at turn {}", classification.terminalState().key(), testId, turn);
                tracker.updateProgress(classifier.toLegacyIntent(classification), "", turn);
                break;
            }

            int nextChild = NextChildDetector.advance(lastAgentTurn.content(), childIndex, persona.inventory().children().size());
            if (nextChild != childIndex) {
                childIndex = nextChild;
                LOG.info("Advanced to child {} for {}", childIndex + 1, testId);
            }

            ResponseContext context = new ResponseContext(
                testCase.id(),
                childIndex,
                providedFields,
                transcript,
                turn,
                tracker.getState().bookingConfirmed()
            );
            String reply = classifier.generateResponse(classification, persona, context);
            providedFields.addAll(classification.dataFields());

            tracker.updateProgress(classifier.toLegacyIntent(classification), reply, turn);
            markVolunteered(tracker, reply, turn);

            if (tracker.shouldAbort()) {
                LOG.warn("Critical issue detected for {}, aborting at turn {}", testId, turn);
                break;
            }

            turn++;
            AgentReply agentReply = send(agent, reply, transcript, "turn-" + turn, runId, testId);
            if (agentReply == null && !settings.continueOnError()) {
                throw new IOException("Failed to get response at turn " + turn);
            }

            if (settings.saveProgressSnapshots()) {
                saveSnapshot(runId, testId, turn, tracker);
            }
            if (!pause()) {
                break;
            }
        }
    }

    boolean shouldStop(ProgressTracker tracker, int turn, GoalTestCase testCase) {
        if (tracker.areGoalsComplete()) {
            LOG.debug("All required goals complete");
            return true;
        }
        if (tracker.hasFailedGoals()) {
            LOG.debug("Goals failed, stopping");
            return true;
        }
        int maxTurns = effectiveMaxTurns(testCase);
        if (turn >= maxTurns) {
            LOG.info("Max turns ({}) reached for {}", maxTurns, testCase.id());
            return true;
        }
        return false;
    }

    int effectiveMaxTurns(GoalTestCase testCase) {
        return Math.max(testCase.responseConfig().maxTurns(), settings.maxTurns());
    }

    private AgentReply send(
        AgentClient agent,
        String message,
        List<ConversationTurn> transcript,
        String stepId,
        String runId,
        String testId
    ) {
        transcript.add(ConversationTurn.user(message, clock.instant(), stepId));
        try {
            AgentReply reply = agent.sendMessage(message);
            transcript.add(ConversationTurn.assistant(reply.text(), clock.instant(), reply.responseTimeMs(), stepId));
            for (ToolCall call : reply.toolCalls()) {
                saveApiCall(runId, testId, stepId, call);
            }
            return reply;
        } catch (AgentClientException e) {
            transcript.add(ConversationTurn.error(String.valueOf(e.getMessage()), clock.instant(), stepId));
            LOG.warn("Message send failed for {} at {}: {}", testId, stepId, e.getMessage());
            return null;
        }
    }

    private void markVolunteered(ProgressTracker tracker, String message, int turn) {
        for (ExtractedField extracted : extractor.extract(message)) {
            tracker.markFieldCollected(extracted.field(), extracted.value(), turn);
            LOG.debug("Extracted volunteered {}: {}", extracted.field().key(), extracted.value());
        }
    }

    private boolean pause() {
        if (settings.delayBetweenTurnsMs() <= 0) {
            return true;
        }
        try {
            Thread.sleep(settings.delayBetweenTurnsMs());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted between turns, ending conversation");
            return false;
        }
    }

    private void saveSnapshot(String runId, String testId, int turn, ProgressTracker tracker) {
        try {
            results.saveGoalProgressSnapshot(records.snapshot(runId, testId, turn, tracker.getState(), clock.instant()));
        } catch (IOException e) {
            LOG.warn("Failed to save progress snapshot for {} turn {}: {}", testId, turn, e.getMessage());
        }
    }

    private void saveApiCall(String runId, String testId, String stepId, ToolCall call) {
        try {
            results.saveApiCall(records.apiCall(runId, testId, stepId, call, clock.instant()));
        } catch (IOException e) {
            LOG.warn("Failed to save api call {} for {}: {}", call.toolName(), testId, e.getMessage());
        }
    }

    private void persist(
        String runId,
        String testId,
        GoalTestCase testCase,
        GoalTestResult result,
        List<ConversationTurn> transcript,
        ResolvedPersona resolved
    ) {
        try {
            Instant completedAt = clock.instant();
            results.saveTestResult(records.testResult(runId, testId, testCase, result, completedAt));
            if (!transcript.isEmpty()) {
                results.saveTranscript(records.transcript(runId, testId, transcript));
            }
            results.saveFindings(records.findings(runId, testId, result));
            results.saveGoalTestResult(records.goalTestResult(runId, testId, result, resolved, completedAt));
        } catch (IOException e) {
            LOG.error("Failed to save result for {}: {}", testId, e.getMessage(), e);
        }
    }

    private void rollback(String targetFile) {
        try {
            variants.rollback(targetFile);
            LOG.info("Rolled back variant from {}", targetFile);
        } catch (IOException e) {
            LOG.error("Failed to roll back variant on {}, file left dirty: {}", targetFile, e.getMessage(), e);
        }
    }

    private void recordRun(
        String experimentId,
        String runId,
        String testId,
        VariantSelection selection,
        GoalTestResult result,
        boolean errorOccurred
    ) {
        RunMetrics metrics = new RunMetrics(
            result.passed(),
            result.turnCount(),
            result.durationMs(),
            result.goalCompletionRate(),
            result.constraintViolations().size(),
            errorOccurred,
            (int) result.goalsPassed(),
            result.goalResults().size(),
            result.issues().size()
        );
        try {
            experiments.recordTestResult(experimentId, runId, testId, selection, metrics);
        } catch (IOException | RuntimeException e) {
            LOG.error("Failed to record experiment run for {} in {}: {}", testId, experimentId, e.getMessage(), e);
        }
    }

    private void record(String type, Map<String, Object> attributes) {
        if (observability != null) {
            observability.recordSafely(type, attributes);
        }
    }

    private static ConversationTurn lastAgentTurn(List<ConversationTurn> transcript) {
        for (int i = transcript.size() - 1; i >= 0; i--) {
            if (transcript.get(i).role() == TurnRole.ASSISTANT) {
                return transcript.get(i);
            }
        }
        return null;
    }

    public static final class Builder {
        private final AgentClientFactory agents;
        private final ResponseClassifier classifier;
        private final ResultRepository results;
        private PersonaResolver personaResolver;
        private VolunteeredDataExtractor extractor;
        private GoalEvaluator evaluator = new GoalEvaluator();
        private RunnerSettings settings = RunnerSettings.defaults();
        private Clock clock = Clock.systemUTC();
        private ObservabilityService observability;
        private ExperimentService experiments;
        private VariantService variants;

        private Builder(AgentClientFactory agents, ResponseClassifier classifier, ResultRepository results) {
            this.agents = Objects.requireNonNull(agents, "agents must not be null");
            this.classifier = Objects.requireNonNull(classifier, "classifier must not be null");
            this.results = Objects.requireNonNull(results, "results must not be null");
        }

        public Builder personaResolver(PersonaResolver value) {
            this.personaResolver = value;
            return this;
        }

        public Builder extractor(VolunteeredDataExtractor value) {
            this.extractor = value;
            return this;
        }

        public Builder evaluator(GoalEvaluator value) {
            this.evaluator = Objects.requireNonNull(value, "evaluator must not be null");
            return this;
        }

        public Builder settings(RunnerSettings value) {
            this.settings = Objects.requireNonNull(value, "settings must not be null");
            return this;
        }

        public Builder clock(Clock value) {
            this.clock = Objects.requireNonNull(value, "clock must not be null");
            return this;
        }

        public Builder observability(ObservabilityService value) {
            this.observability = value;
            return this;
        }

        public Builder experiments(ExperimentService experimentService, VariantService variantService) {
            this.experiments = Objects.requireNonNull(experimentService, "experimentService must not be null");
            this.variants = Objects.requireNonNull(variantService, "variantService must not be null");
            return this;
        }

        public GoalTestRunner build() {
            return new GoalTestRunner(this);
        }
    }
}
