package io.convotest.core.runner;

import static org.assertj.core.api.Assertions.assertThat;

import io.convotest.core.agent.AgentClient;
import io.convotest.core.agent.AgentClientException;
import io.convotest.core.agent.AgentReply;
import io.convotest.core.classify.AgentIntent;
import io.convotest.core.classify.Classification;
import io.convotest.core.classify.DataField;
import io.convotest.core.classify.IntentDetectionResult;
import io.convotest.core.classify.ResponseCategory;
import io.convotest.core.classify.ResponseClassifier;
import io.convotest.core.classify.ResponseContext;
import io.convotest.core.classify.TerminalState;
import io.convotest.core.config.model.RunnerSettings;
import io.convotest.core.conversation.ConversationTurn;
import io.convotest.core.experiment.CreateExperimentRequest;
import io.convotest.core.experiment.CreateVariantRequest;
import io.convotest.core.experiment.ExperimentRun;
import io.convotest.core.experiment.ExperimentService;
import io.convotest.core.experiment.SqliteExperimentStore;
import io.convotest.core.experiment.Variant;
import io.convotest.core.experiment.VariantService;
import io.convotest.core.experiment.VariantType;
import io.convotest.core.observability.AuditEvent;
import io.convotest.core.observability.EventTypes;
import io.convotest.core.observability.FileAuditStore;
import io.convotest.core.observability.ObservabilityService;
import io.convotest.core.persona.DataInventory;
import io.convotest.core.persona.Persona;
import io.convotest.core.progress.CollectableField;
import io.convotest.core.progress.ConversationGoal;
import io.convotest.core.progress.GoalResult;
import io.convotest.core.progress.GoalTestResult;
import io.convotest.core.progress.IssueType;
import io.convotest.core.storage.ResultRepository;
import io.convotest.core.storage.WriteOperation;
import io.convotest.core.storage.WriteOperation.ApiCallWrite;
import io.convotest.core.storage.WriteOperation.FindingWrite;
import io.convotest.core.storage.WriteOperation.GoalTestResultWrite;
import io.convotest.core.storage.WriteOperation.ProgressSnapshotWrite;
import io.convotest.core.storage.WriteOperation.TestResultWrite;
import io.convotest.core.storage.WriteOperation.TranscriptWrite;
import io.convotest.core.testcase.GoalTestCase;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class GoalTestRunnerTest {
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-05-10T08:00:00Z"), ZoneOffset.UTC);
    private static final String ASK_PHONE = "What is the best phone number to reach you?";
    private static final String CONFIRMED = "You're all set, see you Tuesday at 3pm.";
    private static final String ASK_TIME = "What time of day works best?";
    private static final String GOODBYE = "Thanks for calling, goodbye!";

    @TempDir
    Path tempDir;

    private ScriptedClassifier classifier;
    private RecordingRepository repository;
    private ObservabilityService observability;

    @BeforeEach
    void setUp() {
        classifier = new ScriptedClassifier();
        repository = new RecordingRepository();
        observability = new ObservabilityService(new FileAuditStore(tempDir.resolve("audit.jsonl")), CLOCK);
    }

    @Test
    void shouldCollectPhoneAndStopOnConfirmedBooking() throws Exception {
        ScriptedAgent agent = new ScriptedAgent(List.of(ASK_PHONE, CONFIRMED));
        GoalTestCase testCase = GoalTestCase.builder("T-PHONE", persona())
            .initialMessage("Hello, I need to book an appointment for my son")
            .goal(ConversationGoal.collect("collect-phone", "Agent collects a phone number", CollectableField.PARENT_PHONE))
            .goal(ConversationGoal.bookingConfirmed("confirm-booking"))
            .build();

        GoalTestResult result = runner(agent, settings(50, true)).runTest(testCase, "run-1");

        assertThat(result.error()).isNull();
        assertThat(result.passed()).isTrue();
        assertThat(result.turnCount()).isEqualTo(2);
        assertThat(result.goalResults()).extracting(GoalResult::passed).containsExactly(true, true);
        assertThat(result.progress().collectedFields().get(CollectableField.PARENT_PHONE).collectedAtTurn()).isEqualTo(1);
        assertThat(result.progress().collectedFields().get(CollectableField.PARENT_PHONE).value()).isEqualTo("555-000-1111");
        assertThat(agent.received).containsExactly("Hello, I need to book an appointment for my son", "555-000-1111");
        assertThat(repository.kinds()).containsExactly("test_result", "transcript", "goal_test_result");
        assertThat(observability.byType(EventTypes.TEST_COMPLETED)).hasSize(1);
    }

    @Test
    void shouldStopOnGoodbyeAndFailIncompleteGoals() {
        ScriptedAgent agent = new ScriptedAgent(List.of(GOODBYE));
        GoalTestCase testCase = GoalTestCase.builder("T-BYE", persona())
            .initialMessage("Hello there")
            .goal(ConversationGoal.collect("collect-phone", "Agent collects a phone number", CollectableField.PARENT_PHONE))
            .build();

        GoalTestResult result = runner(agent, settings(50, true)).runTest(testCase, "run-1");

        assertThat(agent.received).hasSize(1);
        assertThat(classifier.generatedAtTurns).isEmpty();
        assertThat(result.passed()).isFalse();
        assertThat(result.goalResults()).singleElement().satisfies(goal -> {
            assertThat(goal.passed()).isFalse();
            assertThat(goal.message()).isEqualTo("Missing 1 of 1 fields: parent_phone");
        });
        assertThat(result.progress().conversationEnded()).isTrue();
    }

    @Test
    void shouldAdvanceTurnsByOneUpToEffectiveMaximum() {
        ScriptedAgent agent = new ScriptedAgent(List.of(ASK_TIME, ASK_TIME, ASK_TIME, ASK_TIME, ASK_TIME));
        GoalTestCase testCase = GoalTestCase.builder("T-LIMIT", persona())
            .initialMessage("Hello there")
            .goal(ConversationGoal.bookingConfirmed("confirm-booking"))
            .maxTurns(2)
            .build();
        GoalTestRunner runner = runner(agent, settings(4, true));

        GoalTestResult result = runner.runTest(testCase, "run-1");

        assertThat(runner.effectiveMaxTurns(testCase)).isEqualTo(4);
        assertThat(classifier.generatedAtTurns).containsExactly(1, 2, 3);
        assertThat(agent.received).hasSize(4);
        assertThat(result.turnCount()).isEqualTo(3);
        assertThat(result.passed()).isFalse();
    }

    @Test
    void shouldSaveSnapshotPerTurnWhenEnabled() {
        ScriptedAgent agent = new ScriptedAgent(List.of(ASK_TIME, ASK_TIME, ASK_TIME));
        GoalTestCase testCase = GoalTestCase.builder("T-SNAP", persona())
            .goal(ConversationGoal.bookingConfirmed("confirm-booking"))
            .maxTurns(2)
            .build();
        RunnerSettings withSnapshots = new RunnerSettings(3, 0, 1000, true, true, true, 1);

        runner(agent, withSnapshots).runTest(testCase, "run-1");

        assertThat(repository.writes).filteredOn(w -> w instanceof ProgressSnapshotWrite)
            .extracting(w -> ((ProgressSnapshotWrite) w).turnNumber())
            .containsExactly(2, 3);
    }

    @Test
    void shouldReturnFailedResultWhenInitialMessageFails() throws Exception {
        ScriptedAgent agent = new ScriptedAgent(List.of(ASK_PHONE));
        agent.failAt = 0;
        GoalTestCase testCase = GoalTestCase.builder("T-DOWN", persona())
            .goal(ConversationGoal.collect("collect-phone", "phone", CollectableField.PARENT_PHONE))
            .goal(ConversationGoal.bookingConfirmed("confirm-booking"))
            .build();

        GoalTestResult result = runner(agent, settings(50, true)).runTest(testCase, "run-1");

        assertThat(result.passed()).isFalse();
        assertThat(result.error()).isEqualTo("Failed to get initial response from agent");
        assertThat(result.goalResults()).hasSize(2).noneMatch(GoalResult::passed);
        assertThat(repository.writes).filteredOn(w -> w instanceof TestResultWrite)
            .singleElement()
            .satisfies(w -> assertThat(((TestResultWrite) w).status()).isEqualTo("failed"));
        assertThat(observability.byType(EventTypes.TEST_FAILED)).hasSize(1);
        assertThat(observability.byType(EventTypes.TEST_COMPLETED)).isEmpty();
    }

    @Test
    void shouldEndWithErrorWhenLaterSendFailsAndContinueOnErrorIsOff() {
        ScriptedAgent agent = new ScriptedAgent(List.of(ASK_PHONE, CONFIRMED));
        agent.failAt = 1;
        GoalTestCase testCase = GoalTestCase.builder("T-FLAKY", persona())
            .goal(ConversationGoal.collect("collect-phone", "phone", CollectableField.PARENT_PHONE))
            .goal(ConversationGoal.bookingConfirmed("confirm-booking"))
            .build();

        GoalTestResult result = runner(agent, settings(50, false)).runTest(testCase, "run-1");

        assertThat(result.error()).isEqualTo("Failed to get response at turn 2");
        assertThat(result.passed()).isFalse();
        assertThat(result.progress().hasCollected(CollectableField.PARENT_PHONE)).isTrue();
        assertThat(result.transcript()).last().satisfies(turn -> assertThat(turn.isError()).isTrue());
    }

    @Test
    void shouldFailResultWhenSendFailsAfterGoalsAreComplete() throws Exception {
        ScriptedAgent agent = new ScriptedAgent(List.of(ASK_PHONE, CONFIRMED));
        agent.failAt = 1;
        GoalTestCase testCase = GoalTestCase.builder("T-LATE-ERROR", persona())
            .goal(ConversationGoal.collect("collect-phone", "phone", CollectableField.PARENT_PHONE))
            .constraints(List.of())
            .build();

        GoalTestResult result = runner(agent, settings(50, false)).runTest(testCase, "run-1");

        assertThat(result.goalResults()).singleElement().satisfies(goal -> assertThat(goal.passed()).isTrue());
        assertThat(result.error()).isEqualTo("Failed to get response at turn 2");
        assertThat(result.passed()).isFalse();
        assertThat(result.summary()).startsWith("TEST FAILED").endsWith("Error: Failed to get response at turn 2");
        assertThat(result.issues()).anySatisfy(issue -> {
            assertThat(issue.type()).isEqualTo(IssueType.ERROR);
            assertThat(issue.isCritical()).isTrue();
        });
        assertThat(repository.writes).filteredOn(w -> w instanceof TestResultWrite)
            .singleElement()
            .satisfies(w -> assertThat(((TestResultWrite) w).status()).isEqualTo("failed"));
        assertThat(observability.byType(EventTypes.TEST_FAILED)).hasSize(1);
    }

    @Test
    void shouldKeepGoingAfterFailedSendWhenContinueOnErrorIsOn() {
        ScriptedAgent agent = new ScriptedAgent(List.of(ASK_TIME, ASK_TIME, CONFIRMED));
        agent.failAt = 1;
        GoalTestCase testCase = GoalTestCase.builder("T-RETRY", persona())
            .goal(ConversationGoal.bookingConfirmed("confirm-booking"))
            .build();

        GoalTestResult result = runner(agent, settings(50, true)).runTest(testCase, "run-1");

        assertThat(result.error()).isNull();
        assertThat(result.progress().agentConfirmedBooking()).isTrue();
        assertThat(agent.received).hasSize(3);
        assertThat(result.transcript()).filteredOn(ConversationTurn::isError).hasSize(1);
    }

    @Test
    void shouldReturnResultsInInputOrderUnderConcurrency() {
        List<GoalTestCase> testCases = new ArrayList<>();
        for (int i = 1; i <= 4; i++) {
            GoalTestCase.Builder builder = GoalTestCase.builder("T" + i, persona()).initialMessage("test-" + i);
            for (int g = 0; g < i; g++) {
                builder.goal(ConversationGoal.bookingConfirmed("goal-" + g));
            }
            testCases.add(builder.build());
        }
        GoalTestRunner runner = GoalTestRunner.builder(() -> new ScriptedAgent(List.of(GOODBYE)).slowInitial(), classifier, repository)
            .settings(new RunnerSettings(10, 0, 1000, false, true, true, 3))
            .clock(CLOCK)
            .build();

        List<GoalTestResult> results = runner.runTests(testCases, "run-1");

        assertThat(results).extracting(r -> r.goalResults().size()).containsExactly(1, 2, 3, 4);
    }

    @Test
    void shouldRollBackOnceAndRecordErrorRunWhenConversationThrows() throws Exception {
        Path workDir = Files.createDirectories(tempDir.resolve("work"));
        Path prompt = workDir.resolve("prompts/system.md");
        Files.createDirectories(prompt.getParent());
        Files.writeString(prompt, "original prompt\n");
        SqliteExperimentStore store = new SqliteExperimentStore(tempDir.resolve("experiments.db"));
        VariantService variants = new VariantService(store, workDir, observability, CLOCK);
        ExperimentService experiments = new ExperimentService(store, variants, observability, new Random(7), CLOCK);
        Variant control = variants.captureBaseline("prompts/system.md", VariantType.PROMPT);
        Variant treatment = variants.createVariant(
            CreateVariantRequest.of(VariantType.PROMPT, "prompts/system.md", "terse", "terse prompt\n")
        );
        String experimentId = experiments.createExperiment(new CreateExperimentRequest(
            "terse", null, null, VariantType.PROMPT, control.variantId(), List.of(treatment.variantId()),
            List.of("T-BOOM"), null, null, null
        )).experimentId();
        experiments.startExperiment(experimentId);

        classifier.failOn = ASK_PHONE;
        ScriptedAgent agent = new ScriptedAgent(List.of(ASK_PHONE));
        GoalTestRunner runner = GoalTestRunner.builder(() -> agent, classifier, repository)
            .settings(settings(50, true))
            .clock(CLOCK)
            .observability(observability)
            .experiments(experiments, variants)
            .build();
        GoalTestCase testCase = GoalTestCase.builder("T-BOOM", persona())
            .goal(ConversationGoal.collect("collect-phone", "phone", CollectableField.PARENT_PHONE))
            .goal(ConversationGoal.bookingConfirmed("confirm-booking"))
            .build();

        GoalTestResult result = runner.runTestWithExperiment(testCase, "run-1", null, new ExperimentContext(experimentId));

        assertThat(result.error()).isEqualTo("classifier exploded");
        assertThat(result.goalResults()).noneMatch(GoalResult::passed);
        assertThat(Files.readString(prompt)).isEqualTo("original prompt\n");
        assertThat(variants.hasActiveVariant("prompts/system.md")).isFalse();
        assertThat(observability.byType(EventTypes.VARIANT_APPLIED)).hasSize(1);
        assertThat(observability.byType(EventTypes.VARIANT_ROLLED_BACK)).hasSize(1);

        List<ExperimentRun> runs = experiments.getRuns(experimentId);
        assertThat(runs).singleElement().satisfies(run -> {
            assertThat(run.testId()).isEqualTo("T-BOOM");
            assertThat(run.errorOccurred()).isTrue();
            assertThat(run.passed()).isFalse();
            assertThat(run.metrics().goalsCompleted()).isZero();
            assertThat(run.metrics().goalsTotal()).isEqualTo(2);
        });
    }

    @Test
    void shouldSerializeConcurrentExperimentRunsOnSharedTargetFile() throws Exception {
        Path workDir = Files.createDirectories(tempDir.resolve("shared"));
        Path prompt = workDir.resolve("prompt.md");
        Files.writeString(prompt, "friendly prompt\n");
        SqliteExperimentStore store = new SqliteExperimentStore(tempDir.resolve("experiments.db"));
        VariantService variants = new VariantService(store, workDir, observability, CLOCK);
        ExperimentService experiments = new ExperimentService(store, variants, observability, new Random(11), CLOCK);
        Variant control = variants.captureBaseline("prompt.md", VariantType.PROMPT);
        Variant treatment = variants.createVariant(
            CreateVariantRequest.of(VariantType.PROMPT, "prompt.md", "terse", "terse prompt\n")
        );
        String experimentId = experiments.createExperiment(new CreateExperimentRequest(
            "tone", null, null, VariantType.PROMPT, control.variantId(), List.of(treatment.variantId()),
            List.of("T-A", "T-B", "T-C"), null, null, null
        )).experimentId();
        experiments.startExperiment(experimentId);

        Map<String, List<String>> seen = new ConcurrentHashMap<>();
        GoalTestRunner runner = GoalTestRunner.builder(() -> new FileReadingAgent(prompt, seen), classifier, repository)
            .settings(new RunnerSettings(10, 0, 1000, false, true, true, 3))
            .clock(CLOCK)
            .observability(observability)
            .experiments(experiments, variants)
            .build();
        List<GoalTestCase> testCases = new ArrayList<>();
        for (String id : List.of("T-A", "T-B", "T-C")) {
            testCases.add(GoalTestCase.builder(id, persona())
                .initialMessage("hello from " + id)
                .goal(ConversationGoal.bookingConfirmed("confirm-booking"))
                .build());
        }

        List<GoalTestResult> results = runner.runTestsWithExperiment(testCases, "run-1", experimentId);

        assertThat(results).allSatisfy(result -> assertThat(result.error()).isNull());
        List<ExperimentRun> runs = experiments.getRuns(experimentId);
        assertThat(runs).hasSize(3);
        for (ExperimentRun run : runs) {
            String expected = variants.getVariantContent(run.variantId()).orElseThrow();
            assertThat(seen.get("hello from " + run.testId()))
                .as("prompt seen by %s", run.testId())
                .hasSize(3)
                .containsOnly(expected);
        }
        List<String> variantEvents = new FileAuditStore(tempDir.resolve("audit.jsonl")).load().stream()
            .filter(e -> e.isType(EventTypes.VARIANT_APPLIED) || e.isType(EventTypes.VARIANT_ROLLED_BACK))
            .map(AuditEvent::type)
            .toList();
        assertThat(variantEvents).containsExactly(
            EventTypes.VARIANT_APPLIED, EventTypes.VARIANT_ROLLED_BACK,
            EventTypes.VARIANT_APPLIED, EventTypes.VARIANT_ROLLED_BACK,
            EventTypes.VARIANT_APPLIED, EventTypes.VARIANT_ROLLED_BACK
        );
        assertThat(Files.readString(prompt)).isEqualTo("friendly prompt\n");
    }

    @Test
    void shouldReportExperimentSetupFailureAsFailedResult() throws Exception {
        SqliteExperimentStore store = new SqliteExperimentStore(tempDir.resolve("experiments.db"));
        VariantService variants = new VariantService(store, tempDir, observability, CLOCK);
        ExperimentService experiments = new ExperimentService(store, variants, observability, new Random(7), CLOCK);
        GoalTestRunner runner = GoalTestRunner.builder(() -> new ScriptedAgent(List.of(GOODBYE)), classifier, repository)
            .settings(settings(50, true))
            .clock(CLOCK)
            .experiments(experiments, variants)
            .build();
        GoalTestCase testCase = GoalTestCase.builder("T-NOEXP", persona())
            .goal(ConversationGoal.bookingConfirmed("confirm-booking"))
            .build();

        List<GoalTestResult> results = runner.runTestsWithExperiment(List.of(testCase), "run-1", "EXP-MISSING");

        assertThat(results).singleElement().satisfies(result -> {
            assertThat(result.passed()).isFalse();
            assertThat(result.error()).isEqualTo("Experiment EXP-MISSING not found");
        });
    }

    private GoalTestRunner runner(ScriptedAgent agent, RunnerSettings settings) {
        return GoalTestRunner.builder(() -> agent, classifier, repository)
            .settings(settings)
            .clock(CLOCK)
            .observability(observability)
            .build();
    }

    private static RunnerSettings settings(int maxTurns, boolean continueOnError) {
        return new RunnerSettings(maxTurns, 0, 1000, false, continueOnError, true, 1);
    }

    private static Persona persona() {
        DataInventory inventory = new DataInventory(
            "Dana", "Smith", "555-000-1111", "dana@example.com", List.of(),
            true, "Aetna", null, null, null, null, null, null, null
        );
        return new Persona("Dana Smith", "Parent booking a first visit", inventory, null);
    }

    private static final class ScriptedAgent implements AgentClient {
        private final List<String> replies;
        private final List<String> received = Collections.synchronizedList(new ArrayList<>());
        private final AtomicInteger calls = new AtomicInteger();
        private int failAt = -1;
        private boolean slowInitial;

        private ScriptedAgent(List<String> replies) {
            this.replies = replies;
        }

        private ScriptedAgent slowInitial() {
            this.slowInitial = true;
            return this;
        }

        @Override
        public String newSession() {
            return "session-1";
        }

        @Override
        public String sessionId() {
            return "session-1";
        }

        @Override
        public AgentReply sendMessage(String text) throws AgentClientException {
            received.add(text);
            int call = calls.getAndIncrement();
            if (slowInitial && call == 0 && text.startsWith("test-")) {
                pauseFor(text);
            }
            if (call == failAt) {
                throw new AgentClientException("Agent returned HTTP 502", 502);
            }
            String reply = replies.get(Math.min(call, replies.size() - 1));
            return new AgentReply(reply, "session-1", 12, List.of());
        }

        // Earlier tests answer later so completion order differs from input order.
        private static void pauseFor(String text) {
            int index = Integer.parseInt(text.substring("test-".length()));
            try {
                Thread.sleep((5 - index) * 30L);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    // Reads the live prompt on every send, keyed by the test's opening message.
    private static final class FileReadingAgent implements AgentClient {
        private final Path prompt;
        private final Map<String, List<String>> seen;
        private final AtomicInteger calls = new AtomicInteger();
        private String key;

        private FileReadingAgent(Path prompt, Map<String, List<String>> seen) {
            this.prompt = prompt;
            this.seen = seen;
        }

        @Override
        public String newSession() {
            return "session-file";
        }

        @Override
        public String sessionId() {
            return "session-file";
        }

        @Override
        public AgentReply sendMessage(String text) throws AgentClientException {
            if (key == null) {
                key = text;
            }
            try {
                seen.computeIfAbsent(key, k -> Collections.synchronizedList(new ArrayList<>()))
                    .add(Files.readString(prompt));
                Thread.sleep(15);
            } catch (IOException e) {
                throw new AgentClientException("prompt unreadable: " + e.getMessage(), 500);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new AgentClientException("interrupted", 500);
            }
            String reply = calls.getAndIncrement() < 2 ? ASK_TIME : CONFIRMED;
            return new AgentReply(reply, "session-file", 15, List.of());
        }
    }

    private static final class ScriptedClassifier implements ResponseClassifier {
        private final List<Integer> generatedAtTurns = Collections.synchronizedList(new ArrayList<>());
        private volatile String failOn;

        @Override
        public String name() {
            return "scripted";
        }

        @Override
        public Classification classify(String agentUtterance, List<ConversationTurn> history, Persona persona) {
            if (agentUtterance.equals(failOn)) {
                throw new IllegalStateException("classifier exploded");
            }
            if (agentUtterance.equals(ASK_PHONE)) {
                return classification(ResponseCategory.PROVIDE_DATA, AgentIntent.ASKING_PHONE, TerminalState.NONE, DataField.CALLER_PHONE);
            }
            if (agentUtterance.equals(CONFIRMED)) {
                return classification(ResponseCategory.ACKNOWLEDGE, AgentIntent.CONFIRMING_BOOKING, TerminalState.BOOKING_CONFIRMED, null);
            }
            if (agentUtterance.equals(GOODBYE)) {
                return classification(ResponseCategory.ACKNOWLEDGE, AgentIntent.SAYING_GOODBYE, TerminalState.CONVERSATION_ENDED, null);
            }
            return classification(ResponseCategory.EXPRESS_PREFERENCE, AgentIntent.ASKING_TIME_PREFERENCE, TerminalState.NONE, DataField.TIME_PREFERENCE);
        }

        @Override
        public boolean isTerminal(Classification classification) {
            return classification.terminalState() != TerminalState.NONE;
        }

        @Override
        public IntentDetectionResult toLegacyIntent(Classification classification) {
            return classification.legacyIntent();
        }

        @Override
        public String generateResponse(Classification classification, Persona persona, ResponseContext context) {
            generatedAtTurns.add(context.turnNumber());
            if (classification.dataFields().contains(DataField.CALLER_PHONE)) {
                return persona.inventory().parentPhone();
            }
            return "Mornings are best";
        }

        private static Classification classification(
            ResponseCategory category,
            AgentIntent intent,
            TerminalState terminal,
            DataField field
        ) {
            return Classification.builder(category, 0.9)
                .dataFields(field == null ? List.of() : List.of(field))
                .terminalState(terminal)
                .legacyIntent(new IntentDetectionResult(intent, 0.9, true, !terminal.equals(TerminalState.NONE), ""))
                .build();
        }
    }

    private static final class RecordingRepository implements ResultRepository {
        private final List<WriteOperation> writes = Collections.synchronizedList(new ArrayList<>());

        List<String> kinds() {
            synchronized (writes) {
                return writes.stream().map(WriteOperation::kind).distinct().toList();
            }
        }

        @Override
        public void saveTestResult(TestResultWrite result) {
            writes.add(result);
        }

        @Override
        public void saveTranscript(TranscriptWrite transcript) {
            writes.add(transcript);
        }

        @Override
        public void saveFindings(List<FindingWrite> findings) {
            writes.addAll(findings);
        }

        @Override
        public void saveApiCall(ApiCallWrite call) {
            writes.add(call);
        }

        @Override
        public void saveGoalTestResult(GoalTestResultWrite result) {
            writes.add(result);
        }

        @Override
        public void saveGoalProgressSnapshot(ProgressSnapshotWrite snapshot) {
            writes.add(snapshot);
        }
    }
}
