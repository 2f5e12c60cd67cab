package io.convotest.cli;

import static org.assertj.core.api.Assertions.assertThat;

import io.convotest.core.agent.HttpAgentClient;
import io.convotest.core.config.ConfigService;
import io.convotest.core.provider.ProviderRegistry;
import io.convotest.core.runtime.ConvotestRuntime;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import okhttp3.mockwebserver.Dispatcher;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class RunCommandIntegrationTest {
    private static final String BOOKED = "{\"text\": \"Your appointment has been scheduled for Tuesday at 3pm.\"}";

    private MockWebServer server;
    private Path configPath;
    private Path suitePath;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();

        configPath = tempDir.resolve("config.json");
        Files.writeString(configPath, """
            {
              "runner": { "maxTurns": 5, "delayBetweenTurnsMs": 0 },
              "agent": { "endpoint": "%s", "maxRetries": 1, "retryDelayMs": 0 },
              "storage": { "workspace": "%s" }
            }
            """.formatted(
                server.url("/api/v1/prediction/agent").toString(),
                tempDir.resolve("workspace").toString().replace("\\", "\\\\")
            ), StandardCharsets.UTF_8);

        suitePath = tempDir.resolve("suite.json");
        Files.writeString(suitePath, """
            {
              "name": "cli-suite",
              "tests": [
                {
                  "id": "GOAL-CLI-001",
                  "persona": {
                    "name": "Mike Chen",
                    "inventory": { "parentFirstName": "Mike", "parentLastName": "Chen", "parentPhone": "555-301-2299" }
                  },
                  "goals": [ { "id": "booking", "type": "booking_confirmed" } ]
                }
              ]
            }
            """, StandardCharsets.UTF_8);
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    void shouldRunSuiteAndListStoredResults() throws Exception {
        server.setDispatcher(always(new MockResponse().setHeader("Content-Type", "application/json").setBody(BOOKED)));

        Execution run = execute("run", "--suite", suitePath.toString(), "--run-id", "RUN-CLI");
        Execution runs = execute("results");
        Execution tests = execute("results", "--run-id", "RUN-CLI");
        Execution status = execute("--config", configPath.toString(), "status");

        assertThat(run.code()).isEqualTo(0);
        assertThat(run.out()).contains("Run RUN-CLI: 1 tests, category classifier");
        assertThat(run.out()).contains("PASS GOAL-CLI-001");
        assertThat(run.out()).contains("Passed 1/1");
        assertThat(runs.out()).contains("RUN-CLI  passed");
        assertThat(runs.out()).contains("cli-suite");
        assertThat(tests.out()).contains("PASSED GOAL-CLI-001");
        assertThat(tests.out()).contains("1 started, pass rate 100.0%");
        assertThat(status.code()).isEqualTo(0);
        assertThat(status.out()).contains("Tests passed: 1");

        RecordedRequest first = server.takeRequest();
        assertThat(first.getBody().readUtf8()).contains("\"question\":\"Hi\"");
    }

    @Test
    void shouldExitWithTwoWhenTestsFail() throws Exception {
        server.setDispatcher(always(new MockResponse().setResponseCode(500).setBody("{\"message\":\"down\"}")));

        Execution run = execute("run", "--suite", suitePath.toString(), "--run-id", "RUN-FAIL", "--legacy");
        Execution tests = execute("results", "--run-id", "RUN-FAIL");

        assertThat(run.code()).isEqualTo(2);
        assertThat(run.out()).contains("legacy classifier");
        assertThat(run.out()).contains("FAIL GOAL-CLI-001");
        assertThat(run.out()).contains("=== FAILURE REPORT ===");
        assertThat(tests.out()).contains("FAILED GOAL-CLI-001");
        assertThat(tests.out()).contains("error: Failed to get initial response from agent");
    }

    @Test
    void shouldInitializeWorkspaceStorage() {
        Execution init = execute("init");

        Path workspace = tempDir.resolve("workspace").toAbsolutePath().normalize();
        assertThat(init.code()).isEqualTo(0);
        assertThat(init.out()).contains("Config merged with defaults: " + configPath);
        assertThat(init.out()).contains("Results database: " + workspace.resolve("results.db") + " (0 runs)");
        assertThat(init.out()).contains("(0 variants, 0 experiments)");
        assertThat(init.out()).contains("Audit log: " + workspace.resolve("audit-events.jsonl") + " (empty)");
        assertThat(init.out()).contains("Classifier: category");
        assertThat(init.out()).contains("Agent under test: " + server.url("/api/v1/prediction/agent"));
        assertThat(workspace.resolve("results.db")).exists();
        assertThat(workspace.resolve("experiments.db")).exists();
    }

    @Test
    void shouldReturnOneForMissingSuite() {
        Execution run = execute("run", "--suite", tempDir.resolve("missing.json").toString());

        assertThat(run.code()).isEqualTo(1);
    }

    @Test
    void shouldRunExperimentAndRestoreTargetFile() throws Exception {
        server.setDispatcher(always(new MockResponse().setHeader("Content-Type", "application/json").setBody(BOOKED)));
        Path prompt = tempDir.resolve("prompt.txt");
        Files.writeString(prompt, "You are a friendly booking assistant.", StandardCharsets.UTF_8);
        Path treatmentContent = tempDir.resolve("treatment.txt");
        Files.writeString(treatmentContent, "You are a concise booking assistant.", StandardCharsets.UTF_8);

        Execution capture = execute("variant", "capture", "--file", "prompt.txt");
        String baselineId = firstGroup("Captured baseline (\\S+) for", capture.out());
        Execution create = execute(
            "variant", "create", "--file", "prompt.txt", "--name", "concise", "--content-file", treatmentContent.toString()
        );
        String treatmentId = firstGroup("Variant (\\S+) \\(", create.out());
        Execution list = execute("variant", "list", "--file", "prompt.txt");

        Execution experiment = execute(
            "experiment", "create", "--name", "tone", "--control", baselineId, "--treatment", treatmentId,
            "--test", "GOAL-CLI-001", "--min-samples", "1"
        );
        String experimentId = firstGroup("Created experiment (\\S+)", experiment.out());
        Execution start = execute("experiment", "start", experimentId);
        Execution run = execute("run", "--suite", suitePath.toString(), "--run-id", "RUN-EXP", "--experiment", experimentId);
        Execution summary = execute("experiment", "summary", experimentId);

        assertThat(capture.code()).isEqualTo(0);
        assertThat(create.code()).isEqualTo(0);
        assertThat(list.out()).contains("[baseline]").contains("concise");
        assertThat(start.out()).contains("is running");
        assertThat(run.code()).isEqualTo(0);
        assertThat(summary.code()).isEqualTo(0);
        assertThat(summary.out()).containsPattern("Samples: control [01], treatment [01] \\(min 1\\)");
        assertThat(Files.readString(prompt, StandardCharsets.UTF_8)).isEqualTo("You are a friendly booking assistant.");

        Execution rollback = execute("variant", "rollback", "--file", "prompt.txt");
        assertThat(rollback.out()).contains("from baseline " + baselineId);
    }

    private Execution execute(String... args) {
        CliContext context = new CliContext(new ConfigService(), configPath, (config, forceLegacy) -> ConvotestRuntime.open(
            config,
            new ProviderRegistry(),
            () -> new HttpAgentClient(config.agent(), Duration.ofSeconds(5), Clock.systemUTC()),
            tempDir,
            forceLegacy
        ));
        PrintStream originalOut = System.out;
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        int code;
        try {
            System.setOut(new PrintStream(out, true, StandardCharsets.UTF_8));
            code = ConvotestCliCommand.commandLine(context).execute(args);
        } finally {
            System.setOut(originalOut);
        }
        return new Execution(code, out.toString(StandardCharsets.UTF_8));
    }

    private static String firstGroup(String regex, String text) {
        Matcher matcher = Pattern.compile(regex).matcher(text);
        assertThat(matcher.find()).as("output matching %s in:%n%s", regex, text).isTrue();
        return matcher.group(1);
    }

    private static Dispatcher always(MockResponse response) {
        return new Dispatcher() {
            @Override
            public MockResponse dispatch(RecordedRequest request) {
                return response;
            }
        };
    }

    private record Execution(int code, String out) {
    }
}
