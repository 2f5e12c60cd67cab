package io.convotest.cli;

import io.convotest.core.progress.GoalEvaluator;
import io.convotest.core.progress.GoalTestResult;
import io.convotest.core.runner.GoalTestRunner;
import io.convotest.core.runtime.ConvotestRuntime;
import io.convotest.core.testcase.GoalTestCase;
import io.convotest.core.testcase.JsonTestSuiteLoader;
import io.convotest.core.testcase.TestSuite;
import java.nio.file.Path;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Runs a suite and prints one line per test. Exit code 2 means the run completed with failing tests.
 */
@Command(name = "run", description = "Run goal-oriented tests from a suite file")
public final class RunCommand implements Callable<Integer> {
    private static final DateTimeFormatter RUN_ID = DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss").withZone(ZoneOffset.UTC);

    private final CliContext context;

    @Option(names = "--suite", required = true, description = "Suite JSON file")
    Path suite;

    @Option(names = "--run-id", description = "Run id (default: run-<timestamp>)")
    String runId;

    @Option(names = "--test", description = "Only run this test id, repeatable")
    List<String> tests = new ArrayList<>();

    @Option(names = "--legacy", description = "Use the legacy intent classifier")
    boolean legacy;

    @Option(names = "--experiment", description = "Run every test as a sample of this experiment")
    String experimentId;

    public RunCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try (ConvotestRuntime runtime = context.openRuntime(legacy)) {
            TestSuite loaded = new JsonTestSuiteLoader().load(suite);
            List<GoalTestCase> selected = loaded.select(tests).tests();
            if (selected.isEmpty()) {
                throw new IllegalArgumentException("No tests selected from " + suite);
            }
            Instant startedAt = Instant.now();
            String id = runId == null || runId.isBlank() ? "run-" + RUN_ID.format(startedAt) : runId;
            runtime.resultStore().createRun(id, loaded.name(), startedAt);

            GoalTestRunner runner = runtime.runner();
            System.out.println("Run " + id + ": " + selected.size() + " tests, " + runner.classifierName() + " classifier");
            List<GoalTestResult> results = experimentId == null
                ? runner.runTests(selected, id)
                : runner.runTestsWithExperiment(selected, id, experimentId);
            runtime.batchWriter().flush();

            GoalEvaluator evaluator = new GoalEvaluator();
            int passed = 0;
            for (int i = 0; i < results.size(); i++) {
                GoalTestResult result = results.get(i);
                GoalTestCase testCase = selected.get(i);
                if (result.passed()) {
                    passed++;
                }
                System.out.println((result.passed() ? "PASS " : "FAIL ") + testCase.id()
                    + " (" + result.turnCount() + " turns, " + result.durationMs() + " ms) " + result.summary());
                if (!result.passed()) {
                    System.out.println(evaluator.failureReport(result));
                }
            }
            boolean allPassed = passed == results.size();
            runtime.resultStore().completeRun(id, allPassed ? "passed" : "failed", Instant.now());
            System.out.println("Passed " + passed + "/" + results.size());
            return allPassed ? 0 : 2;
        } catch (Exception e) {
            System.err.println("Run command failed: " + e.getMessage());
            return 1;
        }
    }
}
