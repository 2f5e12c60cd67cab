package io.convotest.cli;

import io.convotest.core.observability.RunSummary;
import io.convotest.core.runtime.ConvotestRuntime;
import io.convotest.core.storage.SqliteResultStore;
import io.convotest.core.storage.SqliteResultStore.TestRunRecord;
import io.convotest.core.storage.WriteOperation.FindingWrite;
import io.convotest.core.storage.WriteOperation.TestResultWrite;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "results", description = "List recent runs, or the tests and findings of one run")
public final class ResultsCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = "--run-id", description = "Show the tests of this run")
    String runId;

    @Option(names = "--limit", description = "Number of runs to list", defaultValue = "10")
    int limit;

    public ResultsCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try (ConvotestRuntime runtime = context.openRuntime(false)) {
            SqliteResultStore store = runtime.resultStore();
            if (runId == null || runId.isBlank()) {
                List<TestRunRecord> runs = store.listRuns(limit);
                if (runs.isEmpty()) {
                    System.out.println("No runs recorded");
                }
                for (TestRunRecord run : runs) {
                    System.out.println(run.runId() + "  " + run.status() + "  " + run.startedAt() + "  " + run.name());
                }
                return 0;
            }
            List<TestResultWrite> results = store.listTestResults(runId);
            if (results.isEmpty()) {
                System.out.println("No results for run " + runId);
                return 0;
            }
            for (TestResultWrite result : results) {
                System.out.println(result.status().toUpperCase(Locale.ROOT) + " " + result.testId()
                    + " (" + result.durationMs() + " ms)"
                    + (result.errorMessage() == null ? "" : " error: " + result.errorMessage()));
            }
            RunSummary audit = runtime.observability().summary(runId);
            System.out.println(String.format(
                Locale.ROOT,
                "Audit: %d events, %d started, pass rate %.1f%%, p95 %.0f ms",
                audit.auditEvents(),
                audit.testsStarted(),
                audit.passRate(),
                audit.p95DurationMs()
            ));
            List<FindingWrite> findings = store.listFindings(runId);
            if (!findings.isEmpty()) {
                System.out.println("Findings:");
                for (FindingWrite finding : findings) {
                    System.out.println("  [" + finding.severity() + "] " + finding.testId() + " " + finding.title());
                }
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Results command failed: " + e.getMessage());
            return 1;
        }
    }
}
