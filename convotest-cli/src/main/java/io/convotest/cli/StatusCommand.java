package io.convotest.cli;

import io.convotest.core.config.ConfigPaths;
import io.convotest.core.config.model.ConvotestConfig;
import io.convotest.core.observability.FileAuditStore;
import io.convotest.core.observability.ObservabilityService;
import io.convotest.core.observability.RunSummary;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Locale;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;

@Command(name = "status", description = "Show configuration and audit status")
public final class StatusCommand implements Callable<Integer> {
    private final CliContext context;

    public StatusCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            ConvotestConfig config = context.loadConfig();
            Path workspace = ConfigPaths.resolveWorkspace(config.storage().workspace());
            System.out.println("Config path: " + context.configPath());
            System.out.println("Config exists: " + Files.exists(context.configPath()));
            System.out.println("Workspace: " + workspace);
            System.out.println("Agent endpoint: " + config.agent().endpoint());
            System.out.println("Classifier: " + (config.runner().useCategoryBasedSystem() ? "category" : "legacy"));
            System.out.println("Max turns: " + config.runner().maxTurns());
            System.out.println("Concurrency: " + config.runner().concurrency());
            System.out.println("Batch writer: " + (config.batchWriter().enabled()
                ? "enabled (size " + config.batchWriter().batchSize() + ", every " + config.batchWriter().flushIntervalMs() + " ms)"
                : "disabled"));
            System.out.println("OpenAI configured: " + config.providers().openai().configured());
            System.out.println("OpenRouter configured: " + config.providers().openrouter().configured());

            Path auditFile = workspace.resolve(config.storage().auditFile());
            if (Files.exists(auditFile)) {
                RunSummary summary = new ObservabilityService(new FileAuditStore(auditFile), Clock.systemUTC()).summary();
                System.out.println("Tests started: " + summary.testsStarted());
                System.out.println("Tests passed: " + summary.testsPassed());
                System.out.println("Tests failed: " + summary.testsFailed());
                System.out.println(String.format(Locale.ROOT, "Pass rate: %.1f%%", summary.passRate()));
                System.out.println(String.format(Locale.ROOT, "Duration p50/p95: %.0f/%.0f ms",
                    summary.p50DurationMs(), summary.p95DurationMs()));
                System.out.println("Rollback failures: " + summary.rollbackFailures());
                System.out.println("Flush failures: " + summary.flushFailures());
            } else {
                System.out.println("No audit events recorded yet");
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Status command failed: " + e.getMessage());
            return 1;
        }
    }
}
