package io.convotest.cli;

import io.convotest.core.experiment.CreateExperimentRequest;
import io.convotest.core.experiment.Experiment;
import io.convotest.core.experiment.ExperimentService;
import io.convotest.core.experiment.ExperimentSummary;
import io.convotest.core.experiment.VariantType;
import io.convotest.core.runtime.ConvotestRuntime;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(name = "experiment", mixinStandardHelpOptions = true, description = "Design and control A/B experiments")
public final class ExperimentCommand implements Runnable {

    @Override
    public void run() {
        // Group command only shows help when no subcommand is provided.
    }

    static CommandLine commandLine(CliContext context) {
        CommandLine commandLine = new CommandLine(new ExperimentCommand());
        commandLine.addSubcommand("create", new Create(context));
        commandLine.addSubcommand("start", new Transition(context, "start"));
        commandLine.addSubcommand("pause", new Transition(context, "pause"));
        commandLine.addSubcommand("complete", new Transition(context, "complete"));
        commandLine.addSubcommand("abort", new Transition(context, "abort"));
        commandLine.addSubcommand("summary", new Summary(context));
        return commandLine;
    }

    @Command(name = "create", description = "Create a draft experiment")
    static final class Create implements Callable<Integer> {
        private final CliContext context;

        @Option(names = "--name", required = true, description = "Experiment name")
        String name;

        @Option(names = "--hypothesis", description = "What the treatment is expected to change")
        String hypothesis;

        @Option(names = "--description", description = "Experiment description")
        String description;

        @Option(names = "--type", defaultValue = "prompt", description = "prompt, tool or config")
        String type;

        @Option(names = "--control", required = true, description = "Control variant id")
        String control;

        @Option(names = "--treatment", required = true, description = "Treatment variant id, repeatable")
        List<String> treatments = new ArrayList<>();

        @Option(names = "--test", description = "Test id under experiment, repeatable")
        List<String> tests = new ArrayList<>();

        @Option(names = "--min-samples", description = "Minimum samples per variant (default 10)")
        Integer minSamples;

        @Option(names = "--max-samples", description = "Maximum samples per variant (default 100)")
        Integer maxSamples;

        @Option(names = "--significance", description = "Significance threshold (default 0.05)")
        Double significance;

        Create(CliContext context) {
            this.context = context;
        }

        @Override
        public Integer call() {
            try (ConvotestRuntime runtime = context.openRuntime(false)) {
                Experiment experiment = runtime.experiments().createExperiment(new CreateExperimentRequest(
                    name,
                    description,
                    hypothesis,
                    VariantType.fromKey(type),
                    control,
                    treatments,
                    tests,
                    minSamples,
                    maxSamples,
                    significance
                ));
                System.out.println("Created experiment " + experiment.experimentId());
                experiment.variants().forEach(v ->
                    System.out.println("  " + v.role().key() + " " + v.variantId() + " weight " + v.weight()));
                return 0;
            } catch (Exception e) {
                System.err.println("Experiment create command failed: " + e.getMessage());
                return 1;
            }
        }
    }

    @Command(description = "Change the status of an experiment")
    static final class Transition implements Callable<Integer> {
        private final CliContext context;
        private final String action;

        @Parameters(index = "0", arity = "1", description = "Experiment id")
        String experimentId;

        @Option(names = "--reason", description = "Conclusion for complete, reason for abort")
        String reason;

        Transition(CliContext context, String action) {
            this.context = context;
            this.action = action;
        }

        @Override
        public Integer call() {
            try (ConvotestRuntime runtime = context.openRuntime(false)) {
                ExperimentService experiments = runtime.experiments();
                Experiment experiment = switch (action) {
                    case "start" -> experiments.startExperiment(experimentId);
                    case "pause" -> experiments.pauseExperiment(experimentId);
                    case "complete" -> experiments.completeExperiment(experimentId, reason);
                    case "abort" -> experiments.abortExperiment(experimentId, reason);
                    default -> throw new IllegalArgumentException("Unknown action " + action);
                };
                System.out.println("Experiment " + experiment.experimentId() + " is " + experiment.status().key());
                if (experiment.winningVariantId() != null) {
                    System.out.println("Winner: " + experiment.winningVariantId());
                }
                if (experiment.conclusion() != null) {
                    System.out.println("Conclusion: " + experiment.conclusion());
                }
                return 0;
            } catch (Exception e) {
                System.err.println("Experiment " + action + " command failed: " + e.getMessage());
                return 1;
            }
        }
    }

    @Command(name = "summary", description = "Show samples, pass rates and the recommendation")
    static final class Summary implements Callable<Integer> {
        private final CliContext context;

        @Parameters(index = "0", arity = "1", description = "Experiment id")
        String experimentId;

        Summary(CliContext context) {
            this.context = context;
        }

        @Override
        public Integer call() {
            try (ConvotestRuntime runtime = context.openRuntime(false)) {
                ExperimentSummary summary = runtime.experiments().getExperimentSummary(experimentId);
                System.out.println(summary.experimentId() + "  " + summary.name() + "  " + summary.status().key());
                if (summary.hypothesis() != null) {
                    System.out.println("Hypothesis: " + summary.hypothesis());
                }
                System.out.println("Samples: control " + summary.controlSamples() + ", treatment "
                    + summary.treatmentSamples() + " (min " + summary.minSampleSize() + ")");
                if (summary.controlPassRate() != null) {
                    System.out.println(String.format(
                        Locale.ROOT,
                        "Pass rate: control %.1f%%, treatment %.1f%%, lift %.1f%%, p=%.4f%s",
                        summary.controlPassRate() * 100.0,
                        summary.treatmentPassRate() * 100.0,
                        summary.passRateLift(),
                        summary.pValue(),
                        Boolean.TRUE.equals(summary.significant()) ? " (significant)" : ""
                    ));
                }
                if (summary.recommendation() != null) {
                    System.out.println("Recommendation: " + summary.recommendation().key());
                }
                if (summary.winningVariantId() != null) {
                    System.out.println("Winner: " + summary.winningVariantId());
                }
                if (summary.conclusion() != null) {
                    System.out.println("Conclusion: " + summary.conclusion());
                }
                return 0;
            } catch (Exception e) {
                System.err.println("Experiment summary command failed: " + e.getMessage());
                return 1;
            }
        }
    }
}
