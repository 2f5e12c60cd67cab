package io.convotest.cli;

import io.convotest.core.config.InitResult;
import io.convotest.core.config.model.ConvotestConfig;
import io.convotest.core.config.model.StorageConfig;
import io.convotest.core.runtime.ConvotestRuntime;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "init", description = "Write the config file and prepare the workspace databases")
public final class InitCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = "--overwrite", description = "Replace the existing config with defaults")
    boolean overwrite;

    public InitCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            InitResult result = context.configService().init(context.configPath(), overwrite);
            String action = result.createdConfig() ? "created" : result.overwrittenConfig() ? "reset to defaults" : "merged with defaults";
            System.out.println("Config " + action + ": " + result.configPath());

            ConvotestConfig config = context.loadConfig();
            StorageConfig storage = config.storage();
            Path auditFile = result.workspacePath().resolve(storage.auditFile());
            boolean auditExisted = Files.exists(auditFile);
            try (ConvotestRuntime runtime = context.openRuntime(false)) {
                Path workspace = runtime.workspace();
                System.out.println("Workspace: " + workspace);
                System.out.println("Results database: " + workspace.resolve(storage.resultsDb())
                    + " (" + runtime.resultStore().listRuns(Integer.MAX_VALUE).size() + " runs)");
                System.out.println("Experiments database: " + workspace.resolve(storage.experimentsDb())
                    + " (" + runtime.variants().getAllVariants().size() + " variants, "
                    + runtime.experiments().getAllExperiments().size() + " experiments)");
                System.out.println("Audit log: " + auditFile
                    + (auditExisted ? " (" + runtime.observability().summary().auditEvents() + " events)" : " (empty)"));
                System.out.println("Classifier: " + runtime.classifier().name());
            }

            if (config.agent().configured()) {
                System.out.println("Agent under test: " + config.agent().endpoint());
            } else {
                System.out.println("Agent under test: not set, add agent.endpoint to " + result.configPath());
            }
            System.out.println("Next: convotest run --suite <suite.json>");
            return 0;
        } catch (Exception e) {
            System.err.println("Init command failed: " + e.getMessage());
            return 1;
        }
    }
}
