package io.convotest.cli;

import java.nio.file.Path;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "convotest", mixinStandardHelpOptions = true, description = "Goal-oriented conversational test runner")
public final class ConvotestCliCommand implements Runnable {
    private final CliContext context;

    public ConvotestCliCommand(CliContext context) {
        this.context = context;
    }

    @Option(names = "--config", description = "Config file (default: ~/.convotest/config.json)")
    void setConfig(Path config) {
        context.overrideConfigPath(config);
    }

    @Override
    public void run() {
        // Root command only shows help when no subcommand is provided.
    }

    public static CommandLine commandLine(CliContext context) {
        CommandLine commandLine = new CommandLine(new ConvotestCliCommand(context));
        commandLine.addSubcommand("init", new InitCommand(context));
        commandLine.addSubcommand("status", new StatusCommand(context));
        commandLine.addSubcommand("run", new RunCommand(context));
        commandLine.addSubcommand("results", new ResultsCommand(context));
        commandLine.addSubcommand("variant", VariantCommand.commandLine(context));
        commandLine.addSubcommand("experiment", ExperimentCommand.commandLine(context));
        return commandLine;
    }
}
