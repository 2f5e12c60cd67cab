package io.convotest.cli;

import io.convotest.core.experiment.CreateVariantRequest;
import io.convotest.core.experiment.Variant;
import io.convotest.core.experiment.VariantType;
import io.convotest.core.runtime.ConvotestRuntime;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "variant", mixinStandardHelpOptions = true, description = "Manage content variants of target files")
public final class VariantCommand implements Runnable {

    @Override
    public void run() {
        // Group command only shows help when no subcommand is provided.
    }

    static CommandLine commandLine(CliContext context) {
        CommandLine commandLine = new CommandLine(new VariantCommand());
        commandLine.addSubcommand("capture", new Capture(context));
        commandLine.addSubcommand("create", new Create(context));
        commandLine.addSubcommand("list", new ListVariants(context));
        commandLine.addSubcommand("rollback", new Rollback(context));
        return commandLine;
    }

    @Command(name = "capture", description = "Store the live content of a file as its baseline")
    static final class Capture implements Callable<Integer> {
        private final CliContext context;

        @Option(names = "--file", required = true, description = "Target file")
        String file;

        @Option(names = "--type", defaultValue = "prompt", description = "prompt, tool or config")
        String type;

        Capture(CliContext context) {
            this.context = context;
        }

        @Override
        public Integer call() {
            try (ConvotestRuntime runtime = context.openRuntime(false)) {
                Variant baseline = runtime.variants().captureBaseline(file, VariantType.fromKey(type));
                System.out.println("Captured baseline " + baseline.variantId() + " for " + baseline.targetFile());
                return 0;
            } catch (Exception e) {
                System.err.println("Variant capture command failed: " + e.getMessage());
                return 1;
            }
        }
    }

    @Command(name = "create", description = "Store new content for a target file")
    static final class Create implements Callable<Integer> {
        private final CliContext context;

        @Option(names = "--file", required = true, description = "Target file the variant replaces")
        String file;

        @Option(names = "--type", defaultValue = "prompt", description = "prompt, tool or config")
        String type;

        @Option(names = "--name", required = true, description = "Variant name")
        String name;

        @Option(names = "--content-file", required = true, description = "File holding the variant content")
        Path contentFile;

        @Option(names = "--description", description = "Variant description")
        String description;

        Create(CliContext context) {
            this.context = context;
        }

        @Override
        public Integer call() {
            try (ConvotestRuntime runtime = context.openRuntime(false)) {
                String content = Files.readString(contentFile, StandardCharsets.UTF_8);
                String baselineId = runtime.variants().getBaseline(file).map(Variant::variantId).orElse(null);
                Variant variant = runtime.variants().createVariant(new CreateVariantRequest(
                    VariantType.fromKey(type),
                    file,
                    name,
                    description,
                    content,
                    baselineId,
                    null,
                    "cli"
                ));
                System.out.println("Variant " + variant.variantId() + " (" + variant.contentHash().substring(0, 12) + ")");
                return 0;
            } catch (Exception e) {
                System.err.println("Variant create command failed: " + e.getMessage());
                return 1;
            }
        }
    }

    @Command(name = "list", description = "List variants")
    static final class ListVariants implements Callable<Integer> {
        private final CliContext context;

        @Option(names = "--file", description = "Only variants of this target file")
        String file;

        ListVariants(CliContext context) {
            this.context = context;
        }

        @Override
        public Integer call() {
            try (ConvotestRuntime runtime = context.openRuntime(false)) {
                List<Variant> variants = file == null
                    ? runtime.variants().getAllVariants()
                    : runtime.variants().getVariantsForFile(file);
                if (variants.isEmpty()) {
                    System.out.println("No variants");
                }
                for (Variant variant : variants) {
                    System.out.println(variant.variantId() + "  " + variant.variantType().key() + "  " + variant.targetFile()
                        + "  " + variant.name() + (variant.baseline() ? "  [baseline]" : ""));
                }
                return 0;
            } catch (Exception e) {
                System.err.println("Variant list command failed: " + e.getMessage());
                return 1;
            }
        }
    }

    @Command(name = "rollback", description = "Write the baseline content back over a target file")
    static final class Rollback implements Callable<Integer> {
        private final CliContext context;

        @Option(names = "--file", required = true, description = "Target file")
        String file;

        Rollback(CliContext context) {
            this.context = context;
        }

        @Override
        public Integer call() {
            try (ConvotestRuntime runtime = context.openRuntime(false)) {
                Variant baseline = runtime.variants().restoreBaseline(file);
                System.out.println("Restored " + baseline.targetFile() + " from baseline " + baseline.variantId());
                return 0;
            } catch (Exception e) {
                System.err.println("Variant rollback command failed: " + e.getMessage());
                return 1;
            }
        }
    }
}
