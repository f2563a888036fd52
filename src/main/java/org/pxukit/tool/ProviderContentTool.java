package org.pxukit.tool;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.Objects;
import org.pxukit.obs.ContentSnapshotDumper;
import org.pxukit.obs.JsonLinesLogger;
import org.pxukit.provider.ContentProblem;
import org.pxukit.provider.LoadOptions;
import org.pxukit.provider.Provider;
import org.pxukit.provider.ProviderDefinition;
import org.pxukit.provider.ProviderDefinitionLoader;
import org.pxukit.unit.CheckContext;
import org.pxukit.unit.ValidationOptions;

/**
 * CLI utility that loads the content of one provider and reports units and problems.
 *
 * <p>Exit codes: 0 when the content loaded without problems, 1 when the definition could not be
 * used or some files failed to load, 2 for bad arguments.
 */
public final class ProviderContentTool {
    private ProviderContentTool() {}

    public static void main(final String[] args) {
        final int exitCode = run(args, System.out, System.err);
        if (exitCode != 0) {
            System.exit(exitCode);
        }
    }

    static int run(final String[] args, final PrintStream out, final PrintStream err) {
        Objects.requireNonNull(args, "args");
        Objects.requireNonNull(out, "out");
        Objects.requireNonNull(err, "err");

        final Config config;
        try {
            config = parseArgs(args);
        } catch (final IllegalArgumentException e) {
            err.println(e.getMessage());
            printUsage(err);
            return 2;
        }

        if (config.help()) {
            printUsage(out);
            return 0;
        }

        final Provider provider;
        try {
            final ProviderDefinition definition = ProviderDefinitionLoader.load(config.definitionPath());
            provider = Provider.fromDefinition(definition, false, JsonLinesLogger.noop());
            provider.load(config.options());
            if (config.options().check()) {
                // Cross references resolve against the units of the first pass.
                provider.load(config.options().withCheck(true, CheckContext.of(provider.unitList())));
            }
        } catch (final IOException | RuntimeException e) {
            err.println("provider content tool failed: " + e.getMessage());
            return 1;
        }

        renderSummary(config.definitionPath(), provider, out);
        if (config.jsonOutput()) {
            out.println();
            out.println(new ContentSnapshotDumper().dumpJson(provider));
        }
        return provider.problemList().isEmpty() ? 0 : 1;
    }

    private static Config parseArgs(final String[] args) {
        Path definitionPath = null;
        boolean jsonOutput = false;
        boolean help = false;
        boolean check = false;
        boolean validate = true;
        boolean strict = false;
        boolean deprecated = false;

        for (final String arg : args) {
            if ("--help".equals(arg) || "-h".equals(arg)) {
                help = true;
                continue;
            }
            if ("--json".equals(arg)) {
                jsonOutput = true;
                continue;
            }
            if ("--check".equals(arg)) {
                check = true;
                continue;
            }
            if ("--no-validate".equals(arg)) {
                validate = false;
                continue;
            }
            if ("--strict".equals(arg)) {
                strict = true;
                continue;
            }
            if ("--deprecated".equals(arg)) {
                deprecated = true;
                continue;
            }
            if (arg.startsWith("--provider=")) {
                definitionPath = Path.of(valueAfterPrefix(arg, "--provider="));
                continue;
            }
            throw new IllegalArgumentException("unknown argument: " + arg);
        }

        if (!help && definitionPath == null) {
            throw new IllegalArgumentException("--provider=<path> is required");
        }
        final LoadOptions options = LoadOptions.defaults()
                .withValidate(validate)
                .withValidation(new ValidationOptions(strict, deprecated))
                .withCheck(check, null);
        return new Config(definitionPath, options, jsonOutput, help);
    }

    private static void renderSummary(final Path definitionPath, final Provider provider, final PrintStream out) {
        out.println("Provider content loaded");
        out.println("- definition: " + definitionPath.toAbsolutePath().normalize());
        out.println("- provider: " + provider.name());
        out.println("- version: " + provider.version());
        out.println("- units: " + provider.unitList().size());
        out.println("- identifiers: " + provider.idMap().size());
        out.println("- selectionLists: " + provider.selectionLists().size());
        out.println("- problems: " + provider.problemList().size());
        for (final ContentProblem problem : provider.problemList()) {
            out.println("  - " + problem.path() + ": " + problem.message());
        }
    }

    private static String valueAfterPrefix(final String arg, final String prefix) {
        final String value = arg.substring(prefix.length()).trim();
        if (value.isEmpty()) {
            throw new IllegalArgumentException(prefix + " must have a value");
        }
        return value;
    }

    private static void printUsage(final PrintStream stream) {
        stream.println("Usage: ProviderContentTool --provider=<path> [--check] [--no-validate] [--strict]"
                + " [--deprecated] [--json]");
        stream.println("  --provider=<path>     Provider definition file (required)");
        stream.println("  --check               Reject files with units that fail consistency checks");
        stream.println("  --no-validate         Skip static unit validation");
        stream.println("  --strict              Also reject units with warnings");
        stream.println("  --deprecated          Also reject units using deprecated fields");
        stream.println("  --json                Print the load snapshot as JSON");
        stream.println("  --help                Show usage");
    }

    private record Config(Path definitionPath, LoadOptions options, boolean jsonOutput, boolean help) {}
}
