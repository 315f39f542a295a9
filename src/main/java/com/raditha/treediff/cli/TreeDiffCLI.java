package com.raditha.treediff.cli;

import com.raditha.treediff.analyzer.BatchDiffer;
import com.raditha.treediff.analyzer.BatchResult;
import com.raditha.treediff.analyzer.DiffJob;
import com.raditha.treediff.analyzer.DiffReport;
import com.raditha.treediff.analyzer.TreeDiffer;
import com.raditha.treediff.config.DiffConfig;
import com.raditha.treediff.config.DiffSettings;
import com.raditha.treediff.frontend.JavaSourceParser;
import com.raditha.treediff.report.EditScriptRenderer;
import com.raditha.treediff.report.JsonReportWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Command-line interface for the structural tree differ.
 * <p>
 * Usage:
 * tree-diff [options] OLD NEW
 * <p>
 * OLD and NEW are Java source files, or two directories whose .java files
 * are paired by relative path and compared in parallel.
 * <p>
 * Configuration priority: CLI arguments > config file > preset defaults
 */
@Command(name = "tree-diff", mixinStandardHelpOptions = true, version = "tree-diff v1.0.0",
        description = "Structural diff of Java syntax trees")
public class TreeDiffCLI implements Callable<Integer> {

    private static final Logger logger = LoggerFactory.getLogger(TreeDiffCLI.class);

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", description = "Old file or directory", paramLabel = "OLD")
    private Path oldPath;

    @Parameters(index = "1", description = "New file or directory", paramLabel = "NEW")
    private Path newPath;

    @Option(names = "--config-file", description = "Use custom configuration file", paramLabel = "<path>")
    private Path configFile;

    @Option(names = "--threshold", description = "Minimum similarity 1-100 for two nodes to match (default: 70)", paramLabel = "<n>")
    private int threshold = 0; // 0 = use YAML/default

    @Option(names = "--dimension", description = "Feature vector dimension (default: 64)", paramLabel = "<d>")
    private int dimension = 0;

    @Option(names = "--p", description = "Ancestor labels per gram (default: 2)", paramLabel = "<n>")
    private int p = 0;

    @Option(names = "--q", description = "Sibling labels per gram (default: 3)", paramLabel = "<n>")
    private int q = 0;

    @Option(names = "--strict", description = "Strict preset (85%% similarity, larger grams)")
    private boolean strict = false;

    @Option(names = "--lenient", description = "Lenient preset (50%% similarity)")
    private boolean lenient = false;

    @Option(names = "--json", description = "Output results in JSON format")
    private boolean jsonOutput = false;

    @Option(names = "--mapping", description = "Also print the node mapping")
    private boolean showMapping = false;

    @Option(names = "--threads", description = "Worker threads for directory comparisons (default: available processors)", paramLabel = "<n>")
    private int threads = Runtime.getRuntime().availableProcessors();

    @Option(names = "--timeout", description = "Deadline in seconds for directory comparisons (default: 300)", paramLabel = "<s>")
    private long timeoutSeconds = 300;

    @Override
    public Integer call() throws Exception {
        validateConfiguration();

        String preset = strict ? "strict" : lenient ? "lenient" : null;
        DiffConfig config = DiffSettings.loadConfig(configFile, p, q, dimension, threshold, preset);
        TreeDiffer differ = new TreeDiffer(config);
        JavaSourceParser parser = new JavaSourceParser();

        if (Files.isDirectory(oldPath) && Files.isDirectory(newPath)) {
            return compareDirectories(differ, parser);
        }
        if (Files.isDirectory(oldPath) || Files.isDirectory(newPath)) {
            throw new IllegalArgumentException("OLD and NEW must both be files or both be directories");
        }
        DiffReport report = differ.diff(parser.parse(oldPath), parser.parse(newPath));
        print(oldPath.getFileName().toString(), report);
        return 0;
    }

    private int compareDirectories(TreeDiffer differ, JavaSourceParser parser) throws IOException, InterruptedException {
        List<Path> relative = pairedFiles();
        List<DiffJob> jobs = new ArrayList<>(relative.size());
        for (Path rel : relative) {
            Path oldFile = oldPath.resolve(rel);
            Path newFile = newPath.resolve(rel);
            jobs.add(new DiffJob(rel.toString(), () -> parser.parse(oldFile), () -> parser.parse(newFile)));
        }
        logger.info("Comparing {} file pairs", jobs.size());

        List<BatchResult> results = new BatchDiffer(differ, threads).diffAll(jobs, Duration.ofSeconds(timeoutSeconds));
        int incomplete = 0;
        for (BatchResult result : results) {
            if (result.isCompleted()) {
                print(result.name(), result.report());
            } else {
                incomplete++;
                out().println(result.name() + ": " + result.status()
                        + (result.error() != null ? " (" + result.error() + ")" : ""));
            }
        }
        return incomplete == 0 ? 0 : 1;
    }

    /**
     * .java files present under both directories, as relative paths.
     */
    private List<Path> pairedFiles() throws IOException {
        try (Stream<Path> files = Files.walk(oldPath)) {
            return files.filter(f -> f.toString().endsWith(".java"))
                    .map(oldPath::relativize)
                    .filter(rel -> Files.isRegularFile(newPath.resolve(rel)))
                    .sorted()
                    .collect(Collectors.toList());
        }
    }

    private void print(String name, DiffReport report) throws IOException {
        PrintWriter out = out();
        if (jsonOutput) {
            out.println(new JsonReportWriter().toJson(report, showMapping));
            return;
        }
        EditScriptRenderer renderer = new EditScriptRenderer();
        out.println("=== " + name + " ===");
        out.print(renderer.render(report));
        if (showMapping) {
            out.println();
            out.println("Mapping:");
            out.print(renderer.renderMapping(report.mapping()));
        }
        out.flush();
    }

    private PrintWriter out() {
        return spec.commandLine().getOut();
    }

    /**
     * Validate CLI configuration before execution.
     *
     * @throws IllegalArgumentException if configuration is invalid
     */
    private void validateConfiguration() {
        if (threshold != 0 && (threshold < 0 || threshold > 100)) {
            throw new IllegalArgumentException("Threshold must be between 0 and 100, got: " + threshold);
        }
        if (dimension < 0 || p < 0 || q < 0) {
            throw new IllegalArgumentException("Dimension, p and q must be positive");
        }
        if (strict && lenient) {
            throw new IllegalArgumentException("Cannot use both --strict and --lenient presets simultaneously");
        }
        if (threads < 1) {
            throw new IllegalArgumentException("Threads must be positive, got: " + threads);
        }
        if (timeoutSeconds < 1) {
            throw new IllegalArgumentException("Timeout must be positive, got: " + timeoutSeconds);
        }
        if (!Files.exists(oldPath)) {
            throw new IllegalArgumentException("Not found: " + oldPath);
        }
        if (!Files.exists(newPath)) {
            throw new IllegalArgumentException("Not found: " + newPath);
        }
    }

    /**
     * Command line with the exit-code mapping installed.
     */
    public static CommandLine createCommandLine() {
        CommandLine cmd = new CommandLine(new TreeDiffCLI());

        cmd.setExecutionExceptionHandler((ex, commandLine, parseResult) -> {
            if (ex instanceof IllegalArgumentException) {
                commandLine.getErr().println("Configuration error: " + ex.getMessage());
                return 2;
            } else if (ex instanceof IOException) {
                commandLine.getErr().println("I/O error: " + ex.getMessage());
                return 3;
            } else if (ex instanceof InterruptedException) {
                commandLine.getErr().println("Process interrupted: " + ex.getMessage());
                return 4;
            } else {
                commandLine.getErr().println("Error: " + ex.getMessage());
                ex.printStackTrace(commandLine.getErr());
                return 1;
            }
        });

        cmd.setParameterExceptionHandler((ex, args) -> {
            CommandLine.Help.ColorScheme colorScheme = CommandLine.Help.defaultColorScheme(CommandLine.Help.Ansi.AUTO);
            cmd.getErr().println(colorScheme.errorText(ex.getMessage()));
            CommandLine.UnmatchedArgumentException.printSuggestions(ex, cmd.getErr());
            cmd.getErr().print(cmd.getUsageMessage(colorScheme));
            return 2;
        });
        return cmd;
    }

    public static void main(String[] args) {
        int exitCode = createCommandLine().execute(args);
        System.exit(exitCode);
    }
}
