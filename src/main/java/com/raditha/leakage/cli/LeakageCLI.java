package com.raditha.leakage.cli;

import com.raditha.leakage.config.AnalysisConfig;
import com.raditha.leakage.config.AnalysisSettings;
import com.raditha.leakage.config.ExportFormat;
import com.raditha.leakage.config.SeverityPolicy;
import com.raditha.leakage.merge.MergeStatistics;
import com.raditha.leakage.merge.TreeInvariants;
import com.raditha.leakage.metrics.CallTreeDumper;
import com.raditha.leakage.metrics.LeakageReportExporter;
import com.raditha.leakage.pipeline.PipelineResult;
import com.raditha.leakage.pipeline.SkippedTrace;
import com.raditha.leakage.pipeline.TraceMergePipeline;
import com.raditha.leakage.scoring.LeakageAnalysis;
import com.raditha.leakage.scoring.LeakageInfo;
import com.raditha.leakage.scoring.LeakageScorer;
import com.raditha.leakage.trace.TraceFormatException;
import com.raditha.leakage.util.Sequences;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.File;
import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command-line interface for the leakage detector.
 * <p>
 * Usage:
 * java -jar leakage-detector.jar [options] &lt;trace-directory&gt;
 * <p>
 * Configuration priority: CLI arguments > configuration file > defaults
 */
@Command(name = "leakage-detector", mixinStandardHelpOptions = true, version = "Leakage Detector v1.0.0",
        description = "Merges per-testcase execution traces and scores secret dependent behaviour")
public class LeakageCLI implements Callable<Integer> {

    private static final Logger logger = LoggerFactory.getLogger(LeakageCLI.class);

    static final int EXIT_OK = 0;
    static final int EXIT_ERROR = 1;
    static final int EXIT_CONFIGURATION = 2;
    static final int EXIT_IO = 3;
    static final int EXIT_INTERRUPTED = 4;
    static final int EXIT_TRACE_FORMAT = 5;

    static final String CALL_TREE_FILE_NAME = "call-tree.txt";

    /**
     * Number of sites printed in the console report.
     */
    private static final int MAX_REPORTED_SITES = 50;

    @Parameters(index = "0", description = "Directory containing one <name><testcase-id>.trace file per testcase",
            paramLabel = "<trace-dir>")
    private String traceDirectory;

    @Option(names = "--config-file", description = "Use custom configuration file", paramLabel = "<path>")
    private String configFile;

    @Option(names = "--output", description = "Output directory for exports and dumps (default: .)",
            paramLabel = "<path>")
    private String outputPath;

    @Option(names = "--threads", description = "Parser threads (default: 4)", paramLabel = "<n>")
    private int threads = 0; // 0 = use YAML/default

    @Option(names = "--queue-capacity", description = "Parsed traces buffered before merging (default: 16)",
            paramLabel = "<n>")
    private int queueCapacity = 0; // 0 = use YAML/default

    @Option(names = "--skip-invalid", description = "Skip invalid traces instead of aborting")
    private boolean skipInvalid = false;

    @Option(names = "--scoring", description = "Scoring function: guessing-entropy or mutual-information",
            paramLabel = "<name>")
    private String scoring;

    @Option(names = "--export", description = "Export results (csv, json, or both)", paramLabel = "<format>")
    private String exportFormat;

    @Option(names = "--dump-call-tree", description = "Write the merged call tree to " + CALL_TREE_FILE_NAME)
    private boolean dumpCallTree = false;

    @Option(names = "--check-invariants", description = "Verify the structure of the merged call tree")
    private boolean checkInvariants = false;

    /**
     * Picocli call method - executes the main logic.
     *
     * @return exit code (0 for success, non-zero for errors)
     */
    @Override
    public Integer call() throws Exception {
        validateConfiguration();

        AnalysisConfig config = AnalysisSettings.loadConfig(
                configFile != null ? Paths.get(configFile) : null,
                threads,
                queueCapacity,
                skipInvalid ? "skip" : null,
                scoring,
                exportFormat,
                dumpCallTree);

        PipelineResult result = new TraceMergePipeline(config).run(Paths.get(traceDirectory));
        if (result.mergedTestcases() == 0) {
            System.out.println("No traces were merged. Nothing to analyze.");
            return EXIT_OK;
        }

        if (checkInvariants) {
            List<String> violations = TreeInvariants.check(result.root());
            if (!violations.isEmpty()) {
                System.err.println("Call tree invariants violated:");
                violations.forEach(v -> System.err.println("  " + v));
                return EXIT_ERROR;
            }
            System.out.println("✓ Call tree invariants hold");
        }

        LeakageAnalysis analysis = new LeakageScorer(config.scoringFunction()).analyze(result.root());
        printTextReport(result, analysis, config);

        Path outputDirectory = Paths.get(outputPath != null ? outputPath : ".");
        if (config.dumpCallTree()) {
            Path dumpFile = outputDirectory.resolve(CALL_TREE_FILE_NAME);
            new CallTreeDumper().dump(result.root(), dumpFile);
            System.out.println("Call tree written to " + dumpFile);
        }
        if (config.exportFormat() != ExportFormat.NONE) {
            List<Path> files = new LeakageReportExporter(config.severity())
                    .export(analysis, config.exportFormat(), outputDirectory);
            files.forEach(f -> System.out.println("Report written to " + f));
        }

        return EXIT_OK;
    }

    public static void main(String[] args) {
        int exitCode = createCommandLine().execute(args);
        System.exit(exitCode);
    }

    /**
     * Creates the command line with the exit code mapping used by
     * {@link #main(String[])}.
     */
    public static CommandLine createCommandLine() {
        CommandLine cmd = new CommandLine(new LeakageCLI());

        cmd.setExecutionExceptionHandler((ex, commandLine, parseResult) -> {
            if (ex instanceof IllegalArgumentException) {
                commandLine.getErr().println("Configuration error: " + ex.getMessage());
                return EXIT_CONFIGURATION;
            } else if (ex instanceof TraceFormatException) {
                commandLine.getErr().println("Invalid trace: " + ex.getMessage());
                return EXIT_TRACE_FORMAT;
            } else if (ex instanceof IOException) {
                commandLine.getErr().println("I/O error: " + ex.getMessage());
                return EXIT_IO;
            } else if (ex instanceof InterruptedException) {
                commandLine.getErr().println("Process interrupted: " + ex.getMessage());
                return EXIT_INTERRUPTED;
            } else {
                commandLine.getErr().println("Error: " + ex.getMessage());
                logger.error("Analysis failed", ex);
                return EXIT_ERROR;
            }
        });

        cmd.setParameterExceptionHandler((ex, args) -> {
            CommandLine.Help.ColorScheme colorScheme = CommandLine.Help.defaultColorScheme(CommandLine.Help.Ansi.AUTO);
            cmd.getErr().println(colorScheme.errorText(ex.getMessage()));
            CommandLine.UnmatchedArgumentException.printSuggestions(ex, cmd.getErr());
            cmd.getErr().print(cmd.getUsageMessage(colorScheme));
            return EXIT_CONFIGURATION;
        });

        return cmd;
    }

    /**
     * Validate CLI configuration before execution.
     *
     * @throws IllegalArgumentException if configuration is invalid
     */
    private void validateConfiguration() {
        if (threads < 0) {
            throw new IllegalArgumentException("Threads must be positive, got: " + threads);
        }
        if (queueCapacity < 0) {
            throw new IllegalArgumentException("Queue capacity must be positive, got: " + queueCapacity);
        }

        // Throws for unknown formats
        ExportFormat.fromString(exportFormat);

        if (configFile != null && !new File(configFile).exists()) {
            throw new IllegalArgumentException("Config file not found: " + configFile);
        }

        if (!new File(traceDirectory).isDirectory()) {
            throw new IllegalArgumentException("Trace directory not found: " + traceDirectory);
        }

        if (outputPath != null) {
            File outputDir = new File(outputPath);
            if (outputDir.exists() && !outputDir.isDirectory()) {
                throw new IllegalArgumentException("Output path exists but is not a directory: " + outputPath);
            }
            if (!outputDir.exists() && !outputDir.mkdirs()) {
                throw new IllegalArgumentException("Cannot create output directory: " + outputPath);
            }
        }
    }

    private static void printTextReport(PipelineResult result, LeakageAnalysis analysis, AnalysisConfig config) {
        MergeStatistics statistics = result.statistics();
        SeverityPolicy severity = config.severity();

        System.out.println("=".repeat(80));
        System.out.println("LEAKAGE ANALYSIS REPORT");
        System.out.println("=".repeat(80));
        System.out.println();
        System.out.printf("Testcases merged: %d%n", result.mergedTestcases());
        if (!result.skippedTestcases().isEmpty()) {
            System.out.printf("Traces skipped: %d%n", result.skippedTestcases().size());
            for (SkippedTrace skipped : result.skippedTestcases()) {
                System.out.printf("  %s: %s%n", skipped.file().getFileName(), skipped.reason());
            }
        }
        if (result.cancelled()) {
            System.out.println("⚠ Analysis was cancelled, results are partial");
        }
        System.out.printf("Merge: %d splits, %d branches, %d address promotions%n",
                statistics.splits(), statistics.branches(), statistics.addressPromotions());
        System.out.printf("Configuration: scoring=%s, major>%.0f, critical>%.0f%n",
                config.scoring(), severity.majorThreshold(), severity.criticalThreshold());
        System.out.printf("Divergence sites: %d in %d call stacks%n",
                analysis.sites().size(), analysis.callStacks().size());
        System.out.println();

        if (analysis.sites().isEmpty()) {
            System.out.println("✓ No secret dependent behaviour found!");
            System.out.println();
            return;
        }

        System.out.println("-".repeat(80));
        System.out.printf("%-9s %6s  %-14s %-14s %-16s %s%n", "SEVERITY", "SCORE", "INSTRUCTION", "TYPE",
                "CALL STACK", "DETAILS");
        System.out.println("-".repeat(80));

        List<LeakageInfo> sites = analysis.sitesByScore();
        for (int i = 0; i < Math.min(MAX_REPORTED_SITES, sites.size()); i++) {
            LeakageInfo info = sites.get(i);
            System.out.printf("%-9s %6.1f  %-14s %-14s %016X %s%n",
                    severity.classify(info.headlineScore()).label(),
                    info.headlineScore(),
                    info.site().formatInstruction(),
                    info.site().type().getLabel(),
                    info.site().callStackId(),
                    String.format("calls=%d outcomes=%d MI=%.2f±%.2f populations=%s",
                            info.numberOfCalls(),
                            info.maximumOutcomeCount(),
                            info.mutualInformation().mean(),
                            info.mutualInformation().standardDeviation(),
                            info.worstCasePopulations()));
        }
        if (sites.size() > MAX_REPORTED_SITES) {
            System.out.printf("... and %d more sites%n", sites.size() - MAX_REPORTED_SITES);
        }
        System.out.println();

        Sequences.MeanAndDeviation scores = Sequences.computeMean(
                sites.stream().map(LeakageInfo::headlineScore).toList());
        System.out.printf("Average score: %.1f ± %.1f%n", scores.mean(), scores.standardDeviation());
        System.out.println();
    }
}
