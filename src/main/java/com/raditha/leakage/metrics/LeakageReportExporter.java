package com.raditha.leakage.metrics;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.raditha.leakage.config.ExportFormat;
import com.raditha.leakage.config.SeverityPolicy;
import com.raditha.leakage.model.InstructionIds;
import com.raditha.leakage.scoring.CallStackInfo;
import com.raditha.leakage.scoring.LeakageAnalysis;
import com.raditha.leakage.scoring.LeakageInfo;
import com.raditha.leakage.scoring.StatisticsEntry;
import com.raditha.leakage.trace.CallStackIds;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Exports scored leakage to CSV and JSON for downstream report generators.
 */
public class LeakageReportExporter {

    private static final Logger logger = LoggerFactory.getLogger(LeakageReportExporter.class);

    public static final String CSV_FILE_NAME = "leakage-report.csv";
    public static final String JSON_FILE_NAME = "call-stacks.json";

    private static final ObjectMapper mapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private final SeverityPolicy severityPolicy;

    public LeakageReportExporter(SeverityPolicy severityPolicy) {
        this.severityPolicy = severityPolicy;
    }

    /**
     * Top level JSON document.
     */
    public record LeakageReport(
            LocalDateTime timestamp,
            int testcaseCount,
            int siteCount,
            double maximumMutualInformation,
            CallStackEntry callStacks) {
    }

    /**
     * One call stack with the leakage found directly in it and its callees.
     */
    public record CallStackEntry(
            String callStackId,
            String source,
            String target,
            List<LeakageEntry> leakageEntries,
            List<CallStackEntry> children) {
    }

    /**
     * Leakage of one instruction within a call stack.
     */
    public record LeakageEntry(
            String instruction,
            String type,
            String severity,
            double score,
            int numberOfCalls,
            List<Integer> worstCasePopulations,
            StatisticsEntry treeDepth,
            StatisticsEntry mutualInformation,
            StatisticsEntry conditionalGuessingEntropy,
            StatisticsEntry minimumConditionalGuessingEntropy) {
    }

    /**
     * Writes the requested report files into the output directory.
     *
     * @return the files written
     */
    public List<Path> export(LeakageAnalysis analysis, ExportFormat format, Path outputDirectory) throws IOException {
        List<Path> written = new ArrayList<>();
        if (format == ExportFormat.NONE) {
            return written;
        }

        Files.createDirectories(outputDirectory);
        if (format.includesCsv()) {
            Path csv = outputDirectory.resolve(CSV_FILE_NAME);
            exportToCsv(analysis, csv);
            written.add(csv);
        }
        if (format.includesJson()) {
            Path json = outputDirectory.resolve(JSON_FILE_NAME);
            exportToJson(analysis, json);
            written.add(json);
        }
        written.forEach(p -> logger.info("Wrote {}", p));
        return written;
    }

    /**
     * Export one row per site, ordered by descending score.
     */
    public void exportToCsv(LeakageAnalysis analysis, Path outputPath) throws IOException {
        StringBuilder csv = new StringBuilder();

        csv.append("call_stack;instruction;type;severity;score;number_of_calls;max_outcomes;tree_depth;")
                .append("mi_mean;mi_sd;mi_min;mi_max;")
                .append("cge_mean;cge_sd;cge_min;cge_max;")
                .append("min_cge_mean;min_cge_sd;min_cge_min;min_cge_max\n");

        for (LeakageInfo info : analysis.sitesByScore()) {
            csv.append(String.format(Locale.ROOT, "%016X;%s;%s;%s;%.2f;%d;%d;%.2f;",
                    info.site().callStackId(),
                    instruction(info),
                    info.site().type().getLabel(),
                    severityPolicy.classify(info.headlineScore()).label(),
                    info.headlineScore(),
                    info.numberOfCalls(),
                    info.maximumOutcomeCount(),
                    info.treeDepth().mean()));
            appendStatistics(csv, info.mutualInformation());
            csv.append(';');
            appendStatistics(csv, info.conditionalGuessingEntropy());
            csv.append(';');
            appendStatistics(csv, info.minimumConditionalGuessingEntropy());
            csv.append('\n');
        }

        Files.writeString(outputPath, csv.toString());
    }

    private static void appendStatistics(StringBuilder csv, StatisticsEntry entry) {
        csv.append(String.format(Locale.ROOT, "%.4f;%.4f;%.4f;%.4f",
                entry.mean(), entry.standardDeviation(), entry.minimum(), entry.maximum()));
    }

    /**
     * Export the call stack tree with its leakage entries.
     */
    public void exportToJson(LeakageAnalysis analysis, Path outputPath) throws IOException {
        LeakageReport report = buildReport(analysis);
        mapper.writerWithDefaultPrettyPrinter().writeValue(outputPath.toFile(), report);
    }

    /**
     * Arranges the scored sites by call stack. Call stacks without leakage are
     * kept when one of their callees leaks.
     */
    public LeakageReport buildReport(LeakageAnalysis analysis) {
        CallStackEntry root = new CallStackEntry(formatCallStackId(CallStackIds.ROOT), "", "",
                new ArrayList<>(), new ArrayList<>());
        Map<Long, CallStackEntry> entries = new HashMap<>();
        entries.put(CallStackIds.ROOT, root);

        // Callers are always seen before their callees
        for (CallStackInfo info : analysis.callStacks().values()) {
            if (info.callStackId() == CallStackIds.ROOT) {
                continue;
            }
            CallStackEntry entry = new CallStackEntry(formatCallStackId(info.callStackId()),
                    InstructionIds.format(info.sourceInstructionId()),
                    InstructionIds.format(info.targetInstructionId()),
                    new ArrayList<>(), new ArrayList<>());
            entries.put(info.callStackId(), entry);
            entries.getOrDefault(info.parentCallStackId(), root).children().add(entry);
        }

        for (LeakageInfo info : analysis.sitesByScore()) {
            entries.getOrDefault(info.site().callStackId(), root).leakageEntries().add(toLeakageEntry(info));
        }

        prune(root);
        return new LeakageReport(LocalDateTime.now(), analysis.testcaseCount(), analysis.sites().size(),
                analysis.maximumMutualInformation(), root);
    }

    /**
     * Removes subtrees without leakage entries.
     *
     * @return true if the entry or one of its descendants has leakage
     */
    private static boolean prune(CallStackEntry entry) {
        entry.children().removeIf(child -> !prune(child));
        return !entry.leakageEntries().isEmpty() || !entry.children().isEmpty();
    }

    private LeakageEntry toLeakageEntry(LeakageInfo info) {
        return new LeakageEntry(
                instruction(info),
                info.site().type().getLabel(),
                severityPolicy.classify(info.headlineScore()).label(),
                info.headlineScore(),
                info.numberOfCalls(),
                info.worstCasePopulations(),
                info.treeDepth(),
                info.mutualInformation(),
                info.conditionalGuessingEntropy(),
                info.minimumConditionalGuessingEntropy());
    }

    private static String instruction(LeakageInfo info) {
        return info.site().formatInstruction();
    }

    static String formatCallStackId(long callStackId) {
        return String.format("%016X", callStackId);
    }
}
