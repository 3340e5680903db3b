package com.raditha.leakage.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Loads the analysis configuration from a YAML file with CLI overrides.
 * <p>
 * Configuration priority: CLI arguments > YAML file > defaults
 * <p>
 * The file is expected to contain a {@code leakage_analysis} section:
 * <pre>
 * leakage_analysis:
 *   parser_threads: 4
 *   queue_capacity: 16
 *   error_policy: skip
 *   scoring: guessing-entropy
 *   dump_call_tree: true
 *   export: both
 *   severity:
 *     major: 20
 *     critical: 80
 * </pre>
 */
public class AnalysisSettings {

    private static final Logger logger = LoggerFactory.getLogger(AnalysisSettings.class);

    static final String CONFIG_KEY = "leakage_analysis";

    private AnalysisSettings() {
    }

    /**
     * Load configuration, applying CLI overrides where provided.
     *
     * @param configFile          YAML file, null to use defaults only
     * @param parserThreadsCLI    CLI thread count (0 = use YAML/default)
     * @param queueCapacityCLI    CLI queue capacity (0 = use YAML/default)
     * @param errorPolicyCLI      CLI error policy (null = use YAML/default)
     * @param scoringCLI          CLI scoring function name (null = use YAML/default)
     * @param exportFormatCLI     CLI export format (null = use YAML/default)
     * @param dumpCallTreeCLI     CLI dump flag (false = use YAML/default)
     * @return complete analysis configuration
     * @throws IOException              if the file cannot be read
     * @throws IllegalArgumentException if the file or a value is invalid
     */
    public static AnalysisConfig loadConfig(Path configFile, int parserThreadsCLI, int queueCapacityCLI,
            String errorPolicyCLI, String scoringCLI, String exportFormatCLI, boolean dumpCallTreeCLI)
            throws IOException {
        Map<String, Object> config = configFile != null ? readSection(configFile) : Map.of();
        AnalysisConfig defaults = AnalysisConfig.defaults();

        int parserThreads = parserThreadsCLI != 0 ? parserThreadsCLI
                : getInt(config, "parser_threads", defaults.parserThreads());
        int queueCapacity = queueCapacityCLI != 0 ? queueCapacityCLI
                : getInt(config, "queue_capacity", defaults.queueCapacity());

        String errorPolicy = errorPolicyCLI != null ? errorPolicyCLI : getString(config, "error_policy", null);
        String scoring = scoringCLI != null ? scoringCLI : getString(config, "scoring", defaults.scoring());
        String exportFormat = exportFormatCLI != null ? exportFormatCLI : getString(config, "export", null);
        boolean dumpCallTree = dumpCallTreeCLI || getBoolean(config, "dump_call_tree", defaults.dumpCallTree());

        return new AnalysisConfig(
                parserThreads,
                queueCapacity,
                errorPolicy != null ? ErrorPolicy.fromString(errorPolicy) : defaults.errorPolicy(),
                scoring,
                buildSeverity(config),
                dumpCallTree,
                ExportFormat.fromString(exportFormat));
    }

    /**
     * Reads the {@value #CONFIG_KEY} section of the given file. A file without
     * that section yields an empty map.
     */
    static Map<String, Object> readSection(Path configFile) throws IOException {
        Object document;
        try (Reader reader = Files.newBufferedReader(configFile)) {
            document = new Yaml().load(reader);
        } catch (YAMLException e) {
            throw new IllegalArgumentException("Invalid configuration file " + configFile + ": " + e.getMessage(), e);
        }

        if (!(document instanceof Map<?, ?> root)) {
            logger.warn("Configuration file {} is empty or not a mapping, using defaults", configFile);
            return Map.of();
        }

        Object section = root.get(CONFIG_KEY);
        if (!(section instanceof Map)) {
            logger.warn("Configuration file {} has no '{}' section, using defaults", configFile, CONFIG_KEY);
            return Map.of();
        }

        @SuppressWarnings("unchecked")
        Map<String, Object> config = (Map<String, Object>) section;
        logger.debug("Loaded configuration from {}: {}", configFile, config);
        return config;
    }

    private static SeverityPolicy buildSeverity(Map<String, Object> config) {
        Object severityObj = config.get("severity");
        if (severityObj instanceof Map) {
            @SuppressWarnings("unchecked")
            Map<String, Object> severityMap = (Map<String, Object>) severityObj;
            SeverityPolicy defaults = SeverityPolicy.defaults();
            double major = getDouble(severityMap, "major", defaults.majorThreshold());
            double critical = getDouble(severityMap, "critical", defaults.criticalThreshold());
            return new SeverityPolicy(major, critical);
        }
        return SeverityPolicy.defaults();
    }

    private static int getInt(Map<String, Object> map, String key, int defaultValue) {
        Object value = map.get(key);
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        return defaultValue;
    }

    private static double getDouble(Map<String, Object> map, String key, double defaultValue) {
        Object value = map.get(key);
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        return defaultValue;
    }

    private static boolean getBoolean(Map<String, Object> map, String key, boolean defaultValue) {
        Object value = map.get(key);
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        return defaultValue;
    }

    private static String getString(Map<String, Object> map, String key, String defaultValue) {
        Object value = map.get(key);
        if (value != null) {
            return value.toString();
        }
        return defaultValue;
    }
}
