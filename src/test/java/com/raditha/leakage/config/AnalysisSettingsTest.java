package com.raditha.leakage.config;

import com.raditha.leakage.scoring.GuessingEntropyScoring;
import com.raditha.leakage.scoring.MutualInformationScoring;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class AnalysisSettingsTest {

    @TempDir
    Path tempDir;

    private static Path testConfig() throws URISyntaxException {
        return Paths.get(AnalysisSettingsTest.class.getResource("/leakage-analysis.yml").toURI());
    }

    @Test
    void testLoadConfig_Defaults() throws IOException {
        AnalysisConfig config = AnalysisSettings.loadConfig(null, 0, 0, null, null, null, false);

        assertEquals(AnalysisConfig.defaults(), config);
        assertEquals(ErrorPolicy.ABORT, config.errorPolicy());
        assertEquals(GuessingEntropyScoring.NAME, config.scoring());
        assertEquals(ExportFormat.NONE, config.exportFormat());
    }

    @Test
    void testLoadConfig_YamlFile() throws Exception {
        AnalysisConfig config = AnalysisSettings.loadConfig(testConfig(), 0, 0, null, null, null, false);

        assertEquals(2, config.parserThreads());
        assertEquals(8, config.queueCapacity());
        assertEquals(ErrorPolicy.SKIP, config.errorPolicy());
        assertEquals(MutualInformationScoring.NAME, config.scoring());
        assertTrue(config.dumpCallTree());
        assertEquals(ExportFormat.CSV, config.exportFormat());
        assertEquals(30.0, config.severity().majorThreshold(), 0.001);
        assertEquals(90.0, config.severity().criticalThreshold(), 0.001);
    }

    @Test
    void testLoadConfig_CliOverridesYaml() throws Exception {
        AnalysisConfig config = AnalysisSettings.loadConfig(testConfig(), 6, 32, "abort", "guessing-entropy",
                "both", false);

        assertEquals(6, config.parserThreads());
        assertEquals(32, config.queueCapacity());
        assertEquals(ErrorPolicy.ABORT, config.errorPolicy());
        assertEquals(GuessingEntropyScoring.NAME, config.scoring());
        assertEquals(ExportFormat.BOTH, config.exportFormat());
        // Not overridable from the command line
        assertEquals(30.0, config.severity().majorThreshold(), 0.001);
    }

    @Test
    void testLoadConfig_PartialSeverity() throws IOException {
        Path file = tempDir.resolve("partial.yml");
        Files.writeString(file, """
                leakage_analysis:
                  severity:
                    critical: 95
                """);

        AnalysisConfig config = AnalysisSettings.loadConfig(file, 0, 0, null, null, null, false);

        assertEquals(20.0, config.severity().majorThreshold(), 0.001);
        assertEquals(95.0, config.severity().criticalThreshold(), 0.001);
        assertEquals(AnalysisConfig.DEFAULT_PARSER_THREADS, config.parserThreads());
    }

    @Test
    void testMissingSectionUsesDefaults() throws IOException {
        Path file = tempDir.resolve("other.yml");
        Files.writeString(file, """
                duplication_detector:
                  min_lines: 5
                """);

        assertTrue(AnalysisSettings.readSection(file).isEmpty());
        assertEquals(AnalysisConfig.defaults(),
                AnalysisSettings.loadConfig(file, 0, 0, null, null, null, false));
    }

    @Test
    void testEmptyFileUsesDefaults() throws IOException {
        Path file = tempDir.resolve("empty.yml");
        Files.writeString(file, "");

        assertEquals(Map.of(), AnalysisSettings.readSection(file));
    }

    @Test
    void testInvalidYamlIsRejected() throws IOException {
        Path file = tempDir.resolve("broken.yml");
        Files.writeString(file, "leakage_analysis: [unclosed\n");

        assertThrows(IllegalArgumentException.class, () -> AnalysisSettings.readSection(file));
    }

    @Test
    void testInvalidValuesAreRejected() throws IOException {
        Path file = tempDir.resolve("invalid.yml");
        Files.writeString(file, """
                leakage_analysis:
                  scoring: entropy-of-everything
                """);

        assertThrows(IllegalArgumentException.class,
                () -> AnalysisSettings.loadConfig(file, 0, 0, null, null, null, false));
        assertThrows(IllegalArgumentException.class,
                () -> AnalysisSettings.loadConfig(null, 0, 0, "retry", null, null, false));
        assertThrows(IllegalArgumentException.class,
                () -> AnalysisSettings.loadConfig(null, 0, 0, null, null, "xml", false));
    }

    @Test
    void testMissingFileIsAnIoError() {
        Path file = tempDir.resolve("absent.yml");

        assertThrows(IOException.class, () -> AnalysisSettings.loadConfig(file, 0, 0, null, null, null, false));
    }
}
