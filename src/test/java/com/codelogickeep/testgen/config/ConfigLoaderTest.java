package com.codelogickeep.testgen.config;

import com.codelogickeep.testgen.exception.TestGenException;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ConfigLoader Tests")
class ConfigLoaderTest {

    @TempDir
    Path userHome;

    @TempDir
    Path workingDir;

    private ConfigLoader loader;

    @BeforeEach
    void setUp() {
        loader = new ConfigLoader(userHome, workingDir);
    }

    private void writeUserConfig(String yaml) throws IOException {
        Path dir = userHome.resolve(ConfigLoader.USER_CONFIG_DIR);
        Files.createDirectories(dir);
        Files.writeString(dir.resolve(ConfigLoader.CONFIG_FILE_NAME), yaml);
    }

    @Test
    @DisplayName("should load bundled defaults when no other layer exists")
    void shouldLoadBundledDefaults() {
        AppConfig config = loader.load(null);

        assertEquals("target/site/jacoco/jacoco.xml", config.getReport().getPath());
        assertEquals(3, config.getGeneration().getMaxTestsPerGap());
        assertEquals(20, config.getOutput().getTopGaps());
        assertFalse(config.getOutput().isOverwrite());
    }

    @Test
    @DisplayName("later layers should override only the keys they set")
    void shouldApplyLayersInPriorityOrder() throws IOException {
        writeUserConfig("generation:\n  max-tests-per-gap: 1\noutput:\n  top-gaps: 4\n");
        Files.writeString(workingDir.resolve(ConfigLoader.CONFIG_FILE_NAME), "output:\n  top-gaps: 6\n");
        Path explicit = workingDir.resolve("ci.yml");
        Files.writeString(explicit, "output:\n  overwrite: true\n");

        AppConfig config = loader.load(explicit.toString());

        assertEquals(1, config.getGeneration().getMaxTestsPerGap());
        assertEquals(6, config.getOutput().getTopGaps());
        assertTrue(config.getOutput().isOverwrite());
        assertEquals(10, config.getOutput().getSummaryTopN());
    }

    @Test
    @DisplayName("should fail when the explicit file is missing")
    void shouldFailForMissingExplicitFile() {
        TestGenException ex = assertThrows(TestGenException.class,
                () -> loader.load(workingDir.resolve("missing.yml").toString()));

        assertEquals(TestGenException.ErrorCode.CONFIG_NOT_FOUND, ex.getErrorCode());
    }

    @Test
    @DisplayName("should fail for malformed YAML")
    void shouldFailForMalformedYaml() throws IOException {
        Files.writeString(workingDir.resolve(ConfigLoader.CONFIG_FILE_NAME), "output: [unclosed\n");

        TestGenException ex = assertThrows(TestGenException.class, () -> loader.load(null));

        assertEquals(TestGenException.ErrorCode.CONFIG_INVALID, ex.getErrorCode());
    }

    @Test
    @DisplayName("should fail when a section is a list instead of a mapping")
    void shouldFailForNonMappingSection() throws IOException {
        Files.writeString(workingDir.resolve(ConfigLoader.CONFIG_FILE_NAME), "output: [1, 2]\n");

        TestGenException ex = assertThrows(TestGenException.class, () -> loader.load(null));

        assertEquals(TestGenException.ErrorCode.CONFIG_INVALID, ex.getErrorCode());
        assertTrue(ex.getMessage().contains("'output'"));
    }

    @Test
    @DisplayName("should fail when the document is not a mapping")
    void shouldFailForScalarDocument() throws IOException {
        writeUserConfig("just some text\n");

        TestGenException ex = assertThrows(TestGenException.class, () -> loader.load(null));

        assertEquals(TestGenException.ErrorCode.CONFIG_INVALID, ex.getErrorCode());
    }

    @Test
    @DisplayName("should skip an empty layer")
    void shouldSkipEmptyLayer() throws IOException {
        Files.writeString(workingDir.resolve(ConfigLoader.CONFIG_FILE_NAME), "");

        AppConfig config = loader.load(null);

        assertEquals(20, config.getOutput().getTopGaps());
    }

    @Test
    @DisplayName("should fail validation for out-of-range values")
    void shouldFailForInvalidValues() throws IOException {
        writeUserConfig("output:\n  summary-top-n: 0\n");

        TestGenException ex = assertThrows(TestGenException.class, () -> loader.load(null));

        assertEquals(TestGenException.ErrorCode.CONFIG_INVALID, ex.getErrorCode());
        assertTrue(ex.getMessage().contains("output.summary-top-n"));
    }

    @Test
    @DisplayName("replaceEnvVars should leave plain and unresolved values untouched")
    void replaceEnvVars_shouldLeavePlainValues() {
        assertNull(ConfigLoader.replaceEnvVars(null));
        assertEquals("a/b.xml", ConfigLoader.replaceEnvVars("a/b.xml"));
        assertEquals("${env:NO_SUCH_VARIABLE_FOR_TESTGEN}",
                ConfigLoader.replaceEnvVars("${env:NO_SUCH_VARIABLE_FOR_TESTGEN}"));
        assertEquals("prefix-${env:HOME}", ConfigLoader.replaceEnvVars("prefix-${env:HOME}"));
    }
}
