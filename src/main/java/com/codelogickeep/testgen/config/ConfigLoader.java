package com.codelogickeep.testgen.config;

import com.codelogickeep.testgen.exception.TestGenException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Iterator;
import java.util.Map;

/**
 * Loads {@link AppConfig} by merging YAML layers, lowest priority first:
 * classpath {@code testgen.yml}, {@code ~/.jacoco-test-generator/testgen.yml},
 * {@code ./testgen.yml}, then the file passed with {@code --config}.
 */
@Slf4j
public class ConfigLoader {
    public static final String CONFIG_FILE_NAME = "testgen.yml";
    public static final String USER_CONFIG_DIR = ".jacoco-test-generator";

    private final ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
    private final Path userHome;
    private final Path workingDir;

    public ConfigLoader() {
        this(Paths.get(System.getProperty("user.home")), Paths.get(""));
    }

    public ConfigLoader(Path userHome, Path workingDir) {
        this.userHome = userHome;
        this.workingDir = workingDir;
    }

    /**
     * @param explicitConfig path given on the command line, or null
     * @throws TestGenException if the explicit file is missing or any layer is invalid
     */
    public AppConfig load(String explicitConfig) {
        AppConfig config = new AppConfig();

        // 1. Classpath - base defaults
        try (InputStream in = getClass().getClassLoader().getResourceAsStream(CONFIG_FILE_NAME)) {
            if (in != null) {
                mergeTree(config, mapper.readTree(in), "classpath:" + CONFIG_FILE_NAME);
            }
        } catch (IOException e) {
            throw new TestGenException(TestGenException.ErrorCode.CONFIG_INVALID,
                    "Failed to read bundled configuration: " + e.getMessage(), CONFIG_FILE_NAME, e);
        }

        // 2. User home
        mergeConfigFromFile(config, userHome.resolve(USER_CONFIG_DIR).resolve(CONFIG_FILE_NAME));

        // 3. Working directory
        mergeConfigFromFile(config, workingDir.resolve(CONFIG_FILE_NAME));

        // 4. CLI path - highest priority, must exist
        if (explicitConfig != null) {
            Path path = Paths.get(explicitConfig);
            if (!Files.isRegularFile(path)) {
                throw new TestGenException(TestGenException.ErrorCode.CONFIG_NOT_FOUND,
                        "Configuration file not found: " + path.toAbsolutePath(), explicitConfig);
            }
            mergeConfigFromFile(config, path);
        }

        if (config.getReport() != null) {
            config.getReport().setPath(replaceEnvVars(config.getReport().getPath()));
        }
        if (config.getOutput() != null) {
            config.getOutput().setDirectory(replaceEnvVars(config.getOutput().getDirectory()));
        }

        ConfigValidator.validateAndApplyDefaults(config);
        log.debug("Effective configuration:\n{}", ConfigValidator.getConfigSummary(config));
        return config;
    }

    private void mergeConfigFromFile(AppConfig config, Path file) {
        if (!Files.isRegularFile(file)) {
            log.debug("No configuration at {}", file.toAbsolutePath());
            return;
        }
        try {
            mergeTree(config, mapper.readTree(file.toFile()), file.toString());
            log.info("Merged configuration from {}", file.toAbsolutePath());
        } catch (IOException e) {
            throw new TestGenException(TestGenException.ErrorCode.CONFIG_INVALID,
                    "Failed to merge config from " + file.toAbsolutePath() + ": " + e.getMessage(),
                    file.toString(), e);
        }
    }

    /**
     * Merges one parsed layer into the config. The layer must be a mapping of sections,
     * each section itself a mapping; an empty document is a no-op.
     */
    private void mergeTree(AppConfig config, JsonNode tree, String source) throws IOException {
        if (tree == null || tree.isMissingNode() || tree.isNull()) {
            log.debug("Configuration {} is empty", source);
            return;
        }
        if (!tree.isObject()) {
            throw new TestGenException(TestGenException.ErrorCode.CONFIG_INVALID,
                    "Configuration must be a mapping of sections, got " + tree.getNodeType(), source);
        }
        Iterator<Map.Entry<String, JsonNode>> sections = tree.fields();
        while (sections.hasNext()) {
            Map.Entry<String, JsonNode> section = sections.next();
            if (!section.getValue().isObject() && !section.getValue().isNull()) {
                throw new TestGenException(TestGenException.ErrorCode.CONFIG_INVALID,
                        "Section '" + section.getKey() + "' must be a mapping, got " + section.getValue().getNodeType(),
                        source);
            }
        }
        mapper.readerForUpdating(config)
                .with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
                .readValue(tree);
    }

    static String replaceEnvVars(String value) {
        if (value == null || !value.contains("${env:")) {
            return value;
        }

        // Only a value that is entirely one placeholder is substituted
        if (value.startsWith("${env:") && value.endsWith("}")) {
            String envVar = value.substring(6, value.length() - 1);
            String envValue = System.getenv(envVar);
            return envValue != null ? envValue : value;
        }

        return value;
    }
}
