package com.codelogickeep.testgen.config;

import com.codelogickeep.testgen.exception.TestGenException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Validates AppConfig and fills in missing sections.
 */
public class ConfigValidator {
    private static final Logger log = LoggerFactory.getLogger(ConfigValidator.class);

    /**
     * Validates the configuration and throws exception if invalid.
     *
     * @param config the configuration to validate
     * @throws TestGenException if a value is out of range
     */
    public static void validate(AppConfig config) {
        List<String> errors = new ArrayList<>();

        if (config == null) {
            throw new TestGenException(
                    TestGenException.ErrorCode.CONFIG_INVALID,
                    "Configuration is null",
                    "No configuration loaded"
            );
        }

        if (config.getReport() != null && isNullOrEmpty(config.getReport().getPath())) {
            errors.add("report.path: Report path must not be empty");
        }

        if (config.getGeneration() != null && config.getGeneration().getMaxTestsPerGap() < 0) {
            errors.add("generation.max-tests-per-gap: Must be zero or positive");
        }

        if (config.getOutput() != null) {
            AppConfig.OutputConfig output = config.getOutput();
            if (isNullOrEmpty(output.getDirectory())) {
                errors.add("output.directory: Output directory must not be empty");
            }
            if (output.getTopGaps() <= 0) {
                errors.add("output.top-gaps: Must be positive");
            }
            if (output.getSummaryTopN() <= 0) {
                errors.add("output.summary-top-n: Must be positive");
            }
            if (output.getUncoveredLinesPreview() < 0) {
                errors.add("output.uncovered-lines-preview: Must be zero or positive");
            }
            if (output.getTestsPreview() < 0) {
                errors.add("output.tests-preview: Must be zero or positive");
            }
        }

        if (!errors.isEmpty()) {
            String errorMessage = "Configuration validation failed:\n  - " + String.join("\n  - ", errors);
            throw new TestGenException(
                    TestGenException.ErrorCode.CONFIG_INVALID,
                    errorMessage,
                    "Check your testgen.yml or command line parameters"
            );
        }

        log.info("Configuration validation passed");
    }

    /**
     * Creates any missing section with its default values.
     *
     * @param config the configuration to apply defaults to
     */
    public static void applyDefaults(AppConfig config) {
        if (config == null) {
            return;
        }

        if (config.getReport() == null) {
            config.setReport(new AppConfig.ReportConfig());
        }
        if (config.getGeneration() == null) {
            config.setGeneration(new AppConfig.GenerationConfig());
        }
        if (config.getOutput() == null) {
            config.setOutput(new AppConfig.OutputConfig());
        }

        log.debug("Configuration defaults applied");
    }

    /**
     * Validates and applies defaults in one call.
     *
     * @param config the configuration to process
     * @throws TestGenException if a value is out of range
     */
    public static void validateAndApplyDefaults(AppConfig config) {
        applyDefaults(config);
        validate(config);
    }

    /**
     * Creates a summary of the effective configuration for display.
     */
    public static String getConfigSummary(AppConfig config) {
        if (config == null) {
            return "Configuration not loaded";
        }

        StringBuilder sb = new StringBuilder();
        sb.append("=== Configuration Summary ===\n");
        if (config.getReport() != null) {
            sb.append("Report:\n");
            sb.append("  Path: ").append(config.getReport().getPath()).append("\n");
        }
        if (config.getGeneration() != null) {
            sb.append("Generation:\n");
            sb.append("  Max Tests Per Gap: ").append(config.getGeneration().getMaxTestsPerGap()).append("\n");
        }
        if (config.getOutput() != null) {
            AppConfig.OutputConfig output = config.getOutput();
            sb.append("Output:\n");
            sb.append("  Directory: ").append(output.getDirectory()).append("\n");
            sb.append("  Overwrite: ").append(output.isOverwrite()).append("\n");
            sb.append("  Top Gaps: ").append(output.getTopGaps()).append("\n");
            sb.append("  Summary Top N: ").append(output.getSummaryTopN()).append("\n");
        }
        sb.append("=============================\n");

        return sb.toString();
    }

    private static boolean isNullOrEmpty(String str) {
        if (str == null || str.trim().isEmpty()) {
            return true;
        }
        // Check if it's an unresolved environment variable
        return str.contains("${env:") && str.contains("}");
    }
}
