package com.codelogickeep.testgen.exception;

import java.util.ArrayList;
import java.util.List;

/**
 * Unified exception for report parsing, scaffold output and configuration errors.
 * Carries a structured error code so the CLI can print a useful message and exit code.
 */
public class TestGenException extends RuntimeException {

    private final ErrorCode errorCode;
    private final String context;
    /** Overrides the error code's default suggestion when set */
    private final String suggestionOverride;

    public TestGenException(ErrorCode errorCode, String message) {
        this(errorCode, message, null, null, null);
    }

    public TestGenException(ErrorCode errorCode, String message, String context) {
        this(errorCode, message, context, null, null);
    }

    public TestGenException(ErrorCode errorCode, String message, String context, Throwable cause) {
        this(errorCode, message, context, cause, null);
    }

    private TestGenException(ErrorCode errorCode, String message, String context, Throwable cause,
                             String suggestionOverride) {
        super(message, cause);
        this.errorCode = errorCode;
        this.context = context;
        this.suggestionOverride = suggestionOverride;
    }

    /**
     * For failures that need a suggestion specific to the input, e.g. a report path that is a directory.
     */
    public static Builder builder(ErrorCode errorCode, String message) {
        return new Builder(errorCode, message);
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    public String getContext() {
        return context;
    }

    public String getSuggestion() {
        return suggestionOverride != null ? suggestionOverride : errorCode.getSuggestion();
    }

    /**
     * True when the failure means no coverage data is available for the requested source.
     */
    public boolean isReportUnreadable() {
        return errorCode == ErrorCode.REPORT_UNREADABLE || errorCode == ErrorCode.REPORT_NOT_FOUND;
    }

    /**
     * One line per present part: "ERROR [code]: message", then Context and Suggestion.
     */
    public String toDisplayMessage() {
        List<String> lines = new ArrayList<>(3);
        lines.add("ERROR [" + errorCode.getCode() + "]: " + getMessage());
        if (context != null && !context.isEmpty()) {
            lines.add("Context: " + context);
        }
        String suggestion = getSuggestion();
        if (suggestion != null && !suggestion.isEmpty()) {
            lines.add("Suggestion: " + suggestion);
        }
        return String.join("\n", lines);
    }

    @Override
    public String toString() {
        return toDisplayMessage();
    }

    public static final class Builder {
        private final ErrorCode errorCode;
        private final String message;
        private String context;
        private String suggestion;
        private Throwable cause;

        private Builder(ErrorCode errorCode, String message) {
            this.errorCode = errorCode;
            this.message = message;
        }

        public Builder context(String context) {
            this.context = context;
            return this;
        }

        public Builder suggestion(String suggestion) {
            this.suggestion = suggestion;
            return this;
        }

        public Builder cause(Throwable cause) {
            this.cause = cause;
            return this;
        }

        public TestGenException build() {
            return new TestGenException(errorCode, message, context, cause, suggestion);
        }
    }

    public enum ErrorCode {
        // Report Errors (1xx)
        REPORT_NOT_FOUND("E101", "Coverage report not found", "Run 'mvn test jacoco:report' to generate target/site/jacoco/jacoco.xml."),
        REPORT_UNREADABLE("E102", "Coverage report is unreadable", "Ensure the file is a well-formed JaCoCo XML report."),

        // Argument Errors (2xx)
        INVALID_ARGUMENT("E201", "Invalid argument provided", "Check the parameter value and try again."),

        // Output Errors (3xx)
        FILE_WRITE_FAILED("E301", "Failed to write file", "Check that the output directory is writable."),

        // Configuration Errors (6xx)
        CONFIG_NOT_FOUND("E601", "Configuration file not found", "Create a testgen.yml or pass an existing file to --config."),
        CONFIG_INVALID("E602", "Invalid configuration", "Check the configuration file for invalid values."),

        UNKNOWN_ERROR("E999", "Unknown error occurred", "Check the logs for more details.");

        private final String code;
        private final String description;
        private final String suggestion;

        ErrorCode(String code, String description, String suggestion) {
            this.code = code;
            this.description = description;
            this.suggestion = suggestion;
        }

        public String getCode() {
            return code;
        }

        public String getDescription() {
            return description;
        }

        public String getSuggestion() {
            return suggestion;
        }
    }
}
