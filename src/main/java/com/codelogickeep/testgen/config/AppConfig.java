package com.codelogickeep.testgen.config;

import com.fasterxml.jackson.annotation.JsonMerge;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

@Data
public class AppConfig {
    // Merged so a later layer only overrides the keys it sets
    @JsonMerge
    private ReportConfig report;
    @JsonMerge
    private GenerationConfig generation;
    @JsonMerge
    private OutputConfig output;

    @Data
    public static class ReportConfig {
        /**
         * Report used when no --report is given, relative to the working directory
         */
        private String path = "target/site/jacoco/jacoco.xml";
    }

    @Data
    public static class GenerationConfig {
        @JsonProperty("max-tests-per-gap")
        private int maxTestsPerGap = 3; // cases generated per coverage gap
    }

    @Data
    public static class OutputConfig {
        private String directory = "target/generated-test-scaffolds";
        private boolean overwrite = false;
        @JsonProperty("top-gaps")
        private int topGaps = 20; // gaps listed by the parse command
        @JsonProperty("summary-top-n")
        private int summaryTopN = 10; // gaps listed by the summary command
        @JsonProperty("uncovered-lines-preview")
        private int uncoveredLinesPreview = 5; // uncovered line numbers shown per gap
        @JsonProperty("tests-preview")
        private int testsPreview = 10; // generated tests echoed by the generate command
    }
}
