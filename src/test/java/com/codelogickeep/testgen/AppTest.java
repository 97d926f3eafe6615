package com.codelogickeep.testgen;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.InputStream;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end tests of the command line against the bundled sample report.
 */
@DisplayName("App CLI Tests")
class AppTest {

    @TempDir
    Path tempDir;

    private Path report;
    private StringWriter out;
    private StringWriter err;
    private CommandLine cmd;

    @BeforeEach
    void setUp() throws Exception {
        report = tempDir.resolve("jacoco.xml");
        try (InputStream in = getClass().getResourceAsStream("/reports/sample-jacoco.xml")) {
            Files.copy(in, report);
        }
        out = new StringWriter();
        err = new StringWriter();
        cmd = App.newCommandLine();
        cmd.setOut(new PrintWriter(out, true));
        cmd.setErr(new PrintWriter(err, true));
    }

    private int run(String... args) {
        return cmd.execute(args);
    }

    @Nested
    @DisplayName("parse")
    class Parse {

        @Test
        @DisplayName("should print totals and the lowest covered method first")
        void shouldPrintTextSummary() {
            int exitCode = run("parse", "-r", report.toString());

            assertEquals(0, exitCode);
            String text = out.toString();
            assertTrue(text.contains("Coverage Summary:"));
            assertTrue(text.contains("Line Coverage:      58.33%"));
            assertTrue(text.contains("Methods with gaps:  3"));
            assertTrue(text.indexOf("com.acme.Widget.resize(II)V") < text.indexOf("com.acme.Widget.render()V"));
        }

        @Test
        @DisplayName("should print JSON limited to --top gaps")
        void shouldPrintJson() throws Exception {
            assertEquals(0, run("parse", "-r", report.toString(), "--json", "--top", "1"));

            JsonNode node = new ObjectMapper().readTree(out.toString());
            assertEquals(3, node.get("total_gaps").asInt());
            assertEquals(1, node.get("top_gaps").size());
        }

        @Test
        @DisplayName("should exit with 1 and a readable error for a missing report")
        void shouldReportMissingFile() {
            int exitCode = run("parse", "-r", tempDir.resolve("missing.xml").toString());

            assertEquals(1, exitCode);
            assertTrue(err.toString().contains("ERROR [E101]"));
        }

        @Test
        @DisplayName("should print a JSON error for an unreadable report with --json")
        void shouldPrintJsonError() throws Exception {
            Path broken = tempDir.resolve("broken.xml");
            Files.writeString(broken, "<report><package");

            assertEquals(1, run("parse", "-r", broken.toString(), "--json"));

            JsonNode node = new ObjectMapper().readTree(out.toString());
            assertFalse(node.get("success").asBoolean());
            assertEquals("E102", node.get("error_code").asText());
            assertTrue(node.get("report_unreadable").asBoolean());
        }
    }

    @Test
    @DisplayName("summary should print JSON totals")
    void summary_shouldPrintJson() throws Exception {
        assertEquals(0, run("summary", "-r", report.toString(), "--top", "2"));

        JsonNode node = new ObjectMapper().readTree(out.toString());
        assertEquals(58.33, node.get("summary").get("total_line_coverage").asDouble());
        assertEquals(2, node.get("top_uncovered_methods").size());
    }

    @Nested
    @DisplayName("generate")
    class Generate {

        @Test
        @DisplayName("should write one test file per target class")
        void shouldWriteTestFiles() throws Exception {
            Path output = tempDir.resolve("scaffolds");

            int exitCode = run("generate", "-r", report.toString(), "-n", "1", "-o", output.toString());

            assertEquals(0, exitCode);
            assertTrue(out.toString().contains("Generated 3 test cases"));
            String widget = Files.readString(output.resolve("com/acme/test/WidgetTest.java"));
            assertTrue(widget.startsWith("package com.acme.test;"));
            assertTrue(widget.contains("public void testResize_Case1()"));
            assertTrue(Files.exists(output.resolve("com/acme/util/test/StringsTest.java")));
        }

        @Test
        @DisplayName("should write to the configured output directory with --write")
        void shouldWriteToConfiguredDirectory() throws Exception {
            Path configured = tempDir.resolve("configured-out");
            Path configFile = tempDir.resolve("ci.yml");
            Files.writeString(configFile, "output:\n  directory: '" + configured.toString().replace("'", "''") + "'\n");

            int exitCode = run("generate", "-r", report.toString(), "-c", configFile.toString(), "-n", "1", "--write");

            assertEquals(0, exitCode);
            assertTrue(Files.exists(configured.resolve("com/acme/test/WidgetTest.java")));
            assertTrue(out.toString().contains("test files to " + configured));
        }

        @Test
        @DisplayName("should not write files without --output or --write")
        void shouldNotWriteByDefault() throws Exception {
            Path configured = tempDir.resolve("configured-out");
            Path configFile = tempDir.resolve("ci.yml");
            Files.writeString(configFile, "output:\n  directory: '" + configured.toString().replace("'", "''") + "'\n");

            assertEquals(0, run("generate", "-r", report.toString(), "-c", configFile.toString(), "-n", "1"));

            assertFalse(Files.exists(configured));
        }

        @Test
        @DisplayName("should reject a negative test count")
        void shouldRejectNegativeCount() {
            int exitCode = run("generate", "-r", report.toString(), "-n", "-1");

            assertEquals(1, exitCode);
            assertTrue(err.toString().contains("ERROR [E201]"));
        }

        @Test
        @DisplayName("should generate nothing for zero tests per gap")
        void shouldGenerateNothingForZero() throws Exception {
            assertEquals(0, run("generate", "-r", report.toString(), "-n", "0", "--json"));

            JsonNode node = new ObjectMapper().readTree(out.toString());
            assertEquals(0, node.get("tests_generated").asInt());
        }
    }

    @Nested
    @DisplayName("annotate")
    class Annotate {

        @Test
        @DisplayName("should append a commit message section")
        void shouldAnnotateCommitMessage() {
            assertEquals(0, run("annotate", "-r", report.toString(), "-m", "Add tests", "-n", "2"));

            String text = out.toString();
            assertTrue(text.startsWith("Add tests\n\nCoverage Update:"));
            assertTrue(text.contains("- Line Coverage: 58.33%"));
            assertTrue(text.contains("- Tests Generated: 6"));
            assertTrue(text.contains("- Coverage Gap: 41.67%"));
        }

        @Test
        @DisplayName("should append a pull request section with the improvement")
        void shouldAnnotatePullRequest() {
            assertEquals(0, run("annotate", "-r", report.toString(), "-m", "Body",
                    "--pull-request", "--improvement", "4.5"));

            String text = out.toString();
            assertTrue(text.startsWith("Body\n## Coverage Improvements\n"));
            assertTrue(text.contains("- Coverage Improvement: +4.50%"));
        }

        @Test
        @DisplayName("should fail when the message is missing")
        void shouldRequireMessage() {
            assertEquals(2, run("annotate", "-r", report.toString()));
        }
    }
}
