package com.codelogickeep.testgen;

import com.codelogickeep.testgen.config.AppConfig;
import com.codelogickeep.testgen.config.ConfigLoader;
import com.codelogickeep.testgen.engine.CoverageSummaryBuilder;
import com.codelogickeep.testgen.engine.CoverageWorkflow;
import com.codelogickeep.testgen.engine.StatsAnnotator;
import com.codelogickeep.testgen.exception.TestGenException;
import com.codelogickeep.testgen.framework.util.JsonUtil;
import com.codelogickeep.testgen.model.CoverageGap;
import com.codelogickeep.testgen.model.CoverageReport;
import com.codelogickeep.testgen.model.CoverageStats;
import com.codelogickeep.testgen.model.GeneratedTest;
import com.codelogickeep.testgen.tools.TestFileWriter;
import lombok.extern.slf4j.Slf4j;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.Callable;

@Command(name = "jacoco-test-generator", mixinStandardHelpOptions = true, version = "0.1.0",
        description = "Finds uncovered methods in a JaCoCo XML report and generates JUnit 5 test scaffolds.",
        subcommands = {
                App.ParseCommand.class,
                App.SummaryCommand.class,
                App.GenerateCommand.class,
                App.AnnotateCommand.class
        })
@Slf4j
public class App implements Callable<Integer> {

    @Spec
    private CommandSpec spec;

    public static void main(String[] args) {
        if (args.length == 0) {
            System.out.println("JaCoCo Test Generator: turns coverage gaps into JUnit 5 test scaffolds.");
            System.out.println();
            new CommandLine(new App()).usage(System.out);
            System.exit(0);
        }
        System.exit(newCommandLine().execute(args));
    }

    /**
     * Command line with failures mapped to a readable message and exit code 1.
     * Commands run with {@code --json} also print the error as JSON on stdout.
     */
    public static CommandLine newCommandLine() {
        CommandLine commandLine = new CommandLine(new App());
        commandLine.setExecutionExceptionHandler((ex, cmd, parseResult) -> {
            TestGenException error;
            if (ex instanceof TestGenException) {
                error = (TestGenException) ex;
            } else {
                log.error("Unexpected failure in {}", cmd.getCommandName(), ex);
                error = TestGenException.builder(TestGenException.ErrorCode.UNKNOWN_ERROR, String.valueOf(ex.getMessage()))
                        .context(ex.getClass().getName())
                        .cause(ex)
                        .build();
            }
            if (cmd.getParseResult().hasMatchedOption("--json")) {
                cmd.getOut().println(JsonUtil.toJson(JsonUtil.errorToJson(error)));
                cmd.getOut().flush();
            }
            cmd.getErr().println(error.toDisplayMessage());
            return 1;
        });
        return commandLine;
    }

    @Override
    public Integer call() {
        spec.commandLine().usage(spec.commandLine().getOut());
        return 0;
    }

    /**
     * Options shared by every subcommand.
     */
    public static class CommonOptions {
        @Option(names = {"-r", "--report"}, description = "Path to the JaCoCo XML report (defaults to report.path in testgen.yml)")
        String reportPath;

        @Option(names = {"-c", "--config"}, description = "Path to a configuration file that overrides testgen.yml")
        String configPath;

        AppConfig loadConfig() {
            return new ConfigLoader().load(configPath);
        }

        String resolveReportPath(AppConfig config) {
            return reportPath != null ? reportPath : config.getReport().getPath();
        }
    }

    @Command(name = "parse", mixinStandardHelpOptions = true,
            description = "Parse a coverage report and list the least covered methods.")
    public static class ParseCommand implements Callable<Integer> {
        @Spec
        CommandSpec spec;

        @Mixin
        CommonOptions common;

        @Option(names = {"--top"}, description = "Number of gaps to list (defaults to output.top-gaps)")
        Integer top;

        @Option(names = {"--json"}, description = "Print JSON instead of text")
        boolean json;

        @Override
        public Integer call() {
            AppConfig config = common.loadConfig();
            CoverageReport report = new CoverageWorkflow().analyze(common.resolveReportPath(config));
            int topN = top != null ? top : config.getOutput().getTopGaps();
            int linesPreview = config.getOutput().getUncoveredLinesPreview();
            PrintWriter out = spec.commandLine().getOut();

            if (json) {
                out.println(JsonUtil.toJson(JsonUtil.reportToJson(report, topN, linesPreview)));
                return 0;
            }

            out.println("Coverage Summary:");
            out.println(String.format(Locale.ROOT, "  Line Coverage:      %.2f%%", report.getTotalLineCoveragePct()));
            out.println(String.format(Locale.ROOT, "  Branch Coverage:    %.2f%%", report.getTotalBranchCoveragePct()));
            out.println("  Methods with gaps:  " + report.getGaps().size());

            List<CoverageGap> gaps = report.getGaps();
            int limit = Math.min(topN, gaps.size());
            if (limit > 0) {
                out.println();
                out.println("Top " + limit + " Coverage Gaps:");
            }
            for (int i = 0; i < limit; i++) {
                CoverageGap gap = gaps.get(i);
                List<Integer> lines = gap.getUncoveredLines();
                out.println();
                out.println("  " + (i + 1) + ". " + gap.getClassFullName() + "." + gap.getMethodSignature());
                out.println(String.format(Locale.ROOT, "     Line Coverage:    %.2f%%", gap.getLineCoveragePct()));
                out.println(String.format(Locale.ROOT, "     Branch Coverage:  %.2f%%", gap.getBranchCoveragePct()));
                out.println("     Uncovered lines:  " + lines.subList(0, Math.min(linesPreview, lines.size())));
            }
            out.flush();
            return 0;
        }
    }

    @Command(name = "summary", mixinStandardHelpOptions = true,
            description = "Print a JSON coverage summary with the top uncovered methods.")
    public static class SummaryCommand implements Callable<Integer> {
        @Spec
        CommandSpec spec;

        @Mixin
        CommonOptions common;

        @Option(names = {"--top"}, description = "Number of methods to include (defaults to output.summary-top-n)")
        Integer top;

        @Override
        public Integer call() {
            AppConfig config = common.loadConfig();
            CoverageReport report = new CoverageWorkflow().analyze(common.resolveReportPath(config));
            int topN = top != null ? top : config.getOutput().getSummaryTopN();
            spec.commandLine().getOut().println(
                    JsonUtil.toJson(JsonUtil.summaryToJson(new CoverageSummaryBuilder().summarize(report, topN))));
            return 0;
        }
    }

    @Command(name = "generate", mixinStandardHelpOptions = true,
            description = "Generate JUnit 5 test scaffolds for the least covered methods.")
    public static class GenerateCommand implements Callable<Integer> {
        @Spec
        CommandSpec spec;

        @Mixin
        CommonOptions common;

        @Option(names = {"-n", "--max-tests-per-gap"}, description = "Test cases per coverage gap (defaults to generation.max-tests-per-gap)")
        Integer maxTestsPerGap;

        @Option(names = {"-o", "--output"}, description = "Write one test class per target class below this directory")
        String outputDir;

        @Option(names = {"--write"}, description = "Write test files to output.directory from testgen.yml when no --output is given")
        boolean write;

        @Option(names = {"--overwrite"}, description = "Replace existing test files in the output directory")
        boolean overwrite;

        @Option(names = {"--json"}, description = "Print JSON instead of text")
        boolean json;

        @Override
        public Integer call() {
            AppConfig config = common.loadConfig();
            int perGap = maxTestsPerGap != null ? maxTestsPerGap : config.getGeneration().getMaxTestsPerGap();
            if (perGap < 0) {
                throw new TestGenException(TestGenException.ErrorCode.INVALID_ARGUMENT,
                        "--max-tests-per-gap must be zero or positive, got " + perGap);
            }

            CoverageWorkflow workflow = new CoverageWorkflow();
            CoverageWorkflow.GenerationResult result = workflow.generate(common.resolveReportPath(config), perGap);
            List<GeneratedTest> tests = result.getTests();
            int preview = config.getOutput().getTestsPreview();
            PrintWriter out = spec.commandLine().getOut();

            if (json) {
                out.println(JsonUtil.toJson(JsonUtil.testsToJson(tests, preview)));
            } else {
                out.println("Generated " + tests.size() + " test cases");
                tests.stream().limit(preview).forEach(test -> {
                    out.println();
                    out.println("  " + test.getTestClassName() + "." + test.getTestMethodName()
                            + " -> " + test.getTargetClass() + "." + test.getTargetMethod());
                    out.println(test.getTestBody());
                });
            }

            if (outputDir != null || write) {
                String targetDir = outputDir != null ? outputDir : config.getOutput().getDirectory();
                Map<String, String> documents = workflow.assemble(tests);
                boolean replace = overwrite || config.getOutput().isOverwrite();
                List<Path> written = new TestFileWriter(replace).write(Paths.get(targetDir), documents);
                if (!json) {
                    out.println();
                    out.println("Wrote " + written.size() + " of " + documents.size() + " test files to " + targetDir);
                    written.forEach(path -> out.println("  " + path));
                }
            }
            out.flush();
            return 0;
        }
    }

    @Command(name = "annotate", mixinStandardHelpOptions = true,
            description = "Append coverage statistics to a commit message or pull request body.")
    public static class AnnotateCommand implements Callable<Integer> {
        @Spec
        CommandSpec spec;

        @Mixin
        CommonOptions common;

        @Option(names = {"-m", "--message"}, required = true, description = "Commit message or pull request body to annotate")
        String message;

        @Option(names = {"--pull-request"}, description = "Format as a pull request body section")
        boolean pullRequest;

        @Option(names = {"-n", "--max-tests-per-gap"}, description = "Test cases per gap used to count generated tests")
        Integer maxTestsPerGap;

        @Option(names = {"--improvement"}, description = "Coverage improvement in percentage points, shown in pull request bodies")
        Double improvement;

        @Override
        public Integer call() {
            AppConfig config = common.loadConfig();
            int perGap = maxTestsPerGap != null ? maxTestsPerGap : config.getGeneration().getMaxTestsPerGap();
            CoverageWorkflow.GenerationResult result =
                    new CoverageWorkflow().generate(common.resolveReportPath(config), Math.max(0, perGap));

            CoverageStats stats = CoverageStats.from(result.getReport(), result.getTests());
            if (improvement != null) {
                stats = stats.toBuilder().coverageImprovementPct(improvement).build();
            }

            StatsAnnotator annotator = new StatsAnnotator();
            String text = pullRequest
                    ? annotator.annotatePullRequestBody(message, stats)
                    : annotator.annotateCommitMessage(message, stats);
            spec.commandLine().getOut().println(text);
            return 0;
        }
    }
}
