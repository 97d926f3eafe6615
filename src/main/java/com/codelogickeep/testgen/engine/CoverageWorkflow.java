package com.codelogickeep.testgen.engine;

import com.codelogickeep.testgen.model.CoverageReport;
import com.codelogickeep.testgen.model.GeneratedTest;
import com.codelogickeep.testgen.tools.JacocoReportParser;
import com.codelogickeep.testgen.tools.TestScaffoldGenerator;
import lombok.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Chains report parsing, scaffold generation and test file assembly.
 */
public class CoverageWorkflow {
    private static final Logger log = LoggerFactory.getLogger(CoverageWorkflow.class);

    private final JacocoReportParser parser;
    private final TestScaffoldGenerator generator;

    public CoverageWorkflow() {
        this(new JacocoReportParser(), new TestScaffoldGenerator());
    }

    public CoverageWorkflow(JacocoReportParser parser, TestScaffoldGenerator generator) {
        this.parser = parser;
        this.generator = generator;
    }

    public CoverageReport analyze(String reportPath) {
        return parser.parse(reportPath);
    }

    public GenerationResult generate(String reportPath, int maxTestsPerGap) {
        CoverageReport report = parser.parse(reportPath);
        List<GeneratedTest> tests = generator.generateTests(report.getGaps(), maxTestsPerGap);
        log.info("Generated {} tests for {} gaps", tests.size(), report.getGaps().size());
        return new GenerationResult(report, tests);
    }

    /**
     * Groups tests by target class and formats one document per test class.
     *
     * @return relative file path (e.g. "com/acme/test/WidgetTest.java") to document text, in generation order
     */
    public Map<String, String> assemble(List<GeneratedTest> tests) {
        Map<String, List<GeneratedTest>> byTargetClass = new LinkedHashMap<>();
        for (GeneratedTest test : tests) {
            byTargetClass.computeIfAbsent(test.getTargetClass(), k -> new ArrayList<>()).add(test);
        }

        Map<String, String> documents = new LinkedHashMap<>();
        for (List<GeneratedTest> classTests : byTargetClass.values()) {
            GeneratedTest first = classTests.get(0);
            String packageName = first.getTargetPackage();
            documents.put(testFilePath(packageName, first.getTestClassName()),
                    generator.formatTestFile(first.getTestClassName(), packageName, classTests));
        }
        return documents;
    }

    static String testFilePath(String packageName, String testClassName) {
        if (packageName == null || packageName.isEmpty()) {
            return testClassName + ".java";
        }
        return packageName.replace('.', '/') + "/test/" + testClassName + ".java";
    }

    @Value
    public static class GenerationResult {
        CoverageReport report;
        List<GeneratedTest> tests;
    }
}
