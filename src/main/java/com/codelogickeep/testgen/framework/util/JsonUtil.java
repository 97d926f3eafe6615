package com.codelogickeep.testgen.framework.util;

import com.codelogickeep.testgen.engine.CoverageSummaryBuilder;
import com.codelogickeep.testgen.exception.TestGenException;
import com.codelogickeep.testgen.model.CoverageGap;
import com.codelogickeep.testgen.model.CoverageReport;
import com.codelogickeep.testgen.model.CoverageSummary;
import com.codelogickeep.testgen.model.GeneratedTest;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;

/**
 * Shapes parse and generation results into the JSON printed by the CLI.
 * Keys are snake_case; percentages are rounded to two decimals.
 */
public class JsonUtil {

    private static final ObjectMapper mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    /**
     * Report totals plus the first {@code topN} gaps, each with at most {@code linesPreview} uncovered lines.
     */
    public static ObjectNode reportToJson(CoverageReport report, int topN, int linesPreview) {
        ObjectNode node = mapper.createObjectNode();
        node.put("success", true);
        node.put("total_line_coverage", CoverageSummaryBuilder.round(report.getTotalLineCoveragePct()));
        node.put("total_branch_coverage", CoverageSummaryBuilder.round(report.getTotalBranchCoveragePct()));
        node.put("total_gaps", report.getGaps().size());

        ArrayNode gaps = node.putArray("top_gaps");
        List<CoverageGap> top = report.getGaps().subList(0, Math.max(0, Math.min(topN, report.getGaps().size())));
        for (CoverageGap gap : top) {
            ObjectNode g = gaps.addObject();
            g.put("class_name", gap.getClassFullName());
            g.put("method_name", gap.getMethodSignature());
            g.put("line_coverage", CoverageSummaryBuilder.round(gap.getLineCoveragePct()));
            g.put("branch_coverage", CoverageSummaryBuilder.round(gap.getBranchCoveragePct()));
            ArrayNode lines = g.putArray("uncovered_lines");
            gap.getUncoveredLines().stream().limit(Math.max(0, linesPreview)).forEach(lines::add);
        }
        return node;
    }

    public static ObjectNode summaryToJson(CoverageSummary summary) {
        ObjectNode node = mapper.createObjectNode();
        node.put("success", true);

        ObjectNode totals = node.putObject("summary");
        totals.put("total_line_coverage", summary.getTotalLineCoveragePct());
        totals.put("total_branch_coverage", summary.getTotalBranchCoveragePct());
        totals.put("coverage_gap", summary.getCoverageGapPct());
        totals.put("total_methods_with_gaps", summary.getTotalMethodsWithGaps());

        ArrayNode methods = node.putArray("top_uncovered_methods");
        for (CoverageGap gap : summary.getTopGaps()) {
            ObjectNode g = methods.addObject();
            g.put("class_name", gap.getClassFullName());
            g.put("method_name", gap.getMethodSignature());
            g.put("line_coverage_percent", CoverageSummaryBuilder.round(gap.getLineCoveragePct()));
            g.put("branch_coverage_percent", CoverageSummaryBuilder.round(gap.getBranchCoveragePct()));
        }
        return node;
    }

    /**
     * Generated test count plus the first {@code preview} tests with their source.
     */
    public static ObjectNode testsToJson(List<GeneratedTest> tests, int preview) {
        ObjectNode node = mapper.createObjectNode();
        node.put("success", true);
        node.put("tests_generated", tests.size());

        ArrayNode array = node.putArray("tests");
        tests.stream().limit(Math.max(0, preview)).forEach(test -> {
            ObjectNode t = array.addObject();
            t.put("test_class", test.getTestClassName());
            t.put("test_method", test.getTestMethodName());
            t.put("target_class", test.getTargetClass());
            t.put("target_method", test.getTargetMethod());
            t.put("test_code", test.getTestBody());
        });
        return node;
    }

    public static ObjectNode errorToJson(TestGenException error) {
        ObjectNode node = mapper.createObjectNode();
        node.put("success", false);
        node.put("error", error.getMessage());
        node.put("error_code", error.getErrorCode().getCode());
        node.put("error_type", error.getErrorCode().getDescription());
        node.put("report_unreadable", error.isReportUnreadable());
        return node;
    }

    public static String toJson(Object value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize JSON: " + e.getMessage(), e);
        }
    }
}
