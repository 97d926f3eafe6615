package com.codelogickeep.testgen.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Coverage statistics attached to commit messages and pull request bodies.
 * Every field is optional; absent fields are left out of the annotation.
 */
@Value
@Builder(toBuilder = true)
public class CoverageStats {
    Double lineCoveragePct;
    Double branchCoveragePct;
    Integer testsGenerated;
    Double coverageGapPct;
    Double coverageImprovementPct;

    public static CoverageStats from(CoverageReport report, List<GeneratedTest> tests) {
        return CoverageStats.builder()
                .lineCoveragePct(report.getTotalLineCoveragePct())
                .branchCoveragePct(report.getTotalBranchCoveragePct())
                .testsGenerated(tests != null ? tests.size() : 0)
                .coverageGapPct(100.0 - report.getTotalLineCoveragePct())
                .build();
    }
}
