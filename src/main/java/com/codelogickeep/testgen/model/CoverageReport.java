package com.codelogickeep.testgen.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Result of parsing one coverage report: report-level totals and the gaps,
 * lowest line coverage first.
 */
@Value
@Builder
public class CoverageReport {
    double totalLineCoveragePct;

    double totalBranchCoveragePct;

    @Singular
    List<CoverageGap> gaps;

    public static CoverageReport empty() {
        return CoverageReport.builder().build();
    }
}
