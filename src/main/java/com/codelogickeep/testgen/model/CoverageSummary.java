package com.codelogickeep.testgen.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Bounded projection of a report for display: rounded totals and the lowest-covered gaps.
 */
@Value
@Builder
public class CoverageSummary {
    double totalLineCoveragePct;
    double totalBranchCoveragePct;
    double coverageGapPct;
    int totalMethodsWithGaps;

    @Singular
    List<CoverageGap> topGaps;
}
