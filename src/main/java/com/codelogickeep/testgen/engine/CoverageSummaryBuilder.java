package com.codelogickeep.testgen.engine;

import com.codelogickeep.testgen.model.CoverageGap;
import com.codelogickeep.testgen.model.CoverageReport;
import com.codelogickeep.testgen.model.CoverageSummary;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;

/**
 * Builds the top-N summary shown by the CLI.
 */
public class CoverageSummaryBuilder {

    public CoverageSummary summarize(CoverageReport report, int topN) {
        List<CoverageGap> gaps = report.getGaps();
        int limit = Math.max(0, Math.min(topN, gaps.size()));

        return CoverageSummary.builder()
                .totalLineCoveragePct(round(report.getTotalLineCoveragePct()))
                .totalBranchCoveragePct(round(report.getTotalBranchCoveragePct()))
                .coverageGapPct(round(100.0 - report.getTotalLineCoveragePct()))
                .totalMethodsWithGaps(gaps.size())
                .topGaps(gaps.subList(0, limit))
                .build();
    }

    public static double round(double value) {
        return BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_EVEN).doubleValue();
    }
}
