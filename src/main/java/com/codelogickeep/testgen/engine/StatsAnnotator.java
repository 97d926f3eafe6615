package com.codelogickeep.testgen.engine;

import com.codelogickeep.testgen.model.CoverageStats;

import java.util.Locale;

/**
 * Appends coverage statistics to commit messages and pull request bodies.
 * Fields missing from {@link CoverageStats} are skipped.
 */
public class StatsAnnotator {

    public String annotateCommitMessage(String message, CoverageStats stats) {
        StringBuilder sb = new StringBuilder(message != null ? message : "");
        if (stats == null) {
            return sb.toString();
        }

        sb.append("\n\nCoverage Update:");
        if (stats.getLineCoveragePct() != null) {
            sb.append("\n- Line Coverage: ").append(percent(stats.getLineCoveragePct()));
        }
        if (stats.getBranchCoveragePct() != null) {
            sb.append("\n- Branch Coverage: ").append(percent(stats.getBranchCoveragePct()));
        }
        if (stats.getTestsGenerated() != null) {
            sb.append("\n- Tests Generated: ").append(stats.getTestsGenerated());
        }
        if (stats.getCoverageGapPct() != null) {
            sb.append("\n- Coverage Gap: ").append(percent(stats.getCoverageGapPct()));
        }
        return sb.toString();
    }

    public String annotatePullRequestBody(String body, CoverageStats stats) {
        StringBuilder sb = new StringBuilder(body != null ? body : "");
        if (stats == null) {
            return sb.toString();
        }

        sb.append("\n## Coverage Improvements\n");
        if (stats.getLineCoveragePct() != null) {
            sb.append("- Line Coverage: ").append(percent(stats.getLineCoveragePct())).append("\n");
        }
        if (stats.getBranchCoveragePct() != null) {
            sb.append("- Branch Coverage: ").append(percent(stats.getBranchCoveragePct())).append("\n");
        }
        if (stats.getTestsGenerated() != null) {
            sb.append("- Tests Generated: ").append(stats.getTestsGenerated()).append("\n");
        }
        if (stats.getCoverageImprovementPct() != null) {
            sb.append("- Coverage Improvement: +").append(percent(stats.getCoverageImprovementPct())).append("\n");
        }
        return sb.toString();
    }

    private static String percent(double value) {
        return String.format(Locale.ROOT, "%.2f%%", value);
    }
}
