package com.codelogickeep.coverage.report;

import com.codelogickeep.coverage.model.CoverageData;
import com.codelogickeep.coverage.model.CoverageSummary;
import com.codelogickeep.coverage.model.FileCoverage;

import java.util.Locale;

/**
 * 控制台摘要输出
 */
public class ConsoleReporter {

    static final int MAX_FILES = 10;

    public String render(CoverageData data) {
        CoverageSummary summary = data.summary();
        StringBuilder sb = new StringBuilder();

        sb.append("\n📈 Coverage Summary:\n");
        sb.append("  Files analyzed: ").append(data.fileCount()).append('\n');
        sb.append("  Lines found: ").append(summary.linesFound()).append('\n');
        sb.append("  Lines hit: ").append(summary.linesHit()).append('\n');
        sb.append(String.format(Locale.ROOT, "  Line coverage: %.1f%%\n", summary.linePercentage()));

        if (summary.functionsFound() > 0) {
            sb.append(String.format(Locale.ROOT, "  Function coverage: %.1f%%\n", summary.functionPercentage()));
        }
        if (summary.branchesFound() > 0) {
            sb.append(String.format(Locale.ROOT, "  Branch coverage: %.1f%%\n", summary.branchPercentage()));
        }

        if (!data.isEmpty()) {
            sb.append("\n📁 File Coverage:\n");
            for (FileCoverage file : data.files().subList(0, Math.min(MAX_FILES, data.fileCount()))) {
                double percentage = file.summary().linePercentage();
                sb.append(String.format(Locale.ROOT, "  %s %s: %.1f%%\n", icon(percentage), file.path(), percentage));
            }
            if (data.fileCount() > MAX_FILES) {
                sb.append("  ... and ").append(data.fileCount() - MAX_FILES).append(" more files\n");
            }
        }

        return sb.toString();
    }

    private static String icon(double percentage) {
        if (percentage >= 80) {
            return "✅";
        }
        return percentage >= 60 ? "⚠️" : "❌";
    }
}
