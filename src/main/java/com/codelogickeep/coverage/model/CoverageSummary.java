package com.codelogickeep.coverage.model;

import java.util.Collection;

/**
 * 覆盖率汇总 - 行/函数/分支的 found/hit 计数
 *
 * 百分比为派生值，found 为 0 时定义为 0.0
 */
public record CoverageSummary(
        int linesFound,
        int linesHit,
        int functionsFound,
        int functionsHit,
        int branchesFound,
        int branchesHit
) {

    public static final CoverageSummary EMPTY = new CoverageSummary(0, 0, 0, 0, 0, 0);

    public CoverageSummary {
        requireNonNegative("linesFound", linesFound);
        requireNonNegative("linesHit", linesHit);
        requireNonNegative("functionsFound", functionsFound);
        requireNonNegative("functionsHit", functionsHit);
        requireNonNegative("branchesFound", branchesFound);
        requireNonNegative("branchesHit", branchesHit);
    }

    /**
     * 逐字段求和，超出 int 范围时截断为 {@link Integer#MAX_VALUE}
     */
    public static CoverageSummary sum(Collection<FileCoverage> files) {
        long linesFound = 0;
        long linesHit = 0;
        long functionsFound = 0;
        long functionsHit = 0;
        long branchesFound = 0;
        long branchesHit = 0;

        for (FileCoverage file : files) {
            CoverageSummary s = file.summary();
            linesFound += s.linesFound;
            linesHit += s.linesHit;
            functionsFound += s.functionsFound;
            functionsHit += s.functionsHit;
            branchesFound += s.branchesFound;
            branchesHit += s.branchesHit;
        }

        return new CoverageSummary(saturate(linesFound), saturate(linesHit),
                saturate(functionsFound), saturate(functionsHit),
                saturate(branchesFound), saturate(branchesHit));
    }

    public CoverageSummary plus(CoverageSummary other) {
        return new CoverageSummary(
                saturate((long) linesFound + other.linesFound),
                saturate((long) linesHit + other.linesHit),
                saturate((long) functionsFound + other.functionsFound),
                saturate((long) functionsHit + other.functionsHit),
                saturate((long) branchesFound + other.branchesFound),
                saturate((long) branchesHit + other.branchesHit));
    }

    public double linePercentage() {
        return percentage(linesHit, linesFound);
    }

    public double functionPercentage() {
        return percentage(functionsHit, functionsFound);
    }

    public double branchPercentage() {
        return percentage(branchesHit, branchesFound);
    }

    public CoverageSummary withLinesFound(int value) {
        return new CoverageSummary(value, linesHit, functionsFound, functionsHit, branchesFound, branchesHit);
    }

    public CoverageSummary withLinesHit(int value) {
        return new CoverageSummary(linesFound, value, functionsFound, functionsHit, branchesFound, branchesHit);
    }

    public CoverageSummary withFunctionsFound(int value) {
        return new CoverageSummary(linesFound, linesHit, value, functionsHit, branchesFound, branchesHit);
    }

    public CoverageSummary withFunctionsHit(int value) {
        return new CoverageSummary(linesFound, linesHit, functionsFound, value, branchesFound, branchesHit);
    }

    public CoverageSummary withBranchesFound(int value) {
        return new CoverageSummary(linesFound, linesHit, functionsFound, functionsHit, value, branchesHit);
    }

    public CoverageSummary withBranchesHit(int value) {
        return new CoverageSummary(linesFound, linesHit, functionsFound, functionsHit, branchesFound, value);
    }

    // hit 可能大于 found（以生成工具的数据为准），百分比仍限制在 [0, 100]
    private static double percentage(int hit, int found) {
        if (found <= 0) {
            return 0.0;
        }
        return Math.min(100.0, (hit * 100.0) / found);
    }

    private static int saturate(long value) {
        return (int) Math.min(value, Integer.MAX_VALUE);
    }

    private static void requireNonNegative(String field, int value) {
        if (value < 0) {
            throw new IllegalArgumentException(field + " must be non-negative: " + value);
        }
    }
}
