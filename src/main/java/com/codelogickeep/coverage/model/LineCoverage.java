package com.codelogickeep.coverage.model;

/**
 * 单行覆盖信息
 *
 * @param lineNumber 1-based 行号
 * @param hitCount   执行次数（可能超过 int 范围）；仅增量结果中可为负数
 */
public record LineCoverage(int lineNumber, long hitCount) {

    public LineCoverage {
        if (lineNumber < 1) {
            throw new IllegalArgumentException("lineNumber must be positive: " + lineNumber);
        }
    }

    /**
     * Creates a regular line record; hit count must be non-negative.
     */
    public static LineCoverage of(int lineNumber, long hitCount) {
        if (hitCount < 0) {
            throw new IllegalArgumentException("hitCount must be non-negative: " + hitCount);
        }
        return new LineCoverage(lineNumber, hitCount);
    }

    /**
     * Creates a signed difference record, used by coverage deltas.
     */
    public static LineCoverage delta(int lineNumber, long hitCountDelta) {
        return new LineCoverage(lineNumber, hitCountDelta);
    }

    public boolean isCovered() {
        return hitCount > 0;
    }
}
