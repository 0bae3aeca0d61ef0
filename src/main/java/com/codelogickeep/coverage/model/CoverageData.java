package com.codelogickeep.coverage.model;

import java.util.List;

/**
 * 解析后的覆盖数据集合
 *
 * files 不按路径去重；summary 始终等于各文件 summary 的逐字段之和
 */
public record CoverageData(List<FileCoverage> files, CoverageSummary summary) {

    private static final CoverageData EMPTY = new CoverageData(List.of(), CoverageSummary.EMPTY);

    /**
     * @throws IllegalArgumentException if {@code summary} is not the field-wise sum of {@code files}
     */
    public CoverageData {
        files = files == null ? List.of() : List.copyOf(files);
        CoverageSummary expected = CoverageSummary.sum(files);
        if (summary != null && !summary.equals(expected)) {
            throw new IllegalArgumentException("summary " + summary + " does not match files total " + expected);
        }
        summary = expected;
    }

    public static CoverageData empty() {
        return EMPTY;
    }

    /**
     * Builds a value whose summary is recomputed from {@code files}.
     */
    public static CoverageData of(List<FileCoverage> files) {
        return new CoverageData(files, null);
    }

    public boolean isEmpty() {
        return files.isEmpty();
    }

    public int fileCount() {
        return files.size();
    }
}
