package com.codelogickeep.coverage.model;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * 单个源文件的覆盖数据
 *
 * summary 来自记录级计数 (LF/LH/...)，不要求与 lines 的数量一致
 */
public record FileCoverage(String path, List<LineCoverage> lines, CoverageSummary summary) {

    public FileCoverage {
        Objects.requireNonNull(path, "path");
        lines = lines == null ? List.of() : List.copyOf(lines);
        summary = summary == null ? CoverageSummary.EMPTY : summary;
    }

    public List<LineCoverage> coveredLines() {
        return lines.stream().filter(LineCoverage::isCovered).collect(Collectors.toList());
    }

    public List<LineCoverage> uncoveredLines() {
        return lines.stream().filter(l -> !l.isCovered()).collect(Collectors.toList());
    }
}
