package com.codelogickeep.coverage.engine;

import com.codelogickeep.coverage.model.CoverageData;
import com.codelogickeep.coverage.model.CoverageSummary;
import com.codelogickeep.coverage.model.FileCoverage;
import com.codelogickeep.coverage.model.LineCoverage;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 计算两份覆盖数据之间的逐行差异
 *
 * 文件按记录路径精确匹配；同一文件中 hitCount 差值为 0 的行被丢弃，
 * 基准中不存在的行或文件原样保留。
 */
public class CoverageDeltaCalculator {

    public CoverageData calculate(CoverageData base, CoverageData current) {
        Map<String, FileCoverage> baseFiles = new HashMap<>();
        for (FileCoverage file : base.files()) {
            baseFiles.put(file.path(), file);
        }

        List<FileCoverage> deltaFiles = new ArrayList<>();
        for (FileCoverage currentFile : current.files()) {
            FileCoverage baseFile = baseFiles.get(currentFile.path());
            if (baseFile == null) {
                deltaFiles.add(currentFile);
                continue;
            }

            List<LineCoverage> deltaLines = diffLines(baseFile, currentFile);
            if (!deltaLines.isEmpty()) {
                deltaFiles.add(new FileCoverage(currentFile.path(), deltaLines, summarize(deltaLines)));
            }
        }

        return CoverageData.of(deltaFiles);
    }

    private List<LineCoverage> diffLines(FileCoverage baseFile, FileCoverage currentFile) {
        Map<Integer, LineCoverage> baseLines = new HashMap<>();
        for (LineCoverage line : baseFile.lines()) {
            baseLines.put(line.lineNumber(), line);
        }

        List<LineCoverage> deltaLines = new ArrayList<>();
        for (LineCoverage currentLine : currentFile.lines()) {
            LineCoverage baseLine = baseLines.get(currentLine.lineNumber());
            if (baseLine == null) {
                deltaLines.add(currentLine);
                continue;
            }
            long delta = currentLine.hitCount() - baseLine.hitCount();
            if (delta != 0) {
                deltaLines.add(LineCoverage.delta(currentLine.lineNumber(), delta));
            }
        }
        return deltaLines;
    }

    // 行级数据没有函数/分支信息
    private CoverageSummary summarize(List<LineCoverage> lines) {
        int hit = (int) lines.stream().filter(LineCoverage::isCovered).count();
        return new CoverageSummary(lines.size(), hit, 0, 0, 0, 0);
    }
}
