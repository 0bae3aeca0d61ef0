package com.codelogickeep.coverage.parser;

import com.codelogickeep.coverage.model.CoverageData;
import com.codelogickeep.coverage.model.CoverageSummary;
import com.codelogickeep.coverage.model.FileCoverage;
import com.codelogickeep.coverage.model.LineCoverage;

import java.util.ArrayList;
import java.util.List;

/**
 * LCOV 记录读取器 - 单遍扫描文本，逐条累积 SF...end_of_record 记录
 *
 * 同步解析与 worker 线程解析共用此实现，保证两条路径行为一致。
 * 实例不可复用，每次解析新建。
 */
final class LcovRecordReader {

    static final String SOURCE_FILE = "SF:";
    static final String LINE_DATA = "DA:";
    static final String LINES_FOUND = "LF:";
    static final String LINES_HIT = "LH:";
    static final String FUNCTIONS_FOUND = "FNF:";
    static final String FUNCTIONS_HIT = "FNH:";
    static final String BRANCHES_FOUND = "BRF:";
    static final String BRANCHES_HIT = "BRH:";
    static final String END_OF_RECORD = "end_of_record";

    private final List<FileCoverage> files = new ArrayList<>();
    private final List<LineCoverage> currentLines = new ArrayList<>();
    private String currentPath;
    private CoverageSummary currentSummary;
    private int skippedLines;

    int skippedLines() {
        return skippedLines;
    }

    void consume(String content) {
        int length = content.length();
        int start = 0;
        while (start <= length) {
            int end = content.indexOf('\n', start);
            if (end < 0) {
                end = length;
            }
            int lineEnd = end;
            if (lineEnd > start && content.charAt(lineEnd - 1) == '\r') {
                lineEnd--;
            }
            if (lineEnd > start) {
                accept(content.substring(start, lineEnd));
            }
            start = end + 1;
        }
    }

    CoverageData finish() {
        flush();
        return CoverageData.of(files);
    }

    private void accept(String line) {
        if (line.startsWith(SOURCE_FILE)) {
            flush();
            currentPath = line.substring(SOURCE_FILE.length());
            currentSummary = CoverageSummary.EMPTY;
            return;
        }
        if (currentPath == null) {
            // 第一个 SF: 之前的内容（如 TN:）没有归属
            return;
        }

        if (line.startsWith(LINE_DATA)) {
            acceptLineData(line.substring(LINE_DATA.length()));
        } else if (line.startsWith(LINES_FOUND)) {
            currentSummary = currentSummary.withLinesFound(count(line, LINES_FOUND));
        } else if (line.startsWith(LINES_HIT)) {
            currentSummary = currentSummary.withLinesHit(count(line, LINES_HIT));
        } else if (line.startsWith(FUNCTIONS_FOUND)) {
            currentSummary = currentSummary.withFunctionsFound(count(line, FUNCTIONS_FOUND));
        } else if (line.startsWith(FUNCTIONS_HIT)) {
            currentSummary = currentSummary.withFunctionsHit(count(line, FUNCTIONS_HIT));
        } else if (line.startsWith(BRANCHES_FOUND)) {
            currentSummary = currentSummary.withBranchesFound(count(line, BRANCHES_FOUND));
        } else if (line.startsWith(BRANCHES_HIT)) {
            currentSummary = currentSummary.withBranchesHit(count(line, BRANCHES_HIT));
        }
        // end_of_record 及其他标签 (TN/FN/FNDA/BRDA) 无需处理，flush 在下一个 SF: 或输入结束时发生
    }

    private void acceptLineData(String payload) {
        int comma = payload.indexOf(',');
        if (comma < 0) {
            skippedLines++;
            return;
        }
        int secondComma = payload.indexOf(',', comma + 1);
        String lineField = payload.substring(0, comma);
        String hitField = secondComma < 0 ? payload.substring(comma + 1) : payload.substring(comma + 1, secondComma);

        Long lineNumber = tryParse(lineField);
        Long hitCount = tryParse(hitField);
        if (lineNumber == null || hitCount == null
                || lineNumber < 1 || lineNumber > Integer.MAX_VALUE || hitCount < 0) {
            skippedLines++;
            return;
        }
        currentLines.add(new LineCoverage(lineNumber.intValue(), hitCount));
    }

    private void flush() {
        if (currentPath == null) {
            return;
        }
        files.add(new FileCoverage(currentPath, currentLines, currentSummary));
        currentLines.clear();
        currentPath = null;
        currentSummary = null;
    }

    // 计数器超出 int 范围时截断
    private int count(String line, String tag) {
        Long value = tryParse(line.substring(tag.length()));
        if (value == null || value < 0) {
            skippedLines++;
            return 0;
        }
        return (int) Math.min(value, Integer.MAX_VALUE);
    }

    private static Long tryParse(String text) {
        String trimmed = text.trim();
        if (trimmed.isEmpty()) {
            return null;
        }
        try {
            return Long.parseLong(trimmed);
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
