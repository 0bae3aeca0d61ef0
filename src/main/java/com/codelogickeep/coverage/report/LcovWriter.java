package com.codelogickeep.coverage.report;

import com.codelogickeep.coverage.exception.CoverageException;
import com.codelogickeep.coverage.model.CoverageData;
import com.codelogickeep.coverage.model.CoverageSummary;
import com.codelogickeep.coverage.model.FileCoverage;
import com.codelogickeep.coverage.model.LineCoverage;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static com.codelogickeep.coverage.exception.CoverageException.ErrorCode.REPORT_WRITE_FAILED;

/**
 * 将 CoverageData 输出为 LCOV 文本
 *
 * 所有计数器都会输出（包括 0），保证重新解析后字段完全一致。
 */
public class LcovWriter {

    public String write(CoverageData data) {
        StringBuilder sb = new StringBuilder();
        for (FileCoverage file : data.files()) {
            CoverageSummary s = file.summary();
            sb.append("TN:\n");
            sb.append("SF:").append(file.path()).append('\n');
            sb.append("FNF:").append(s.functionsFound()).append('\n');
            sb.append("FNH:").append(s.functionsHit()).append('\n');
            for (LineCoverage line : file.lines()) {
                sb.append("DA:").append(line.lineNumber()).append(',').append(line.hitCount()).append('\n');
            }
            sb.append("LF:").append(s.linesFound()).append('\n');
            sb.append("LH:").append(s.linesHit()).append('\n');
            sb.append("BRF:").append(s.branchesFound()).append('\n');
            sb.append("BRH:").append(s.branchesHit()).append('\n');
            sb.append("end_of_record\n");
        }
        return sb.toString();
    }

    public void write(CoverageData data, Path outputPath) {
        try {
            Path parent = outputPath.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(outputPath, write(data), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new CoverageException(REPORT_WRITE_FAILED,
                    "Failed to write LCOV report: " + e.getMessage(),
                    "Output: " + outputPath, e);
        }
    }
}
