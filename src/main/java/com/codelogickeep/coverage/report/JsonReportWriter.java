package com.codelogickeep.coverage.report;

import com.codelogickeep.coverage.exception.CoverageException;
import com.codelogickeep.coverage.model.CoverageData;
import com.codelogickeep.coverage.model.CoverageSummary;
import com.codelogickeep.coverage.model.FileCoverage;
import com.codelogickeep.coverage.model.LineCoverage;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;

import static com.codelogickeep.coverage.exception.CoverageException.ErrorCode.REPORT_WRITE_FAILED;

/**
 * JSON 报告 - 汇总百分比 + 每个文件/每行的明细
 */
public class JsonReportWriter {

    private static final ObjectMapper mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    private final Clock clock;

    public JsonReportWriter() {
        this(Clock.systemUTC());
    }

    JsonReportWriter(Clock clock) {
        this.clock = clock;
    }

    public ObjectNode toJson(CoverageData data) {
        ObjectNode root = mapper.createObjectNode();
        root.put("timestamp", Instant.now(clock).toString());

        ObjectNode summary = summaryToJson(data.summary());
        summary.put("totalFiles", data.fileCount());
        root.set("summary", summary);

        ArrayNode files = mapper.createArrayNode();
        for (FileCoverage file : data.files()) {
            files.add(fileToJson(file));
        }
        root.set("files", files);

        return root;
    }

    public String write(CoverageData data) {
        try {
            return mapper.writeValueAsString(toJson(data));
        } catch (JsonProcessingException e) {
            throw new CoverageException(REPORT_WRITE_FAILED,
                    "Failed to serialize JSON report: " + e.getOriginalMessage(), null, e);
        }
    }

    public void write(CoverageData data, Path outputPath) {
        try {
            Path parent = outputPath.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            mapper.writeValue(outputPath.toFile(), toJson(data));
        } catch (IOException e) {
            throw new CoverageException(REPORT_WRITE_FAILED,
                    "Failed to write JSON report: " + e.getMessage(),
                    "Output: " + outputPath, e);
        }
    }

    private static ObjectNode fileToJson(FileCoverage file) {
        ObjectNode node = mapper.createObjectNode();
        node.put("sourceFile", file.path());
        node.set("summary", summaryToJson(file.summary()));

        ArrayNode lines = mapper.createArrayNode();
        for (LineCoverage line : file.lines()) {
            ObjectNode lineNode = mapper.createObjectNode();
            lineNode.put("lineNumber", line.lineNumber());
            lineNode.put("hitCount", line.hitCount());
            lineNode.put("isCovered", line.isCovered());
            lines.add(lineNode);
        }
        node.set("lines", lines);
        return node;
    }

    private static ObjectNode summaryToJson(CoverageSummary s) {
        ObjectNode node = mapper.createObjectNode();
        node.put("totalLines", s.linesFound());
        node.put("coveredLines", s.linesHit());
        node.put("linePercentage", s.linePercentage());
        node.put("totalFunctions", s.functionsFound());
        node.put("coveredFunctions", s.functionsHit());
        node.put("functionPercentage", s.functionPercentage());
        node.put("totalBranches", s.branchesFound());
        node.put("coveredBranches", s.branchesHit());
        node.put("branchPercentage", s.branchPercentage());
        return node;
    }
}
