package com.codelogickeep.coverage.report;

import com.codelogickeep.coverage.model.CoverageData;
import lombok.extern.slf4j.Slf4j;

import java.io.PrintStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * 按配置的输出格式生成报告
 */
@Slf4j
public class ReportService {

    static final String JSON_FILE = "coverage_report.json";
    static final String LCOV_FILE = "filtered_lcov.info";

    private final LcovWriter lcovWriter;
    private final JsonReportWriter jsonWriter;
    private final ConsoleReporter consoleReporter;
    private final PrintStream out;

    public ReportService(PrintStream out) {
        this(new LcovWriter(), new JsonReportWriter(), new ConsoleReporter(), out);
    }

    ReportService(LcovWriter lcovWriter, JsonReportWriter jsonWriter, ConsoleReporter consoleReporter, PrintStream out) {
        this.lcovWriter = lcovWriter;
        this.jsonWriter = jsonWriter;
        this.consoleReporter = consoleReporter;
        this.out = out;
    }

    /**
     * @return files written, in format order
     */
    public List<Path> generate(CoverageData data, List<String> formats, Path outputDir) {
        List<Path> written = new ArrayList<>();
        for (String format : formats) {
            switch (format.toLowerCase(Locale.ROOT)) {
                case "console":
                    out.print(consoleReporter.render(data));
                    break;
                case "json": {
                    Path path = outputDir.resolve(JSON_FILE);
                    jsonWriter.write(data, path);
                    written.add(path);
                    break;
                }
                case "lcov": {
                    Path path = outputDir.resolve(LCOV_FILE);
                    lcovWriter.write(data, path);
                    written.add(path);
                    break;
                }
                default:
                    log.warn("Unsupported output format '{}' ignored", format);
            }
        }
        written.forEach(p -> log.info("Report written: {}", p.toAbsolutePath()));
        return written;
    }
}
