package com.codelogickeep.coverage.report;

import com.codelogickeep.coverage.model.CoverageData;
import com.codelogickeep.coverage.model.CoverageSummary;
import com.codelogickeep.coverage.model.FileCoverage;
import com.codelogickeep.coverage.model.LineCoverage;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class ReportServiceTest {

    @TempDir
    Path tempDir;

    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    private final PrintStream out = new PrintStream(buffer, true, StandardCharsets.UTF_8);

    private final CoverageData data = CoverageData.of(List.of(
            new FileCoverage("lib/a.dart", List.of(LineCoverage.of(1, 1)), new CoverageSummary(1, 1, 0, 0, 0, 0))));

    @Test
    void writesEveryRequestedFormat() {
        ReportService service = new ReportService(out);

        List<Path> written = service.generate(data, List.of("console", "JSON", "lcov"), tempDir);

        assertEquals(List.of(tempDir.resolve(ReportService.JSON_FILE), tempDir.resolve(ReportService.LCOV_FILE)), written);
        assertTrue(Files.isRegularFile(tempDir.resolve("coverage_report.json")));
        assertTrue(Files.isRegularFile(tempDir.resolve("filtered_lcov.info")));
        assertTrue(buffer.toString(StandardCharsets.UTF_8).contains("Files analyzed: 1"));
    }

    @Test
    void consoleOnlyWritesNoFiles() {
        LcovWriter lcovWriter = mock(LcovWriter.class);
        JsonReportWriter jsonWriter = mock(JsonReportWriter.class);
        ReportService service = new ReportService(lcovWriter, jsonWriter, new ConsoleReporter(), out);

        assertTrue(service.generate(data, List.of("console"), tempDir).isEmpty());

        verifyNoInteractions(lcovWriter, jsonWriter);
    }

    @Test
    void unknownFormatIsIgnored() {
        ReportService service = new ReportService(out);

        assertTrue(service.generate(data, List.of("html"), tempDir).isEmpty());
        assertEquals("", buffer.toString(StandardCharsets.UTF_8));
    }
}
