package com.codelogickeep.coverage.report;

import com.codelogickeep.coverage.model.CoverageData;
import com.codelogickeep.coverage.model.CoverageSummary;
import com.codelogickeep.coverage.model.FileCoverage;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ConsoleReporterTest {

    private final ConsoleReporter reporter = new ConsoleReporter();

    private static FileCoverage file(String path, int found, int hit) {
        return new FileCoverage(path, List.of(), new CoverageSummary(found, hit, 0, 0, 0, 0));
    }

    @Test
    void summaryAndIconsByThreshold() {
        CoverageData data = CoverageData.of(List.of(
                file("lib/good.dart", 10, 8),
                file("lib/ok.dart", 10, 6),
                file("lib/bad.dart", 10, 1)));

        String out = reporter.render(data);

        assertTrue(out.contains("Files analyzed: 3"));
        assertTrue(out.contains("Lines found: 30"));
        assertTrue(out.contains("Lines hit: 15"));
        assertTrue(out.contains("Line coverage: 50.0%"));
        assertTrue(out.contains("✅ lib/good.dart: 80.0%"));
        assertTrue(out.contains("⚠️ lib/ok.dart: 60.0%"));
        assertTrue(out.contains("❌ lib/bad.dart: 10.0%"));
        assertFalse(out.contains("Function coverage"));
    }

    @Test
    void onlyFirstTenFilesAreListed() {
        List<FileCoverage> files = new ArrayList<>();
        for (int i = 0; i < 13; i++) {
            files.add(file("lib/f" + i + ".dart", 1, 1));
        }

        String out = reporter.render(CoverageData.of(files));

        assertTrue(out.contains("lib/f9.dart"));
        assertFalse(out.contains("lib/f10.dart"));
        assertTrue(out.contains("... and 3 more files"));
    }

    @Test
    void emptyDataPrintsSummaryOnly() {
        String out = reporter.render(CoverageData.empty());

        assertTrue(out.contains("Files analyzed: 0"));
        assertFalse(out.contains("File Coverage"));
    }
}
