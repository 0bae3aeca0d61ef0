package com.codelogickeep.coverage.model;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CoverageDataTest {

    private static FileCoverage file(String path, int found, int hit) {
        return new FileCoverage(path, List.of(LineCoverage.of(1, hit > 0 ? 1 : 0)), new CoverageSummary(found, hit, 0, 0, 0, 0));
    }

    @Test
    void ofRecomputesSummaryFromFiles() {
        CoverageData data = CoverageData.of(List.of(file("a.dart", 2, 1), file("b.dart", 1, 1)));

        assertEquals(2, data.fileCount());
        assertEquals(3, data.summary().linesFound());
        assertEquals(2, data.summary().linesHit());
    }

    @Test
    void duplicatePathsAreKeptAndCountedTwice() {
        CoverageData data = CoverageData.of(List.of(file("a.dart", 2, 1), file("a.dart", 2, 1)));

        assertEquals(2, data.fileCount());
        assertEquals(4, data.summary().linesFound());
    }

    @Test
    void filesAreDefensivelyCopied() {
        List<FileCoverage> files = new ArrayList<>(List.of(file("a.dart", 1, 1)));
        CoverageData data = CoverageData.of(files);

        files.add(file("b.dart", 1, 1));

        assertEquals(1, data.fileCount());
        assertThrows(UnsupportedOperationException.class, () -> data.files().add(file("c.dart", 1, 0)));
    }

    @Test
    void emptyHasNoFilesAndZeroSummary() {
        assertTrue(CoverageData.empty().isEmpty());
        assertEquals(CoverageSummary.EMPTY, CoverageData.empty().summary());
    }

    @Test
    void lineCoverageRules() {
        assertTrue(LineCoverage.of(3, 1).isCovered());
        assertFalse(LineCoverage.of(3, 0).isCovered());
        assertThrows(IllegalArgumentException.class, () -> LineCoverage.of(0, 1));
        assertThrows(IllegalArgumentException.class, () -> LineCoverage.of(1, -1));
        assertEquals(-2, LineCoverage.delta(4, -2).hitCount());
    }

    @Test
    void fileCoverageSplitsCoveredAndUncoveredLines() {
        FileCoverage file = new FileCoverage("a.dart",
                List.of(LineCoverage.of(1, 1), LineCoverage.of(2, 0), LineCoverage.of(3, 5)),
                CoverageSummary.EMPTY);

        assertEquals(2, file.coveredLines().size());
        assertEquals(List.of(LineCoverage.of(2, 0)), file.uncoveredLines());
    }

    @Test
    void summaryMustMatchFiles() {
        List<FileCoverage> files = List.of(file("a.dart", 2, 1));

        assertThrows(IllegalArgumentException.class,
                () -> new CoverageData(files, new CoverageSummary(99, 1, 0, 0, 0, 0)));
        assertEquals(new CoverageSummary(2, 1, 0, 0, 0, 0), new CoverageData(files, null).summary());
        assertEquals(CoverageData.of(files), new CoverageData(files, new CoverageSummary(2, 1, 0, 0, 0, 0)));
    }
}
