package com.codelogickeep.coverage.engine;

import com.codelogickeep.coverage.model.CoverageData;
import com.codelogickeep.coverage.model.CoverageSummary;
import com.codelogickeep.coverage.model.FileCoverage;
import com.codelogickeep.coverage.model.LineCoverage;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CoverageDeltaCalculatorTest {

    private final CoverageDeltaCalculator calculator = new CoverageDeltaCalculator();

    private static FileCoverage file(String path, LineCoverage... lines) {
        return new FileCoverage(path, List.of(lines), new CoverageSummary(lines.length, 0, 0, 0, 0, 0));
    }

    @Test
    void unchangedFilesAreDropped() {
        CoverageData data = CoverageData.of(List.of(file("a.dart", LineCoverage.of(1, 2))));

        assertTrue(calculator.calculate(data, data).isEmpty());
    }

    @Test
    void changedLinesCarrySignedDifference() {
        CoverageData base = CoverageData.of(List.of(file("a.dart",
                LineCoverage.of(1, 2), LineCoverage.of(2, 5), LineCoverage.of(3, 1))));
        CoverageData current = CoverageData.of(List.of(file("a.dart",
                LineCoverage.of(1, 2), LineCoverage.of(2, 1), LineCoverage.of(3, 4))));

        CoverageData delta = calculator.calculate(base, current);

        FileCoverage file = delta.files().get(0);
        assertEquals(List.of(LineCoverage.delta(2, -4), LineCoverage.delta(3, 3)), file.lines());
        assertEquals(new CoverageSummary(2, 1, 0, 0, 0, 0), file.summary());
    }

    @Test
    void newLinesAndFilesAreKeptAsIs() {
        CoverageData base = CoverageData.of(List.of(file("a.dart", LineCoverage.of(1, 1))));
        FileCoverage added = file("b.dart", LineCoverage.of(1, 0));
        CoverageData current = CoverageData.of(List.of(
                file("a.dart", LineCoverage.of(1, 1), LineCoverage.of(9, 2)),
                added));

        CoverageData delta = calculator.calculate(base, current);

        assertEquals(2, delta.fileCount());
        assertEquals(List.of(LineCoverage.of(9, 2)), delta.files().get(0).lines());
        assertSame(added, delta.files().get(1));
    }

    @Test
    void filesOnlyInBaseAreIgnored() {
        CoverageData base = CoverageData.of(List.of(file("gone.dart", LineCoverage.of(1, 1))));

        assertTrue(calculator.calculate(base, CoverageData.empty()).isEmpty());
    }
}
