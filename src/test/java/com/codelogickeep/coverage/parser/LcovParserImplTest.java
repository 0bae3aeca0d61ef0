package com.codelogickeep.coverage.parser;

import com.codelogickeep.coverage.exception.CoverageException;
import com.codelogickeep.coverage.model.CoverageData;
import com.codelogickeep.coverage.model.CoverageSummary;
import com.codelogickeep.coverage.model.FileCoverage;
import com.codelogickeep.coverage.model.LineCoverage;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LcovParserImplTest {

    private static final String SAMPLE = """
            TN:
            SF:lib/a.dart
            DA:1,1
            DA:2,0
            LF:2
            LH:1
            end_of_record
            SF:lib/b.dart
            DA:1,3
            LF:1
            LH:1
            end_of_record
            """;

    private final LcovParserImpl parser = new LcovParserImpl();

    @AfterEach
    void tearDown() {
        parser.close();
    }

    @Nested
    @DisplayName("parse(String)")
    class ParseString {

        @Test
        @DisplayName("two records produce two files in input order")
        void parsesTwoRecords() {
            CoverageData data = parser.parse(SAMPLE);

            assertEquals(2, data.fileCount());
            FileCoverage a = data.files().get(0);
            assertEquals("lib/a.dart", a.path());
            assertEquals(List.of(LineCoverage.of(1, 1), LineCoverage.of(2, 0)), a.lines());
            assertEquals(2, a.summary().linesFound());
            assertEquals(1, a.summary().linesHit());

            FileCoverage b = data.files().get(1);
            assertEquals("lib/b.dart", b.path());
            assertEquals(List.of(LineCoverage.of(1, 3)), b.lines());

            assertEquals(new CoverageSummary(3, 2, 0, 0, 0, 0), data.summary());
            assertEquals(66.67, data.summary().linePercentage(), 0.01);
        }

        @Test
        void emptyAndNullInputYieldEmptyData() {
            assertTrue(parser.parse("").isEmpty());
            assertTrue(parser.parse((String) null).isEmpty());
            assertEquals(CoverageSummary.EMPTY, parser.parse("").summary());
        }

        @Test
        @DisplayName("malformed DA lines are skipped, the rest of the record survives")
        void malformedLineDataIsSkipped() {
            String lcov = """
                    SF:lib/a.dart
                    DA:1,1
                    DA:x,1
                    DA:2
                    DA:3,-1
                    DA:0,4
                    DA:4,0
                    LF:abc
                    LH:-2
                    end_of_record
                    """;

            CoverageData data = parser.parse(lcov);

            FileCoverage file = data.files().get(0);
            assertEquals(List.of(LineCoverage.of(1, 1), LineCoverage.of(4, 0)), file.lines());
            assertEquals(0, file.summary().linesFound());
            assertEquals(0, file.summary().linesHit());
        }

        @Test
        void checksumFieldOnLineDataIsIgnored() {
            CoverageData data = parser.parse("SF:a.js\nDA:7,2,abcdef0123\nend_of_record\n");

            assertEquals(List.of(LineCoverage.of(7, 2)), data.files().get(0).lines());
        }

        @Test
        void windowsLineEndingsAreStripped() {
            CoverageData data = parser.parse(SAMPLE.replace("\n", "\r\n"));

            assertEquals("lib/a.dart", data.files().get(0).path());
            assertEquals("lib/b.dart", data.files().get(1).path());
            assertEquals(3, data.summary().linesFound());
        }

        @Test
        @DisplayName("tags before the first SF: are ignored")
        void tagsBeforeFirstSourceFileAreIgnored() {
            CoverageData data = parser.parse("TN:suite\nDA:1,1\nLF:9\nSF:a.dart\nDA:2,1\nend_of_record\n");

            assertEquals(1, data.fileCount());
            assertEquals(List.of(LineCoverage.of(2, 1)), data.files().get(0).lines());
            assertEquals(0, data.summary().linesFound());
        }

        @Test
        void lastRecordWithoutEndOfRecordIsKept() {
            CoverageData data = parser.parse("SF:a.dart\nDA:1,1\nLF:1\nLH:1");

            assertEquals(1, data.fileCount());
            assertEquals(1, data.files().get(0).summary().linesHit());
        }

        @Test
        void duplicateSourceFilesAreKeptAsSeparateEntries() {
            String lcov = "SF:a.dart\nLF:2\nLH:1\nend_of_record\nSF:a.dart\nLF:2\nLH:2\nend_of_record\n";

            CoverageData data = parser.parse(lcov);

            assertEquals(2, data.fileCount());
            assertEquals(4, data.summary().linesFound());
            assertEquals(3, data.summary().linesHit());
        }

        @Test
        @DisplayName("hit counts above the int range are kept")
        void largeHitCountsAreKept() {
            CoverageData data = parser.parse("SF:a.c\nDA:1,3000000000\nDA:2,1\nend_of_record\n");

            assertEquals(List.of(LineCoverage.of(1, 3_000_000_000L), LineCoverage.of(2, 1)),
                    data.files().get(0).lines());
            assertTrue(data.files().get(0).lines().get(0).isCovered());
        }

        @Test
        @DisplayName("corpus totals beyond the int range saturate instead of failing")
        void corpusTotalsSaturate() {
            String lcov = "SF:a.c\nLF:2000000000\nLH:2000000000\nend_of_record\n"
                    + "SF:b.c\nLF:2000000000\nLH:1\nend_of_record\n";

            CoverageData data = assertDoesNotThrow(() -> parser.parse(lcov));

            assertEquals(2, data.fileCount());
            assertEquals(Integer.MAX_VALUE, data.summary().linesFound());
            assertEquals(2000000001, data.summary().linesHit());
        }

        @Test
        void recordCountersBeyondIntRangeSaturate() {
            CoverageData data = parser.parse("SF:a.c\nLF:5000000000\nend_of_record\n");

            assertEquals(Integer.MAX_VALUE, data.files().get(0).summary().linesFound());
        }

        @Test
        void functionAndBranchCountersAreRead() {
            String lcov = "SF:a.dart\nFN:1,main\nFNDA:1,main\nFNF:4\nFNH:3\nBRDA:1,0,0,1\nBRF:6\nBRH:2\nend_of_record\n";

            CoverageSummary summary = parser.parse(lcov).summary();

            assertEquals(4, summary.functionsFound());
            assertEquals(3, summary.functionsHit());
            assertEquals(6, summary.branchesFound());
            assertEquals(2, summary.branchesHit());
        }
    }

    @Nested
    @DisplayName("parse(Path)")
    class ParseFile {

        @TempDir
        Path tempDir;

        @Test
        void readsFileFromDisk() throws IOException {
            Path lcov = tempDir.resolve("lcov.info");
            Files.writeString(lcov, SAMPLE);

            assertEquals(parser.parse(SAMPLE), parser.parse(lcov));
        }

        @Test
        void missingFileIsReportedAsNotFound() {
            CoverageException e = assertThrows(CoverageException.class,
                    () -> parser.parse(tempDir.resolve("missing.info")));

            assertEquals(CoverageException.ErrorCode.COVERAGE_FILE_NOT_FOUND, e.getErrorCode());
        }

        @Test
        void directoryIsReportedAsNotFound() {
            CoverageException e = assertThrows(CoverageException.class, () -> parser.parse(tempDir));

            assertEquals(CoverageException.ErrorCode.COVERAGE_FILE_NOT_FOUND, e.getErrorCode());
        }
    }

    @Nested
    @DisplayName("worker offload")
    class WorkerOffload {

        @TempDir
        Path tempDir;

        @Test
        void thresholdDecidesWhereParsingRuns() {
            LcovParserImpl small = new LcovParserImpl(100);

            assertFalse(small.usesWorker(99));
            assertTrue(small.usesWorker(100));
            assertEquals(LcovParserImpl.DEFAULT_ASYNC_THRESHOLD_BYTES, parser.getAsyncThresholdBytes());
        }

        @Test
        void negativeThresholdIsRejected() {
            assertThrows(IllegalArgumentException.class, () -> new LcovParserImpl(-1));
        }

        @Test
        @DisplayName("worker and synchronous paths produce identical results")
        void workerMatchesSynchronousParse() throws IOException {
            String lcov = generate(200);
            Path file = tempDir.resolve("lcov.info");
            Files.writeString(file, lcov);

            CoverageData sync = new LcovParserImpl(Long.MAX_VALUE).parse(lcov);
            try (LcovParserImpl offloading = new LcovParserImpl(0)) {
                assertEquals(sync, offloading.parse(lcov));
                assertEquals(sync, offloading.parse(file));
            }
        }

        @Test
        @DisplayName("inputs above the default threshold parse completely")
        void largeInputParsesCompletely() throws IOException {
            String lcov = generate(3000);
            assertTrue(lcov.length() > LcovParserImpl.DEFAULT_ASYNC_THRESHOLD_BYTES);
            Path file = tempDir.resolve("big.info");
            Files.writeString(file, lcov);

            CoverageData data = parser.parse(file);

            assertEquals(3000, data.fileCount());
            assertEquals(3000 * 20, data.summary().linesFound());
            assertEquals(3000 * 10, data.summary().linesHit());
        }

        @Test
        @DisplayName("a 10 MB report parses within a few seconds")
        void tenMegabyteReportParsesQuickly() {
            String lcov = generate(60_000);
            assertTrue(lcov.length() >= 10 * 1024 * 1024);

            CoverageData data = assertTimeoutPreemptively(Duration.ofSeconds(10), () -> parser.parse(lcov));

            assertEquals(60_000, data.fileCount());
        }

        private String generate(int files) {
            StringBuilder sb = new StringBuilder();
            for (int f = 0; f < files; f++) {
                sb.append("SF:lib/src/module_").append(f).append("/generated_source_file.dart\n");
                for (int line = 1; line <= 20; line++) {
                    sb.append("DA:").append(line).append(',').append(line % 2).append('\n');
                }
                sb.append("LF:20\nLH:10\nend_of_record\n");
            }
            return sb.toString();
        }
    }
}
