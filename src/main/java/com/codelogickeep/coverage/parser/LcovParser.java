package com.codelogickeep.coverage.parser;

import com.codelogickeep.coverage.model.CoverageData;

import java.nio.file.Path;

/**
 * LCOV 解析服务
 */
public interface LcovParser {

    /**
     * Parses LCOV text. Malformed lines are skipped, never fatal.
     */
    CoverageData parse(String content);

    /**
     * Parses an LCOV file.
     *
     * @throws com.codelogickeep.coverage.exception.CoverageException with
     *         {@code COVERAGE_FILE_NOT_FOUND} if the file does not exist
     */
    CoverageData parse(Path lcovFile);
}
