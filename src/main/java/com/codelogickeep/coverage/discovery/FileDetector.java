package com.codelogickeep.coverage.discovery;

import java.nio.file.Path;
import java.util.List;

/**
 * 目标文件发现服务 - 决定覆盖率报告关注哪些源文件
 */
public interface FileDetector {

    /**
     * Returns the source files of interest, relative to {@code packageRoot}.
     *
     * @param baseBranch  revision to compare against, may be {@code null}
     * @param packageRoot package root, possibly a sub-directory of the repository
     * @throws com.codelogickeep.coverage.exception.CoverageException with
     *         {@code VCS_UNAVAILABLE} when no repository encloses {@code packageRoot},
     *         or {@code DISCOVERY_FAILED} for any other failure
     */
    List<String> targetFiles(String baseBranch, Path packageRoot);

    /**
     * Converts target files to {@code **}-prefixed LCOV include globs.
     */
    List<String> generateIncludePatterns(List<String> files);

    boolean validatePackageStructure(Path packageRoot);

    /**
     * All source files under {@code packageRoot}, relative to it.
     */
    List<String> allSourceFiles(Path packageRoot);
}
