package com.codelogickeep.coverage.engine;

import com.codelogickeep.coverage.discovery.FileDetector;
import com.codelogickeep.coverage.exception.CoverageException;
import com.codelogickeep.coverage.filter.CoverageFilter;
import com.codelogickeep.coverage.model.CoverageData;
import com.codelogickeep.coverage.model.FileCoverage;
import com.codelogickeep.coverage.parser.LcovParser;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static com.codelogickeep.coverage.exception.CoverageException.ErrorCode.INVALID_PACKAGE;

/**
 * 覆盖率分析流程编排
 *
 * 决策顺序（每个分支都是终点）：
 * 1. 未配置基准分支 → 全量
 * 2. 文件发现报告 VCS 不可用 → 全量
 * 3. 没有目标文件 → 全量
 * 4. 目标文件在 LCOV 中一个都没匹配上 → 全量
 * 5. 否则 → 按目标文件筛选后的结果
 * 其他异常原样抛出。
 */
@Slf4j
public class CoverageProcessor {

    private final FileDetector fileDetector;
    private final LcovParser lcovParser;
    private final CoverageFilter coverageFilter;
    private final CoverageDeltaCalculator deltaCalculator;

    public CoverageProcessor(FileDetector fileDetector, LcovParser lcovParser) {
        this(fileDetector, lcovParser, new CoverageFilter(), new CoverageDeltaCalculator());
    }

    public CoverageProcessor(FileDetector fileDetector, LcovParser lcovParser,
                             CoverageFilter coverageFilter, CoverageDeltaCalculator deltaCalculator) {
        this.fileDetector = fileDetector;
        this.lcovParser = lcovParser;
        this.coverageFilter = coverageFilter;
        this.deltaCalculator = deltaCalculator;
    }

    public CoverageOutcome process(AnalysisRequest request) {
        Path packageRoot = request.packageRoot();
        if (!fileDetector.validatePackageStructure(packageRoot)) {
            throw new CoverageException(INVALID_PACKAGE,
                    "Invalid package structure at: " + packageRoot.toAbsolutePath(),
                    "Package: " + packageRoot);
        }

        if (!request.hasBaseBranch()) {
            return fullCorpus(request, CoverageOutcome.Reason.NO_BASE_BRANCH, 0);
        }

        List<String> targets;
        try {
            targets = fileDetector.targetFiles(request.baseBranch(), packageRoot);
        } catch (CoverageException e) {
            if (!e.isVcsUnavailable()) {
                throw e;
            }
            log.info("File discovery unavailable: {}", e.getMessage());
            return fullCorpus(request, CoverageOutcome.Reason.VCS_UNAVAILABLE, 0);
        }

        if (targets.isEmpty()) {
            return fullCorpus(request, CoverageOutcome.Reason.NO_TARGET_FILES, 0);
        }
        log.debug("Include patterns: {}", fileDetector.generateIncludePatterns(targets));

        CoverageData allFiles = lcovParser.parse(request.lcovPath());
        CoverageData filtered = coverageFilter.filterByTargets(allFiles, targets);
        if (filtered.isEmpty()) {
            // 解析是纯函数，直接复用全量结果，无需再次解析
            log.info("{}", CoverageOutcome.Reason.NO_MATCHING_FILES.getMessage());
            return CoverageOutcome.fullCorpus(allFiles, CoverageOutcome.Reason.NO_MATCHING_FILES, targets.size());
        }

        log.info("Coverage scoped to {} of {} file(s)", filtered.fileCount(), allFiles.fileCount());
        return CoverageOutcome.filtered(filtered, targets.size());
    }

    public CoverageData processAllFiles(Path lcovPath) {
        return lcovParser.parse(lcovPath);
    }

    /**
     * Coverage of a single file, if the LCOV data contains a match for it.
     */
    public Optional<FileCoverage> getFileCoverage(Path lcovPath, String filePath) {
        CoverageData all = lcovParser.parse(lcovPath);
        CoverageData matched = coverageFilter.filterByTargets(all, List.of(filePath));
        return matched.files().stream().findFirst();
    }

    public CoverageData calculateDelta(Path baseLcovPath, Path currentLcovPath) {
        CoverageData base = lcovParser.parse(baseLcovPath);
        CoverageData current = lcovParser.parse(currentLcovPath);
        return deltaCalculator.calculate(base, current);
    }

    private CoverageOutcome fullCorpus(AnalysisRequest request, CoverageOutcome.Reason reason, int targetCount) {
        log.info("{}", reason.getMessage());
        return CoverageOutcome.fullCorpus(processAllFiles(request.lcovPath()), reason, targetCount);
    }
}
