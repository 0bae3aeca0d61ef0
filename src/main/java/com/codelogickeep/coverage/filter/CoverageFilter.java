package com.codelogickeep.coverage.filter;

import com.codelogickeep.coverage.model.CoverageData;
import com.codelogickeep.coverage.model.FileCoverage;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 按目标文件列表筛选覆盖数据
 *
 * 返回新的 CoverageData，summary 由筛选后的文件重新计算，不复用输入的 summary。
 */
@Slf4j
public class CoverageFilter {

    /**
     * Selects the files of {@code data} matching any of {@code targets}.
     * An empty target list selects nothing.
     */
    public CoverageData filterByTargets(CoverageData data, List<String> targets) {
        if (targets == null || targets.isEmpty()) {
            log.info("No target files to filter - returning empty coverage data");
            return CoverageData.empty();
        }

        Set<String> normalizedTargets = new LinkedHashSet<>();
        for (String target : targets) {
            normalizedTargets.add(PathMatcher.normalize(target));
        }

        log.info("Filtering coverage data: {} files in LCOV, {} target files", data.fileCount(), normalizedTargets.size());

        List<FileCoverage> matched = new ArrayList<>();
        for (FileCoverage file : data.files()) {
            String recorded = PathMatcher.normalize(file.path());
            for (String target : normalizedTargets) {
                if (PathMatcher.matchesNormalized(recorded, target)) {
                    matched.add(file);
                    break;
                }
            }
        }

        log.info("Matched files: {}", matched.size());
        if (matched.isEmpty()) {
            log.warn("No matches found! Target example: {}, LCOV example: {}",
                    targets.get(0), data.isEmpty() ? "none" : data.files().get(0).path());
        }

        return CoverageData.of(matched);
    }
}
