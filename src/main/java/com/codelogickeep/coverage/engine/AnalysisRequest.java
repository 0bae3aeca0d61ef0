package com.codelogickeep.coverage.engine;

import java.nio.file.Path;
import java.util.Objects;

/**
 * 单次分析的输入
 *
 * @param lcovPath    LCOV 文件
 * @param baseBranch  基准分支，为空表示分析全部文件
 * @param packageRoot 包根目录，默认当前目录
 */
public record AnalysisRequest(Path lcovPath, String baseBranch, Path packageRoot) {

    public AnalysisRequest {
        Objects.requireNonNull(lcovPath, "lcovPath");
        packageRoot = packageRoot == null ? Path.of(".") : packageRoot;
    }

    public static AnalysisRequest allFiles(Path lcovPath) {
        return new AnalysisRequest(lcovPath, null, null);
    }

    public boolean hasBaseBranch() {
        return baseBranch != null && !baseBranch.isBlank();
    }
}
