package com.codelogickeep.coverage.engine;

import com.codelogickeep.coverage.model.CoverageData;

/**
 * 分析结果：覆盖数据 + 作用范围 + 选择该范围的原因
 */
public record CoverageOutcome(CoverageData data, Scope scope, Reason reason, int targetCount) {

    public enum Scope {
        CHANGED_FILES,
        FULL_CORPUS
    }

    public enum Reason {
        FILTERED("Coverage scoped to changed files"),
        NO_BASE_BRANCH("No base branch configured - analyzing all files"),
        VCS_UNAVAILABLE("Git repository not available - analyzing all files"),
        NO_TARGET_FILES("No changed files detected - analyzing all files"),
        NO_MATCHING_FILES("No changed files found in coverage data - analyzing all files");

        private final String message;

        Reason(String message) {
            this.message = message;
        }

        public String getMessage() {
            return message;
        }
    }

    static CoverageOutcome filtered(CoverageData data, int targetCount) {
        return new CoverageOutcome(data, Scope.CHANGED_FILES, Reason.FILTERED, targetCount);
    }

    static CoverageOutcome fullCorpus(CoverageData data, Reason reason, int targetCount) {
        return new CoverageOutcome(data, Scope.FULL_CORPUS, reason, targetCount);
    }

    public boolean isFallback() {
        return scope == Scope.FULL_CORPUS;
    }

    /**
     * 面向用户的状态说明
     */
    public String statusMessage() {
        if (reason == Reason.FILTERED) {
            return String.format("%s (%d of %d target file(s) have coverage data)",
                    reason.getMessage(), data.fileCount(), targetCount);
        }
        return reason.getMessage();
    }
}
