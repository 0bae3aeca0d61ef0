package com.codelogickeep.coverage.parser;

import com.codelogickeep.coverage.model.CoverageData;

/**
 * 解析 worker 的回复：要么携带完整的 CoverageData，要么携带失败原因
 */
record ParseResponse(CoverageData data, int skippedLines, Throwable error) {

    static ParseResponse success(CoverageData data, int skippedLines) {
        return new ParseResponse(data, skippedLines, null);
    }

    static ParseResponse failure(Throwable error) {
        return new ParseResponse(null, 0, error);
    }

    boolean isSuccess() {
        return error == null;
    }
}
