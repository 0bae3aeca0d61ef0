package com.codelogickeep.coverage.config;

import com.fasterxml.jackson.annotation.JsonMerge;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
public class AppConfig {
    // 分层加载时合并到已有 section，而不是整体替换
    @JsonMerge
    private CoverageConfig coverage;
    @JsonMerge
    private ParserConfig parser;
    @JsonMerge
    private DiscoveryConfig discovery;

    @Data
    public static class CoverageConfig {
        @JsonProperty("lcov-path")
        private String lcovPath = "coverage/lcov.info";

        /**
         * 包根目录（monorepo 中的子包），默认当前目录
         */
        @JsonProperty("package-path")
        private String packagePath = ".";

        /**
         * 基准分支；为空时分析全部文件
         */
        @JsonProperty("base-branch")
        private String baseBranch;

        @JsonProperty("output-dir")
        private String outputDir = "coverage/smart_coverage";

        /**
         * console, json, lcov
         */
        @JsonProperty("output-formats")
        private List<String> outputFormats = new ArrayList<>(List.of("console"));
    }

    @Data
    public static class ParserConfig {
        /**
         * 达到该大小的 LCOV 输入交给 worker 线程解析
         */
        @JsonProperty("async-threshold-bytes")
        private long asyncThresholdBytes = 1024L * 1024L;
    }

    @Data
    public static class DiscoveryConfig {
        private List<String> extensions = new ArrayList<>(List.of(".dart", ".java", ".kt", ".js", ".ts", ".py", ".go"));

        /**
         * 路径片段或后缀，命中即排除（生成代码、构建目录）
         */
        @JsonProperty("exclude-patterns")
        private List<String> excludePatterns = new ArrayList<>(List.of(
                ".dart_tool/", "build/", "target/", "/generated/", ".g.dart", ".freezed.dart"));

        /**
         * 包根目录下至少存在其一才视为合法包；为空则不检查
         */
        @JsonProperty("manifest-files")
        private List<String> manifestFiles = new ArrayList<>();
    }
}
