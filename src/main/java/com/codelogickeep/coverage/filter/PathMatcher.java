package com.codelogickeep.coverage.filter;

/**
 * 路径匹配启发式规则
 *
 * 归一化后依次尝试：完全相等、记录路径以目标结尾、目标以记录路径结尾、
 * 同名文件且记录路径包含去掉首个 "lib/" 的目标。
 * 最后一条规则在不同目录下的同名文件之间可能误匹配，保持现状。
 */
public final class PathMatcher {

    private static final String LIB_SEGMENT = "lib/";

    private PathMatcher() {
    }

    /**
     * Replaces {@code \} with {@code /} and strips one leading {@code ./} or {@code /}.
     */
    public static String normalize(String path) {
        String normalized = path.replace('\\', '/');
        if (normalized.startsWith("./")) {
            return normalized.substring(2);
        }
        if (normalized.startsWith("/")) {
            return normalized.substring(1);
        }
        return normalized;
    }

    public static boolean matches(String recordedPath, String targetPath) {
        return matchesNormalized(normalize(recordedPath), normalize(targetPath));
    }

    static boolean matchesNormalized(String recorded, String target) {
        if (recorded.equals(target)) {
            return true;
        }
        if (recorded.endsWith(target)) {
            return true;
        }
        if (target.endsWith(recorded)) {
            return true;
        }
        return basename(recorded).equals(basename(target))
                && recorded.contains(stripFirstLibSegment(target));
    }

    static String basename(String normalizedPath) {
        int slash = normalizedPath.lastIndexOf('/');
        return slash < 0 ? normalizedPath : normalizedPath.substring(slash + 1);
    }

    static String stripFirstLibSegment(String normalizedPath) {
        int idx = normalizedPath.indexOf(LIB_SEGMENT);
        if (idx < 0) {
            return normalizedPath;
        }
        return normalizedPath.substring(0, idx) + normalizedPath.substring(idx + LIB_SEGMENT.length());
    }
}
