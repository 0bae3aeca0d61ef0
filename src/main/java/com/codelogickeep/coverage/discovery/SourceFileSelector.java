package com.codelogickeep.coverage.discovery;

import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * 源文件筛选：扩展名白名单 + 排除规则
 *
 * 排除规则写法：
 * <ul>
 *   <li>{@code "/generated/"} 前后都有斜杠 - 路径包含即排除</li>
 *   <li>{@code "build/"} 以斜杠结尾 - 路径以其开头即排除</li>
 *   <li>{@code ".g.dart"} 其他 - 路径以其结尾即排除</li>
 * </ul>
 */
class SourceFileSelector {

    private final List<String> extensions;
    private final List<String> excludePatterns;

    SourceFileSelector(List<String> extensions, List<String> excludePatterns) {
        this.extensions = extensions.stream()
                .map(e -> e.toLowerCase(Locale.ROOT))
                .collect(Collectors.toList());
        this.excludePatterns = List.copyOf(excludePatterns);
    }

    boolean isSourceFile(String relativePath) {
        if (relativePath == null || relativePath.isEmpty()) {
            return false;
        }
        String lower = relativePath.toLowerCase(Locale.ROOT);
        if (extensions.stream().noneMatch(lower::endsWith)) {
            return false;
        }
        return !isExcluded(relativePath);
    }

    boolean hasSourceExtension(String path) {
        String lower = path.toLowerCase(Locale.ROOT);
        return extensions.stream().anyMatch(lower::endsWith);
    }

    boolean isExcluded(String relativePath) {
        for (String pattern : excludePatterns) {
            if (pattern.startsWith("/") && pattern.endsWith("/")) {
                if (relativePath.contains(pattern)) {
                    return true;
                }
            } else if (pattern.endsWith("/")) {
                if (relativePath.startsWith(pattern)) {
                    return true;
                }
            } else if (relativePath.endsWith(pattern)) {
                return true;
            }
        }
        return false;
    }
}
