package com.xcodecompiledb.converter.service;

import java.util.List;
import java.util.regex.Pattern;

/**
 * 目录 / 文件排除规则，都是正则，用 find() 匹配（不锚定，除非正则自己写了 ^ $）。
 */
public class ExclusionFilter {

    private static final ExclusionFilter NONE = new ExclusionFilter(List.of(), List.of());

    private final List<Pattern> directoryPatterns;
    private final List<Pattern> filePatterns;

    private ExclusionFilter(List<Pattern> directoryPatterns, List<Pattern> filePatterns) {
        this.directoryPatterns = directoryPatterns;
        this.filePatterns = filePatterns;
    }

    static ExclusionFilter none() {
        return NONE;
    }

    /**
     * @throws java.util.regex.PatternSyntaxException 正则写错时
     */
    public static ExclusionFilter of(List<String> directoryRegexes, List<String> fileRegexes) {
        return new ExclusionFilter(compile(directoryRegexes), compile(fileRegexes));
    }

    public boolean isDirectoryExcluded(String directory) {
        return anyMatch(directoryPatterns, directory);
    }

    public boolean isFileExcluded(String file) {
        return anyMatch(filePatterns, file);
    }

    private static List<Pattern> compile(List<String> regexes) {
        if (regexes == null) {
            return List.of();
        }
        return regexes.stream()
                .filter(r -> r != null && !r.isBlank())
                .map(Pattern::compile)
                .toList();
    }

    private static boolean anyMatch(List<Pattern> patterns, String value) {
        for (Pattern p : patterns) {
            if (p.matcher(value).find()) {
                return true;
            }
        }
        return false;
    }
}
