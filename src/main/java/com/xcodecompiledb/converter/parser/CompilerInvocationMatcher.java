package com.xcodecompiledb.converter.parser;

import java.util.Comparator;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * 判断一行是不是受支持的编译器调用。
 * <p>
 * 三个条件按出现顺序依次满足：
 * <ol>
 *   <li>白名单里的编译器名（可以带目录前缀，整个路径可以加引号）</li>
 *   <li>独立的 {@code -c}</li>
 *   <li>独立的 {@code -o}</li>
 * </ol>
 * 只看 flag 不看编译器名的话，会误匹配到碰巧有同名 flag 的其他工具。
 */
public final class CompilerInvocationMatcher {

    public static final List<String> SUPPORTED_COMPILERS = List.of(
            "clang", "clang++",
            "llvm-gcc", "llvm-gcc-4.2",
            "llvm-g++", "llvm-g++-4.2",
            "gcc", "g++", "c++", "cc"
    );

    // 长名字放前面，避免 clang 抢先匹配 clang++
    private static final Pattern COMPILER_PATTERN = Pattern.compile(
            "(?:^|[\\s/\"'])(" + SUPPORTED_COMPILERS.stream()
                    .sorted(Comparator.comparingInt(String::length).reversed())
                    .map(Pattern::quote)
                    .collect(Collectors.joining("|")) + ")(?=[\\s\"'])");

    private static final Pattern COMPILE_FLAG_PATTERN = Pattern.compile("(?<=\\s)-c(?=[\\s\"'])");
    private static final Pattern OUTPUT_FLAG_PATTERN = Pattern.compile("(?<=\\s)-o(?=[\\s\"'])");

    private CompilerInvocationMatcher() {
    }

    public static boolean matches(String line) {
        Matcher compiler = COMPILER_PATTERN.matcher(line);
        if (!compiler.find()) {
            return false;
        }
        Matcher compileFlag = COMPILE_FLAG_PATTERN.matcher(line);
        if (!compileFlag.find(compiler.end())) {
            return false;
        }
        return OUTPUT_FLAG_PATTERN.matcher(line).find(compileFlag.end());
    }

    /** 找到的编译器名，没有时返回 null */
    public static String compilerName(String line) {
        Matcher compiler = COMPILER_PATTERN.matcher(line);
        return compiler.find() ? compiler.group(1) : null;
    }
}
