package com.xcodecompiledb.converter.parser;

import com.xcodecompiledb.converter.command.CommandSyntaxException;
import com.xcodecompiledb.converter.command.ShellTokenizer;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * 解析 section 标记下一行的 {@code cd <dir>}。
 * 不是 cd 语句时目录为空串，不算错误。
 */
@Slf4j
public final class DirectoryLineParser {

    private static final String CD = "cd";

    private DirectoryLineParser() {
    }

    public static String parse(String line) {
        List<String> tokens;
        try {
            tokens = ShellTokenizer.tokenize(line);
        } catch (CommandSyntaxException e) {
            log.warn("Unparseable directory line, using empty directory: {}", e.getMessage());
            return "";
        }
        if (tokens.size() >= 2 && CD.equals(tokens.get(0))) {
            return tokens.get(1);
        }
        return "";
    }
}
