package com.xcodecompiledb.converter.command;

import java.util.ArrayList;
import java.util.List;

/**
 * 把一行 shell 风格的命令拆成参数。
 * <p>
 * 行里没有引号和反斜杠时走快速路径：按单个空格切分再逐个 trim，
 * 连续空格会留下空串参数，这一点保持原样，不做"修正"。
 * 否则按 POSIX shell 规则拆分：
 * <ul>
 *   <li>单引号内全部按字面处理</li>
 *   <li>双引号内反斜杠只转义 {@code "} 和 {@code \}</li>
 *   <li>引号外反斜杠转义下一个字符</li>
 * </ul>
 */
public final class ShellTokenizer {

    private ShellTokenizer() {
    }

    public static List<String> tokenize(String line) {
        if (line.indexOf('"') < 0 && line.indexOf('\'') < 0 && line.indexOf('\\') < 0) {
            return splitOnSpaces(line);
        }
        return shellSplit(line);
    }

    static List<String> splitOnSpaces(String line) {
        String stripped = line.strip();
        List<String> tokens = new ArrayList<>();
        if (stripped.isEmpty()) {
            return tokens;
        }
        for (String part : stripped.split(" ", -1)) {
            tokens.add(part.strip());
        }
        return tokens;
    }

    static List<String> shellSplit(String line) {
        List<String> tokens = new ArrayList<>();
        StringBuilder token = null;   // null 表示当前不在参数里
        char quote = 0;

        int n = line.length();
        for (int i = 0; i < n; i++) {
            char c = line.charAt(i);

            if (quote == '\'') {
                if (c == '\'') {
                    quote = 0;
                } else {
                    token.append(c);
                }
                continue;
            }

            if (quote == '"') {
                if (c == '"') {
                    quote = 0;
                } else if (c == '\\' && i + 1 < n && (line.charAt(i + 1) == '"' || line.charAt(i + 1) == '\\')) {
                    token.append(line.charAt(++i));
                } else {
                    token.append(c);
                }
                continue;
            }

            if (Character.isWhitespace(c)) {
                if (token != null) {
                    tokens.add(token.toString());
                    token = null;
                }
            } else if (c == '\\') {
                if (i + 1 >= n) {
                    throw new CommandSyntaxException("No escaped character: " + line);
                }
                if (token == null) {
                    token = new StringBuilder();
                }
                token.append(line.charAt(++i));
            } else if (c == '\'' || c == '"') {
                if (token == null) {
                    token = new StringBuilder();
                }
                quote = c;
            } else {
                if (token == null) {
                    token = new StringBuilder();
                }
                token.append(c);
            }
        }

        if (quote != 0) {
            throw new CommandSyntaxException("No closing quotation: " + line);
        }
        if (token != null) {
            tokens.add(token.toString());
        }
        return tokens;
    }
}
