package com.xcodecompiledb.converter.command;

/**
 * 给单个参数加上编译数据库消费方能接受的最小引号。
 * 只保护空格、双引号、反斜杠这几个字符，比完整的 shell 引号规则窄。
 */
public final class CommandQuoter {

    private static final String EMPTY_ARGUMENT = "\"\"";

    private CommandQuoter() {
    }

    public static String quote(String argument) {
        if (argument.isEmpty()) {
            return EMPTY_ARGUMENT;
        }
        if (!needsQuoting(argument)) {
            return argument;
        }
        // 先翻倍反斜杠，再转义双引号，否则新插入的反斜杠会被再转义一次
        String escaped = argument.replace("\\", "\\\\").replace("\"", "\\\"");
        return "\"" + escaped + "\"";
    }

    private static boolean needsQuoting(String argument) {
        return argument.indexOf(' ') >= 0
                || argument.indexOf('"') >= 0
                || argument.indexOf('\\') >= 0;
    }
}
