package com.xcodecompiledb.converter.command;

/**
 * 命令行引号不闭合，或以孤立的反斜杠结尾。
 */
public class CommandSyntaxException extends ConversionException {

    public CommandSyntaxException(String message) {
        super(message);
    }
}
