package com.xcodecompiledb.converter.command;

/**
 * 转换过程中无法就地恢复的错误，抛出后整次转换中止。
 */
public class ConversionException extends RuntimeException {

    public ConversionException(String message) {
        super(message);
    }

    public ConversionException(String message, Throwable cause) {
        super(message, cause);
    }
}
