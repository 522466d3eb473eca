package com.xcodecompiledb.converter.parser;

import com.xcodecompiledb.converter.command.ConversionException;

public class LogFormatException extends ConversionException {

    public LogFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
