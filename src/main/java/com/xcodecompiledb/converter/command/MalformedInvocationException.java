package com.xcodecompiledb.converter.command;

public class MalformedInvocationException extends ConversionException {

    public MalformedInvocationException(String message) {
        super(message);
    }
}
