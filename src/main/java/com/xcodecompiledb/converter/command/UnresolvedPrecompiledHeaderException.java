package com.xcodecompiledb.converter.command;

import lombok.Getter;

/**
 * -include 的路径既不在磁盘上，也查不到对应的 PCH 映射。
 */
@Getter
public class UnresolvedPrecompiledHeaderException extends ConversionException {

    private final String includePath;

    public UnresolvedPrecompiledHeaderException(String includePath) {
        super("Cannot find the original header for precompiled header " + includePath);
        this.includePath = includePath;
    }
}
