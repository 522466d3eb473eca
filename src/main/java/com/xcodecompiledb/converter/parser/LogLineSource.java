package com.xcodecompiledb.converter.parser;

import java.io.Closeable;
import java.io.IOException;
import java.util.Optional;

/**
 * 只能向前读一次的日志行来源。
 * 读完时返回 {@link Optional#empty()}，这是正常结束信号，不是错误。
 */
public interface LogLineSource extends Closeable {

    Optional<String> nextLine() throws IOException;
}
