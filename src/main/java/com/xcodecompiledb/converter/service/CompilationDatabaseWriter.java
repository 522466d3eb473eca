package com.xcodecompiledb.converter.service;

import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.xcodecompiledb.converter.model.CompilationRecord;

import java.io.Closeable;
import java.io.IOException;
import java.io.Writer;

/**
 * 边产出边写 compile_commands.json：
 * <pre>
 * [
 * {record},
 * {record}
 * ]
 * </pre>
 * 每条记录用 2 空格缩进美化输出。{@link #finish()} 补上结尾的 {@code \n]\n}，
 * 没调用 finish 就 close 的输出不是合法的数组，调用方应当丢弃。
 */
public class CompilationDatabaseWriter implements Closeable {

    private final Writer out;
    private final ObjectWriter recordWriter;
    private boolean opened;
    private boolean finished;
    private int count;

    public CompilationDatabaseWriter(Writer out, ObjectMapper objectMapper) {
        this.out = out;
        DefaultPrettyPrinter printer = new DefaultPrettyPrinter()
                .withObjectIndenter(new DefaultIndenter("  ", "\n"));
        this.recordWriter = objectMapper.writer(printer);
    }

    public void write(CompilationRecord record) throws IOException {
        open();
        out.write(count == 0 ? "\n" : ",\n");
        out.write(recordWriter.writeValueAsString(record));
        count++;
    }

    public int getCount() {
        return count;
    }

    private void open() throws IOException {
        if (!opened) {
            out.write("[");
            opened = true;
        }
    }

    public void finish() throws IOException {
        if (finished) {
            return;
        }
        open();
        out.write("\n]\n");
        out.flush();
        finished = true;
    }

    @Override
    public void close() throws IOException {
        out.close();
    }
}
