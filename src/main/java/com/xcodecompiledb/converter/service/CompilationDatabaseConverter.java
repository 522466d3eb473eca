package com.xcodecompiledb.converter.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.xcodecompiledb.converter.command.CommandProcessor;
import com.xcodecompiledb.converter.command.FileExistenceChecker;
import com.xcodecompiledb.converter.command.PchTable;
import com.xcodecompiledb.converter.model.CompilationRecord;
import com.xcodecompiledb.converter.parser.LogFormat;
import com.xcodecompiledb.converter.parser.LogLineSource;
import com.xcodecompiledb.converter.parser.SectionScanner;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.Optional;

/**
 * 一次转换：日志 → 编译数据库。
 * 每次调用都新建 PCH 表，不同转换之间不共享状态。
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CompilationDatabaseConverter {

    private final FileExistenceChecker fileExistenceChecker;
    private final ObjectMapper objectMapper;

    /**
     * 边扫描边写出，返回写出的记录数。出错时已经写出的内容不完整，由调用方丢弃。
     */
    public int convert(LogLineSource source, ExclusionFilter filter, CompilationDatabaseWriter writer)
            throws IOException {
        SectionScanner scanner = newScanner(source, filter);
        Optional<CompilationRecord> record;
        while ((record = scanner.nextRecord()).isPresent()) {
            writer.write(record.get());
        }
        writer.finish();
        return writer.getCount();
    }

    public List<CompilationRecord> convert(LogLineSource source, ExclusionFilter filter) {
        return newScanner(source, filter).records().toList();
    }

    /**
     * 转换 input 写到 output。先写同目录下的临时文件，成功后再移动过去，
     * 中途失败时删掉临时文件，已有的 output 保持不动。
     */
    public int convertFile(Path input, Path output, ExclusionFilter filter) throws IOException {
        LogFormat format = LogFormat.fromFileName(input.getFileName().toString());
        log.info("Converting {} ({}) -> {}", input, format, output);

        Path absoluteOutput = output.toAbsolutePath();
        Path temp = Files.createTempFile(absoluteOutput.getParent(), ".compile_commands", ".json.tmp");
        boolean done = false;
        try {
            int count;
            try (InputStream in = Files.newInputStream(input);
                 LogLineSource source = format.open(in, objectMapper);
                 BufferedWriter out = Files.newBufferedWriter(temp, StandardCharsets.UTF_8);
                 CompilationDatabaseWriter writer = new CompilationDatabaseWriter(out, objectMapper)) {
                count = convert(source, filter, writer);
            }
            Files.move(temp, absoluteOutput, StandardCopyOption.REPLACE_EXISTING);
            done = true;
            log.info("Wrote {} compilation records to {}", count, output);
            return count;
        } finally {
            if (!done) {
                Files.deleteIfExists(temp);
            }
        }
    }

    private SectionScanner newScanner(LogLineSource source, ExclusionFilter filter) {
        CommandProcessor processor = new CommandProcessor(new PchTable(), fileExistenceChecker);
        return new SectionScanner(source, processor, filter::isDirectoryExcluded, filter::isFileExcluded);
    }
}
