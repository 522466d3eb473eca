package com.xcodecompiledb.converter.parser;

import com.xcodecompiledb.converter.command.CommandProcessor;
import com.xcodecompiledb.converter.model.CompilationRecord;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.function.Predicate;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * 逐行扫描构建日志，找出 CompileC / ProcessPCH section。
 * <p>
 * 每个 section：
 * <ol>
 *   <li>标记行的下一行是 {@code cd <dir>}，解析出工作目录</li>
 *   <li>目录被排除则整个 section 跳过，从下一行继续正常扫描</li>
 *   <li>否则往下找第一条编译器调用行，途中的行都当噪声丢掉</li>
 *   <li>CompileC 产出一条记录（文件被排除则丢弃），ProcessPCH 只登记 PCH 映射</li>
 * </ol>
 * 流读完时还没找到调用行，该 section 什么也不产出。
 * 一个 scanner 只能消费一次。
 */
@Slf4j
public class SectionScanner {

    private final LogLineSource source;
    private final CommandProcessor commandProcessor;
    private final Predicate<String> directoryExcluded;
    private final Predicate<String> fileExcluded;

    public SectionScanner(LogLineSource source,
                          CommandProcessor commandProcessor,
                          Predicate<String> directoryExcluded,
                          Predicate<String> fileExcluded) {
        this.source = source;
        this.commandProcessor = commandProcessor;
        this.directoryExcluded = directoryExcluded;
        this.fileExcluded = fileExcluded;
    }

    /**
     * 拉取下一条记录，流结束时返回 empty。
     */
    public Optional<CompilationRecord> nextRecord() throws IOException {
        while (true) {
            Optional<String> line = source.nextLine();
            if (line.isEmpty()) {
                return Optional.empty();
            }

            Optional<SectionKind> kind = SectionKind.detect(line.get());
            if (kind.isEmpty()) {
                continue;
            }

            Optional<String> directoryLine = source.nextLine();
            if (directoryLine.isEmpty()) {
                return Optional.empty();
            }
            String directory = DirectoryLineParser.parse(directoryLine.get());
            if (directoryExcluded.test(directory)) {
                log.debug("Skip {} section in excluded directory: {}", kind.get(), directory);
                continue;
            }

            Optional<String> invocation = findInvocation();
            if (invocation.isEmpty()) {
                log.debug("Log ended inside {} section without a compiler invocation (dir={})",
                        kind.get(), directory);
                return Optional.empty();
            }

            if (kind.get() == SectionKind.PRECOMPILE) {
                commandProcessor.registerSourceForPchFile(invocation.get(), directory);
                continue;
            }

            CompilationRecord record = commandProcessor.processCompileCommand(invocation.get(), directory);
            if (fileExcluded.test(record.getFile())) {
                log.debug("Skip excluded file: {}", record.getFile());
                continue;
            }
            return Optional.of(record);
        }
    }

    /**
     * 惰性的记录流，只能消费一次。读日志时的 IOException 以 UncheckedIOException 抛出。
     */
    public Stream<CompilationRecord> records() {
        Iterator<CompilationRecord> iterator = new Iterator<>() {
            private Optional<CompilationRecord> next;

            @Override
            public boolean hasNext() {
                if (next == null) {
                    try {
                        next = nextRecord();
                    } catch (IOException e) {
                        throw new UncheckedIOException(e);
                    }
                }
                return next.isPresent();
            }

            @Override
            public CompilationRecord next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                CompilationRecord record = next.get();
                next = null;
                return record;
            }
        };
        return StreamSupport.stream(
                Spliterators.spliteratorUnknownSize(iterator, Spliterator.ORDERED | Spliterator.NONNULL),
                false);
    }

    private Optional<String> findInvocation() throws IOException {
        Optional<String> line;
        while ((line = source.nextLine()).isPresent()) {
            if (CompilerInvocationMatcher.matches(line.get())) {
                log.trace("Compiler invocation ({}): {}",
                        CompilerInvocationMatcher.compilerName(line.get()), line.get());
                return line;
            }
        }
        return Optional.empty();
    }
}
