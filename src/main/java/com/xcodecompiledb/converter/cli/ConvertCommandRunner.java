package com.xcodecompiledb.converter.cli;

import com.xcodecompiledb.converter.command.ConversionException;
import com.xcodecompiledb.converter.config.CompileDbProperties;
import com.xcodecompiledb.converter.service.CompilationDatabaseConverter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.regex.PatternSyntaxException;

/**
 * 命令行入口：{@code xcode-compiledb [log] [--compiledb.output=...]}。
 * <p>
 * 退出码：0 成功；1 输入日志不存在；2 转换中止（此时不会留下输出文件）。
 */
@Component
@Profile("!server")
@RequiredArgsConstructor
@Slf4j
public class ConvertCommandRunner implements ApplicationRunner, ExitCodeGenerator {

    static final int EXIT_OK = 0;
    static final int EXIT_INPUT_NOT_FOUND = 1;
    static final int EXIT_CONVERSION_FAILED = 2;

    private final CompileDbProperties properties;
    private final CompilationDatabaseConverter converter;

    private int exitCode = EXIT_OK;

    @Override
    public void run(ApplicationArguments args) {
        List<String> positional = args.getNonOptionArgs();
        Path input = Path.of(positional.isEmpty() ? properties.getInput() : positional.get(0));
        if (!Files.isRegularFile(input)) {
            log.error("Input log not found: {}", input);
            exitCode = EXIT_INPUT_NOT_FOUND;
            return;
        }

        try {
            converter.convertFile(input, Path.of(properties.getOutput()), properties.toExclusionFilter());
            exitCode = EXIT_OK;
        } catch (ConversionException | PatternSyntaxException e) {
            log.error("Conversion aborted: {}", e.getMessage());
            exitCode = EXIT_CONVERSION_FAILED;
        } catch (IOException e) {
            log.error("I/O error while converting {}", input, e);
            exitCode = EXIT_CONVERSION_FAILED;
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
