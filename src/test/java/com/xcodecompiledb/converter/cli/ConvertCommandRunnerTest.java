package com.xcodecompiledb.converter.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.xcodecompiledb.converter.config.CompileDbProperties;
import com.xcodecompiledb.converter.service.CompilationDatabaseConverter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.DefaultApplicationArguments;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ConvertCommandRunnerTest {

    @TempDir
    Path tempDir;

    private CompileDbProperties properties;
    private Path output;

    @BeforeEach
    void setUp() {
        output = tempDir.resolve("compile_commands.json");
        properties = new CompileDbProperties();
        properties.setInput(tempDir.resolve("xcodebuild.log").toString());
        properties.setOutput(output.toString());
    }

    @Test
    void run_convertsDefaultInput() throws IOException {
        Files.writeString(Path.of(properties.getInput()), String.join("\n",
                "CompileC build/a.o a.cpp normal x86_64 c++ x",
                "    cd /project",
                "    clang -c /project/a.cpp -o /project/a.o"));
        ConvertCommandRunner runner = new ConvertCommandRunner(properties, realConverter());

        runner.run(new DefaultApplicationArguments());

        assertEquals(ConvertCommandRunner.EXIT_OK, runner.getExitCode());
        assertTrue(Files.readString(output).contains("\"/project/a.cpp\""));
    }

    @Test
    void run_prefersPositionalInput() throws IOException {
        Path other = Files.writeString(tempDir.resolve("other.log"), "nothing to see\n");
        ConvertCommandRunner runner = new ConvertCommandRunner(properties, realConverter());

        runner.run(new DefaultApplicationArguments(other.toString()));

        assertEquals(ConvertCommandRunner.EXIT_OK, runner.getExitCode());
        assertEquals("[\n]\n", Files.readString(output));
    }

    @Test
    void run_reportsMissingInput() {
        ConvertCommandRunner runner = new ConvertCommandRunner(properties, realConverter());

        runner.run(new DefaultApplicationArguments());

        assertEquals(ConvertCommandRunner.EXIT_INPUT_NOT_FOUND, runner.getExitCode());
        assertFalse(Files.exists(output));
    }

    @Test
    void run_reportsUnresolvedPrecompiledHeader() throws IOException {
        Files.writeString(Path.of(properties.getInput()), String.join("\n",
                "CompileC build/a.o a.m normal x86_64 objective-c x",
                "    cd /project",
                "    clang -include /cache/Prefix.pch -c /project/a.m -o /project/a.o"));
        ConvertCommandRunner runner = new ConvertCommandRunner(properties, realConverter());

        runner.run(new DefaultApplicationArguments());

        assertEquals(ConvertCommandRunner.EXIT_CONVERSION_FAILED, runner.getExitCode());
        assertFalse(Files.exists(output));
    }

    @Test
    void run_reportsInvalidExclusionPattern() throws IOException {
        Files.writeString(Path.of(properties.getInput()), "\n");
        properties.setExcludeFiles(List.of("("));
        ConvertCommandRunner runner = new ConvertCommandRunner(properties, realConverter());

        runner.run(new DefaultApplicationArguments());

        assertEquals(ConvertCommandRunner.EXIT_CONVERSION_FAILED, runner.getExitCode());
    }

    @Test
    void run_reportsIoFailure() throws IOException {
        Files.writeString(Path.of(properties.getInput()), "\n");
        CompilationDatabaseConverter converter = mock(CompilationDatabaseConverter.class);
        when(converter.convertFile(any(), any(), any())).thenThrow(new IOException("disk full"));
        ConvertCommandRunner runner = new ConvertCommandRunner(properties, converter);

        runner.run(new DefaultApplicationArguments());

        assertEquals(ConvertCommandRunner.EXIT_CONVERSION_FAILED, runner.getExitCode());
    }

    private static CompilationDatabaseConverter realConverter() {
        return new CompilationDatabaseConverter(path -> false, new ObjectMapper());
    }
}
