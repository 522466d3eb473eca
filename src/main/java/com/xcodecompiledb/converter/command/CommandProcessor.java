package com.xcodecompiledb.converter.command;

import com.xcodecompiledb.converter.model.CompilationRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * 处理 section 里找到的编译器调用行。
 * <ul>
 *   <li>ProcessPCH：登记 PCH 产物 → 头文件源</li>
 *   <li>CompileC：重写 -include / -c 的参数，逐个加引号，拼回命令</li>
 * </ul>
 */
@Slf4j
@RequiredArgsConstructor
public class CommandProcessor {

    private static final String INCLUDE_FLAG = "-include";
    private static final String COMPILE_FLAG = "-c";
    private static final String OUTPUT_FLAG = "-o";

    private static final List<String> PCH_OUTPUT_SUFFIXES = List.of(".pch.pth", ".pch.pch", ".h.pch");

    private final PchTable pchTable;
    private final FileExistenceChecker fileExistenceChecker;

    public void registerSourceForPchFile(String line, String directory) {
        List<String> tokens = ShellTokenizer.tokenize(line);

        String source = null;
        String artifact = null;
        for (int i = 0; i < tokens.size(); i++) {
            String token = tokens.get(i);
            if (COMPILE_FLAG.equals(token) && i + 1 < tokens.size()) {
                source = tokens.get(++i);
            } else if (OUTPUT_FLAG.equals(token) && i + 1 < tokens.size()) {
                String output = tokens.get(++i);
                if (isPchArtifact(output)) {
                    artifact = output;
                }
            }
        }

        if (source != null && artifact != null) {
            pchTable.register(artifact, source);
        } else {
            log.debug("No PCH mapping in precompile invocation (dir={}): {}", directory, line);
        }
    }

    public CompilationRecord processCompileCommand(String line, String directory) {
        List<String> tokens = ShellTokenizer.tokenize(line);
        List<String> quoted = new ArrayList<>(tokens.size());

        String source = null;
        for (int i = 0; i < tokens.size(); i++) {
            String token = tokens.get(i);
            quoted.add(CommandQuoter.quote(token));

            if (i + 1 >= tokens.size()) {
                continue;
            }
            if (INCLUDE_FLAG.equals(token)) {
                quoted.add(CommandQuoter.quote(resolveInclude(tokens.get(++i))));
            } else if (COMPILE_FLAG.equals(token)) {
                source = tokens.get(++i);
                quoted.add(CommandQuoter.quote(source));
            }
        }

        if (source == null) {
            throw new MalformedInvocationException("No compiled file (-c) in invocation: " + line);
        }
        return new CompilationRecord(directory, String.join(" ", quoted), normalize(source));
    }

    private String resolveInclude(String path) {
        if (fileExistenceChecker.exists(path)) {
            return path;
        }
        String header = pchTable.resolveInclude(path)
                .orElseThrow(() -> new UnresolvedPrecompiledHeaderException(path));
        log.debug("-include {} resolved to {}", path, header);
        return header;
    }

    private static boolean isPchArtifact(String output) {
        return PCH_OUTPUT_SUFFIXES.stream().anyMatch(output::endsWith);
    }

    static String normalize(String path) {
        try {
            return Path.of(path).normalize().toString();
        } catch (InvalidPathException e) {
            log.warn("Keeping unnormalizable path as-is: {}", path);
            return path;
        }
    }
}
