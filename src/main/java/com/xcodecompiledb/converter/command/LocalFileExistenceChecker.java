package com.xcodecompiledb.converter.command;

import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;

@Component
public class LocalFileExistenceChecker implements FileExistenceChecker {

    @Override
    public boolean exists(String path) {
        try {
            return Files.exists(Path.of(path));
        } catch (InvalidPathException e) {
            // 连路径都不合法，自然不存在
            return false;
        }
    }
}
