package com.xcodecompiledb.converter.parser;

import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.InputStream;
import java.util.Locale;

/**
 * 输入日志格式，按文件扩展名选择。
 */
public enum LogFormat {
    PLAIN,
    JSON_LINES;

    public static LogFormat fromFileName(String fileName) {
        if (fileName == null) {
            return PLAIN;
        }
        String lower = fileName.toLowerCase(Locale.ROOT);
        if (lower.endsWith(".json") || lower.endsWith(".jsonl")) {
            return JSON_LINES;
        }
        return PLAIN;
    }

    public LogLineSource open(InputStream inputStream, ObjectMapper objectMapper) {
        return switch (this) {
            case PLAIN -> new PlainLogLineSource(inputStream);
            case JSON_LINES -> new JsonLinesLogLineSource(inputStream, objectMapper);
        };
    }
}
