package com.xcodecompiledb.converter.parser;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Optional;

/**
 * JSON lines 格式的日志（xctool 的 json-stream 输出）。
 * <p>
 * 每行一个 JSON 对象，取其中的 {@code command} 字段，按换行拆成若干"伪日志行"，
 * 所有对象的行首尾相接成一条流，再交给同一个 scanner。
 * 没有 {@code command} 字段的对象直接跳过。
 */
@Slf4j
public class JsonLinesLogLineSource implements LogLineSource {

    private static final String COMMAND_FIELD = "command";

    private final BufferedReader reader;
    private final ObjectMapper objectMapper;
    private final Deque<String> pending = new ArrayDeque<>();
    private int lineNumber;

    public JsonLinesLogLineSource(InputStream inputStream, ObjectMapper objectMapper) {
        this.reader = new BufferedReader(new InputStreamReader(inputStream, StandardCharsets.UTF_8));
        this.objectMapper = objectMapper;
    }

    @Override
    public Optional<String> nextLine() throws IOException {
        while (pending.isEmpty()) {
            String raw = reader.readLine();
            if (raw == null) {
                return Optional.empty();
            }
            lineNumber++;
            if (raw.isBlank()) {
                continue;
            }

            JsonNode command = parse(raw).get(COMMAND_FIELD);
            if (command == null || !command.isTextual()) {
                continue;
            }
            command.asText().lines().forEach(pending::addLast);
        }
        return Optional.of(pending.removeFirst());
    }

    private JsonNode parse(String raw) {
        try {
            return objectMapper.readTree(raw);
        } catch (JsonProcessingException e) {
            throw new LogFormatException("Invalid JSON on line " + lineNumber, e);
        }
    }

    @Override
    public void close() throws IOException {
        reader.close();
    }
}
