package com.xcodecompiledb.converter.service;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.xcodecompiledb.converter.model.CompilationRecord;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.StringWriter;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CompilationDatabaseWriterTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void finish_writesEmptyArray() throws IOException {
        StringWriter out = new StringWriter();
        try (CompilationDatabaseWriter writer = new CompilationDatabaseWriter(out, objectMapper)) {
            writer.finish();
        }

        assertEquals("[\n]\n", out.toString());
    }

    @Test
    void write_framesRecords() throws IOException {
        StringWriter out = new StringWriter();
        try (CompilationDatabaseWriter writer = new CompilationDatabaseWriter(out, objectMapper)) {
            writer.write(new CompilationRecord("/project", "clang -c a.cpp -o a.o", "a.cpp"));
            writer.write(new CompilationRecord("/project", "clang -c b.cpp -o b.o", "b.cpp"));
            writer.finish();
            assertEquals(2, writer.getCount());
        }

        String json = out.toString();
        assertTrue(json.startsWith("[\n{\n  \"directory\""), json);
        assertTrue(json.contains("},\n{"), json);
        assertTrue(json.endsWith("}\n]\n"), json);

        List<CompilationRecord> parsed = objectMapper.readValue(json, new TypeReference<>() {
        });
        assertEquals("b.cpp", parsed.get(1).getFile());
        assertEquals("clang -c a.cpp -o a.o", parsed.get(0).getCommand());
    }

    @Test
    void write_keepsFieldOrder() throws IOException {
        StringWriter out = new StringWriter();
        try (CompilationDatabaseWriter writer = new CompilationDatabaseWriter(out, objectMapper)) {
            writer.write(new CompilationRecord("/d", "cc -c \"a b.c\" -o x.o", "a b.c"));
            writer.finish();
        }

        String json = out.toString();
        assertTrue(json.indexOf("\"directory\"") < json.indexOf("\"command\""));
        assertTrue(json.indexOf("\"command\"") < json.indexOf("\"file\""));
        assertTrue(json.contains("cc -c \\\"a b.c\\\" -o x.o"), json);
    }
}
