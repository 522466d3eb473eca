package com.xcodecompiledb.converter.parser;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class SectionKindTest {

    @Test
    void detect_recognizesMarkers() {
        assertEquals(Optional.of(SectionKind.COMPILE),
                SectionKind.detect("CompileC build/a.o a.m normal x86_64 objective-c com.apple.compilers.llvm.clang.1_0.compiler"));
        assertEquals(Optional.of(SectionKind.PRECOMPILE),
                SectionKind.detect("ProcessPCH /cache/Prefix.pch.pch Prefix.pch normal x86_64 objective-c com.apple.compilers.llvm.clang.1_0.compiler"));
        assertEquals(Optional.of(SectionKind.PRECOMPILE),
                SectionKind.detect("ProcessPCH++ /cache/Prefix.pch.pch Prefix.pch normal x86_64 objective-c++ com.apple.compilers.llvm.clang.1_0.compiler"));
    }

    @Test
    void detect_ignoresIndentedOrUnrelatedLines() {
        assertTrue(SectionKind.detect("    CompileC build/a.o").isEmpty());
        assertTrue(SectionKind.detect("CompileCSomething").isEmpty());
        assertTrue(SectionKind.detect("Ld build/app normal x86_64").isEmpty());
    }
}
