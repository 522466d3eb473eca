package com.xcodecompiledb.converter.service;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.regex.PatternSyntaxException;

import static org.junit.jupiter.api.Assertions.*;

class ExclusionFilterTest {

    @Test
    void none_excludesNothing() {
        assertFalse(ExclusionFilter.none().isDirectoryExcluded("/excluded"));
        assertFalse(ExclusionFilter.none().isFileExcluded(""));
    }

    @Test
    void of_matchesAnywhereUnlessAnchored() {
        ExclusionFilter filter = ExclusionFilter.of(List.of("^/excluded$"), List.of("/Pods/", "\\.mm$"));

        assertTrue(filter.isDirectoryExcluded("/excluded"));
        assertFalse(filter.isDirectoryExcluded("/excluded/sub"));
        assertTrue(filter.isFileExcluded("/project/Pods/AFNetworking/a.m"));
        assertTrue(filter.isFileExcluded("/project/b.mm"));
        assertFalse(filter.isFileExcluded("/project/b.m"));
    }

    @Test
    void of_ignoresBlankAndNullLists() {
        ExclusionFilter filter = ExclusionFilter.of(null, List.of(" "));

        assertFalse(filter.isDirectoryExcluded("/any"));
        assertFalse(filter.isFileExcluded("/any"));
    }

    @Test
    void of_rejectsInvalidRegex() {
        assertThrows(PatternSyntaxException.class, () -> ExclusionFilter.of(List.of("("), List.of()));
    }
}
