package com.xcodecompiledb.converter.parser;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * 日志里能识别的 section 类型。声明顺序就是匹配顺序，先匹配者优先。
 */
public enum SectionKind {
    COMPILE(Pattern.compile("^CompileC\\s")),
    PRECOMPILE(Pattern.compile("^ProcessPCH(?:\\+\\+)?\\s"));

    private final Pattern marker;

    SectionKind(Pattern marker) {
        this.marker = marker;
    }

    public boolean isMarker(String line) {
        return marker.matcher(line).find();
    }

    public static Optional<SectionKind> detect(String line) {
        for (SectionKind kind : values()) {
            if (kind.isMarker(line)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
