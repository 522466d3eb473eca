package com.xcodecompiledb.converter.command;

import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * PCH 产物路径 → 生成它的头文件源路径。
 * <p>
 * 每次转换新建一张，按日志顺序写入和查询：ProcessPCH section 先登记，
 * 之后的 CompileC section 才能查到。条目从不删除。
 */
@Slf4j
public class PchTable {

    /** -include 路径依次尝试的后缀，空串（原样查询）放最后 */
    private static final List<String> LOOKUP_SUFFIXES = List.of(".pth", ".pch", "");

    private final Map<String, String> sourceByArtifact = new LinkedHashMap<>();

    /** 同一个产物路径重复登记时后写者生效 */
    public void register(String artifactPath, String headerSource) {
        String previous = sourceByArtifact.put(artifactPath, headerSource);
        if (previous != null && !previous.equals(headerSource)) {
            log.debug("PCH {} re-registered: {} -> {}", artifactPath, previous, headerSource);
        } else {
            log.debug("PCH {} registered from {}", artifactPath, headerSource);
        }
    }

    Optional<String> get(String artifactPath) {
        return Optional.ofNullable(sourceByArtifact.get(artifactPath));
    }

    /**
     * 把 -include 里引用的路径解析回头文件源路径。
     * 依次查：路径 + .pth、路径 + .pch、路径本身。
     */
    public Optional<String> resolveInclude(String includePath) {
        for (String suffix : LOOKUP_SUFFIXES) {
            String source = sourceByArtifact.get(includePath + suffix);
            if (source != null) {
                return Optional.of(source);
            }
        }
        return Optional.empty();
    }

    int size() {
        return sourceByArtifact.size();
    }
}
