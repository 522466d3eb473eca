package com.xcodecompiledb.converter.config;

import com.xcodecompiledb.converter.service.ExclusionFilter;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * {@code compiledb.*} 配置，命令行上可以用 {@code --compiledb.output=...} 覆盖。
 */
@ConfigurationProperties(prefix = "compiledb")
@Data
public class CompileDbProperties {

    /** 默认输入日志，命令行第一个非选项参数优先 */
    private String input = "xcodebuild.log";

    private String output = "compile_commands.json";

    /** 目录排除正则 */
    private List<String> excludeDirectories = new ArrayList<>();

    /** 文件排除正则，匹配规范化后的源文件路径 */
    private List<String> excludeFiles = new ArrayList<>();

    public ExclusionFilter toExclusionFilter() {
        return ExclusionFilter.of(excludeDirectories, excludeFiles);
    }
}
