package com.xcodecompiledb.converter.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 编译数据库里的一条记录，对应一个翻译单元：
 * <pre>
 * {
 *   "directory": "/project",
 *   "command": "clang -c /project/a.cpp -o /project/a.o",
 *   "file": "/project/a.cpp"
 * }
 * </pre>
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonPropertyOrder({"directory", "command", "file"})
public class CompilationRecord {

    /** 编译时的工作目录（来自 section 里的 cd 行，解析不到时为空串） */
    private String directory;

    /** 重新加引号后的完整编译命令 */
    private String command;

    /** 被编译的源文件，已规范化；永远不是 PCH 产物路径 */
    private String file;
}
