package com.xcodecompiledb.converter.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.xcodecompiledb.converter.config.CompileDbProperties;
import com.xcodecompiledb.converter.model.CompilationRecord;
import com.xcodecompiledb.converter.parser.LogFormat;
import com.xcodecompiledb.converter.parser.LogLineSource;
import com.xcodecompiledb.converter.service.CompilationDatabaseConverter;
import com.xcodecompiledb.converter.service.ExclusionFilter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;

@RestController
@RequestMapping("/api/convert")
@Slf4j
@RequiredArgsConstructor
public class ConvertController {

    private final CompilationDatabaseConverter converter;
    private final CompileDbProperties properties;
    private final ObjectMapper objectMapper;

    /**
     * 上传 xcodebuild 日志，返回编译数据库。文件名以 .json / .jsonl 结尾时按 JSON lines 解析。
     * 排除规则不传时用配置里的。
     */
    @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public List<CompilationRecord> convert(@RequestPart("file") MultipartFile file,
                                           @RequestParam(value = "excludeDirectory", required = false) List<String> excludeDirectories,
                                           @RequestParam(value = "excludeFile", required = false) List<String> excludeFiles)
            throws IOException {
        log.info("收到日志文件: name={}, size={}", file.getOriginalFilename(), file.getSize());

        ExclusionFilter filter = ExclusionFilter.of(
                excludeDirectories != null ? excludeDirectories : properties.getExcludeDirectories(),
                excludeFiles != null ? excludeFiles : properties.getExcludeFiles());
        LogFormat format = LogFormat.fromFileName(file.getOriginalFilename());

        try (InputStream in = file.getInputStream();
             LogLineSource source = format.open(in, objectMapper)) {
            List<CompilationRecord> records = converter.convert(source, filter);
            log.info("生成编译记录数量: {}", records.size());
            return records;
        }
    }
}
