package com.xcodecompiledb.converter;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.boot.web.context.WebServerApplicationContext;
import org.springframework.context.ConfigurableApplicationContext;

/**
 * 默认作为命令行工具运行一次转换后退出；
 * 打开 {@code server} profile 时作为 HTTP 服务常驻（POST /api/convert）。
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class CompileDbApplication {

    public static void main(String[] args) {
        ConfigurableApplicationContext context = SpringApplication.run(CompileDbApplication.class, args);
        if (!(context instanceof WebServerApplicationContext)) {
            System.exit(SpringApplication.exit(context));
        }
    }
}
