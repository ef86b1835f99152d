package com.quotapool;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * 多 Key 配额池调度服务 - 启动类。
 */
@SpringBootApplication(scanBasePackages = "com.quotapool")
@EnableScheduling
public class QuotaPoolApplication {

    public static void main(String[] args) throws Exception {
        // SQLite 不会自动创建父目录，启动前确保 data/ 存在
        Files.createDirectories(Path.of("data"));
        SpringApplication.run(QuotaPoolApplication.class, args);
    }
}
