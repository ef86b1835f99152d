package com.quotapool.web.config;

import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;

/**
 * Web 模块配置：REST 接口与 SQLite 用量存储（见 {@link JdbcStoreConfig}）。
 */
@Configuration
@ComponentScan(basePackages = "com.quotapool.web")
public class WebModuleConfig {
}
