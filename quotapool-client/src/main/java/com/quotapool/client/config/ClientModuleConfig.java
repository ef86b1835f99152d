package com.quotapool.client.config;

import okhttp3.OkHttpClient;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * 远程 API 客户端模块自动配置。
 */
@Configuration
@ComponentScan(basePackages = "com.quotapool.client")
@EnableConfigurationProperties(ClientProperties.class)
public class ClientModuleConfig {

    @Bean
    public OkHttpClient apiHttpClient(ClientProperties properties) {
        return new OkHttpClient.Builder()
                .connectTimeout(Duration.ofSeconds(properties.getConnectTimeoutSeconds()))
                .readTimeout(Duration.ofSeconds(properties.getRequestTimeoutSeconds()))
                .writeTimeout(Duration.ofSeconds(10))
                .build();
    }
}
