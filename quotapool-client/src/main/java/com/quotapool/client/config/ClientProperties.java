package com.quotapool.client.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 远程 API 客户端配置项。
 */
@Data
@ConfigurationProperties(prefix = "quotapool.client")
public class ClientProperties {

    /** API 根地址 */
    private String baseUrl = "https://www.googleapis.com/youtube/v3";

    /** API Key 作为查询参数时的参数名 */
    private String keyParam = "key";

    /** 建立连接超时（秒） */
    private int connectTimeoutSeconds = 10;

    /** 单次请求读超时（秒） */
    private int requestTimeoutSeconds = 30;
}
