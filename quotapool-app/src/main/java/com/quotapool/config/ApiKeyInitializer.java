package com.quotapool.config;

import com.quotapool.dispatcher.pool.KeyPoolManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;

/**
 * 应用启动时，从配置文件加载 API Keys 并注册到 Key 池。
 * <p>
 * 配置方式（在 application.yml 中）：
 * quotapool.api-keys=key1,key2,key3
 * <p>
 * 或通过环境变量：QUOTAPOOL_API_KEYS=key1,key2,key3
 * <p>
 * Key 的序号即其在列表中的位置，调整顺序会让用量记录对应到其他 Key。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ApiKeyInitializer implements CommandLineRunner {

    private final KeyPoolManager keyPoolManager;

    @Value("${quotapool.api-keys:}")
    private String apiKeysConfig;

    @Override
    public void run(String... args) {
        List<String> keys = parseKeys(apiKeysConfig);

        if (keys.isEmpty()) {
            log.warn("==============================================");
            log.warn("  未配置 API Keys！所有远程调用都将失败");
            log.warn("  请在 application.yml 中设置:");
            log.warn("  quotapool.api-keys: your-key1,your-key2");
            log.warn("  或通过环境变量: QUOTAPOOL_API_KEYS");
            log.warn("==============================================");
            return;
        }

        keyPoolManager.registerCredentials(keys);
        log.info("已加载 {} 个 API Keys 到配额池", keys.size());
    }

    static List<String> parseKeys(String config) {
        if (config == null || config.isBlank()) {
            return List.of();
        }
        return Arrays.stream(config.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
    }
}
