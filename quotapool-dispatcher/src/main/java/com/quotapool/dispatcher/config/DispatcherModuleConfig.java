package com.quotapool.dispatcher.config;

import com.quotapool.dispatcher.pool.ErrorClassifier;
import com.quotapool.dispatcher.pool.KeyPoolManager;
import com.quotapool.dispatcher.pool.TaggedErrorClassifier;
import com.quotapool.dispatcher.quota.QuotaClock;
import com.quotapool.dispatcher.rotation.RotationPolicy;
import com.quotapool.dispatcher.store.CredentialStore;
import com.quotapool.dispatcher.store.InMemoryCredentialStore;
import com.quotapool.dispatcher.store.RedisCredentialStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Clock;

/**
 * 调度模块自动配置。
 * <p>
 * 通过 {@code quotapool.dispatcher.storage-type} 切换用量存储实现：
 * <ul>
 *   <li>{@code memory}（默认）：纯内存，零外部依赖，重启后用量清零</li>
 *   <li>{@code redis}：Redis 实现，适合分布式多实例部署</li>
 *   <li>{@code jdbc}：SQLite 持久化，由 web 模块提供</li>
 * </ul>
 */
@Slf4j
@Configuration
@ComponentScan(basePackages = "com.quotapool.dispatcher")
@EnableConfigurationProperties(DispatcherProperties.class)
public class DispatcherModuleConfig {

    // ==================== 用量存储 ====================

    @Bean
    @ConditionalOnProperty(name = "quotapool.dispatcher.storage-type", havingValue = "memory", matchIfMissing = true)
    public CredentialStore inMemoryCredentialStore() {
        log.info("使用内存 Key 用量存储（轻量模式，重启后用量清零）");
        return new InMemoryCredentialStore();
    }

    @Bean
    @ConditionalOnProperty(name = "quotapool.dispatcher.storage-type", havingValue = "redis")
    public CredentialStore redisCredentialStore(StringRedisTemplate redisTemplate, DispatcherProperties properties) {
        log.info("使用 Redis Key 用量存储（分布式模式）");
        return new RedisCredentialStore(redisTemplate, properties);
    }

    // ==================== 轮换核心 ====================

    @Bean
    public Clock quotaPoolClock() {
        return Clock.systemUTC();
    }

    @Bean
    public QuotaClock quotaClock() {
        return new QuotaClock();
    }

    @Bean
    public RotationPolicy rotationPolicy(DispatcherProperties properties) {
        return new RotationPolicy(properties.getMaxConsecutiveErrors());
    }

    @Bean
    public ErrorClassifier errorClassifier() {
        return new TaggedErrorClassifier();
    }

    @Bean
    public KeyPoolManager keyPoolManager(CredentialStore credentialStore, QuotaClock quotaClock,
                                         RotationPolicy rotationPolicy, ErrorClassifier errorClassifier,
                                         DispatcherProperties properties, Clock quotaPoolClock) {
        properties.validate();
        log.info("配额阈值: 日上限 {}, 预警 {}, 紧急 {}", properties.getDailyQuotaLimit(),
                properties.getWarnThreshold(), properties.getEmergencyThreshold());
        return new KeyPoolManager(credentialStore, quotaClock, rotationPolicy, errorClassifier,
                properties, quotaPoolClock);
    }
}
