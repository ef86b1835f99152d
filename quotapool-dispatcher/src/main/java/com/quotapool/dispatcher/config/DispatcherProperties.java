package com.quotapool.dispatcher.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 调度中心配置项：配额阈值与存储方式。
 * <p>
 * 所有配额数值与调用成本使用同一抽象单位。
 */
@Data
@ConfigurationProperties(prefix = "quotapool.dispatcher")
public class DispatcherProperties {

    /** 存储类型: memory（内存，轻量部署） / redis（分布式） / jdbc（SQLite 持久化） */
    private String storageType = "memory";

    /** 每个 Key 的日配额上限 */
    private long dailyQuotaLimit = 10000;

    /** 预警阈值：用量达到后主动换 Key */
    private long warnThreshold = 8000;

    /** 紧急阈值：用量达到后非强制轮换不再选中该 Key */
    private long emergencyThreshold = 9500;

    /** 连续失败多少次后换 Key */
    private int maxConsecutiveErrors = 3;

    /** 剩余配额低于该值时状态显示为 LOW */
    private long lowQuotaRemaining = 1000;

    /** 展示标识取 Key 末尾的位数 */
    private int identifierLength = 6;

    /** Redis 中 Key 用量记录的前缀 */
    private String redisKeyPrefix = "quotapool:credential:";

    /** 定时状态报告的 cron 表达式（UTC） */
    private String statusReportCron = "0 0 * * * *";

    /**
     * 校验阈值关系：0 < 预警 <= 紧急 <= 日上限。
     */
    public void validate() {
        if (warnThreshold <= 0 || warnThreshold > emergencyThreshold || emergencyThreshold > dailyQuotaLimit) {
            throw new IllegalStateException(String.format(
                    "配额阈值配置错误: 需满足 0 < warn(%d) <= emergency(%d) <= limit(%d)",
                    warnThreshold, emergencyThreshold, dailyQuotaLimit));
        }
        if (maxConsecutiveErrors < 1) {
            throw new IllegalStateException("max-consecutive-errors 必须 >= 1");
        }
    }
}
