package com.quotapool.common.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * Key 池整体配额汇总。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PoolSummary {

    /** 当前使用中的 Key 序号 */
    private int activeIndex;

    /** 所有 Key 当日已用配额之和 */
    private long totalUsed;

    /** 池总配额 = Key 数 × 日上限 */
    private long totalAvailable;

    /** 每个 Key 的日配额上限 */
    private long dailyQuotaLimit;

    /** 下一次配额重置时间（UTC 零点） */
    private Instant nextReset;

    private List<CredentialStatus> credentials;

    /**
     * 未达到预警阈值、仍可正常使用的 Key 数量。
     */
    public long healthyCount() {
        if (credentials == null) {
            return 0;
        }
        return credentials.stream()
                .filter(c -> c.getHealth() == CredentialStatus.Health.HEALTHY)
                .count();
    }
}
