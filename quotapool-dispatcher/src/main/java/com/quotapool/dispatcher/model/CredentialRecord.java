package com.quotapool.dispatcher.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * 单个 API Key 的配额用量记录，按 Key 在配置中的序号唯一标识。
 * <p>
 * 只保存展示标识，不保存 Key 本身。
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class CredentialRecord {

    /** Key 序号，进程生命周期内不变 */
    private int index;

    /** 展示标识（Key 末尾几位） */
    private String identifier;

    /** 自上次重置以来的已用配额，始终 >= 0 */
    private long quotaUsed;

    /** 上一次重置为 0 的时间 */
    private Instant lastReset;

    /** 最近一次成功计费时间 */
    private Instant lastUsed;

    /** false 表示已停用，直到人工恢复；日重置不会改动它 */
    @Builder.Default
    private boolean active = true;

    /** 自上次成功以来的连续失败次数 */
    private int errorCount;

    /** 最近一次失败时间 */
    private Instant lastError;

    /**
     * 创建一条新的零用量记录。
     */
    public static CredentialRecord fresh(int index, String identifier, Instant now) {
        return CredentialRecord.builder()
                .index(index)
                .identifier(identifier)
                .quotaUsed(0)
                .lastReset(now)
                .active(true)
                .errorCount(0)
                .build();
    }

    /**
     * 日重置：清零用量和错误数，不改变启用状态。
     */
    public void resetQuota(Instant now) {
        this.quotaUsed = 0;
        this.errorCount = 0;
        this.lastReset = now;
    }

    public long remaining(long dailyQuotaLimit) {
        return dailyQuotaLimit - quotaUsed;
    }

    public CredentialRecord copy() {
        return toBuilder().build();
    }
}
