package com.quotapool.common.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * 单个 API Key 的配额状态快照（只读，对外展示用，不含完整 Key）。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CredentialStatus {

    /** Key 在池中的序号（按配置顺序） */
    private int index;

    /** 展示用标识（Key 末尾若干位） */
    private String identifier;

    /** 当日已用配额 */
    private long quotaUsed;

    /** 当日剩余配额，可能为负（超额计费时） */
    private long remaining;

    /** 是否启用 */
    private boolean active;

    /** 最近一次成功调用时间，可能为空 */
    private Instant lastUsed;

    /** 连续失败次数 */
    private int errorCount;

    /** 健康等级 */
    private Health health;

    /** 是否为当前正在使用的 Key */
    private boolean current;

    public enum Health {
        HEALTHY, LOW, EXHAUSTED, DISABLED
    }
}
