package com.quotapool.web.entity;

import lombok.*;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

/**
 * API Key 用量表：每个 Key 序号一行，保存当日配额与连续错误数。
 * 时间字段按 ISO-8601 文本存储（SQLite 无原生时间类型）。
 */
@Table("t_credential_usage")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CredentialUsageEntity {

    @Id
    private Long id;

    private Integer credentialIndex;
    private String identifier;

    @Builder.Default
    private Long quotaUsed = 0L;

    private String lastReset;
    private String lastUsed;

    @Builder.Default
    private Boolean active = true;

    @Builder.Default
    private Integer errorCount = 0;

    private String lastError;
    private String updatedAt;
}
