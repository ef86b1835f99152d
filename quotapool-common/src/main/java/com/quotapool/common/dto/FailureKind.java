package com.quotapool.common.dto;

/**
 * 远程调用失败的分类，调度核心只依据该分类决定是否换 Key 重试。
 */
public enum FailureKind {

    /** 当日配额已用完：钉死用量为日上限，换 Key 重试 */
    QUOTA_EXCEEDED,

    /** Key 无效：永久停用该 Key（需人工恢复），换 Key 重试 */
    CREDENTIAL_INVALID,

    /** 其他与 Key 相关的临时错误：累计连续错误数，达到阈值后换 Key */
    TRANSIENT,

    /** 与 Key 无关的错误：不重试，直接抛出 */
    NON_RETRYABLE
}
