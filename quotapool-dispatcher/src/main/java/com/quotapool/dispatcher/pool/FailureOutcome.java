package com.quotapool.dispatcher.pool;

/**
 * 记录一次调用失败后，Key 池给出的处理结论。
 */
public enum FailureOutcome {

    /** 已切换到可用 Key（单 Key 池中可能仍是同一个），可以重试 */
    ROTATED,

    /** 临时错误且未达到换 Key 条件，在同一个 Key 上重试 */
    RETRY_SAME,

    /** 尝试换 Key 但整池无可用 Key */
    EXHAUSTED,

    /** 与 Key 无关的错误，未改动任何记录，不应重试 */
    NON_RETRYABLE
}
