package com.quotapool.common.exception;

/**
 * Key 池耗尽异常：轮换找不到任何可用 Key，或重试次数用尽时抛出。
 * <p>
 * cause 为最后一次底层调用失败的异常（如有）。
 */
public class PoolExhaustedException extends QuotaPoolException {

    public PoolExhaustedException(String message) {
        super("POOL_EXHAUSTED", message);
    }

    public PoolExhaustedException(String message, Throwable lastError) {
        super("POOL_EXHAUSTED", message, lastError);
    }
}
