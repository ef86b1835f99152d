package com.quotapool.common.exception;

/**
 * 与 Key 无关的调用失败（请求参数错误、网络超时等），换 Key 也无法修复，直接向上抛出。
 */
public class NonRetryableException extends QuotaPoolException {

    public NonRetryableException(String message, Throwable cause) {
        super("NON_RETRYABLE", message, cause);
    }
}
