package com.quotapool.common.exception;

/**
 * 未配置任何 API Key（启动配置错误）。
 */
public class NoCredentialConfiguredException extends QuotaPoolException {

    public NoCredentialConfiguredException(String message) {
        super("NO_CREDENTIAL", message);
    }
}
