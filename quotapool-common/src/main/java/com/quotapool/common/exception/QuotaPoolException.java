package com.quotapool.common.exception;

/**
 * 系统基础异常，所有配额池业务异常的父类。
 */
public class QuotaPoolException extends RuntimeException {

    private final String errorCode;

    public QuotaPoolException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public QuotaPoolException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
