package com.quotapool.common.exception;

import com.quotapool.common.dto.FailureKind;

/**
 * 已在传输层完成分类的远程调用失败。
 * <p>
 * 传输层（HTTP 客户端等）只在这里把厂商特定的错误映射一次，
 * 调度核心只认 {@link FailureKind}，不解析错误文本。
 */
public class ClassifiedFailureException extends QuotaPoolException {

    private final FailureKind kind;

    public ClassifiedFailureException(FailureKind kind, String message) {
        super(kind.name(), message);
        this.kind = kind;
    }

    public ClassifiedFailureException(FailureKind kind, String message, Throwable cause) {
        super(kind.name(), message, cause);
        this.kind = kind;
    }

    public FailureKind getKind() {
        return kind;
    }
}
