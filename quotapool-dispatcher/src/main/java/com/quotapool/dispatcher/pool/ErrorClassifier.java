package com.quotapool.dispatcher.pool;

import com.quotapool.common.dto.FailureKind;

/**
 * 把远程调用抛出的异常归入 {@link FailureKind}。
 * <p>
 * 这是调度核心唯一需要的传输层知识，由传输层替换实现。
 */
@FunctionalInterface
public interface ErrorClassifier {

    FailureKind classify(Throwable error);
}
