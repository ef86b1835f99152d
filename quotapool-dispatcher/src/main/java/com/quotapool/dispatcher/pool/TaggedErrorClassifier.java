package com.quotapool.dispatcher.pool;

import com.quotapool.common.dto.FailureKind;
import com.quotapool.common.exception.ClassifiedFailureException;

/**
 * 默认分类器：读取传输层打上的 {@link ClassifiedFailureException} 标签。
 * <p>
 * 沿 cause 链查找（兼容被 CompletionException 等包装的情况），
 * 找不到标签的异常一律视为与 Key 无关。
 */
public class TaggedErrorClassifier implements ErrorClassifier {

    private static final int MAX_CAUSE_DEPTH = 8;

    @Override
    public FailureKind classify(Throwable error) {
        Throwable current = error;
        for (int depth = 0; current != null && depth < MAX_CAUSE_DEPTH; depth++) {
            if (current instanceof ClassifiedFailureException classified) {
                return classified.getKind();
            }
            current = current.getCause();
        }
        return FailureKind.NON_RETRYABLE;
    }
}
