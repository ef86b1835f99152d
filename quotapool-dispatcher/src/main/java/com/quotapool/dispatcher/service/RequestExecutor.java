package com.quotapool.dispatcher.service;

import com.quotapool.common.exception.NonRetryableException;
import com.quotapool.common.exception.PoolExhaustedException;
import com.quotapool.common.util.KeyMasks;
import com.quotapool.dispatcher.pool.ActiveCredential;
import com.quotapool.dispatcher.pool.FailureOutcome;
import com.quotapool.dispatcher.pool.KeyPoolManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * 带换 Key 重试的请求执行器。
 * <p>
 * 核心策略：
 * - 每次尝试从 Key 池借出当前 Key 执行调用，成功后按声明的成本计费
 * - 失败交给 Key 池分类处理，可换 Key 的错误在下一个 Key 上重试
 * - 与 Key 无关的错误立即抛出 {@link NonRetryableException}，不浪费重试次数
 * - 最多尝试 (Key 数 + 1) 次，保证必然结束
 * <p>
 * 调用方只会看到成功结果，或 {@link PoolExhaustedException}、{@link NonRetryableException}、
 * {@link com.quotapool.common.exception.NoCredentialConfiguredException} 三种终止错误。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RequestExecutor {

    private final KeyPoolManager keyPool;

    /**
     * 执行一次远程调用。
     *
     * @param call 实际的调用逻辑 apiKey -> result
     * @param cost 调用成功时计入的配额单位
     * @param <T>  返回类型
     * @throws IllegalArgumentException cost 为负，此时不会发起调用
     */
    public <T> T execute(CredentialCall<T> call, long cost) {
        if (cost < 0) {
            throw new IllegalArgumentException("调用成本不能为负: " + cost);
        }
        int maxAttempts = keyPool.poolSize() + 1;
        Exception lastError = null;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            ActiveCredential credential = keyPool.acquire();
            T result;
            try {
                result = call.call(credential.getSecret());
            } catch (Exception e) {
                if (e instanceof InterruptedException) {
                    Thread.currentThread().interrupt();
                }
                lastError = e;
                FailureOutcome outcome = keyPool.recordFailure(credential.getIndex(), e);
                log.warn("API 调用失败 (Key {}, 尝试 {}/{}, 处理: {}): {}",
                        KeyMasks.mask(credential.getRecord().getIdentifier()),
                        attempt, maxAttempts, outcome, e.getMessage());

                if (outcome == FailureOutcome.NON_RETRYABLE) {
                    if (e instanceof NonRetryableException nonRetryable) {
                        throw nonRetryable;
                    }
                    throw new NonRetryableException("API 调用失败，与 Key 无关，不重试: " + e.getMessage(), e);
                }
                if (outcome == FailureOutcome.EXHAUSTED) {
                    throw new PoolExhaustedException("所有 API Key 均不可用", e);
                }
                continue;
            }

            keyPool.chargeUsage(credential.getIndex(), cost);
            return result;
        }

        throw new PoolExhaustedException("请求在 " + maxAttempts + " 次尝试后仍然失败", lastError);
    }
}
