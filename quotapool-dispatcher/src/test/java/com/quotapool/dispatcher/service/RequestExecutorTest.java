package com.quotapool.dispatcher.service;

import com.quotapool.common.dto.FailureKind;
import com.quotapool.common.exception.ClassifiedFailureException;
import com.quotapool.common.exception.NoCredentialConfiguredException;
import com.quotapool.common.exception.NonRetryableException;
import com.quotapool.common.exception.PoolExhaustedException;
import com.quotapool.dispatcher.MutableClock;
import com.quotapool.dispatcher.config.DispatcherProperties;
import com.quotapool.dispatcher.pool.KeyPoolManager;
import com.quotapool.dispatcher.pool.TaggedErrorClassifier;
import com.quotapool.dispatcher.quota.QuotaClock;
import com.quotapool.dispatcher.rotation.RotationPolicy;
import com.quotapool.dispatcher.store.InMemoryCredentialStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class RequestExecutorTest {

    private static final String KEY_0 = "AIzaSy-key-zero-000000";
    private static final String KEY_1 = "AIzaSy-key-one-111111";
    private static final String KEY_2 = "AIzaSy-key-two-222222";

    private InMemoryCredentialStore store;
    private KeyPoolManager keyPool;
    private RequestExecutor executor;

    @BeforeEach
    void setUp() {
        store = new InMemoryCredentialStore();
        DispatcherProperties properties = new DispatcherProperties();
        keyPool = new KeyPoolManager(store, new QuotaClock(), new RotationPolicy(3),
                new TaggedErrorClassifier(), properties, MutableClock.at("2026-10-18T10:00:00Z"));
        executor = new RequestExecutor(keyPool);
    }

    @Test
    @DisplayName("成功调用按成本计费到实际使用的 Key")
    void successChargesUsedKey() {
        keyPool.registerCredentials(List.of(KEY_0, KEY_1));

        String result = executor.execute(apiKey -> "ok:" + apiKey, 100);

        assertEquals("ok:" + KEY_0, result);
        assertEquals(100, store.get(0).orElseThrow().getQuotaUsed());
        assertEquals(0, store.get(1).orElseThrow().getQuotaUsed());
    }

    @Test
    @DisplayName("配额耗尽后换到下一个 Key 重试成功")
    void quotaErrorRotatesAndRetries() {
        keyPool.registerCredentials(List.of(KEY_0, KEY_1));
        List<String> usedKeys = new ArrayList<>();

        String result = executor.execute(apiKey -> {
            usedKeys.add(apiKey);
            if (KEY_0.equals(apiKey)) {
                throw new ClassifiedFailureException(FailureKind.QUOTA_EXCEEDED, "quotaExceeded");
            }
            return "done";
        }, 1);

        assertEquals("done", result);
        assertEquals(List.of(KEY_0, KEY_1), usedKeys);
        assertEquals(10000, store.get(0).orElseThrow().getQuotaUsed());
        assertEquals(1, store.get(1).orElseThrow().getQuotaUsed());
        assertEquals(1, keyPool.getActiveIndex());
    }

    @Test
    @DisplayName("单 Key 持续临时错误：尝试 2 次后抛出 PoolExhausted 并保留最后的错误")
    void singleKeyTransientExhausts() {
        keyPool.registerCredentials(List.of(KEY_0));
        AtomicInteger attempts = new AtomicInteger();
        ClassifiedFailureException failure =
                new ClassifiedFailureException(FailureKind.TRANSIENT, "HTTP 503");

        PoolExhaustedException e = assertThrows(PoolExhaustedException.class, () ->
                executor.execute(apiKey -> {
                    attempts.incrementAndGet();
                    throw failure;
                }, 1));

        assertEquals(2, attempts.get());
        assertSame(failure, e.getCause());
        assertEquals(2, store.get(0).orElseThrow().getErrorCount());
    }

    @Test
    @DisplayName("3 个 Key 持续临时错误：最多尝试 4 次")
    void attemptsBoundedByPoolSizePlusOne() {
        keyPool.registerCredentials(List.of(KEY_0, KEY_1, KEY_2));
        AtomicInteger attempts = new AtomicInteger();

        assertThrows(PoolExhaustedException.class, () ->
                executor.execute(apiKey -> {
                    attempts.incrementAndGet();
                    throw new ClassifiedFailureException(FailureKind.TRANSIENT, "timeout");
                }, 1));

        assertEquals(4, attempts.get());
    }

    @Test
    @DisplayName("与 Key 无关的错误只尝试 1 次并包装为 NonRetryable")
    void nonRetryableFailsFast() {
        keyPool.registerCredentials(List.of(KEY_0, KEY_1));
        AtomicInteger attempts = new AtomicInteger();
        IllegalArgumentException cause = new IllegalArgumentException("videoId 格式错误");

        NonRetryableException e = assertThrows(NonRetryableException.class, () ->
                executor.execute(apiKey -> {
                    attempts.incrementAndGet();
                    throw cause;
                }, 1));

        assertEquals(1, attempts.get());
        assertSame(cause, e.getCause());
        assertEquals(0, store.get(0).orElseThrow().getErrorCount());
        assertEquals(0, keyPool.getActiveIndex());
    }

    @Test
    @DisplayName("调用方抛出的 NonRetryable 原样透传")
    void nonRetryablePassesThrough() {
        keyPool.registerCredentials(List.of(KEY_0));
        NonRetryableException original = new NonRetryableException("参数错误", null);

        NonRetryableException e = assertThrows(NonRetryableException.class, () ->
                executor.execute(apiKey -> {
                    throw original;
                }, 1));

        assertSame(original, e);
    }

    @Test
    @DisplayName("所有 Key 都无效时抛出 PoolExhausted，且全部被停用")
    void allInvalidExhausts() {
        keyPool.registerCredentials(List.of(KEY_0, KEY_1));

        assertThrows(PoolExhaustedException.class, () ->
                executor.execute(apiKey -> {
                    throw new ClassifiedFailureException(FailureKind.CREDENTIAL_INVALID, "keyInvalid");
                }, 1));

        assertFalse(store.get(0).orElseThrow().isActive());
        assertFalse(store.get(1).orElseThrow().isActive());
    }

    @Test
    @DisplayName("未配置 Key 时直接抛出 NoCredentialConfigured")
    void emptyPool() {
        assertThrows(NoCredentialConfiguredException.class, () ->
                executor.execute(apiKey -> "never", 1));
    }

    @Test
    @DisplayName("成本为 0 的调用不消耗配额")
    void zeroCostCall() {
        keyPool.registerCredentials(List.of(KEY_0));
        executor.execute(apiKey -> 42, 0);
        assertEquals(0, store.get(0).orElseThrow().getQuotaUsed());
        assertNotNull(store.get(0).orElseThrow().getLastUsed());
    }

    @Test
    @DisplayName("成本为负时拒绝执行，不发起调用也不改动配额")
    void negativeCostRejectedBeforeCall() {
        keyPool.registerCredentials(List.of(KEY_0));
        AtomicInteger calls = new AtomicInteger();

        assertThrows(IllegalArgumentException.class, () ->
                executor.execute(apiKey -> calls.incrementAndGet(), -5));

        assertEquals(0, calls.get());
        assertEquals(0, store.get(0).orElseThrow().getQuotaUsed());
        assertNull(store.get(0).orElseThrow().getLastUsed());
    }

    @Test
    @DisplayName("多线程并发执行时每次成功调用都被计费，总用量不丢失")
    void concurrentExecutionsChargeEveryCall() throws Exception {
        keyPool.registerCredentials(List.of(KEY_0, KEY_1));
        int threads = 16;
        int callsPerThread = 500;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (int t = 0; t < threads; t++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < callsPerThread; i++) {
                        executor.execute(apiKey -> "ok", 1);
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(60, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdown();
            assertTrue(pool.awaitTermination(60, TimeUnit.SECONDS));
        }

        long total = store.get(0).orElseThrow().getQuotaUsed() + store.get(1).orElseThrow().getQuotaUsed();
        assertEquals((long) threads * callsPerThread, total);
        // 最后一次计费恰好把 #0 推到预警线，随后指针换到 #1
        assertEquals(8000, store.get(0).orElseThrow().getQuotaUsed());
        assertEquals(1, keyPool.getActiveIndex());
    }
}
