package com.quotapool.dispatcher.service;

import com.quotapool.common.dto.CredentialStatus;
import com.quotapool.common.dto.PoolSummary;
import com.quotapool.dispatcher.pool.KeyPoolManager;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;

import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class QuotaStatusReporterTest {

    @Mock
    private KeyPoolManager keyPool;

    @InjectMocks
    private QuotaStatusReporter reporter;

    @Test
    void skipsEmptyPool() {
        when(keyPool.poolSize()).thenReturn(0);

        reporter.report();

        verify(keyPool, never()).poolSummary();
    }

    @Test
    void readsSummaryOnce() {
        when(keyPool.poolSize()).thenReturn(2);
        when(keyPool.poolSummary()).thenReturn(PoolSummary.builder()
                .activeIndex(1)
                .totalUsed(10400)
                .totalAvailable(20000)
                .dailyQuotaLimit(10000)
                .nextReset(Instant.parse("2026-10-19T00:00:00Z"))
                .credentials(List.of(
                        CredentialStatus.builder().index(0).identifier("aaa111").quotaUsed(10000)
                                .remaining(0).active(true).health(CredentialStatus.Health.EXHAUSTED).build(),
                        CredentialStatus.builder().index(1).identifier("bbb222").quotaUsed(400)
                                .remaining(9600).active(true).health(CredentialStatus.Health.HEALTHY)
                                .current(true).build()))
                .build());

        reporter.report();

        verify(keyPool).poolSummary();
    }
}
