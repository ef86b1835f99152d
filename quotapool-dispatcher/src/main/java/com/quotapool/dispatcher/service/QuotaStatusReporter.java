package com.quotapool.dispatcher.service;

import com.quotapool.common.dto.CredentialStatus;
import com.quotapool.common.dto.PoolSummary;
import com.quotapool.dispatcher.pool.KeyPoolManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * 定时任务：输出 Key 池配额状态，所有 Key 都不健康时告警。
 * <p>
 * 只读，除惰性日重置外不修改任何记录。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class QuotaStatusReporter {

    private final KeyPoolManager keyPool;

    @Scheduled(cron = "${quotapool.dispatcher.status-report-cron:0 0 * * * *}", zone = "UTC")
    public void report() {
        if (keyPool.poolSize() == 0) {
            log.debug("Key 池为空，跳过状态报告");
            return;
        }

        PoolSummary summary = keyPool.poolSummary();
        log.info("配额状态: 当前 Key #{}, 总用量 {}/{}, 下次重置 {}",
                summary.getActiveIndex(), summary.getTotalUsed(), summary.getTotalAvailable(),
                summary.getNextReset());
        for (CredentialStatus status : summary.getCredentials()) {
            log.info("  Key #{} (***{}) [{}] 已用 {}, 剩余 {}, 连续错误 {}",
                    status.getIndex(), status.getIdentifier(), status.getHealth(),
                    status.getQuotaUsed(), status.getRemaining(), status.getErrorCount());
        }

        if (summary.healthyCount() == 0) {
            log.warn("没有处于健康状态的 API Key，本周期剩余请求可能失败");
        }
    }
}
