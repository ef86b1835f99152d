package com.quotapool.web.controller;

import com.quotapool.common.dto.ApiResponse;
import com.quotapool.common.dto.CredentialStatus;
import com.quotapool.common.dto.PoolSummary;
import com.quotapool.common.dto.RotationResult;
import com.quotapool.dispatcher.model.CredentialRecord;
import com.quotapool.dispatcher.pool.KeyPoolManager;
import com.quotapool.dispatcher.quota.QuotaClock;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Key 池状态与人工干预 REST API。
 * <p>
 * 只暴露展示标识，从不返回完整 Key。
 */
@Slf4j
@RestController
@RequestMapping("/api/keys")
@RequiredArgsConstructor
public class KeyPoolController {

    private final KeyPoolManager keyPoolManager;
    private final QuotaClock quotaClock;
    private final Clock quotaPoolClock;

    // ======================== 状态查询 ========================

    /**
     * 整池配额汇总。
     */
    @GetMapping("/summary")
    public ApiResponse<PoolSummary> summary() {
        return ApiResponse.ok(keyPoolManager.poolSummary());
    }

    /**
     * 每个 Key 的配额状态。
     */
    @GetMapping("/status")
    public ApiResponse<List<CredentialStatus>> status() {
        return ApiResponse.ok(keyPoolManager.snapshotStatus());
    }

    /**
     * 距离下一次配额重置（UTC 零点）的时间。
     */
    @GetMapping("/reset-time")
    public ApiResponse<Map<String, Object>> resetTime() {
        Instant now = quotaPoolClock.instant();
        Instant nextReset = quotaClock.nextReset(now);
        Duration remaining = Duration.between(now, nextReset);

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("nextReset", nextReset.toString());
        data.put("hours", remaining.toHours());
        data.put("minutes", remaining.toMinutesPart());
        return ApiResponse.ok(data, "配额将在 " + remaining.toHours() + " 小时 "
                + remaining.toMinutesPart() + " 分钟后重置（UTC 零点）");
    }

    // ======================== 人工干预 ========================

    /**
     * 手动轮换 Key。force=true 时允许切到超过紧急阈值但仍启用的 Key。
     */
    @PostMapping("/rotate")
    public ApiResponse<RotationResult> rotate(@RequestParam(value = "force", defaultValue = "true") boolean force) {
        RotationResult result = keyPoolManager.rotateNow(force);
        log.info("收到手动轮换请求, force: {}, 结果: #{} -> #{}",
                force, result.getPreviousIndex(), result.getActiveIndex());
        if (!result.isRotated()) {
            return ApiResponse.error("ROTATE_FAILED", "轮换失败：所有 Key 可能均已耗尽或停用");
        }
        return ApiResponse.ok(result, "已从 Key #" + result.getPreviousIndex()
                + " 切换到 Key #" + result.getActiveIndex());
    }

    /**
     * 恢复一个被停用的 Key。
     */
    @PostMapping("/{index}/enable")
    public ApiResponse<CredentialStatus> enable(@PathVariable("index") int index) {
        CredentialRecord record = keyPoolManager.enableCredential(index);
        return ApiResponse.ok(findStatus(record.getIndex()), "Key #" + index + " 已恢复启用");
    }

    /**
     * 人工停用一个 Key。
     */
    @PostMapping("/{index}/disable")
    public ApiResponse<CredentialStatus> disable(@PathVariable("index") int index) {
        CredentialRecord record = keyPoolManager.disableCredential(index);
        return ApiResponse.ok(findStatus(record.getIndex()), "Key #" + index + " 已停用");
    }

    private CredentialStatus findStatus(int index) {
        return keyPoolManager.snapshotStatus().stream()
                .filter(s -> s.getIndex() == index)
                .findFirst()
                .orElse(null);
    }
}
