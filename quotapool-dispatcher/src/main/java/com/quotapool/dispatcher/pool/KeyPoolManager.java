package com.quotapool.dispatcher.pool;

import com.quotapool.common.dto.CredentialStatus;
import com.quotapool.common.dto.FailureKind;
import com.quotapool.common.dto.PoolSummary;
import com.quotapool.common.dto.RotationResult;
import com.quotapool.common.exception.NoCredentialConfiguredException;
import com.quotapool.common.exception.PoolExhaustedException;
import com.quotapool.common.exception.QuotaPoolException;
import com.quotapool.common.util.KeyMasks;
import com.quotapool.dispatcher.config.DispatcherProperties;
import com.quotapool.dispatcher.model.CredentialRecord;
import com.quotapool.dispatcher.quota.QuotaClock;
import com.quotapool.dispatcher.rotation.RotationPolicy;
import com.quotapool.dispatcher.store.CredentialStore;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Key 池管理器：持有"当前使用哪个 Key"的指针，是唯一允许修改用量记录的组件。
 * <p>
 * 组合 {@link CredentialStore}、{@link QuotaClock}、{@link RotationPolicy}：
 * <ul>
 *   <li>每次读取记录前惰性检查日重置</li>
 *   <li>成功计费后检查预警阈值，必要时主动换 Key</li>
 *   <li>失败时按错误类型钉死配额、停用 Key 或累计错误数，并决定是否换 Key</li>
 * </ul>
 * 所有"读指针 → 读记录/重置 → 决策 → 修改 → 持久化"的序列都在同一把锁内完成，
 * 远程调用本身不持锁。
 */
@Slf4j
public class KeyPoolManager {

    private final CredentialStore store;
    private final QuotaClock quotaClock;
    private final RotationPolicy rotationPolicy;
    private final ErrorClassifier errorClassifier;
    private final DispatcherProperties properties;
    private final Clock clock;

    private final ReentrantLock lock = new ReentrantLock();

    /** 按配置顺序排列的 Key，下标即序号 */
    private List<String> secrets = List.of();

    /** 当前使用中的 Key 序号，不持久化，启动时为 0 */
    private int activeIndex = 0;

    public KeyPoolManager(CredentialStore store, QuotaClock quotaClock, RotationPolicy rotationPolicy,
                          ErrorClassifier errorClassifier, DispatcherProperties properties, Clock clock) {
        this.store = store;
        this.quotaClock = quotaClock;
        this.rotationPolicy = rotationPolicy;
        this.errorClassifier = errorClassifier;
        this.properties = properties;
        this.clock = clock;
    }

    // ==================== 初始化 ====================

    /**
     * 注册配置中的 Key：为缺失的序号创建零用量记录，已有记录做一次惰性重置。
     * <p>
     * 序号超出当前配置的旧记录保留不动，之后一律忽略。
     */
    public void registerCredentials(List<String> keys) {
        lock.lock();
        try {
            this.secrets = List.copyOf(keys);
            this.activeIndex = 0;
            Instant now = clock.instant();

            int created = 0;
            for (int i = 0; i < secrets.size(); i++) {
                String identifier = KeyMasks.identifier(secrets.get(i), properties.getIdentifierLength());
                CredentialRecord record = store.get(i).orElse(null);
                if (record == null) {
                    store.upsert(CredentialRecord.fresh(i, identifier, now));
                    created++;
                    continue;
                }
                boolean changed = applyResetIfDue(record, now);
                if (!identifier.equals(record.getIdentifier())) {
                    log.info("Key #{} 已更换: {} -> {}", i,
                            KeyMasks.mask(record.getIdentifier()), KeyMasks.mask(identifier));
                    record.setIdentifier(identifier);
                    changed = true;
                }
                if (changed) {
                    store.upsert(record);
                }
            }

            long orphaned = store.listAll().stream()
                    .filter(r -> r.getIndex() >= secrets.size())
                    .count();
            if (orphaned > 0) {
                log.info("存储中有 {} 条已移除 Key 的历史记录，将被忽略", orphaned);
            }
            log.info("Key 池初始化完成: 共 {} 个 Key，新建记录 {} 条", secrets.size(), created);
        } finally {
            lock.unlock();
        }
    }

    // ==================== 查询当前 Key ====================

    /**
     * 当前使用中的 Key 的用量记录（已做惰性重置）。
     *
     * @throws NoCredentialConfiguredException 池为空
     */
    public CredentialRecord currentCredential() {
        return withLock(() -> {
            requireConfigured();
            return loadRecord(activeIndex, clock.instant()).copy();
        });
    }

    /**
     * 借出当前 Key 供一次调用使用。
     * <p>
     * 若指针停在已停用的 Key 上（如重启后序号 0 已被停用），先做一次普通轮换。
     *
     * @throws NoCredentialConfiguredException 池为空
     * @throws PoolExhaustedException          没有任何启用中的可用 Key
     */
    public ActiveCredential acquire() {
        return withLock(() -> {
            requireConfigured();
            Instant now = clock.instant();
            CredentialRecord record = loadRecord(activeIndex, now);
            if (!record.isActive()) {
                log.warn("当前 Key #{} 已停用，尝试轮换", activeIndex);
                if (!rotateLocked(false)) {
                    throw new PoolExhaustedException("所有 API Key 均已停用或配额耗尽");
                }
                record = loadRecord(activeIndex, now);
            }
            return new ActiveCredential(activeIndex, secrets.get(activeIndex), record.copy());
        });
    }

    public int getActiveIndex() {
        return withLock(() -> activeIndex);
    }

    public int poolSize() {
        return withLock(() -> secrets.size());
    }

    // ==================== 计费 ====================

    /**
     * 为当前 Key 计入用量。
     */
    public void chargeUsage(long units) {
        withLock(() -> {
            requireConfigured();
            chargeLocked(activeIndex, units);
            return null;
        });
    }

    /**
     * 为指定 Key 计入用量：累加配额、更新最近使用时间、清零连续错误数并持久化。
     * <p>
     * 之后若该 Key 仍是当前 Key 且达到换 Key 条件，则主动轮换；
     * 轮换只影响下一次调用，不影响刚计费的这次。
     */
    public void chargeUsage(int index, long units) {
        withLock(() -> {
            requireIndex(index);
            chargeLocked(index, units);
            return null;
        });
    }

    // ==================== 轮换 ====================

    /**
     * 从当前 Key 的下一个开始找可用 Key 并切换。
     *
     * @param force true 时允许选中用量超过紧急阈值（但仍启用）的 Key
     * @return 找到可用 Key 返回 true；整池无可用 Key 返回 false，指针保持不变
     */
    public boolean rotate(boolean force) {
        return withLock(() -> {
            requireConfigured();
            return rotateLocked(force);
        });
    }

    /**
     * 手动轮换，返回轮换前后的序号。
     */
    public RotationResult rotateNow(boolean force) {
        return withLock(() -> {
            requireConfigured();
            int previous = activeIndex;
            boolean rotated = rotateLocked(force);
            return RotationResult.builder()
                    .rotated(rotated)
                    .previousIndex(previous)
                    .activeIndex(activeIndex)
                    .forced(force)
                    .build();
        });
    }

    // ==================== 失败处理 ====================

    /**
     * 当前 Key 的一次调用失败。
     */
    public FailureOutcome recordFailure(Throwable error) {
        return withLock(() -> {
            requireConfigured();
            return failureLocked(activeIndex, errorClassifier.classify(error));
        });
    }

    /**
     * 指定 Key 的一次调用失败，按错误类型处理：
     * <ul>
     *   <li>配额耗尽：用量钉死为日上限，换 Key</li>
     *   <li>Key 无效：停用（需人工恢复），换 Key</li>
     *   <li>其他 Key 相关错误：累计连续错误数，达到换 Key 条件时立即换 Key</li>
     *   <li>与 Key 无关：不改动记录</li>
     * </ul>
     */
    public FailureOutcome recordFailure(int index, Throwable error) {
        FailureKind kind = errorClassifier.classify(error);
        return withLock(() -> {
            requireIndex(index);
            return failureLocked(index, kind);
        });
    }

    // ==================== 人工干预 ====================

    /**
     * 恢复一个被停用的 Key，同时清零连续错误数。
     */
    public CredentialRecord enableCredential(int index) {
        return withLock(() -> {
            requireIndex(index);
            CredentialRecord record = loadRecord(index, clock.instant());
            record.setActive(true);
            record.setErrorCount(0);
            store.upsert(record);
            log.info("Key #{} ({}) 已恢复启用", index, KeyMasks.mask(record.getIdentifier()));
            return record.copy();
        });
    }

    /**
     * 人工停用一个 Key。若它是当前 Key，立即尝试换走。
     */
    public CredentialRecord disableCredential(int index) {
        return withLock(() -> {
            requireIndex(index);
            CredentialRecord record = loadRecord(index, clock.instant());
            record.setActive(false);
            store.upsert(record);
            log.warn("Key #{} ({}) 已被人工停用", index, KeyMasks.mask(record.getIdentifier()));
            if (index == activeIndex && !rotateLocked(false)) {
                log.error("停用 Key #{} 后已无可用 Key", index);
            }
            return record.copy();
        });
    }

    // ==================== 状态 ====================

    /**
     * 每个 Key 的配额状态快照（逐个做惰性重置），只包含展示标识。
     */
    public List<CredentialStatus> snapshotStatus() {
        return withLock(() -> {
            Instant now = clock.instant();
            List<CredentialStatus> statuses = new ArrayList<>();
            for (int i = 0; i < secrets.size(); i++) {
                statuses.add(toStatus(loadRecord(i, now)));
            }
            return statuses;
        });
    }

    /**
     * 整池汇总：总用量、总配额、当前 Key 与下次重置时间。
     */
    public PoolSummary poolSummary() {
        return withLock(() -> {
            List<CredentialStatus> statuses = snapshotStatus();
            long totalUsed = statuses.stream().mapToLong(CredentialStatus::getQuotaUsed).sum();
            return PoolSummary.builder()
                    .activeIndex(activeIndex)
                    .totalUsed(totalUsed)
                    .totalAvailable(statuses.size() * properties.getDailyQuotaLimit())
                    .dailyQuotaLimit(properties.getDailyQuotaLimit())
                    .nextReset(quotaClock.nextReset(clock.instant()))
                    .credentials(statuses)
                    .build();
        });
    }

    // ==================== 内部方法（调用方持锁） ====================

    private void chargeLocked(int index, long units) {
        if (units < 0) {
            throw new IllegalArgumentException("计费单位不能为负: " + units);
        }
        Instant now = clock.instant();
        CredentialRecord record = loadRecord(index, now);
        record.setQuotaUsed(record.getQuotaUsed() + units);
        record.setLastUsed(now);
        record.setErrorCount(0);
        store.upsert(record);

        log.info("Key {}: 本次 {} 单位, 已用 {}/{}", KeyMasks.mask(record.getIdentifier()),
                units, record.getQuotaUsed(), properties.getDailyQuotaLimit());

        if (index == activeIndex && rotationPolicy.shouldRotateAway(record, properties.getWarnThreshold())) {
            log.info("Key #{} 用量达到预警阈值 {}，主动轮换", index, properties.getWarnThreshold());
            if (!rotateLocked(false)) {
                log.warn("主动轮换失败：没有其他可用 Key，继续使用 Key #{}", index);
            }
        }
    }

    private FailureOutcome failureLocked(int index, FailureKind kind) {
        if (kind == FailureKind.NON_RETRYABLE) {
            return FailureOutcome.NON_RETRYABLE;
        }

        Instant now = clock.instant();
        CredentialRecord record = loadRecord(index, now);
        record.setErrorCount(record.getErrorCount() + 1);
        record.setLastError(now);

        switch (kind) {
            case QUOTA_EXCEEDED -> {
                log.warn("Key {} 配额已耗尽，用量钉为 {}", KeyMasks.mask(record.getIdentifier()),
                        properties.getDailyQuotaLimit());
                record.setQuotaUsed(properties.getDailyQuotaLimit());
                store.upsert(record);
                return rotateAfterFailure(index);
            }
            case CREDENTIAL_INVALID -> {
                log.error("Key {} 无效，已停用，需人工恢复", KeyMasks.mask(record.getIdentifier()));
                record.setActive(false);
                store.upsert(record);
                return rotateAfterFailure(index);
            }
            default -> {
                store.upsert(record);
                log.warn("Key {} 调用失败，连续错误 {} 次", KeyMasks.mask(record.getIdentifier()),
                        record.getErrorCount());
                if (rotationPolicy.shouldRotateAway(record, properties.getWarnThreshold())) {
                    return rotateAfterFailure(index);
                }
                return FailureOutcome.RETRY_SAME;
            }
        }
    }

    private FailureOutcome rotateAfterFailure(int failedIndex) {
        if (failedIndex != activeIndex) {
            // 其他调用已经把指针移走，沿用它选出的 Key
            return FailureOutcome.ROTATED;
        }
        return rotateLocked(false) ? FailureOutcome.ROTATED : FailureOutcome.EXHAUSTED;
    }

    private boolean rotateLocked(boolean force) {
        Instant now = clock.instant();
        List<CredentialRecord> pool = new ArrayList<>(secrets.size());
        for (int i = 0; i < secrets.size(); i++) {
            pool.add(loadRecord(i, now));
        }

        OptionalInt next = rotationPolicy.selectNext(pool, activeIndex, properties.getEmergencyThreshold(), force);
        if (next.isEmpty()) {
            log.error("没有可用的 API Key（均已停用或超过紧急阈值 {}）", properties.getEmergencyThreshold());
            return false;
        }

        int original = activeIndex;
        activeIndex = next.getAsInt();
        CredentialRecord chosen = pool.get(activeIndex);
        log.info("Key 轮换{}: #{} -> #{} (已用 {}/{})", force ? "（强制）" : "", original, activeIndex,
                chosen.getQuotaUsed(), properties.getDailyQuotaLimit());
        return true;
    }

    /**
     * 读取记录并做惰性日重置；记录缺失时补建（注册后不应发生）。
     */
    private CredentialRecord loadRecord(int index, Instant now) {
        CredentialRecord record = store.get(index).orElse(null);
        if (record == null) {
            String identifier = KeyMasks.identifier(secrets.get(index), properties.getIdentifierLength());
            record = CredentialRecord.fresh(index, identifier, now);
            store.upsert(record);
            return record;
        }
        if (applyResetIfDue(record, now)) {
            store.upsert(record);
        }
        return record;
    }

    private boolean applyResetIfDue(CredentialRecord record, Instant now) {
        if (!quotaClock.isResetDue(record.getLastReset(), now)) {
            return false;
        }
        record.resetQuota(now);
        log.info("Key {} 日配额已重置", KeyMasks.mask(record.getIdentifier()));
        return true;
    }

    private CredentialStatus toStatus(CredentialRecord record) {
        long remaining = record.remaining(properties.getDailyQuotaLimit());
        return CredentialStatus.builder()
                .index(record.getIndex())
                .identifier(record.getIdentifier())
                .quotaUsed(record.getQuotaUsed())
                .remaining(remaining)
                .active(record.isActive())
                .lastUsed(record.getLastUsed())
                .errorCount(record.getErrorCount())
                .health(healthOf(record.isActive(), remaining))
                .current(record.getIndex() == activeIndex)
                .build();
    }

    private CredentialStatus.Health healthOf(boolean active, long remaining) {
        if (!active) return CredentialStatus.Health.DISABLED;
        if (remaining <= 0) return CredentialStatus.Health.EXHAUSTED;
        if (remaining < properties.getLowQuotaRemaining()) return CredentialStatus.Health.LOW;
        return CredentialStatus.Health.HEALTHY;
    }

    private void requireConfigured() {
        if (secrets.isEmpty()) {
            throw new NoCredentialConfiguredException("未配置任何 API Key");
        }
    }

    private void requireIndex(int index) {
        requireConfigured();
        if (index < 0 || index >= secrets.size()) {
            throw new QuotaPoolException("UNKNOWN_CREDENTIAL", "不存在序号为 " + index + " 的 Key");
        }
    }

    private <T> T withLock(Supplier<T> action) {
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }
}
