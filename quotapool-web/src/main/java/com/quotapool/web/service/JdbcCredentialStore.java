package com.quotapool.web.service;

import com.quotapool.common.exception.CredentialStoreException;
import com.quotapool.dispatcher.model.CredentialRecord;
import com.quotapool.dispatcher.store.CredentialStore;
import com.quotapool.web.entity.CredentialUsageEntity;
import com.quotapool.web.repository.CredentialUsageRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * 基于 SQLite 的 Key 用量存储：串联调度核心与 t_credential_usage 表。
 * 基于 Spring Data JDBC，无 Hibernate。
 */
@Slf4j
@RequiredArgsConstructor
public class JdbcCredentialStore implements CredentialStore {

    private final CredentialUsageRepository repository;
    private final Clock clock;

    // ==================== 查询 ====================

    @Override
    public Optional<CredentialRecord> get(int index) {
        try {
            return repository.findByCredentialIndex(index).map(this::toRecord);
        } catch (DataAccessException e) {
            throw new CredentialStoreException("读取 Key #" + index + " 用量失败", e);
        }
    }

    @Override
    public List<CredentialRecord> listAll() {
        try {
            return repository.findAllOrdered().stream()
                    .map(this::toRecord)
                    .toList();
        } catch (DataAccessException e) {
            throw new CredentialStoreException("读取 Key 用量列表失败", e);
        }
    }

    // ==================== 持久化 ====================

    /**
     * 按 Key 序号插入或更新。已有行沿用原主键，保证每个序号只有一行。
     */
    @Override
    public void upsert(CredentialRecord record) {
        try {
            Long existingId = repository.findByCredentialIndex(record.getIndex())
                    .map(CredentialUsageEntity::getId)
                    .orElse(null);
            CredentialUsageEntity entity = toEntity(record);
            entity.setId(existingId);
            repository.save(entity);
        } catch (DataAccessException e) {
            throw new CredentialStoreException("保存 Key #" + record.getIndex() + " 用量失败", e);
        }
        log.debug("Key #{} 用量已持久化: {}", record.getIndex(), record.getQuotaUsed());
    }

    // ==================== 内部方法 ====================

    private CredentialUsageEntity toEntity(CredentialRecord record) {
        return CredentialUsageEntity.builder()
                .credentialIndex(record.getIndex())
                .identifier(record.getIdentifier())
                .quotaUsed(record.getQuotaUsed())
                .lastReset(format(record.getLastReset()))
                .lastUsed(format(record.getLastUsed()))
                .active(record.isActive())
                .errorCount(record.getErrorCount())
                .lastError(format(record.getLastError()))
                .updatedAt(clock.instant().toString())
                .build();
    }

    private CredentialRecord toRecord(CredentialUsageEntity e) {
        return CredentialRecord.builder()
                .index(e.getCredentialIndex())
                .identifier(e.getIdentifier())
                .quotaUsed(e.getQuotaUsed() != null ? e.getQuotaUsed() : 0)
                .lastReset(parse(e.getLastReset()))
                .lastUsed(parse(e.getLastUsed()))
                .active(e.getActive() == null || e.getActive())
                .errorCount(e.getErrorCount() != null ? e.getErrorCount() : 0)
                .lastError(parse(e.getLastError()))
                .build();
    }

    private static String format(Instant instant) {
        return instant != null ? instant.toString() : null;
    }

    private static Instant parse(String text) {
        return text != null && !text.isEmpty() ? Instant.parse(text) : null;
    }
}
