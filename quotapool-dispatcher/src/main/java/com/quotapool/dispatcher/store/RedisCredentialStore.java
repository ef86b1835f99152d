package com.quotapool.dispatcher.store;

import com.quotapool.common.exception.CredentialStoreException;
import com.quotapool.dispatcher.config.DispatcherProperties;
import com.quotapool.dispatcher.model.CredentialRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 基于 Redis Hash 的 Key 用量存储。
 * <p>
 * 每个 Key 一个 Hash（{@code <prefix><index>}），另用一个 Set（{@code <prefix>indices}）
 * 记录已知序号，适用于多实例共享用量计数。
 */
@Slf4j
public class RedisCredentialStore implements CredentialStore {

    static final String F_IDENTIFIER = "identifier";
    static final String F_QUOTA_USED = "quotaUsed";
    static final String F_LAST_RESET = "lastReset";
    static final String F_LAST_USED = "lastUsed";
    static final String F_ACTIVE = "active";
    static final String F_ERROR_COUNT = "errorCount";
    static final String F_LAST_ERROR = "lastError";

    private final StringRedisTemplate redisTemplate;
    private final DispatcherProperties properties;

    public RedisCredentialStore(StringRedisTemplate redisTemplate, DispatcherProperties properties) {
        this.redisTemplate = redisTemplate;
        this.properties = properties;
    }

    @Override
    public Optional<CredentialRecord> get(int index) {
        try {
            Map<Object, Object> hash = redisTemplate.opsForHash().entries(recordKey(index));
            if (hash == null || hash.isEmpty()) {
                return Optional.empty();
            }
            return Optional.of(fromHash(index, hash));
        } catch (DataAccessException e) {
            throw new CredentialStoreException("读取 Key #" + index + " 用量失败", e);
        }
    }

    @Override
    public void upsert(CredentialRecord record) {
        try {
            redisTemplate.opsForHash().putAll(recordKey(record.getIndex()), toHash(record));
            // 可空字段需要显式删除，putAll 不会清掉旧值
            if (record.getLastUsed() == null) {
                redisTemplate.opsForHash().delete(recordKey(record.getIndex()), F_LAST_USED);
            }
            if (record.getLastError() == null) {
                redisTemplate.opsForHash().delete(recordKey(record.getIndex()), F_LAST_ERROR);
            }
            redisTemplate.opsForSet().add(indexSetKey(), String.valueOf(record.getIndex()));
        } catch (DataAccessException e) {
            throw new CredentialStoreException("保存 Key #" + record.getIndex() + " 用量失败", e);
        }
        log.debug("保存 Key #{} 用量到 Redis: {}", record.getIndex(), record.getQuotaUsed());
    }

    @Override
    public List<CredentialRecord> listAll() {
        Set<String> members;
        try {
            members = redisTemplate.opsForSet().members(indexSetKey());
        } catch (DataAccessException e) {
            throw new CredentialStoreException("读取 Key 序号列表失败", e);
        }
        if (members == null || members.isEmpty()) {
            return List.of();
        }
        List<CredentialRecord> result = new ArrayList<>();
        for (String member : members) {
            get(Integer.parseInt(member)).ifPresent(result::add);
        }
        result.sort(Comparator.comparingInt(CredentialRecord::getIndex));
        return result;
    }

    String recordKey(int index) {
        return properties.getRedisKeyPrefix() + index;
    }

    String indexSetKey() {
        return properties.getRedisKeyPrefix() + "indices";
    }

    private Map<String, String> toHash(CredentialRecord record) {
        Map<String, String> hash = new HashMap<>();
        hash.put(F_IDENTIFIER, record.getIdentifier() != null ? record.getIdentifier() : "");
        hash.put(F_QUOTA_USED, String.valueOf(record.getQuotaUsed()));
        hash.put(F_LAST_RESET, String.valueOf(record.getLastReset()));
        hash.put(F_ACTIVE, String.valueOf(record.isActive()));
        hash.put(F_ERROR_COUNT, String.valueOf(record.getErrorCount()));
        if (record.getLastUsed() != null) {
            hash.put(F_LAST_USED, record.getLastUsed().toString());
        }
        if (record.getLastError() != null) {
            hash.put(F_LAST_ERROR, record.getLastError().toString());
        }
        return hash;
    }

    private CredentialRecord fromHash(int index, Map<Object, Object> hash) {
        return CredentialRecord.builder()
                .index(index)
                .identifier(str(hash, F_IDENTIFIER))
                .quotaUsed(Long.parseLong(str(hash, F_QUOTA_USED, "0")))
                .lastReset(instant(hash, F_LAST_RESET))
                .lastUsed(instant(hash, F_LAST_USED))
                .active(Boolean.parseBoolean(str(hash, F_ACTIVE, "true")))
                .errorCount(Integer.parseInt(str(hash, F_ERROR_COUNT, "0")))
                .lastError(instant(hash, F_LAST_ERROR))
                .build();
    }

    private static String str(Map<Object, Object> hash, String field) {
        return str(hash, field, null);
    }

    private static String str(Map<Object, Object> hash, String field, String defaultValue) {
        Object value = hash.get(field);
        return value != null ? value.toString() : defaultValue;
    }

    private static Instant instant(Map<Object, Object> hash, String field) {
        String value = str(hash, field);
        if (value == null || value.isEmpty() || "null".equals(value)) {
            return null;
        }
        return Instant.parse(value);
    }
}
