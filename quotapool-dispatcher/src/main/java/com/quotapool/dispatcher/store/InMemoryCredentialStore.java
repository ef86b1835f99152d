package com.quotapool.dispatcher.store;

import com.quotapool.dispatcher.model.CredentialRecord;
import lombok.extern.slf4j.Slf4j;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 基于内存的 Key 用量存储。
 * <p>
 * 读写都做副本拷贝，调用方修改返回值不会影响已存储的记录。
 * 进程重启后用量清零，适用于单机轻量部署。
 */
@Slf4j
public class InMemoryCredentialStore implements CredentialStore {

    private final Map<Integer, CredentialRecord> records = new ConcurrentHashMap<>();

    @Override
    public Optional<CredentialRecord> get(int index) {
        CredentialRecord record = records.get(index);
        return Optional.ofNullable(record).map(CredentialRecord::copy);
    }

    @Override
    public void upsert(CredentialRecord record) {
        records.put(record.getIndex(), record.copy());
        log.debug("保存 Key #{} 用量: {}", record.getIndex(), record.getQuotaUsed());
    }

    @Override
    public List<CredentialRecord> listAll() {
        return records.values().stream()
                .sorted(Comparator.comparingInt(CredentialRecord::getIndex))
                .map(CredentialRecord::copy)
                .toList();
    }
}
