package com.quotapool.dispatcher.store;

import com.quotapool.dispatcher.model.CredentialRecord;

import java.util.List;
import java.util.Optional;

/**
 * Key 用量记录的持久化存储，按 Key 序号索引。
 * <p>
 * 提供三种实现：
 * - {@link InMemoryCredentialStore}：内存实现，适合轻量单机部署
 * - {@link RedisCredentialStore}：Redis 实现，适合分布式多实例部署
 * - web 模块的 JdbcCredentialStore：SQLite 持久化
 * <p>
 * 要求写后立即可读；写入失败抛出 {@link com.quotapool.common.exception.CredentialStoreException}，
 * 实现内部不做重试。
 */
public interface CredentialStore {

    /** 按序号读取记录，返回的是副本 */
    Optional<CredentialRecord> get(int index);

    /** 插入或覆盖一条记录 */
    void upsert(CredentialRecord record);

    /** 全部记录，按序号升序 */
    List<CredentialRecord> listAll();
}
