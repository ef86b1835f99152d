package com.quotapool.web.repository;

import com.quotapool.web.entity.CredentialUsageEntity;
import org.springframework.data.jdbc.repository.query.Query;
import org.springframework.data.repository.CrudRepository;

import java.util.List;
import java.util.Optional;

public interface CredentialUsageRepository extends CrudRepository<CredentialUsageEntity, Long> {

    @Query("SELECT * FROM t_credential_usage WHERE credential_index = :credentialIndex")
    Optional<CredentialUsageEntity> findByCredentialIndex(Integer credentialIndex);

    /** 全部用量记录，按 Key 序号排序 */
    @Query("SELECT * FROM t_credential_usage ORDER BY credential_index")
    List<CredentialUsageEntity> findAllOrdered();
}
