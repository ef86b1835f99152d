package com.quotapool.dispatcher.pool;

import com.quotapool.dispatcher.model.CredentialRecord;
import lombok.ToString;
import lombok.Value;

/**
 * 借出给一次调用使用的 Key：序号、Key 本身和借出时的用量记录副本。
 */
@Value
public class ActiveCredential {

    int index;

    @ToString.Exclude
    String secret;

    CredentialRecord record;
}
