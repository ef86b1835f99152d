package com.quotapool.common.exception;

/**
 * Key 用量存储读写失败。写入失败必须向上抛出，否则配额计数会丢失。
 */
public class CredentialStoreException extends QuotaPoolException {

    public CredentialStoreException(String message, Throwable cause) {
        super("STORE_ERROR", message, cause);
    }
}
