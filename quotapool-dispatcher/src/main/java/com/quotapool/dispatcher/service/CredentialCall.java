package com.quotapool.dispatcher.service;

/**
 * 使用给定 API Key 执行一次远程调用。
 * <p>
 * 超时与取消由调用方在实现内部自行处理。
 */
@FunctionalInterface
public interface CredentialCall<T> {

    T call(String apiKey) throws Exception;
}
