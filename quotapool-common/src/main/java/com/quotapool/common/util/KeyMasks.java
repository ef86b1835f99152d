package com.quotapool.common.util;

/**
 * API Key 脱敏工具类，日志和状态输出中只出现 Key 的末尾几位。
 */
public final class KeyMasks {

    private KeyMasks() {
    }

    /**
     * 取 Key 末尾 {@code length} 位作为展示标识。
     * Key 本身不足该长度时只取后一半，保证标识永远不等于完整 Key。
     */
    public static String identifier(String secret, int length) {
        if (secret == null || secret.isEmpty()) return "";
        if (secret.length() <= length) return secret.substring(secret.length() / 2 + secret.length() % 2);
        return secret.substring(secret.length() - length);
    }

    /**
     * 日志用掩码形式，如 "***abc123"。
     */
    public static String mask(String identifier) {
        if (identifier == null || identifier.isEmpty()) return "***";
        return "***" + identifier;
    }
}
