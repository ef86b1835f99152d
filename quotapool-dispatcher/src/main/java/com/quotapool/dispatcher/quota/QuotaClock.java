package com.quotapool.dispatcher.quota;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;

/**
 * 日配额重置判断。纯函数，无副作用。
 * <p>
 * 重置按 UTC 自然日进行，在每次读取记录时惰性检查，不依赖定时任务。
 */
public class QuotaClock {

    /**
     * 当 {@code now} 的 UTC 日期严格晚于 {@code lastReset} 的 UTC 日期时返回 true。
     * 从未重置过（lastReset 为空）的记录视为需要重置。
     */
    public boolean isResetDue(Instant lastReset, Instant now) {
        if (lastReset == null) {
            return true;
        }
        return utcDate(now).isAfter(utcDate(lastReset));
    }

    /**
     * 下一次重置时间：{@code now} 之后的第一个 UTC 零点。
     */
    public Instant nextReset(Instant now) {
        return utcDate(now).plusDays(1).atStartOfDay(ZoneOffset.UTC).toInstant();
    }

    private static LocalDate utcDate(Instant instant) {
        return instant.atZone(ZoneOffset.UTC).toLocalDate();
    }
}
