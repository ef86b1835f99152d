package com.quotapool.dispatcher.quota;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class QuotaClockTest {

    private final QuotaClock quotaClock = new QuotaClock();

    @Test
    @DisplayName("同一 UTC 日内不重置，无论时间跨度多大")
    void sameUtcDayIsNotDue() {
        Instant lastReset = Instant.parse("2026-10-18T00:00:00Z");
        assertFalse(quotaClock.isResetDue(lastReset, Instant.parse("2026-10-18T23:59:59.999Z")));
        assertFalse(quotaClock.isResetDue(lastReset, lastReset));
    }

    @Test
    @DisplayName("跨过 UTC 零点即需要重置，哪怕只过了一秒")
    void crossingMidnightIsDue() {
        Instant lastReset = Instant.parse("2026-10-18T23:59:59Z");
        assertTrue(quotaClock.isResetDue(lastReset, Instant.parse("2026-10-19T00:00:00Z")));
    }

    @Test
    @DisplayName("按 UTC 日期判断，与本地时区无关")
    void usesUtcCalendarDate() {
        // 北京时间 10-19 07:00 仍是 UTC 10-18
        Instant lastReset = Instant.parse("2026-10-18T01:00:00Z");
        Instant now = Instant.parse("2026-10-18T23:00:00Z");
        assertFalse(quotaClock.isResetDue(lastReset, now));
    }

    @Test
    @DisplayName("每跨过一个日界只触发一次：重置后同日再检查不再触发")
    void dueExactlyOncePerBoundary() {
        Instant lastReset = Instant.parse("2026-10-18T08:00:00Z");
        Instant now = Instant.parse("2026-10-19T00:00:01Z");
        int triggered = 0;
        for (int minute = 0; minute < 24 * 60; minute += 7) {
            Instant t = now.plus(Duration.ofMinutes(minute));
            if (quotaClock.isResetDue(lastReset, t)) {
                triggered++;
                lastReset = t;
            }
        }
        assertEquals(1, triggered);
    }

    @Test
    @DisplayName("多日未访问也只需一次重置")
    void severalDaysLaterIsDue() {
        assertTrue(quotaClock.isResetDue(Instant.parse("2026-10-10T12:00:00Z"),
                Instant.parse("2026-10-18T12:00:00Z")));
    }

    @Test
    @DisplayName("时间回拨不触发重置")
    void earlierNowIsNotDue() {
        assertFalse(quotaClock.isResetDue(Instant.parse("2026-10-19T01:00:00Z"),
                Instant.parse("2026-10-18T23:00:00Z")));
    }

    @Test
    @DisplayName("从未重置过的记录视为需要重置")
    void nullLastResetIsDue() {
        assertTrue(quotaClock.isResetDue(null, Instant.parse("2026-10-18T10:00:00Z")));
    }

    @Test
    @DisplayName("下次重置时间为下一个 UTC 零点")
    void nextResetIsNextUtcMidnight() {
        assertEquals(Instant.parse("2026-10-19T00:00:00Z"),
                quotaClock.nextReset(Instant.parse("2026-10-18T13:45:00Z")));
        assertEquals(Instant.parse("2026-10-19T00:00:00Z"),
                quotaClock.nextReset(Instant.parse("2026-10-18T00:00:00Z")));
    }
}
