package com.ke.hal.util;

import java.time.Clock;

/**
 * 时间统一使用秒级时间戳
 */
public class DateTimeUtils {

    private static volatile Clock clock = Clock.systemUTC();

    private DateTimeUtils() {
    }

    public static long getCurrentSeconds() {
        return clock.millis() / 1000;
    }

    public static long getCurrentMillis() {
        return clock.millis();
    }

    /**
     * 仅用于测试
     */
    public static void setClock(Clock newClock) {
        clock = newClock == null ? Clock.systemUTC() : newClock;
    }
}
