package com.ke.hal.core.run;

import com.ke.hal.configuration.EngineProperties;
import com.ke.hal.exception.AbortedException;
import lombok.extern.slf4j.Slf4j;

import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * 有界指数退避重试
 */
@Slf4j
public class RetryPolicy {

    /**
     * 可替换的等待实现，便于测试
     */
    public interface Sleeper {
        void sleep(long millis) throws InterruptedException;
    }

    private final int maxAttempts;
    private final long initialDelayMillis;
    private final double multiplier;
    private final long maxDelayMillis;
    private final Sleeper sleeper;

    public RetryPolicy(int maxAttempts, long initialDelayMillis, double multiplier, long maxDelayMillis, Sleeper sleeper) {
        this.maxAttempts = maxAttempts;
        this.initialDelayMillis = initialDelayMillis;
        this.multiplier = multiplier;
        this.maxDelayMillis = maxDelayMillis;
        this.sleeper = sleeper;
    }

    public static RetryPolicy of(EngineProperties.RetryProperties properties) {
        return new RetryPolicy(properties.getMaxAttempts(), properties.getInitialDelayMillis(),
                properties.getMultiplier(), properties.getMaxDelayMillis(), Thread::sleep);
    }

    public static RetryPolicy of(int maxAttempts, EngineProperties.RetryProperties backoff) {
        return new RetryPolicy(maxAttempts, backoff.getInitialDelayMillis(),
                backoff.getMultiplier(), backoff.getMaxDelayMillis(), Thread::sleep);
    }

    public boolean isUnbounded() {
        return maxAttempts <= 0;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    /**
     * 第 attempt 次失败后的等待时间，attempt 从 1 开始
     */
    public long delayMillis(int attempt) {
        double delay = initialDelayMillis * Math.pow(multiplier, Math.max(0, attempt - 1));
        return (long) Math.min(delay, maxDelayMillis);
    }

    /**
     * 执行并在 retryable 判定为可重试时退避重试，重试耗尽后抛出最后一次的异常
     *
     * @param operation 操作名，用于日志
     * @param action 执行体
     * @param retryable 异常是否可重试
     * @param beforeAttempt 每次执行前的检查（例如截止时间），抛出的异常不会被重试
     */
    public <T> T execute(String operation, Supplier<T> action, Predicate<RuntimeException> retryable, Runnable beforeAttempt) {
        int attempt = 0;
        while (true) {
            attempt++;
            beforeAttempt.run();
            try {
                return action.get();
            } catch (RuntimeException e) {
                if(!retryable.test(e) || (!isUnbounded() && attempt >= maxAttempts)) {
                    throw e;
                }
                long delay = delayMillis(attempt);
                log.warn("{} failed on attempt {}, retrying in {} ms: {}", operation, attempt, delay, e.getMessage());
                sleepQuietly(operation, delay);
            }
        }
    }

    public void sleepQuietly(String operation, long millis) {
        try {
            sleeper.sleep(millis);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new AbortedException(operation + " interrupted while waiting to retry", ie);
        }
    }
}
