package com.ke.hal.core;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 引擎使用的线程池，线程名带前缀便于日志定位
 */
public class TaskExecutor {

    private TaskExecutor() {
    }

    /**
     * 每个 worker 独占一个线程，不设置等待队列
     */
    public static ExecutorService newWorkerPool(int workers) {
        return Executors.newFixedThreadPool(workers, new NamedThreadFactory("hal-run-worker-", true));
    }

    public static ScheduledExecutorService newScheduler(String prefix, int threads) {
        return Executors.newScheduledThreadPool(threads, new NamedThreadFactory(prefix, true));
    }

    public static class NamedThreadFactory implements ThreadFactory {
        private final String prefix;
        private final AtomicInteger threadNumber = new AtomicInteger(1);
        private final boolean isDaemon;

        public NamedThreadFactory(String prefix, boolean isDaemon) {
            this.prefix = prefix;
            this.isDaemon = isDaemon;
        }

        @Override
        public Thread newThread(Runnable r) {
            final Thread t = new Thread(r, String.format("%s%d", prefix, threadNumber.getAndIncrement()));
            t.setDaemon(isDaemon);
            return t;
        }
    }
}
