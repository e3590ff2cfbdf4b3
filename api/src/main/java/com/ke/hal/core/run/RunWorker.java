package com.ke.hal.core.run;

import com.ke.hal.configuration.EngineProperties;
import com.ke.hal.exception.AbortedException;
import com.ke.hal.exception.PersistenceException;
import com.ke.hal.queue.RunHandle;
import com.ke.hal.queue.RunQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 单个 worker 槽位：取出 run → 定时续约 → 处理 → 释放
 */
public class RunWorker implements Runnable {

    private static final Logger logger = LoggerFactory.getLogger(RunWorker.class);

    private final RunQueue runQueue;
    private final RunProcessor runProcessor;
    private final EngineProperties engineProperties;
    private final ScheduledExecutorService heartbeatScheduler;
    private final RetryPolicy pollRetry;
    private volatile boolean running = true;

    public RunWorker(RunQueue runQueue, RunProcessor runProcessor, EngineProperties engineProperties,
            ScheduledExecutorService heartbeatScheduler) {
        this.runQueue = runQueue;
        this.runProcessor = runProcessor;
        this.engineProperties = engineProperties;
        this.heartbeatScheduler = heartbeatScheduler;
        this.pollRetry = RetryPolicy.of(engineProperties.getPollRetry());
    }

    @Override
    public void run() {
        Duration lease = Duration.ofSeconds(engineProperties.getLeaseSeconds());
        Duration pollWait = Duration.ofSeconds(engineProperties.getPollWaitSeconds());
        int failures = 0;
        while (running && !Thread.currentThread().isInterrupted()) {
            Optional<RunHandle> handle;
            try {
                handle = runQueue.poll(lease, pollWait);
                failures = 0;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (RuntimeException e) {
                failures++;
                long delay = pollRetry.delayMillis(failures);
                logger.warn("Run queue poll failed {} times, retrying in {} ms: {}", failures, delay, e.getMessage());
                try {
                    pollRetry.sleepQuietly("run queue poll", delay);
                } catch (AbortedException aborted) {
                    break;
                }
                continue;
            }
            handle.ifPresent(this::handle);
        }
        logger.info("Run worker {} stopped", Thread.currentThread().getName());
    }

    public void stop() {
        running = false;
    }

    void handle(RunHandle handle) {
        String runId = handle.getRunId();
        AtomicBoolean held = new AtomicBoolean(true);
        long period = Math.max(1000L, engineProperties.getLeaseSeconds() * 1000L / 3);
        ScheduledFuture<?> heartbeat = heartbeatScheduler.scheduleAtFixedRate(() -> renew(handle, held),
                period, period, TimeUnit.MILLISECONDS);

        boolean release = true;
        try {
            runProcessor.process(runId, held::get);
        } catch (PersistenceException e) {
            release = false;
            logger.error("Run {} processing aborted by storage error, leaving it for redelivery", runId, e);
        } catch (RuntimeException e) {
            release = false;
            logger.error("Run {} processing crashed, leaving it for redelivery", runId, e);
        } finally {
            heartbeat.cancel(false);
        }

        if(release && held.get()) {
            handle.release();
        }
    }

    private void renew(RunHandle handle, AtomicBoolean held) {
        if(!held.get()) {
            return;
        }
        try {
            if(!handle.renew()) {
                held.set(false);
                logger.warn("Lease of run {} is lost", handle.getRunId());
            }
        } catch (RuntimeException e) {
            // 无法确认仍持有 lease，放弃本次处理，run 由 lease 过期后的重新投递接管
            held.set(false);
            logger.warn("Lease renewal of run {} failed, abandoning: {}", handle.getRunId(), e.getMessage());
        }
    }
}
