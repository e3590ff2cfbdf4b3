package com.ke.hal.core.run;

import com.ke.hal.configuration.AssistantProperties;
import com.ke.hal.configuration.EngineProperties;
import com.ke.hal.core.TaskExecutor;
import com.ke.hal.queue.RunQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import javax.annotation.PreDestroy;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Run 执行引擎，启动 worker 线程与 lease 回收
 */
@Component
@ConditionalOnProperty(value = "hal.assistant.engine.enabled", havingValue = "true", matchIfMissing = true)
public class RunEngine {

    private static final Logger logger = LoggerFactory.getLogger(RunEngine.class);

    @Autowired
    private RunQueue runQueue;

    @Autowired
    private RunProcessor runProcessor;

    @Autowired
    private AssistantProperties assistantProperties;

    private final List<RunWorker> workers = new ArrayList<>();
    private ExecutorService workerPool;
    private ScheduledExecutorService heartbeatScheduler;
    private ScheduledExecutorService reaperScheduler;

    @EventListener(ApplicationReadyEvent.class)
    public void start() {
        EngineProperties engine = assistantProperties.getEngine();
        workerPool = TaskExecutor.newWorkerPool(engine.getWorkers());
        heartbeatScheduler = TaskExecutor.newScheduler("hal-lease-heartbeat-", Math.max(1, engine.getWorkers() / 2));
        reaperScheduler = TaskExecutor.newScheduler("hal-lease-reaper-", 1);

        for (int i = 0; i < engine.getWorkers(); i++) {
            RunWorker worker = new RunWorker(runQueue, runProcessor, engine, heartbeatScheduler);
            workers.add(worker);
            workerPool.execute(worker);
        }
        reaperScheduler.scheduleWithFixedDelay(this::reclaim, engine.getReaperIntervalSeconds(),
                engine.getReaperIntervalSeconds(), TimeUnit.SECONDS);
        logger.info("Run engine started with {} workers, lease {}s", engine.getWorkers(), engine.getLeaseSeconds());
    }

    @PreDestroy
    public void stop() {
        workers.forEach(RunWorker::stop);
        if(workerPool == null) {
            return;
        }
        reaperScheduler.shutdownNow();
        workerPool.shutdownNow();
        try {
            if(!workerPool.awaitTermination(10, TimeUnit.SECONDS)) {
                logger.warn("Run workers did not stop in time, unreleased runs will be redelivered");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        heartbeatScheduler.shutdownNow();
        logger.info("Run engine stopped");
    }

    private void reclaim() {
        try {
            int reclaimed = runQueue.reclaimExpired();
            if(reclaimed > 0) {
                logger.info("Reclaimed {} runs with expired leases", reclaimed);
            }
        } catch (RuntimeException e) {
            logger.warn("Lease reclaim failed: {}", e.getMessage());
        }
    }
}
