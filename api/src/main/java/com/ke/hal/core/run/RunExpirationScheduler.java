package com.ke.hal.core.run;

import com.ke.hal.configuration.AssistantProperties;
import com.ke.hal.db.entity.RunDb;
import com.ke.hal.db.repo.RunRepo;
import com.ke.hal.exception.ConflictException;
import com.ke.hal.queue.RunQueue;
import com.ke.hal.util.DateTimeUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;

/**
 * 过期扫描：没有引擎持有的 queued / requires_action run 到期后置为 expired
 * 同时重新投递长时间停留在 queued 却不在队列中的 run（例如提交后入队失败）
 */
@Component
public class RunExpirationScheduler {

    private static final Logger logger = LoggerFactory.getLogger(RunExpirationScheduler.class);

    private static final List<String> SWEPT_STATUSES = Arrays.asList(RunStatus.QUEUED.getValue(),
            RunStatus.REQUIRES_ACTION.getValue());
    private static final int BATCH_SIZE = 100;

    @Autowired
    private RunRepo runRepo;

    @Autowired
    private RunStateManager stateManager;

    @Autowired
    private RunQueue runQueue;

    @Autowired
    private AssistantProperties assistantProperties;

    @Scheduled(fixedDelayString = "PT${hal.assistant.engine.expiration-sweep-seconds:30}S",
            initialDelayString = "PT${hal.assistant.engine.expiration-sweep-seconds:30}S")
    public void scheduledSweep() {
        if(!assistantProperties.getEngine().isEnabled()) {
            return;
        }
        try {
            sweep();
        } catch (RuntimeException e) {
            logger.error("Run expiration sweep failed", e);
        }
        try {
            requeueStale();
        } catch (RuntimeException e) {
            logger.error("Stale queued run redelivery failed", e);
        }
    }

    /**
     * @return 本次置为过期的数量
     */
    public int sweep() {
        List<RunDb> expired = runRepo.findExpired(DateTimeUtils.getCurrentSeconds(), SWEPT_STATUSES, BATCH_SIZE);
        int count = 0;
        for (RunDb run : expired) {
            try {
                if(stateManager.toExpired(run.getId())) {
                    count++;
                }
            } catch (ConflictException e) {
                logger.info("Run {} changed while expiring, skipped: {}", run.getId(), e.getMessage());
            }
        }
        if(count > 0) {
            logger.info("Expired {} runs", count);
        }
        return count;
    }

    /**
     * @return 本次重新投递的数量
     */
    public int requeueStale() {
        long updatedBefore = DateTimeUtils.getCurrentSeconds() - assistantProperties.getEngine().getStaleQueuedSeconds();
        List<RunDb> stale = runRepo.findStale(RunStatus.QUEUED.getValue(), updatedBefore, BATCH_SIZE);
        int count = 0;
        for (RunDb run : stale) {
            if(runQueue.requeue(run.getId())) {
                logger.warn("Run {} was queued without a delivery, pushed again", run.getId());
                count++;
            }
        }
        return count;
    }
}
