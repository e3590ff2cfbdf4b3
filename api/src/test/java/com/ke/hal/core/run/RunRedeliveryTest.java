package com.ke.hal.core.run;

import com.ke.hal.BaseSpringTest;
import com.ke.hal.queue.RunHandle;
import com.ke.hal.queue.RunQueue;
import com.ke.hal.run.RunInfo;
import com.ke.hal.util.DateTimeUtils;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.mock.mockito.SpyBean;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doCallRealMethod;
import static org.mockito.Mockito.doThrow;

/**
 * queued 却丢失投递的 run 由扫描重新入队
 */
class RunRedeliveryTest extends BaseSpringTest {

    private static final Duration LEASE = Duration.ofSeconds(30);

    @SpyBean
    private RunQueue runQueue;

    @Autowired
    private RunExpirationScheduler runExpirationScheduler;

    @Test
    @DisplayName("入队失败不影响创建，扫描后重新投递")
    void requeuesRunWhosePushFailed() throws InterruptedException {
        String assistantId = createAssistant();
        String threadId = createThread("Hello");
        doThrow(new IllegalStateException("redis down")).when(runQueue).push(anyString());
        String runId = createRun(threadId, assistantId);
        doCallRealMethod().when(runQueue).push(anyString());
        assertEquals("queued", runService.getRun(threadId, runId).getStatus());
        assertEquals(0, drain(runId));

        DateTimeUtils.setClock(Clock.offset(Clock.systemUTC(), Duration.ofMinutes(2)));
        assertTrue(runExpirationScheduler.requeueStale() >= 1);

        assertEquals(1, drain(runId));
    }

    @Test
    @DisplayName("仍在队列中的 run 不重复投递")
    void doesNotDuplicateQueuedRun() throws InterruptedException {
        String assistantId = createAssistant();
        String threadId = createThread("Hello");
        String runId = createRun(threadId, assistantId);

        DateTimeUtils.setClock(Clock.offset(Clock.systemUTC(), Duration.ofMinutes(2)));
        runExpirationScheduler.requeueStale();

        RunInfo run = runService.getRun(threadId, runId);
        assertEquals("queued", run.getStatus());
        assertEquals(1, drain(runId));
    }

    /**
     * 取空队列并释放，返回 runId 出现的次数
     */
    private int drain(String runId) throws InterruptedException {
        int count = 0;
        Optional<RunHandle> handle;
        while ((handle = runQueue.poll(LEASE, Duration.ofMillis(10))).isPresent()) {
            if(runId.equals(handle.get().getRunId())) {
                count++;
            }
            handle.get().release();
        }
        return count;
    }
}
