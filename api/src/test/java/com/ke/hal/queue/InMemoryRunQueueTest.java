package com.ke.hal.queue;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class InMemoryRunQueueTest {

    private static final Duration LEASE = Duration.ofSeconds(30);
    private static final Duration NO_WAIT = Duration.ofMillis(10);

    private MutableClock clock;
    private InMemoryRunQueue queue;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        queue = new InMemoryRunQueue(clock);
    }

    @Test
    @DisplayName("按投递顺序取出")
    void pollsInOrder() throws InterruptedException {
        queue.push("run_1");
        queue.push("run_2");

        assertEquals("run_1", queue.poll(LEASE, NO_WAIT).get().getRunId());
        assertEquals("run_2", queue.poll(LEASE, NO_WAIT).get().getRunId());
        assertFalse(queue.poll(LEASE, NO_WAIT).isPresent());
        assertEquals(2, queue.leasedSize());
    }

    @Test
    @DisplayName("lease 过期未释放的 run 重新投递")
    void reclaimsExpiredLease() throws InterruptedException {
        queue.push("run_1");
        RunHandle first = queue.poll(LEASE, NO_WAIT).get();

        clock.advance(Duration.ofSeconds(10));
        assertEquals(0, queue.reclaimExpired());
        assertFalse(queue.poll(LEASE, NO_WAIT).isPresent());

        clock.advance(Duration.ofSeconds(25));
        assertEquals(1, queue.reclaimExpired());
        Optional<RunHandle> second = queue.poll(LEASE, NO_WAIT);
        assertTrue(second.isPresent());
        assertEquals("run_1", second.get().getRunId());

        // 旧持有者已失去 lease
        assertFalse(first.renew());
        first.release();
        assertEquals(1, queue.leasedSize());
    }

    @Test
    @DisplayName("续约推迟过期时间")
    void renewExtendsLease() throws InterruptedException {
        queue.push("run_1");
        RunHandle handle = queue.poll(LEASE, NO_WAIT).get();

        clock.advance(Duration.ofSeconds(20));
        assertTrue(handle.renew());
        clock.advance(Duration.ofSeconds(20));
        assertEquals(0, queue.reclaimExpired());

        handle.release();
        assertEquals(0, queue.leasedSize());
        assertEquals(0, queue.pendingSize());
        assertFalse(handle.renew());
    }

    @Test
    @DisplayName("只重新投递既未排队也未被持有的 run")
    void requeuesOnlyMissingRuns() throws InterruptedException {
        queue.push("run_1");
        assertFalse(queue.requeue("run_1"));

        RunHandle handle = queue.poll(LEASE, NO_WAIT).get();
        assertFalse(queue.requeue("run_1"));

        handle.release();
        assertTrue(queue.requeue("run_1"));
        assertEquals(1, queue.pendingSize());
        assertEquals("run_1", queue.poll(LEASE, NO_WAIT).get().getRunId());
    }

    private static class MutableClock extends Clock {
        private Instant now = Instant.parse("2024-01-01T00:00:00Z");

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
