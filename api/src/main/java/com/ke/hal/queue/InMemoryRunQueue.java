package com.ke.hal.queue;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.BlockingDeque;
import java.util.concurrent.LinkedBlockingDeque;
import java.util.concurrent.TimeUnit;

/**
 * 单进程内的 RunQueue，用于测试与本地开发
 */
@Slf4j
public class InMemoryRunQueue implements RunQueue {

    private final Clock clock;
    private final BlockingDeque<String> pending = new LinkedBlockingDeque<>();
    private final Map<String, Lease> leases = new LinkedHashMap<>();

    public InMemoryRunQueue(Clock clock) {
        this.clock = clock;
    }

    @Override
    public void push(String runId) {
        pending.offerLast(runId);
    }

    @Override
    public Optional<RunHandle> poll(Duration leaseDuration, Duration maxWait) throws InterruptedException {
        String runId = pending.pollFirst(maxWait.toMillis(), TimeUnit.MILLISECONDS);
        if(runId == null) {
            return Optional.empty();
        }
        String token = UUID.randomUUID().toString();
        synchronized (leases) {
            leases.put(runId, new Lease(token, clock.millis() + leaseDuration.toMillis()));
        }
        return Optional.of(new MemoryRunHandle(runId, token, leaseDuration));
    }

    @Override
    public int reclaimExpired() {
        int reclaimed = 0;
        long now = clock.millis();
        synchronized (leases) {
            Iterator<Map.Entry<String, Lease>> iterator = leases.entrySet().iterator();
            while (iterator.hasNext()) {
                Map.Entry<String, Lease> entry = iterator.next();
                if(entry.getValue().expiresAt <= now) {
                    iterator.remove();
                    pending.offerLast(entry.getKey());
                    reclaimed++;
                }
            }
        }
        if(reclaimed > 0) {
            log.info("Reclaimed {} expired run leases", reclaimed);
        }
        return reclaimed;
    }

    @Override
    public boolean requeue(String runId) {
        synchronized (leases) {
            if(leases.containsKey(runId) || pending.contains(runId)) {
                return false;
            }
            pending.offerLast(runId);
            return true;
        }
    }

    public int pendingSize() {
        return pending.size();
    }

    public int leasedSize() {
        synchronized (leases) {
            return leases.size();
        }
    }

    private static class Lease {
        private final String token;
        private final long expiresAt;

        Lease(String token, long expiresAt) {
            this.token = token;
            this.expiresAt = expiresAt;
        }
    }

    private class MemoryRunHandle implements RunHandle {
        private final String runId;
        private final String token;
        private final Duration leaseDuration;

        MemoryRunHandle(String runId, String token, Duration leaseDuration) {
            this.runId = runId;
            this.token = token;
            this.leaseDuration = leaseDuration;
        }

        @Override
        public String getRunId() {
            return runId;
        }

        @Override
        public boolean renew() {
            synchronized (leases) {
                Lease lease = leases.get(runId);
                if(lease == null || !lease.token.equals(token)) {
                    return false;
                }
                leases.put(runId, new Lease(token, clock.millis() + leaseDuration.toMillis()));
                return true;
            }
        }

        @Override
        public void release() {
            synchronized (leases) {
                Lease lease = leases.get(runId);
                if(lease != null && lease.token.equals(token)) {
                    leases.remove(runId);
                }
            }
        }
    }
}
