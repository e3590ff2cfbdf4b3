package com.ke.hal.queue;

import lombok.extern.slf4j.Slf4j;
import org.redisson.api.RList;
import org.redisson.api.RScript;
import org.redisson.api.RedissonClient;
import org.redisson.client.codec.StringCodec;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * 基于 Redis 的 RunQueue
 * pending 列表保存待执行 run，leases 有序集合以过期时间为分值，owners 哈希记录持有者 token
 * 取出、续约、释放、回收均通过 Lua 脚本原子完成
 */
@Slf4j
public class RedisRunQueue implements RunQueue {

    private static final long IDLE_POLL_INTERVAL_MILLIS = 200;

    private static final String CLAIM_SCRIPT =
            "local id = redis.call('LPOP', KEYS[1]) "
            + "if not id then return nil end "
            + "redis.call('ZADD', KEYS[2], ARGV[1], id) "
            + "redis.call('HSET', KEYS[3], id, ARGV[2]) "
            + "return id";

    private static final String RENEW_SCRIPT =
            "if redis.call('HGET', KEYS[2], ARGV[1]) ~= ARGV[2] then return 0 end "
            + "redis.call('ZADD', KEYS[1], ARGV[3], ARGV[1]) "
            + "return 1";

    private static final String RELEASE_SCRIPT =
            "if redis.call('HGET', KEYS[2], ARGV[1]) ~= ARGV[2] then return 0 end "
            + "redis.call('ZREM', KEYS[1], ARGV[1]) "
            + "redis.call('HDEL', KEYS[2], ARGV[1]) "
            + "return 1";

    private static final String RECLAIM_SCRIPT =
            "local ids = redis.call('ZRANGEBYSCORE', KEYS[2], '-inf', ARGV[1]) "
            + "for _, id in ipairs(ids) do "
            + "redis.call('ZREM', KEYS[2], id) "
            + "redis.call('HDEL', KEYS[3], id) "
            + "redis.call('RPUSH', KEYS[1], id) "
            + "end "
            + "return #ids";

    // LPOS 需要 Redis 6.0.6 及以上
    private static final String REQUEUE_SCRIPT =
            "if redis.call('HEXISTS', KEYS[2], ARGV[1]) == 1 then return 0 end "
            + "if redis.call('LPOS', KEYS[1], ARGV[1]) then return 0 end "
            + "redis.call('RPUSH', KEYS[1], ARGV[1]) "
            + "return 1";

    private final RedissonClient redissonClient;
    private final String pendingKey;
    private final String leasesKey;
    private final String ownersKey;

    public RedisRunQueue(RedissonClient redissonClient, String keyPrefix) {
        this.redissonClient = redissonClient;
        // hash tag 保证集群模式下三个 key 位于同一 slot
        String base = "{" + keyPrefix + ":run-queue}";
        this.pendingKey = base + ":pending";
        this.leasesKey = base + ":leases";
        this.ownersKey = base + ":owners";
    }

    @Override
    public void push(String runId) {
        RList<String> pending = redissonClient.getList(pendingKey, StringCodec.INSTANCE);
        pending.add(runId);
        log.debug("Pushed run {} to queue", runId);
    }

    @Override
    public Optional<RunHandle> poll(Duration leaseDuration, Duration maxWait) throws InterruptedException {
        long deadline = System.currentTimeMillis() + maxWait.toMillis();
        String token = UUID.randomUUID().toString();
        while (true) {
            long expiresAt = System.currentTimeMillis() + leaseDuration.toMillis();
            String runId = script().eval(RScript.Mode.READ_WRITE, CLAIM_SCRIPT, RScript.ReturnType.VALUE,
                    keys(pendingKey, leasesKey, ownersKey), String.valueOf(expiresAt), token);
            if(runId != null) {
                return Optional.of(new RedisRunHandle(runId, token, leaseDuration));
            }
            long remaining = deadline - System.currentTimeMillis();
            if(remaining <= 0) {
                return Optional.empty();
            }
            Thread.sleep(Math.min(IDLE_POLL_INTERVAL_MILLIS, remaining));
        }
    }

    @Override
    public int reclaimExpired() {
        Long reclaimed = script().eval(RScript.Mode.READ_WRITE, RECLAIM_SCRIPT, RScript.ReturnType.INTEGER,
                keys(pendingKey, leasesKey, ownersKey), String.valueOf(System.currentTimeMillis()));
        int count = reclaimed == null ? 0 : reclaimed.intValue();
        if(count > 0) {
            log.info("Reclaimed {} expired run leases", count);
        }
        return count;
    }

    @Override
    public boolean requeue(String runId) {
        Long requeued = script().eval(RScript.Mode.READ_WRITE, REQUEUE_SCRIPT, RScript.ReturnType.INTEGER,
                keys(pendingKey, ownersKey), runId);
        return requeued != null && requeued == 1L;
    }

    private RScript script() {
        return redissonClient.getScript(StringCodec.INSTANCE);
    }

    private static List<Object> keys(String... keys) {
        return Arrays.asList((Object[]) keys);
    }

    private class RedisRunHandle implements RunHandle {
        private final String runId;
        private final String token;
        private final Duration leaseDuration;

        RedisRunHandle(String runId, String token, Duration leaseDuration) {
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
            long expiresAt = System.currentTimeMillis() + leaseDuration.toMillis();
            Long renewed = script().eval(RScript.Mode.READ_WRITE, RENEW_SCRIPT, RScript.ReturnType.INTEGER,
                    keys(leasesKey, ownersKey), runId, token, String.valueOf(expiresAt));
            return renewed != null && renewed == 1L;
        }

        @Override
        public void release() {
            Long released = script().eval(RScript.Mode.READ_WRITE, RELEASE_SCRIPT, RScript.ReturnType.INTEGER,
                    keys(leasesKey, ownersKey), runId, token);
            if(released == null || released == 0L) {
                log.warn("Lease of run {} was already lost when releasing", runId);
            }
        }
    }
}
