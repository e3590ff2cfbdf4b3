package com.ke.hal.queue;

import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.redisson.Redisson;
import org.redisson.api.RedissonClient;
import org.redisson.config.Config;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.containers.wait.strategy.Wait;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * RedisRunQueue 测试，Lua 脚本在真实 Redis 上执行
 * 没有 Docker 环境时跳过
 */
@Testcontainers(disabledWithoutDocker = true)
class RedisRunQueueTest {

    private static final Duration LEASE = Duration.ofSeconds(30);
    private static final Duration NO_WAIT = Duration.ofMillis(10);

    @Container
    private static final GenericContainer<?> REDIS = new GenericContainer<>(DockerImageName.parse("redis:7-alpine"))
            .withExposedPorts(6379)
            .waitingFor(Wait.forLogMessage(".*Ready to accept connections.*\\n", 1));

    private static RedissonClient redissonClient;

    private RedisRunQueue queue;

    @BeforeAll
    static void connect() {
        Config config = new Config();
        config.useSingleServer().setAddress("redis://" + REDIS.getHost() + ":" + REDIS.getFirstMappedPort());
        redissonClient = Redisson.create(config);
    }

    @AfterAll
    static void disconnect() {
        if(redissonClient != null) {
            redissonClient.shutdown();
        }
    }

    @BeforeEach
    void setUp() {
        // 每个用例使用独立的 key 前缀
        queue = new RedisRunQueue(redissonClient, "hal-test-" + UUID.randomUUID());
    }

    @Test
    @DisplayName("按投递顺序取出，同一 run 只能被一个 worker 持有")
    void pollsInOrderAndClaimsExclusively() throws InterruptedException {
        queue.push("run_1");
        queue.push("run_2");

        RunHandle first = queue.poll(LEASE, NO_WAIT).get();
        RunHandle second = queue.poll(LEASE, NO_WAIT).get();

        assertEquals("run_1", first.getRunId());
        assertEquals("run_2", second.getRunId());
        assertFalse(queue.poll(LEASE, NO_WAIT).isPresent());
    }

    @Test
    @DisplayName("空队列等待到超时后返回空")
    void pollWaitsUntilTimeout() throws InterruptedException {
        long start = System.currentTimeMillis();

        assertFalse(queue.poll(LEASE, Duration.ofMillis(300)).isPresent());
        assertTrue(System.currentTimeMillis() - start >= 300);
    }

    @Test
    @DisplayName("lease 过期后重新投递，旧持有者续约和释放都不生效")
    void reclaimsExpiredLease() throws InterruptedException {
        queue.push("run_1");
        RunHandle stale = queue.poll(Duration.ofMillis(200), NO_WAIT).get();

        assertEquals(0, queue.reclaimExpired());
        Thread.sleep(400);
        assertEquals(1, queue.reclaimExpired());

        RunHandle current = queue.poll(LEASE, NO_WAIT).get();
        assertEquals("run_1", current.getRunId());
        assertFalse(stale.renew());
        stale.release();

        // 旧持有者的释放不影响新 lease
        assertTrue(current.renew());
        assertEquals(0, queue.reclaimExpired());
    }

    @Test
    @DisplayName("续约推迟过期时间")
    void renewExtendsLease() throws InterruptedException {
        queue.push("run_1");
        RunHandle handle = queue.poll(Duration.ofMillis(500), NO_WAIT).get();

        Thread.sleep(300);
        assertTrue(handle.renew());
        Thread.sleep(300);

        assertEquals(0, queue.reclaimExpired());
    }

    @Test
    @DisplayName("释放后 lease 不再被回收")
    void releaseRemovesLease() throws InterruptedException {
        queue.push("run_1");
        RunHandle handle = queue.poll(Duration.ofMillis(100), NO_WAIT).get();

        handle.release();
        Thread.sleep(200);

        assertEquals(0, queue.reclaimExpired());
        assertFalse(handle.renew());
        assertFalse(queue.poll(LEASE, NO_WAIT).isPresent());
    }

    @Test
    @DisplayName("只补投既不在队列中也未被持有的 run")
    void requeuesOnlyMissingRuns() throws InterruptedException {
        queue.push("run_pending");
        assertFalse(queue.requeue("run_pending"));

        queue.push("run_leased");
        queue.poll(LEASE, NO_WAIT);
        RunHandle leased = queue.poll(LEASE, NO_WAIT).get();
        assertEquals("run_leased", leased.getRunId());
        assertFalse(queue.requeue("run_leased"));

        assertTrue(queue.requeue("run_lost"));
        Optional<RunHandle> redelivered = queue.poll(LEASE, NO_WAIT);
        assertTrue(redelivered.isPresent());
        assertEquals("run_lost", redelivered.get().getRunId());
    }
}
