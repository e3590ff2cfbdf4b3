package com.ke.hal.queue;

import java.time.Duration;
import java.util.Optional;

/**
 * 待执行 run 的至少一次投递队列
 * 取出的 run 在 lease 有效期内对其他消费者不可见，lease 过期未释放则重新投递
 */
public interface RunQueue {

    /**
     * 投递 run
     */
    void push(String runId);

    /**
     * 取出一个 run 并占有 lease，最多等待 maxWait
     *
     * @return 队列为空时返回 empty
     */
    Optional<RunHandle> poll(Duration leaseDuration, Duration maxWait) throws InterruptedException;

    /**
     * 将 lease 已过期的 run 重新放回队列
     *
     * @return 重新投递的数量
     */
    int reclaimExpired();

    /**
     * run 既不在待执行列表中也未被持有时重新投递
     *
     * @return 是否重新投递
     */
    boolean requeue(String runId);
}
