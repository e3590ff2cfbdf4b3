package com.ke.hal.queue;

/**
 * 一次投递对应的 lease
 */
public interface RunHandle {

    String getRunId();

    /**
     * 续约
     *
     * @return false 表示 lease 已失效（过期后被回收或被其他消费者占有）
     */
    boolean renew();

    /**
     * 处理结束，确认消费并释放 lease
     */
    void release();
}
