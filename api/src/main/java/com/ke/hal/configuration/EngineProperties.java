package com.ke.hal.configuration;

import lombok.Data;

@Data
public class EngineProperties {
    /**
     * 关闭后不启动 worker 与后台清理线程
     */
    private boolean enabled = true;
    private int workers = 4;
    private int leaseSeconds = 30;
    private int pollWaitSeconds = 5;
    private int maxSteps = 20;
    private int reaperIntervalSeconds = 10;
    private int expirationSweepSeconds = 30;
    /**
     * queued 状态超过该时长仍不在队列中的 run 会被重新投递
     */
    private int staleQueuedSeconds = 60;
    private RetryProperties modelRetry = new RetryProperties();
    private RetryProperties pollRetry = new RetryProperties(0, 200, 2.0, 10000);

    @Data
    public static class RetryProperties {
        /**
         * 小于等于 0 表示不限次数
         */
        private int maxAttempts = 3;
        private long initialDelayMillis = 500;
        private double multiplier = 2.0;
        private long maxDelayMillis = 8000;

        public RetryProperties() {
        }

        public RetryProperties(int maxAttempts, long initialDelayMillis, double multiplier, long maxDelayMillis) {
            this.maxAttempts = maxAttempts;
            this.initialDelayMillis = initialDelayMillis;
            this.multiplier = multiplier;
            this.maxDelayMillis = maxDelayMillis;
        }
    }
}
