package com.ke.hal.exception;

/**
 * lease 续约失败，放弃本次处理但不修改 run 状态
 */
public class LeaseLostException extends AssistantException {

    public LeaseLostException(String runId) {
        super(ErrorCode.LEASE_LOST, "lease of run " + runId + " is lost");
    }
}
