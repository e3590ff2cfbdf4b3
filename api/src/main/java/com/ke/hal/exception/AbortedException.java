package com.ke.hal.exception;

/**
 * 工作线程被中断（通常是停机），放弃本次处理但不修改 run 状态
 */
public class AbortedException extends AssistantException {

    public AbortedException(String message, Throwable cause) {
        super(ErrorCode.ABORTED, message, cause);
    }
}
