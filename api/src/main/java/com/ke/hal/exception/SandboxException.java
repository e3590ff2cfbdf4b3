package com.ke.hal.exception;

/**
 * 沙箱服务不可用，作为一次失败的执行反馈给模型
 */
public class SandboxException extends AssistantException {

    public SandboxException(String message, Throwable cause) {
        super(ErrorCode.SANDBOX_ERROR, message, cause);
    }

    public SandboxException(String message) {
        super(ErrorCode.SANDBOX_ERROR, message);
    }
}
