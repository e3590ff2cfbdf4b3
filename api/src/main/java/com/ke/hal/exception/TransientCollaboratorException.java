package com.ke.hal.exception;

/**
 * 外部依赖的可重试错误（网络、5xx、限流），code 为重试耗尽后写入 last_error 的值
 */
public class TransientCollaboratorException extends AssistantException {

    public TransientCollaboratorException(ErrorCode code, String message) {
        super(code, message);
    }

    public TransientCollaboratorException(ErrorCode code, String message, Throwable cause) {
        super(code, message, cause);
    }
}
