package com.ke.hal.exception;

/**
 * run 需要以 failed 结束，code 即 last_error.code
 */
public class RunFailedException extends AssistantException {

    public RunFailedException(ErrorCode code, String message) {
        super(code, message);
    }

    public RunFailedException(ErrorCode code, String message, Throwable cause) {
        super(code, message, cause);
    }
}
