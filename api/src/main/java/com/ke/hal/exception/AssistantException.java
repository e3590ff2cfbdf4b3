package com.ke.hal.exception;

import java.util.Objects;

/**
 * 所有业务异常的基类，携带稳定的 {@link ErrorCode}
 */
public class AssistantException extends RuntimeException {

    private final ErrorCode code;

    public AssistantException(ErrorCode code, String message) {
        super(message);
        this.code = Objects.requireNonNull(code, "code");
    }

    public AssistantException(ErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = Objects.requireNonNull(code, "code");
    }

    public ErrorCode getCode() {
        return code;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName()
                + "{code=" + code
                + ", message=" + getMessage()
                + (getCause() == null ? "" : ", cause=" + getCause().getClass().getSimpleName())
                + '}';
    }
}
