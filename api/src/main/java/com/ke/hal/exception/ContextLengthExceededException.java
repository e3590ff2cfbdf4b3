package com.ke.hal.exception;

public class ContextLengthExceededException extends AssistantException {

    public ContextLengthExceededException(String message) {
        super(ErrorCode.CONTEXT_EXCEEDED, message);
    }
}
