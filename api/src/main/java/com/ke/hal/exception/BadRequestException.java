package com.ke.hal.exception;

public class BadRequestException extends AssistantException {

    public BadRequestException(String message) {
        super(ErrorCode.INVALID_REQUEST, message);
    }
}
