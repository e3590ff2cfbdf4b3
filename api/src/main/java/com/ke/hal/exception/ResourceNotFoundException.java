package com.ke.hal.exception;

public class ResourceNotFoundException extends AssistantException {

    public ResourceNotFoundException(String message) {
        super(ErrorCode.NOT_FOUND, message);
    }
}
