package com.ke.hal.exception;

/**
 * 模型服务返回的不可重试错误
 */
public class ModelClientException extends AssistantException {

    private final int statusCode;

    public ModelClientException(int statusCode, String message) {
        super(ErrorCode.MODEL_ERROR, message);
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
