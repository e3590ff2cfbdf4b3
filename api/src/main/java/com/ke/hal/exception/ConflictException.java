package com.ke.hal.exception;

/**
 * 乐观锁校验失败，run 已被其他写入方修改
 */
public class ConflictException extends AssistantException {

    public ConflictException(String message) {
        super(ErrorCode.CONFLICT, message);
    }
}
