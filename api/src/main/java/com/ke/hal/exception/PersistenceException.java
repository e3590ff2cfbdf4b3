package com.ke.hal.exception;

/**
 * 存储层不可恢复错误，当前处理中止且不释放 lease，等待重新投递
 */
public class PersistenceException extends AssistantException {

    public PersistenceException(String message, Throwable cause) {
        super(ErrorCode.PERSISTENCE_ERROR, message, cause);
    }

    public PersistenceException(String message) {
        super(ErrorCode.PERSISTENCE_ERROR, message);
    }
}
