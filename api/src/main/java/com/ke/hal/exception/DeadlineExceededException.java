package com.ke.hal.exception;

public class DeadlineExceededException extends AssistantException {

    public DeadlineExceededException(String runId) {
        super(ErrorCode.DEADLINE_EXCEEDED, "run " + runId + " has expired");
    }
}
