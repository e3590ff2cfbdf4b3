package com.ke.hal.exception;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 错误码，code 与 run.last_error.code 以及 HTTP 错误体中的 code 一致
 */
@Getter
@AllArgsConstructor
public enum ErrorCode {
    // run.last_error
    SERVER_ERROR("server_error", 500),
    RATE_LIMIT("rate_limit", 429),
    INVALID_TOOL_OUTPUT("invalid_tool_output", 400),
    RETRIEVAL_ERROR("retrieval_error", 502),
    SANDBOX_EXHAUSTED("sandbox_exhausted", 500),
    CONTEXT_EXCEEDED("context_exceeded", 400),
    INVALID_TOOL("invalid_tool", 400),
    MAX_STEPS_EXCEEDED("max_steps_exceeded", 500),

    // API
    INVALID_REQUEST("invalid_request_error", 400),
    NOT_FOUND("not_found_error", 404),
    CONFLICT("conflict_error", 409),

    // engine internal
    SANDBOX_ERROR("sandbox_error", 502),
    MODEL_ERROR("model_error", 502),
    DEADLINE_EXCEEDED("deadline_exceeded", 408),
    LEASE_LOST("lease_lost", 409),
    ABORTED("aborted", 503),
    PERSISTENCE_ERROR("persistence_error", 500);

    private final String code;
    private final int httpStatus;
}
