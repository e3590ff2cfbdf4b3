package com.ke.hal.db.entity;

import lombok.Data;

@Data
public class RunStepDb implements Timed {

    public static final String MESSAGE_CREATION = "message_creation";
    public static final String TOOL_CALLS = "tool_calls";

    private String id;
    private String runId;
    private String threadId;
    private String assistantId;
    private String userId;
    private String type;
    private String status;
    /**
     * tool_calls 步骤与其工具调用的 round 一致，message_creation 为最后一轮之后
     */
    private Long stepNumber;
    private String messageId;
    private Long createdAt;
    private Long updatedAt;
    private Long completedAt;
    private Long cancelledAt;
    private Long failedAt;
    private Long expiredAt;
}
