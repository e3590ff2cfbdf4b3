package com.ke.hal.run;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.ke.hal.common.LastError;
import lombok.Data;

import java.util.List;

/**
 * Run Step 信息 DTO
 * 每次模型轮次对应一个步骤：发起工具调用为 tool_calls，最终回答为 message_creation
 */
@Data
public class RunStepInfo {

    private String id;

    private String object = "thread.run.step";

    @JsonProperty("created_at")
    private Long createdAt;

    @JsonProperty("assistant_id")
    private String assistantId;

    @JsonProperty("thread_id")
    private String threadId;

    @JsonProperty("run_id")
    private String runId;

    /**
     * message_creation | tool_calls
     */
    private String type;

    /**
     * in_progress | completed | failed | cancelled | expired
     */
    private String status;

    @JsonProperty("step_details")
    private StepDetails stepDetails;

    /**
     * 步骤失败时与 run 的 last_error 一致
     */
    @JsonProperty("last_error")
    private LastError lastError;

    @JsonProperty("expired_at")
    private Long expiredAt;

    @JsonProperty("cancelled_at")
    private Long cancelledAt;

    @JsonProperty("failed_at")
    private Long failedAt;

    @JsonProperty("completed_at")
    private Long completedAt;

    @Data
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class StepDetails {
        private String type;

        @JsonProperty("message_creation")
        private MessageCreation messageCreation;

        @JsonProperty("tool_calls")
        private List<ToolCallInfo> toolCalls;
    }

    @Data
    public static class MessageCreation {
        @JsonProperty("message_id")
        private String messageId;
    }
}
