package com.ke.hal.run;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.ke.hal.common.LastError;
import com.ke.hal.common.Tool;
import lombok.Data;

import java.util.List;
import java.util.Map;

/**
 * Run 信息 DTO
 */
@Data
public class RunInfo {

    private String id;

    private String object = "thread.run";

    @JsonProperty("created_at")
    private Long createdAt;

    @JsonProperty("thread_id")
    private String threadId;

    @JsonProperty("assistant_id")
    private String assistantId;

    private String status;

    @JsonProperty("required_action")
    private RequiredAction requiredAction;

    @JsonProperty("last_error")
    private LastError lastError;

    @JsonProperty("expires_at")
    private Long expiresAt;

    @JsonProperty("started_at")
    private Long startedAt;

    @JsonProperty("cancelled_at")
    private Long cancelledAt;

    @JsonProperty("failed_at")
    private Long failedAt;

    @JsonProperty("completed_at")
    private Long completedAt;

    private String model;

    private String instructions;

    private List<Tool> tools;

    @JsonProperty("file_ids")
    private List<String> fileIds;

    private Map<String, Object> metadata;

    @Data
    public static class RequiredAction {
        private String type = "submit_tool_outputs";
        @JsonProperty("submit_tool_outputs")
        private SubmitToolOutputs submitToolOutputs;

        @Data
        public static class SubmitToolOutputs {
            @JsonProperty("tool_calls")
            private List<ToolCall> toolCalls;
        }

        @Data
        public static class ToolCall {
            private String id;
            private String type = "function";
            private Function function;

            @Data
            public static class Function {
                private String name;
                private String arguments;
            }
        }
    }
}
