package com.ke.hal.run;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

/**
 * Run 内的一次工具调用
 */
@Data
public class ToolCallInfo {

    private String id;

    private String object = "thread.run.tool_call";

    @JsonProperty("run_id")
    private String runId;

    private String type;

    private String name;

    private String arguments;

    private String output;

    @JsonProperty("is_error")
    private Boolean isError;

    private String status;

    private Integer round;

    @JsonProperty("created_at")
    private Long createdAt;

    @JsonProperty("completed_at")
    private Long completedAt;
}
