package com.ke.hal.run;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import javax.validation.Valid;
import javax.validation.constraints.NotBlank;
import javax.validation.constraints.NotNull;
import java.util.List;
import java.util.Map;

/**
 * Run 操作相关的 DTO 类
 */
public class RunOps {

    /**
     * 创建 Run 请求
     */
    @Data
    public static class CreateRunOp {

        @NotBlank
        @JsonProperty("assistant_id")
        private String assistantId;

        /**
         * 覆盖 assistant 的 instructions
         */
        private String instructions;

        private Map<String, Object> metadata;
    }

    /**
     * 提交 function 调用结果
     */
    @Data
    public static class SubmitToolOutputsOp {

        @Valid
        @NotNull
        @JsonProperty("tool_outputs")
        private List<ToolOutput> toolOutputs;
    }

    @Data
    public static class ToolOutput {

        @NotBlank
        @JsonProperty("tool_call_id")
        private String toolCallId;

        private String output;
    }

    /**
     * 更新 Run 请求，只允许修改 metadata
     */
    @Data
    public static class UpdateRunOp {

        private Map<String, Object> metadata;
    }
}
