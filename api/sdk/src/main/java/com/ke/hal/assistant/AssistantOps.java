package com.ke.hal.assistant;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.ke.hal.common.Tool;
import lombok.Data;

import javax.validation.Valid;
import javax.validation.constraints.NotBlank;
import javax.validation.constraints.Size;
import java.util.List;
import java.util.Map;

/**
 * Assistant 操作相关的 DTO 类
 */
public class AssistantOps {

    /**
     * 创建 Assistant 请求
     */
    @Data
    public static class CreateAssistantOp {

        @NotBlank
        @Size(max = 256)
        private String model;

        @Size(max = 256)
        private String name;

        @Size(max = 512)
        private String description;

        @Size(max = 32768)
        private String instructions;

        @Valid
        private List<Tool> tools;

        @JsonProperty("file_ids")
        private List<String> fileIds;

        private Map<String, Object> metadata;
    }

    /**
     * 更新 Assistant 请求，null 字段保持不变
     */
    @Data
    public static class UpdateAssistantOp {

        @Size(max = 256)
        private String model;

        @Size(max = 256)
        private String name;

        @Size(max = 512)
        private String description;

        @Size(max = 32768)
        private String instructions;

        @Valid
        private List<Tool> tools;

        @JsonProperty("file_ids")
        private List<String> fileIds;

        private Map<String, Object> metadata;
    }
}
