package com.ke.hal.message;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import javax.validation.constraints.NotBlank;
import javax.validation.constraints.Pattern;
import java.util.List;
import java.util.Map;

/**
 * Message 操作相关的 DTO 类
 */
public class MessageOps {

    /**
     * 创建 Message 请求
     */
    @Data
    public static class CreateMessageOp {

        @NotBlank
        @Pattern(regexp = "user|assistant")
        private String role;

        @NotBlank
        private String content;

        @JsonProperty("file_ids")
        private List<String> fileIds;

        private Map<String, Object> metadata;
    }

    /**
     * 更新 Message 请求，只允许修改 metadata
     */
    @Data
    public static class UpdateMessageOp {

        private Map<String, Object> metadata;
    }
}
