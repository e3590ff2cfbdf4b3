package com.ke.hal.thread;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.ke.hal.message.MessageOps;
import lombok.Data;

import javax.validation.Valid;
import java.util.List;
import java.util.Map;

/**
 * Thread 操作相关的 DTO 类
 */
public class ThreadOps {

    /**
     * 创建 Thread 请求，可携带初始消息
     */
    @Data
    public static class CreateThreadOp {

        @Valid
        private List<MessageOps.CreateMessageOp> messages;

        @JsonProperty("file_ids")
        private List<String> fileIds;

        private Map<String, Object> metadata;
    }

    /**
     * 更新 Thread 请求，null 字段保持不变
     */
    @Data
    public static class UpdateThreadOp {

        @JsonProperty("file_ids")
        private List<String> fileIds;

        private Map<String, Object> metadata;
    }
}
