package com.ke.hal.message;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.List;
import java.util.Map;

/**
 * Message Info DTO for API responses
 */
@Data
public class MessageInfo {
    private String id;
    private String object = "thread.message";
    @JsonProperty("created_at")
    private Long createdAt;
    @JsonProperty("thread_id")
    private String threadId;
    private String role;
    private List<MessageContent> content;
    @JsonProperty("assistant_id")
    private String assistantId;
    @JsonProperty("run_id")
    private String runId;
    @JsonProperty("file_ids")
    private List<String> fileIds;
    private Map<String, Object> metadata;
}
