package com.ke.hal.thread;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.List;
import java.util.Map;

/**
 * Thread 信息
 */
@Data
public class ThreadInfo {

    private String id;

    private String object = "thread";

    @JsonProperty("created_at")
    private Long createdAt;

    @JsonProperty("file_ids")
    private List<String> fileIds;

    private Map<String, Object> metadata;
}
