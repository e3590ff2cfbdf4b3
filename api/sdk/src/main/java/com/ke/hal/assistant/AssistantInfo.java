package com.ke.hal.assistant;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.ke.hal.common.Tool;
import lombok.Data;

import java.util.List;
import java.util.Map;

/**
 * Assistant 信息类，用于Service层返回
 */
@Data
public class AssistantInfo {

    private String id;

    private String object = "assistant";

    @JsonProperty("created_at")
    private Long createdAt;

    private String model;

    private String name;

    private String description;

    private String instructions;

    private List<Tool> tools;

    @JsonProperty("file_ids")
    private List<String> fileIds;

    private Map<String, Object> metadata;
}
