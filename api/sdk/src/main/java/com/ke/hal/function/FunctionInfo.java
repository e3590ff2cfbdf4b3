package com.ke.hal.function;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.Map;

/**
 * 已注册的 function 定义
 */
@Data
public class FunctionInfo {

    private String id;

    private String object = "function";

    private String name;

    private String description;

    private Map<String, Object> parameters;

    @JsonProperty("created_at")
    private Long createdAt;
}
