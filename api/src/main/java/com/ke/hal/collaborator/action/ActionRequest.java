package com.ke.hal.collaborator.action;

import lombok.Builder;
import lombok.Data;

import java.util.LinkedHashMap;
import java.util.Map;

@Data
@Builder
public class ActionRequest {
    private String method;
    /**
     * 已替换 path 参数的完整地址，不含 query
     */
    private String url;
    @Builder.Default
    private Map<String, String> query = new LinkedHashMap<>();
    @Builder.Default
    private Map<String, String> headers = new LinkedHashMap<>();
    private String contentType;
    private String body;
}
