package com.ke.hal.configuration;

import org.springframework.boot.context.properties.ConfigurationProperties;

import lombok.Data;

@Data
@ConfigurationProperties("hal.assistant")
public class AssistantProperties {
    private String keyPrefix = "hal_assistant";
    /**
     * run 从创建到过期的分钟数
     */
    private Integer runTtlMinutes = 10;
    private EngineProperties engine = new EngineProperties();
    private QueueProperties queue = new QueueProperties();
    private ModelProperties model = new ModelProperties();
    private ToolProperties tools = new ToolProperties();
}
