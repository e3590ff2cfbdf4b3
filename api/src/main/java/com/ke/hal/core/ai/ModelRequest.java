package com.ke.hal.core.ai;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ModelRequest {
    private String model;
    /**
     * 作为 system 消息发送，截断时始终保留
     */
    private String instructions;
    @Builder.Default
    private List<ChatEntry> history = new ArrayList<>();
    @Builder.Default
    private List<ToolSpec> tools = new ArrayList<>();
}
