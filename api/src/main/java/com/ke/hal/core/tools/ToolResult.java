package com.ke.hal.core.tools;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * 工具执行结果，output 原样写入 tool call 并作为 tool 消息发给模型
 */
@Data
@AllArgsConstructor
public class ToolResult {
    private final String output;
    private final boolean error;

    public static ToolResult success(String output) {
        return new ToolResult(output, false);
    }

    public static ToolResult error(String output) {
        return new ToolResult(output, true);
    }
}
