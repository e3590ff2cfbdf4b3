package com.ke.hal.core.tools;

import com.ke.hal.common.Tool;
import com.ke.hal.core.ai.ToolSpec;

import java.util.List;
import java.util.Map;

/**
 * 工具处理器接口
 * 定义服务端自动执行工具的统一接口，function 工具由调用方执行不经过处理器
 */
public interface ToolHandler {

    /**
     * 执行工具调用
     *
     * @param context 工具执行上下文，包含工具配置与当前 run
     * @param arguments 模型给出的参数
     * @return 工具执行结果，失败以 error 结果返回给模型
     */
    ToolResult execute(ToolContext context, Map<String, Object> arguments);

    /**
     * 处理的工具类型，对应 Tool.type
     */
    String getToolType();

    /**
     * 该工具配置暴露给模型的函数
     */
    List<ToolSpec> getToolSpecs(Tool tool);

    /**
     * 处理中断后未完成的调用是否可以重新执行，不可重新执行的调用以中断结果反馈给模型
     */
    default boolean isReplayable(ToolContext context) {
        return true;
    }
}
