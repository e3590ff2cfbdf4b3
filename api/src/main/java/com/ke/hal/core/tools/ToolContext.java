package com.ke.hal.core.tools;

import com.ke.hal.common.Tool;
import com.ke.hal.core.run.ExecutionContext;
import com.ke.hal.db.entity.ToolCallDb;
import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * 工具执行上下文
 */
@Data
@AllArgsConstructor
public class ToolContext {
    private ExecutionContext execution;
    private ToolCallDb toolCall;
    private Tool tool;
    /**
     * action 工具对应的 operation，其他工具为 null
     */
    private Tool.ActionOperation operation;
}
