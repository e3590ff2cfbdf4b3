package com.ke.hal.core.tools;

import com.ke.hal.common.Tool;
import com.ke.hal.core.ai.ToolSpec;
import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * 暴露给模型的一个函数名与其来源工具的绑定
 */
@Data
@AllArgsConstructor
public class ToolBinding {
    private ToolSpec spec;
    private Tool tool;
    /**
     * function 工具为 null
     */
    private ToolHandler handler;
    private Tool.ActionOperation operation;

    public String getType() {
        return tool.getType();
    }

    public boolean isFunction() {
        return handler == null;
    }
}
