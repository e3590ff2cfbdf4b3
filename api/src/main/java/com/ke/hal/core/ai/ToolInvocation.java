package com.ke.hal.core.ai;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 模型请求的一次工具调用，arguments 为模型给出的原始 JSON 字符串
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ToolInvocation {
    private String id;
    private String name;
    private String arguments;
}
