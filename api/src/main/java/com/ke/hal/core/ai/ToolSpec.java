package com.ke.hal.core.ai;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * 暴露给模型的函数定义
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ToolSpec {
    private String name;
    private String description;
    private Map<String, Object> parameters;
}
