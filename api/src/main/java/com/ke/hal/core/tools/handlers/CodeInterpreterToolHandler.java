package com.ke.hal.core.tools.handlers;

import com.ke.hal.collaborator.sandbox.Sandbox;
import com.ke.hal.collaborator.sandbox.SandboxResult;
import com.ke.hal.common.Tool;
import com.ke.hal.configuration.AssistantProperties;
import com.ke.hal.core.ai.ToolSpec;
import com.ke.hal.core.tools.ToolContext;
import com.ke.hal.core.tools.ToolHandler;
import com.ke.hal.core.tools.ToolResult;
import com.ke.hal.exception.SandboxException;
import com.ke.hal.util.JacksonUtils;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 代码执行工具处理器
 * 执行失败作为错误结果反馈给模型修正，连续失败次数由引擎统计
 */
@Component
public class CodeInterpreterToolHandler implements ToolHandler {

    private static final Logger logger = LoggerFactory.getLogger(CodeInterpreterToolHandler.class);

    public static final String NAME = "code_interpreter";

    @Autowired
    private Sandbox sandbox;

    @Autowired
    private AssistantProperties assistantProperties;

    @Override
    public ToolResult execute(ToolContext context, Map<String, Object> arguments) {
        Object code = arguments.get("code");
        if(!(code instanceof String) || StringUtils.isBlank((String) code)) {
            return ToolResult.error("missing required argument: code");
        }
        Duration timeout = Duration.ofSeconds(assistantProperties.getTools().getCodeInterpreter().getTimeoutSeconds());
        try {
            SandboxResult result = sandbox.run((String) code, timeout);
            String output = JacksonUtils.serialize(result);
            return result.isSuccess() ? ToolResult.success(output) : ToolResult.error(output);
        } catch (SandboxException e) {
            logger.warn("Run {} sandbox unavailable: {}", context.getExecution().getRunId(), e.getMessage());
            return ToolResult.error(JacksonUtils.serialize(Collections.singletonMap("error", "sandbox error: " + e.getMessage())));
        }
    }

    @Override
    public String getToolType() {
        return Tool.CODE_INTERPRETER;
    }

    @Override
    public List<ToolSpec> getToolSpecs(Tool tool) {
        Map<String, Object> code = new LinkedHashMap<>();
        code.put("type", "string");
        code.put("description", "要执行的 Python 代码");

        Map<String, Object> properties = new LinkedHashMap<>();
        properties.put("code", code);

        Map<String, Object> parameters = new LinkedHashMap<>();
        parameters.put("type", "object");
        parameters.put("properties", properties);
        parameters.put("required", Collections.singletonList("code"));
        return Collections.singletonList(new ToolSpec(NAME,
                "Run Python code in an isolated sandbox and return exit_code, stdout and stderr. Print every value you need.",
                parameters));
    }
}
