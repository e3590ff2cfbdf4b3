package com.ke.hal.core.tools.handlers;

import com.ke.hal.collaborator.action.ActionCaller;
import com.ke.hal.collaborator.action.ActionRequest;
import com.ke.hal.collaborator.action.ActionResponse;
import com.ke.hal.common.Tool;
import com.ke.hal.configuration.AssistantProperties;
import com.ke.hal.configuration.ToolProperties;
import com.ke.hal.core.ai.ToolSpec;
import com.ke.hal.core.tools.ToolContext;
import com.ke.hal.core.tools.ToolHandler;
import com.ke.hal.core.tools.ToolResult;
import com.ke.hal.exception.TransientCollaboratorException;
import com.ke.hal.util.JacksonUtils;
import lombok.AllArgsConstructor;
import lombok.Data;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * HTTP Action 工具处理器
 * 每个 operation 以 operation_id 暴露为一个函数，任何响应状态都作为结果返回给模型
 */
@Component
public class ActionToolHandler implements ToolHandler {

    private static final Logger logger = LoggerFactory.getLogger(ActionToolHandler.class);

    @Autowired
    private ActionCaller actionCaller;

    @Autowired
    private AssistantProperties assistantProperties;

    @Override
    public ToolResult execute(ToolContext context, Map<String, Object> arguments) {
        Tool.ActionDefinition action = ((Tool.ToolAction) context.getTool()).getAction();
        Tool.ActionOperation operation = context.getOperation();
        ToolProperties.ActionToolProperties properties = assistantProperties.getTools().getAction();

        List<String> missing = operation.getParameters().stream()
                .filter(Tool.ActionParameter::isRequired)
                .map(Tool.ActionParameter::getName)
                .filter(name -> arguments.get(name) == null)
                .collect(Collectors.toList());
        if(!missing.isEmpty()) {
            return ToolResult.error("missing required parameters: " + String.join(", ", missing));
        }

        String path = operation.getPath();
        Map<String, String> query = new LinkedHashMap<>();
        Map<String, String> headers = new LinkedHashMap<>();
        if(action.getHeaders() != null) {
            headers.putAll(action.getHeaders());
        }
        Map<String, Object> body = new LinkedHashMap<>();
        for (Tool.ActionParameter parameter : operation.getParameters()) {
            Object value = arguments.get(parameter.getName());
            if(value == null) {
                continue;
            }
            switch (parameter.getIn()) {
                case "path":
                    path = path.replace("{" + parameter.getName() + "}", encode(stringify(value)));
                    break;
                case "header":
                    headers.put(parameter.getName(), stringify(value));
                    break;
                case "body":
                    body.put(parameter.getName(), value);
                    break;
                default:
                    query.put(parameter.getName(), stringify(value));
            }
        }

        ActionRequest request = ActionRequest.builder()
                .method(operation.getMethod())
                .url(StringUtils.removeEnd(action.getServerUrl(), "/") + (path.startsWith("/") ? path : "/" + path))
                .query(query)
                .headers(headers)
                .contentType(operation.getContentType())
                .body(body.isEmpty() ? null : JacksonUtils.serialize(body))
                .build();

        ActionResponse response;
        try {
            response = actionCaller.invoke(request, Duration.ofSeconds(properties.getTimeoutSeconds()));
        } catch (TransientCollaboratorException e) {
            logger.warn("Run {} action {} request failed: {}", context.getExecution().getRunId(),
                    operation.getOperationId(), e.getMessage());
            return ToolResult.error(JacksonUtils.serialize(Collections.singletonMap("error", "request failed: " + e.getMessage())));
        }
        String output = JacksonUtils.serialize(new ActionOutput(response.getStatus(),
                StringUtils.abbreviate(StringUtils.defaultString(response.getBody()), properties.getMaxResponseChars())));
        return response.isSuccessful() ? ToolResult.success(output) : ToolResult.error(output);
    }

    /**
     * 有副作用的 operation 中断后不重放
     */
    @Override
    public boolean isReplayable(ToolContext context) {
        return context.getOperation() == null || !context.getOperation().isConsequential();
    }

    @Override
    public String getToolType() {
        return Tool.ACTION;
    }

    @Override
    public List<ToolSpec> getToolSpecs(Tool tool) {
        Tool.ActionDefinition action = ((Tool.ToolAction) tool).getAction();
        List<ToolSpec> specs = new ArrayList<>();
        for (Tool.ActionOperation operation : action.getOperations()) {
            Map<String, Object> properties = new LinkedHashMap<>();
            List<String> required = new ArrayList<>();
            for (Tool.ActionParameter parameter : operation.getParameters()) {
                Map<String, Object> schema = parameter.getSchema() == null
                        ? new LinkedHashMap<>(Collections.singletonMap("type", "string"))
                        : new LinkedHashMap<>(parameter.getSchema());
                if(StringUtils.isNotBlank(parameter.getDescription())) {
                    schema.putIfAbsent("description", parameter.getDescription());
                }
                properties.put(parameter.getName(), schema);
                if(parameter.isRequired()) {
                    required.add(parameter.getName());
                }
            }
            Map<String, Object> parameters = new LinkedHashMap<>();
            parameters.put("type", "object");
            parameters.put("properties", properties);
            if(!required.isEmpty()) {
                parameters.put("required", required);
            }
            String description = StringUtils.defaultIfBlank(operation.getDescription(),
                    operation.getMethod().toUpperCase() + " " + operation.getPath());
            specs.add(new ToolSpec(operation.getOperationId(), description, parameters));
        }
        return specs;
    }

    private static String stringify(Object value) {
        return value instanceof String ? (String) value : JacksonUtils.serialize(value);
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
    }

    @Data
    @AllArgsConstructor
    public static class ActionOutput {
        private int status;
        private String body;
    }
}
