package com.ke.hal;

import com.ke.hal.common.Tool;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 测试用的工具配置
 */
public final class ToolFixtures {

    private ToolFixtures() {
    }

    public static Tool.ToolFunction function(String name) {
        Map<String, Object> city = new LinkedHashMap<>();
        city.put("type", "string");
        Map<String, Object> properties = new LinkedHashMap<>();
        properties.put("city", city);
        Map<String, Object> parameters = new LinkedHashMap<>();
        parameters.put("type", "object");
        parameters.put("properties", properties);

        Tool.FunctionDefinition definition = new Tool.FunctionDefinition();
        definition.setName(name);
        definition.setDescription("Look up " + name);
        definition.setParameters(parameters);
        Tool.ToolFunction tool = new Tool.ToolFunction();
        tool.setFunction(definition);
        return tool;
    }

    public static Tool.ToolRetrieval retrieval(String... fileIds) {
        Tool.ToolRetrieval tool = new Tool.ToolRetrieval();
        tool.setFileIds(new ArrayList<>(List.of(fileIds)));
        return tool;
    }

    public static Tool.ToolCodeInterpreter codeInterpreter() {
        return new Tool.ToolCodeInterpreter();
    }

    /**
     * GET {serverUrl}/forecast/{city}，city 为必填 path 参数
     */
    public static Tool.ToolAction forecastAction(String serverUrl, boolean consequential) {
        Tool.ActionParameter city = new Tool.ActionParameter();
        city.setName("city");
        city.setIn("path");
        city.setRequired(true);

        Tool.ActionOperation operation = new Tool.ActionOperation();
        operation.setOperationId("get_forecast");
        operation.setMethod("GET");
        operation.setPath("/forecast/{city}");
        operation.setConsequential(consequential);
        operation.setParameters(new ArrayList<>(List.of(city)));

        Tool.ActionDefinition action = new Tool.ActionDefinition();
        action.setName("weather");
        action.setServerUrl(serverUrl);
        action.setOperations(new ArrayList<>(List.of(operation)));
        Tool.ToolAction tool = new Tool.ToolAction();
        tool.setAction(action);
        return tool;
    }
}
