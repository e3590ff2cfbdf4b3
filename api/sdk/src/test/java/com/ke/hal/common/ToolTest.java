package com.ke.hal.common;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ToolTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    @DisplayName("按 type 反序列化为对应的工具")
    void shouldDeserializeByType() throws Exception {
        String json = "[{\"type\":\"function\",\"function\":{\"name\":\"get_weather\"}},"
                + "{\"type\":\"retrieval\",\"file_ids\":[\"file_1\"]},"
                + "{\"type\":\"code_interpreter\"},"
                + "{\"type\":\"action\",\"action\":{\"server_url\":\"http://weather.local\","
                + "\"operations\":[{\"operation_id\":\"get_forecast\",\"method\":\"GET\",\"path\":\"/forecast\","
                + "\"is_consequential\":true,\"parameters\":[{\"name\":\"city\",\"in\":\"query\",\"required\":true}]}]}}]";

        List<Tool> tools = objectMapper.readValue(json, objectMapper.getTypeFactory().constructCollectionType(List.class, Tool.class));

        assertEquals(4, tools.size());
        assertEquals("get_weather", assertInstanceOf(Tool.ToolFunction.class, tools.get(0)).getFunction().getName());
        assertEquals(List.of("file_1"), assertInstanceOf(Tool.ToolRetrieval.class, tools.get(1)).getFileIds());
        assertInstanceOf(Tool.ToolCodeInterpreter.class, tools.get(2));
        Tool.ActionOperation operation = assertInstanceOf(Tool.ToolAction.class, tools.get(3)).getAction().getOperations().get(0);
        assertEquals("get_forecast", operation.getOperationId());
        assertTrue(operation.isConsequential());
        assertTrue(operation.getParameters().get(0).isRequired());
        assertEquals("application/json", operation.getContentType());
    }

    @Test
    @DisplayName("序列化时 type 只输出一次")
    void shouldWriteTypeOnce() throws Exception {
        Tool.ToolFunction function = new Tool.ToolFunction();
        Tool.FunctionDefinition definition = new Tool.FunctionDefinition();
        definition.setName("get_weather");
        function.setFunction(definition);

        String json = objectMapper.writeValueAsString(function);
        JsonNode node = objectMapper.readTree(json);

        assertEquals("function", node.get("type").asText());
        assertEquals(json.indexOf("\"type\""), json.lastIndexOf("\"type\""));
        assertEquals("get_weather", node.get("function").get("name").asText());
        assertFalse(node.has("action"));
    }

    @Test
    @DisplayName("operation 的 parameters 为 null 时视为空列表")
    void shouldTreatNullParametersAsEmpty() throws Exception {
        String json = "{\"type\":\"action\",\"action\":{\"server_url\":\"http://status.local\","
                + "\"operations\":[{\"operation_id\":\"get_status\",\"method\":\"GET\",\"path\":\"/status\","
                + "\"parameters\":null}]}}";

        Tool.ToolAction tool = assertInstanceOf(Tool.ToolAction.class, objectMapper.readValue(json, Tool.class));

        assertTrue(tool.getAction().getOperations().get(0).getParameters().isEmpty());
    }
}
