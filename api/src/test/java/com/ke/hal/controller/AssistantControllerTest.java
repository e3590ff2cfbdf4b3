package com.ke.hal.controller;

import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MvcResult;

import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * AssistantController 测试
 * 重点：工具配置校验、owner 隔离、游标分页
 */
class AssistantControllerTest extends BaseControllerTest {

    @Test
    @DisplayName("创建基础Assistant")
    void shouldCreateBasicAssistant() throws Exception {
        mockMvc.perform(addAuthHeader(post("/v1/assistants")
                .contentType(MediaType.APPLICATION_JSON)
                .content(loadTestData("assistant-create-basic.json"))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").exists())
                .andExpect(jsonPath("$.object").value("assistant"))
                .andExpect(jsonPath("$.name").value("Basic Test Assistant"))
                .andExpect(jsonPath("$.model").value("gpt-4o"))
                .andExpect(jsonPath("$.metadata.team").value("search"))
                .andExpect(jsonPath("$.created_at").isNumber());
    }

    @Test
    @DisplayName("创建带四类工具的Assistant - 验证工具按 type 保存")
    void shouldCreateAssistantWithTools() throws Exception {
        String assistantId = postForId("/v1/assistants", loadTestData("assistant-create-with-tools.json"));

        mockMvc.perform(addAuthHeader(get("/v1/assistants/" + assistantId)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.tools.length()").value(4))
                .andExpect(jsonPath("$.tools[0].type").value("function"))
                .andExpect(jsonPath("$.tools[0].function.name").value("get_weather"))
                .andExpect(jsonPath("$.tools[1].type").value("retrieval"))
                .andExpect(jsonPath("$.tools[1].file_ids[0]").value("file_manual"))
                .andExpect(jsonPath("$.tools[2].type").value("code_interpreter"))
                .andExpect(jsonPath("$.tools[3].type").value("action"))
                .andExpect(jsonPath("$.tools[3].action.operations[0].operation_id").value("get_forecast"));
    }

    @Test
    @DisplayName("非法函数名返回 400")
    void shouldRejectInvalidToolName() throws Exception {
        mockMvc.perform(addAuthHeader(post("/v1/assistants")
                .contentType(MediaType.APPLICATION_JSON)
                .content(loadTestData("assistant-create-invalid-tool.json"))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.type").value("invalid_request_error"))
                .andExpect(jsonPath("$.error.code").value("invalid_request_error"));
    }

    @Test
    @DisplayName("缺少 model 返回 400")
    void shouldRejectMissingModel() throws Exception {
        mockMvc.perform(addAuthHeader(post("/v1/assistants")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"name\":\"no model\"}")))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("invalid_request_error"));
    }

    @Test
    @DisplayName("其他 owner 的 Assistant 不可见")
    void shouldHideOtherOwnersAssistant() throws Exception {
        String assistantId = postForId("/v1/assistants", loadTestData("assistant-create-basic.json"));

        mockMvc.perform(asUser("someone_else", get("/v1/assistants/" + assistantId)))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error.type").value("not_found_error"));
    }

    @Test
    @DisplayName("更新只修改传入的字段")
    void shouldUpdateGivenFieldsOnly() throws Exception {
        String assistantId = postForId("/v1/assistants", loadTestData("assistant-create-basic.json"));

        mockMvc.perform(addAuthHeader(post("/v1/assistants/" + assistantId)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"name\":\"Renamed\"}")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.name").value("Renamed"))
                .andExpect(jsonPath("$.model").value("gpt-4o"))
                .andExpect(jsonPath("$.instructions").value("You are a helpful assistant."));
    }

    @Test
    @DisplayName("删除Assistant后不可访问，其他 owner 不能删除")
    void shouldDeleteAssistant() throws Exception {
        String assistantId = postForId("/v1/assistants", loadTestData("assistant-create-basic.json"));

        mockMvc.perform(asUser("someone_else", delete("/v1/assistants/" + assistantId)))
                .andExpect(status().isNotFound());
        mockMvc.perform(addAuthHeader(delete("/v1/assistants/" + assistantId)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value(assistantId))
                .andExpect(jsonPath("$.object").value("assistant.deleted"))
                .andExpect(jsonPath("$.deleted").value(true));
        mockMvc.perform(addAuthHeader(get("/v1/assistants/" + assistantId)))
                .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("游标分页 - 不丢失不重复")
    void shouldPageWithCursor() throws Exception {
        Set<String> created = new HashSet<>();
        for (int i = 0; i < 3; i++) {
            created.add(postForId("/v1/assistants", loadTestData("assistant-create-basic.json")));
        }

        MvcResult first = mockMvc.perform(addAuthHeader(get("/v1/assistants").param("limit", "2").param("order", "asc")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.object").value("list"))
                .andExpect(jsonPath("$.data.length()").value(2))
                .andExpect(jsonPath("$.has_more").value(true))
                .andReturn();
        JsonNode firstPage = objectMapper.readTree(first.getResponse().getContentAsString());

        MvcResult second = mockMvc.perform(addAuthHeader(get("/v1/assistants")
                        .param("limit", "2")
                        .param("order", "asc")
                        .param("after", firstPage.get("last_id").asText())))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.length()").value(1))
                .andExpect(jsonPath("$.has_more").value(false))
                .andReturn();
        JsonNode secondPage = objectMapper.readTree(second.getResponse().getContentAsString());

        Set<String> listed = new HashSet<>();
        firstPage.get("data").forEach(node -> listed.add(node.get("id").asText()));
        secondPage.get("data").forEach(node -> listed.add(node.get("id").asText()));
        assertEquals(created, listed);
        assertFalse(listed.contains(null));
        assertTrue(firstPage.get("first_id").isTextual());
    }

    @Test
    @DisplayName("limit 超出范围返回 400")
    void shouldRejectInvalidLimit() throws Exception {
        mockMvc.perform(addAuthHeader(get("/v1/assistants").param("limit", "101")))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("invalid_request_error"));
        mockMvc.perform(addAuthHeader(get("/v1/assistants").param("order", "sideways")))
                .andExpect(status().isBadRequest());
    }
}
