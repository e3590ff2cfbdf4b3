package com.ke.hal.core.memory;

import com.ke.hal.core.ai.ChatEntry;
import com.ke.hal.core.ai.ModelRequest;
import com.ke.hal.core.ai.ToolInvocation;
import org.apache.commons.lang3.StringUtils;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ContextTruncatorTest {

    private final ContextTruncator truncator = new ContextTruncator();

    @Test
    @DisplayName("从最早的历史开始删除，保留最新的用户消息")
    void dropsOldestFirst() {
        List<ChatEntry> history = new ArrayList<>();
        history.add(ChatEntry.user(StringUtils.repeat("ancient history ", 300)));
        history.add(ChatEntry.assistant("noted"));
        history.add(ChatEntry.assistantToolCalls(List.of(new ToolInvocation("call_1", "get_weather", "{\"city\":\"Paris\"}"))));
        history.add(ChatEntry.tool("call_1", "{\"temp\":20}"));
        history.add(ChatEntry.user("What should I wear?"));
        ModelRequest request = ModelRequest.builder().model("gpt-4o").instructions("Be brief.").history(history).build();

        ModelRequest truncated = truncator.truncate(request, 100000);

        assertEquals(4, truncated.getHistory().size());
        assertEquals("noted", truncated.getHistory().get(0).getContent());
        assertEquals("What should I wear?", truncated.getHistory().get(3).getContent());
        assertEquals("Be brief.", truncated.getInstructions());
        assertTrue(truncator.countTokens(truncated) < truncator.countTokens(request));
    }

    @Test
    @DisplayName("工具调用与结果成对删除")
    void dropsToolCallWithItsResult() {
        List<ChatEntry> history = new ArrayList<>();
        history.add(ChatEntry.assistantToolCalls(List.of(
                new ToolInvocation("call_1", "search", "{}"),
                new ToolInvocation("call_2", "search", "{}"))));
        history.add(ChatEntry.tool("call_1", StringUtils.repeat("result one ", 100)));
        history.add(ChatEntry.tool("call_2", StringUtils.repeat("result two ", 100)));
        history.add(ChatEntry.user("Summarize"));
        ModelRequest request = ModelRequest.builder().model("gpt-4o").history(history).build();

        ModelRequest truncated = truncator.truncate(request, 10);

        assertEquals(1, truncated.getHistory().size());
        assertEquals(ChatEntry.USER, truncated.getHistory().get(0).getRole());
    }

    @Test
    void returnsOriginalWhenNothingCanBeDropped() {
        List<ChatEntry> history = new ArrayList<>();
        history.add(ChatEntry.user(StringUtils.repeat("only question ", 50)));
        ModelRequest request = ModelRequest.builder().model("gpt-4o").history(history).build();

        assertSame(request, truncator.truncate(request, 5));
    }

    @Test
    @DisplayName("最新用户消息之后的工具往返不被删除")
    void keepsToolRoundsAfterLatestUserMessage() {
        List<ChatEntry> history = new ArrayList<>();
        history.add(ChatEntry.user(StringUtils.repeat("earlier question ", 100)));
        history.add(ChatEntry.assistant("earlier answer"));
        history.add(ChatEntry.user("Weather in Paris?"));
        history.add(ChatEntry.assistantToolCalls(List.of(new ToolInvocation("call_1", "get_weather", "{\"city\":\"Paris\"}"))));
        history.add(ChatEntry.tool("call_1", StringUtils.repeat("sunny and warm ", 200)));
        ModelRequest request = ModelRequest.builder().model("gpt-4o").history(history).build();

        ModelRequest truncated = truncator.truncate(request, 10);

        assertEquals(3, truncated.getHistory().size());
        assertEquals("Weather in Paris?", truncated.getHistory().get(0).getContent());
        assertEquals("call_1", truncated.getHistory().get(1).getToolCalls().get(0).getId());
        assertEquals("call_1", truncated.getHistory().get(2).getToolCallId());
    }
}
