package com.ke.hal.core.ai;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.apache.commons.collections4.CollectionUtils;

import java.util.ArrayList;
import java.util.List;

/**
 * 发送给模型的一条历史记录
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ChatEntry {

    public static final String USER = "user";
    public static final String ASSISTANT = "assistant";
    public static final String TOOL = "tool";

    private String role;
    private String content;
    /**
     * assistant 发起的工具调用
     */
    private List<ToolInvocation> toolCalls = new ArrayList<>();
    /**
     * tool 消息对应的调用 id
     */
    private String toolCallId;

    public static ChatEntry user(String content) {
        return new ChatEntry(USER, content, new ArrayList<>(), null);
    }

    public static ChatEntry assistant(String content) {
        return new ChatEntry(ASSISTANT, content, new ArrayList<>(), null);
    }

    public static ChatEntry assistantToolCalls(List<ToolInvocation> toolCalls) {
        return new ChatEntry(ASSISTANT, null, new ArrayList<>(toolCalls), null);
    }

    public static ChatEntry tool(String toolCallId, String content) {
        return new ChatEntry(TOOL, content, new ArrayList<>(), toolCallId);
    }

    public boolean hasToolCalls() {
        return CollectionUtils.isNotEmpty(toolCalls);
    }
}
