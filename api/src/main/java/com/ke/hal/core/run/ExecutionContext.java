package com.ke.hal.core.run;

import com.fasterxml.jackson.core.type.TypeReference;
import com.ke.hal.common.Tool;
import com.ke.hal.core.ai.ChatEntry;
import com.ke.hal.core.ai.ToolInvocation;
import com.ke.hal.db.entity.MessageDb;
import com.ke.hal.db.entity.RunDb;
import com.ke.hal.db.entity.ThreadDb;
import com.ke.hal.db.entity.ToolCallDb;
import com.ke.hal.exception.DeadlineExceededException;
import com.ke.hal.exception.LeaseLostException;
import com.ke.hal.message.MessageContent;
import com.ke.hal.util.DateTimeUtils;
import com.ke.hal.util.JacksonUtils;
import lombok.Data;
import org.apache.commons.collections4.CollectionUtils;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * 一次处理过程的上下文，全部由持久化状态构建，不在两次处理之间保留
 */
@Data
public class ExecutionContext {

    private static final TypeReference<List<MessageContent>> CONTENT_TYPE = new TypeReference<>() {
    };
    private static final TypeReference<List<String>> IDS_TYPE = new TypeReference<>() {
    };

    private RunDb run;
    private RunSnapshot snapshot;
    private ThreadDb thread;
    /**
     * 线程内消息，按 seq 升序
     */
    private List<MessageDb> messages = new ArrayList<>();
    /**
     * 本 run 的工具调用，按 (round, seq) 升序
     */
    private List<ToolCallDb> toolCalls = new ArrayList<>();
    private LeaseGuard lease = LeaseGuard.ALWAYS;

    public String getRunId() {
        return run.getId();
    }

    public String getThreadId() {
        return run.getThreadId();
    }

    public String getUserId() {
        return run.getUserId();
    }

    /**
     * 检查 lease 仍被持有且 run 未过期，在每次外部调用前执行
     */
    public void ensureActive() {
        if(!lease.isHeld()) {
            throw new LeaseLostException(getRunId());
        }
        if(run.getExpiresAt() != null && DateTimeUtils.getCurrentSeconds() >= run.getExpiresAt()) {
            throw new DeadlineExceededException(getRunId());
        }
    }

    /**
     * 已产生工具调用的最大模型轮次，没有时为 0
     */
    public int currentRound() {
        return toolCalls.stream().mapToInt(ToolCallDb::getRound).max().orElse(0);
    }

    public List<ToolCallDb> pendingAutoCalls() {
        return toolCalls.stream()
                .filter(ToolCallDb::isPending)
                .filter(call -> !Tool.FUNCTION.equals(call.getType()))
                .collect(Collectors.toList());
    }

    public List<ToolCallDb> pendingFunctionCalls() {
        return toolCalls.stream()
                .filter(ToolCallDb::isPending)
                .filter(call -> Tool.FUNCTION.equals(call.getType()))
                .collect(Collectors.toList());
    }

    /**
     * 末尾连续失败的代码执行次数
     */
    public int consecutiveSandboxFailures() {
        int failures = 0;
        for (int i = toolCalls.size() - 1; i >= 0; i--) {
            ToolCallDb call = toolCalls.get(i);
            if(!Tool.CODE_INTERPRETER.equals(call.getType()) || call.isPending()) {
                continue;
            }
            if(!Boolean.TRUE.equals(call.getIsError())) {
                break;
            }
            failures++;
        }
        return failures;
    }

    public String latestUserMessageText() {
        for (int i = messages.size() - 1; i >= 0; i--) {
            if(ChatEntry.USER.equals(messages.get(i).getRole())) {
                return textOf(messages.get(i));
            }
        }
        return null;
    }

    /**
     * 线程及其消息附带的文件
     */
    public List<String> threadFileIds() {
        Set<String> ids = new LinkedHashSet<>(parseIds(thread == null ? null : thread.getFileIds()));
        for (MessageDb message : messages) {
            ids.addAll(parseIds(message.getFileIds()));
        }
        return new ArrayList<>(ids);
    }

    /**
     * 线程历史 + 本 run 已完成的工具调用，按轮次展开为 assistant tool_calls / tool 结果对
     */
    public List<ChatEntry> buildHistory() {
        List<ChatEntry> history = new ArrayList<>();
        for (MessageDb message : messages) {
            String text = textOf(message);
            if(StringUtils.isBlank(text)) {
                continue;
            }
            history.add(ChatEntry.USER.equals(message.getRole()) ? ChatEntry.user(text) : ChatEntry.assistant(text));
        }

        Map<Integer, List<ToolCallDb>> rounds = new TreeMap<>();
        for (ToolCallDb call : toolCalls) {
            rounds.computeIfAbsent(call.getRound(), k -> new ArrayList<>()).add(call);
        }
        for (List<ToolCallDb> calls : rounds.values()) {
            List<ToolCallDb> resolved = calls.stream().filter(call -> !call.isPending()).collect(Collectors.toList());
            if(resolved.isEmpty()) {
                continue;
            }
            history.add(ChatEntry.assistantToolCalls(resolved.stream()
                    .map(call -> new ToolInvocation(call.getId(), call.getName(), call.getArguments()))
                    .collect(Collectors.toList())));
            for (ToolCallDb call : resolved) {
                history.add(ChatEntry.tool(call.getId(), call.getOutput()));
            }
        }
        return history;
    }

    public static String textOf(MessageDb message) {
        List<MessageContent> contents = JacksonUtils.deserialize(message.getContent(), CONTENT_TYPE);
        if(CollectionUtils.isEmpty(contents)) {
            return "";
        }
        return contents.stream()
                .filter(content -> MessageContent.TEXT.equals(content.getType()) && content.getText() != null)
                .map(content -> content.getText().getValue())
                .collect(Collectors.joining("\n"));
    }

    public static List<String> parseIds(String json) {
        List<String> ids = JacksonUtils.deserialize(json, IDS_TYPE);
        return ids == null ? new ArrayList<>() : ids;
    }
}
