package com.ke.hal.core.memory;

import com.ke.hal.core.ai.ChatEntry;
import com.ke.hal.core.ai.ModelRequest;
import com.ke.hal.core.ai.ToolInvocation;
import com.knuddels.jtokkit.Encodings;
import com.knuddels.jtokkit.api.Encoding;
import com.knuddels.jtokkit.api.EncodingType;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * 上下文截断器
 * 从最早的历史开始删除，instructions、最新的用户消息及其后的内容始终保留，工具调用与工具结果成对删除
 */
@Component
public class ContextTruncator {

    private static final Logger logger = LoggerFactory.getLogger(ContextTruncator.class);

    /**
     * 每条消息的格式开销
     */
    private static final int MESSAGE_OVERHEAD_TOKENS = 4;

    private final Encoding encoding = Encodings.newDefaultEncodingRegistry().getEncoding(EncodingType.CL100K_BASE);

    /**
     * 截断到 maxTokens 与当前 token 数一半中的较小值，保证重试时上下文一定变短
     *
     * @return 截断后的请求，无可删除内容时返回原请求
     */
    public ModelRequest truncate(ModelRequest request, int maxTokens) {
        List<List<ChatEntry>> groups = group(request.getHistory());
        int pinned = lastUserGroup(groups);

        int instructionTokens = countTokens(request.getInstructions());
        int total = instructionTokens;
        List<Integer> groupTokens = new ArrayList<>();
        for (List<ChatEntry> group : groups) {
            int tokens = group.stream().mapToInt(this::countTokens).sum();
            groupTokens.add(tokens);
            total += tokens;
        }
        int budget = Math.min(maxTokens, total / 2);

        // 最新用户消息及其后的工具往返都属于当前轮次，只删除其之前的分组
        int droppable = pinned >= 0 ? pinned : groups.size() - 1;
        Set<Integer> dropped = new HashSet<>();
        for (int i = 0; i < droppable && total > budget; i++) {
            dropped.add(i);
            total -= groupTokens.get(i);
        }

        if(dropped.isEmpty()) {
            logger.warn("Nothing left to truncate, history has {} entries", request.getHistory().size());
            return request;
        }

        List<ChatEntry> history = new ArrayList<>();
        for (int i = 0; i < groups.size(); i++) {
            if(!dropped.contains(i)) {
                history.addAll(groups.get(i));
            }
        }
        logger.info("Truncated context from {} to {} entries, about {} tokens left",
                request.getHistory().size(), history.size(), total);
        return request.toBuilder().history(history).build();
    }

    public int countTokens(ModelRequest request) {
        return countTokens(request.getInstructions())
                + request.getHistory().stream().mapToInt(this::countTokens).sum();
    }

    /**
     * assistant 的工具调用与其后对应的 tool 结果归为一组
     */
    private List<List<ChatEntry>> group(List<ChatEntry> history) {
        List<List<ChatEntry>> groups = new ArrayList<>();
        List<ChatEntry> current = null;
        Set<String> openCallIds = new HashSet<>();
        for (ChatEntry entry : history) {
            if(ChatEntry.TOOL.equals(entry.getRole()) && current != null && openCallIds.contains(entry.getToolCallId())) {
                current.add(entry);
                continue;
            }
            current = new ArrayList<>();
            current.add(entry);
            groups.add(current);
            openCallIds.clear();
            if(entry.hasToolCalls()) {
                entry.getToolCalls().forEach(call -> openCallIds.add(call.getId()));
            }
        }
        return groups;
    }

    private int lastUserGroup(List<List<ChatEntry>> groups) {
        for (int i = groups.size() - 1; i >= 0; i--) {
            if(ChatEntry.USER.equals(groups.get(i).get(0).getRole())) {
                return i;
            }
        }
        return -1;
    }

    private int countTokens(ChatEntry entry) {
        int tokens = MESSAGE_OVERHEAD_TOKENS + countTokens(entry.getContent());
        if(entry.hasToolCalls()) {
            for (ToolInvocation call : entry.getToolCalls()) {
                tokens += countTokens(call.getName()) + countTokens(call.getArguments());
            }
        }
        return tokens;
    }

    private int countTokens(String text) {
        return StringUtils.isEmpty(text) ? 0 : encoding.countTokens(text);
    }
}
