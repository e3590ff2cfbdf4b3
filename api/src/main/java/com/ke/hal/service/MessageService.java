package com.ke.hal.service;

import com.fasterxml.jackson.core.type.TypeReference;
import com.ke.hal.db.entity.MessageDb;
import com.ke.hal.db.repo.MessageRepo;
import com.ke.hal.exception.ResourceNotFoundException;
import com.ke.hal.message.MessageContent;
import com.ke.hal.message.MessageInfo;
import com.ke.hal.message.MessageOps;
import com.ke.hal.util.JacksonUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Message Service
 */
@Service
public class MessageService {

    private static final TypeReference<List<MessageContent>> CONTENT_TYPE = new TypeReference<>() {
    };

    @Autowired
    private MessageRepo messageRepo;

    /**
     * 追加消息，seq 分配与插入在同一事务内
     */
    @Transactional
    public MessageInfo createMessage(String userId, String threadId, MessageOps.CreateMessageOp op) {
        List<String> fileIds = op.getFileIds() == null ? new ArrayList<>() : op.getFileIds();
        List<MessageContent> content = new ArrayList<>();
        content.add(MessageContent.text(op.getContent()));
        fileIds.forEach(fileId -> content.add(MessageContent.file(fileId)));

        MessageDb message = new MessageDb();
        message.setThreadId(threadId);
        message.setUserId(userId);
        message.setRole(op.getRole());
        message.setContent(JacksonUtils.serialize(content));
        message.setFileIds(JacksonUtils.serialize(fileIds));
        message.setMetadata(JacksonUtils.serialize(op.getMetadata() == null ? new HashMap<>() : op.getMetadata()));
        messageRepo.insert(message);
        return convertToInfo(message);
    }

    /**
     * 基于游标的分页查询，按 seq 排序
     */
    public List<MessageInfo> getMessagesByCursor(String threadId, String after, String before, int limit, String order) {
        return messageRepo.findByThreadIdWithCursor(threadId, after, before, limit, order).stream()
                .map(this::convertToInfo)
                .collect(Collectors.toList());
    }

    public MessageInfo getMessage(String threadId, String messageId) {
        return convertToInfo(getMessageDb(threadId, messageId));
    }

    /**
     * 只更新 metadata，内容写入后不可修改
     */
    public MessageInfo updateMessage(String threadId, String messageId, MessageOps.UpdateMessageOp op) {
        MessageDb existing = getMessageDb(threadId, messageId);
        if(op.getMetadata() != null) {
            existing.setMetadata(JacksonUtils.serialize(op.getMetadata()));
            messageRepo.updateMetadata(threadId, messageId, existing.getMetadata());
        }
        return convertToInfo(existing);
    }

    public boolean deleteMessage(String threadId, String messageId) {
        getMessageDb(threadId, messageId);
        return messageRepo.deleteById(threadId, messageId);
    }

    @Transactional
    public int deleteMessagesByThreadId(String threadId) {
        return messageRepo.deleteByThreadId(threadId);
    }

    private MessageDb getMessageDb(String threadId, String messageId) {
        MessageDb message = messageRepo.findById(threadId, messageId);
        if(message == null) {
            throw new ResourceNotFoundException("message not found: " + messageId);
        }
        return message;
    }

    public List<MessageInfo> getRunMessages(String threadId, String runId) {
        return messageRepo.findByRunId(threadId, runId).stream()
                .map(this::convertToInfo)
                .collect(Collectors.toList());
    }

    public MessageInfo convertToInfo(MessageDb db) {
        MessageInfo info = new MessageInfo();
        info.setId(db.getId());
        info.setCreatedAt(db.getCreatedAt());
        info.setThreadId(db.getThreadId());
        info.setRole(db.getRole());
        List<MessageContent> content = JacksonUtils.deserialize(db.getContent(), CONTENT_TYPE);
        info.setContent(content == null ? Collections.emptyList() : content);
        info.setAssistantId(db.getAssistantId());
        info.setRunId(db.getRunId());
        List<String> fileIds = JacksonUtils.deserialize(db.getFileIds(), AssistantService.IDS_TYPE);
        info.setFileIds(fileIds == null ? new ArrayList<>() : fileIds);
        info.setMetadata(JacksonUtils.deserialize(db.getMetadata(), AssistantService.METADATA_TYPE));
        return info;
    }
}
