package com.ke.hal.service;

import com.ke.hal.db.entity.ThreadDb;
import com.ke.hal.db.repo.ThreadRepo;
import com.ke.hal.exception.ResourceNotFoundException;
import com.ke.hal.message.MessageOps;
import com.ke.hal.thread.ThreadInfo;
import com.ke.hal.thread.ThreadOps;
import com.ke.hal.util.JacksonUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Thread Service
 */
@Service
@Slf4j
public class ThreadService {

    @Autowired
    private ThreadRepo threadRepo;

    @Autowired
    private MessageService messageService;

    @Autowired
    private RunService runService;

    /**
     * 创建 Thread，初始消息按给定顺序追加
     */
    @Transactional
    public ThreadInfo createThread(String userId, ThreadOps.CreateThreadOp op) {
        ThreadDb thread = new ThreadDb();
        thread.setUserId(userId);
        thread.setFileIds(JacksonUtils.serialize(op.getFileIds() == null ? new ArrayList<>() : op.getFileIds()));
        thread.setMetadata(JacksonUtils.serialize(op.getMetadata() == null ? new HashMap<>() : op.getMetadata()));
        threadRepo.insert(thread);

        if(op.getMessages() != null) {
            for (MessageOps.CreateMessageOp message : op.getMessages()) {
                messageService.createMessage(userId, thread.getId(), message);
            }
        }
        log.info("Thread {} created by {}", thread.getId(), userId);
        return convertToInfo(thread);
    }

    /**
     * 获取调用方拥有的 Thread，不存在或不属于调用方时返回 404
     */
    public ThreadDb getOwnedThread(String userId, String threadId) {
        ThreadDb thread = threadRepo.findById(threadId);
        if(thread == null || !thread.getUserId().equals(userId)) {
            throw new ResourceNotFoundException("thread not found: " + threadId);
        }
        return thread;
    }

    public ThreadInfo getThread(String userId, String threadId) {
        return convertToInfo(getOwnedThread(userId, threadId));
    }

    /**
     * 基于游标的分页查询用户的 Thread
     */
    public List<ThreadInfo> getThreadsByCursor(String userId, String after, String before, int limit, String order) {
        return threadRepo.findByUserIdWithCursor(userId, after, before, limit, order).stream()
                .map(this::convertToInfo)
                .collect(Collectors.toList());
    }

    /**
     * 更新 Thread，null 字段保持不变
     */
    public ThreadInfo updateThread(String userId, String threadId, ThreadOps.UpdateThreadOp op) {
        ThreadDb existing = getOwnedThread(userId, threadId);
        if(op.getFileIds() != null) {
            existing.setFileIds(JacksonUtils.serialize(op.getFileIds()));
        }
        if(op.getMetadata() != null) {
            existing.setMetadata(JacksonUtils.serialize(op.getMetadata()));
        }
        threadRepo.update(existing);
        return convertToInfo(existing);
    }

    /**
     * 删除 Thread 及其消息与 run，线程上仍有未结束的 run 时拒绝
     */
    @Transactional
    public boolean deleteThread(String userId, String threadId) {
        getOwnedThread(userId, threadId);
        runService.deleteRunsOfThread(threadId);
        messageService.deleteMessagesByThreadId(threadId);
        boolean deleted = threadRepo.deleteById(threadId);
        log.info("Thread {} deleted by {}", threadId, userId);
        return deleted;
    }

    public ThreadInfo convertToInfo(ThreadDb db) {
        ThreadInfo info = new ThreadInfo();
        info.setId(db.getId());
        info.setCreatedAt(db.getCreatedAt());
        List<String> fileIds = JacksonUtils.deserialize(db.getFileIds(), AssistantService.IDS_TYPE);
        info.setFileIds(fileIds == null ? new ArrayList<>() : fileIds);
        info.setMetadata(JacksonUtils.deserialize(db.getMetadata(), AssistantService.METADATA_TYPE));
        return info;
    }
}
