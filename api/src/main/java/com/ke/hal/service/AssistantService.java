package com.ke.hal.service;

import com.fasterxml.jackson.core.type.TypeReference;
import com.ke.hal.assistant.AssistantInfo;
import com.ke.hal.assistant.AssistantOps;
import com.ke.hal.common.Tool;
import com.ke.hal.db.entity.AssistantDb;
import com.ke.hal.db.repo.AssistantRepo;
import com.ke.hal.exception.ResourceNotFoundException;
import com.ke.hal.util.JacksonUtils;
import com.ke.hal.util.ToolUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Assistant Service
 */
@Service
@Slf4j
public class AssistantService {

    static final TypeReference<List<Tool>> TOOLS_TYPE = new TypeReference<>() {
    };
    static final TypeReference<List<String>> IDS_TYPE = new TypeReference<>() {
    };
    static final TypeReference<Map<String, Object>> METADATA_TYPE = new TypeReference<>() {
    };

    @Autowired
    private AssistantRepo assistantRepo;

    /**
     * 创建 Assistant
     */
    public AssistantInfo createAssistant(String userId, AssistantOps.CreateAssistantOp op) {
        ToolUtils.checkTools(op.getTools());

        AssistantDb assistant = new AssistantDb();
        assistant.setUserId(userId);
        assistant.setModel(op.getModel());
        assistant.setName(op.getName());
        assistant.setDescription(op.getDescription());
        assistant.setInstructions(op.getInstructions());
        assistant.setTools(JacksonUtils.serialize(op.getTools() == null ? new ArrayList<>() : op.getTools()));
        assistant.setFileIds(JacksonUtils.serialize(op.getFileIds() == null ? new ArrayList<>() : op.getFileIds()));
        assistant.setMetadata(JacksonUtils.serialize(op.getMetadata() == null ? new HashMap<>() : op.getMetadata()));

        assistantRepo.insert(assistant);
        log.info("Assistant {} created by {}", assistant.getId(), userId);
        return convertToInfo(assistant);
    }

    /**
     * 获取调用方拥有的 Assistant，不存在或不属于调用方时返回 404
     */
    public AssistantDb getOwnedAssistant(String userId, String assistantId) {
        AssistantDb assistant = assistantRepo.findById(assistantId);
        if(assistant == null || !assistant.getUserId().equals(userId)) {
            throw new ResourceNotFoundException("assistant not found: " + assistantId);
        }
        return assistant;
    }

    public AssistantInfo getAssistant(String userId, String assistantId) {
        return convertToInfo(getOwnedAssistant(userId, assistantId));
    }

    /**
     * 基于游标的分页查询Assistant
     */
    public List<AssistantInfo> getAssistantsByCursor(String userId, String after, String before, int limit, String order) {
        return assistantRepo.findByUserIdWithCursor(userId, after, before, limit, order).stream()
                .map(this::convertToInfo)
                .collect(Collectors.toList());
    }

    /**
     * 更新Assistant，null 字段保持不变，已创建的 run 使用各自的快照不受影响
     */
    public AssistantInfo updateAssistant(String userId, String assistantId, AssistantOps.UpdateAssistantOp op) {
        AssistantDb existing = getOwnedAssistant(userId, assistantId);
        if(op.getTools() != null) {
            ToolUtils.checkTools(op.getTools());
            existing.setTools(JacksonUtils.serialize(op.getTools()));
        }
        if(op.getModel() != null) {
            existing.setModel(op.getModel());
        }
        if(op.getName() != null) {
            existing.setName(op.getName());
        }
        if(op.getDescription() != null) {
            existing.setDescription(op.getDescription());
        }
        if(op.getInstructions() != null) {
            existing.setInstructions(op.getInstructions());
        }
        if(op.getFileIds() != null) {
            existing.setFileIds(JacksonUtils.serialize(op.getFileIds()));
        }
        if(op.getMetadata() != null) {
            existing.setMetadata(JacksonUtils.serialize(op.getMetadata()));
        }
        assistantRepo.update(existing);
        return convertToInfo(existing);
    }

    /**
     * 删除 Assistant，已创建的 run 使用各自的快照继续执行
     */
    public boolean deleteAssistant(String userId, String assistantId) {
        getOwnedAssistant(userId, assistantId);
        boolean deleted = assistantRepo.deleteById(assistantId);
        log.info("Assistant {} deleted by {}", assistantId, userId);
        return deleted;
    }

    public List<Tool> parseTools(AssistantDb assistant) {
        List<Tool> tools = JacksonUtils.deserialize(assistant.getTools(), TOOLS_TYPE);
        return tools == null ? new ArrayList<>() : tools;
    }

    public AssistantInfo convertToInfo(AssistantDb db) {
        AssistantInfo info = new AssistantInfo();
        info.setId(db.getId());
        info.setCreatedAt(db.getCreatedAt());
        info.setModel(db.getModel());
        info.setName(db.getName());
        info.setDescription(db.getDescription());
        info.setInstructions(db.getInstructions());
        info.setTools(parseTools(db));
        List<String> fileIds = JacksonUtils.deserialize(db.getFileIds(), IDS_TYPE);
        info.setFileIds(fileIds == null ? new ArrayList<>() : fileIds);
        info.setMetadata(JacksonUtils.deserialize(db.getMetadata(), METADATA_TYPE));
        return info;
    }
}
