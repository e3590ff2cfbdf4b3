package com.ke.hal.db.entity;

import lombok.Data;

/**
 * 消息创建后不可修改，线程内按 seq 排序
 */
@Data
public class MessageDb {
    private String id;
    private String threadId;
    private String userId;
    private Long seq;
    private String role;
    private String content;
    private String fileIds;
    private String assistantId;
    private String runId;
    private String metadata;
    private Long createdAt;
}
