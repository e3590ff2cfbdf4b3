package com.ke.hal.db.entity;

import lombok.Data;

@Data
public class RunDb implements Timed {
    private String id;
    private String threadId;
    private String assistantId;
    private String userId;
    private String status;
    private String requiredAction;
    private String lastError;
    /**
     * 创建时 assistant 配置的快照，见 RunSnapshot
     */
    private String snapshot;
    private String metadata;
    private Integer attempts;
    private Integer version;
    private Long createdAt;
    private Long updatedAt;
    private Long expiresAt;
    private Long startedAt;
    private Long cancelledAt;
    private Long failedAt;
    private Long completedAt;
}
