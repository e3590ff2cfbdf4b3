package com.ke.hal.db.entity;

import lombok.Data;

@Data
public class ThreadDb implements Timed {
    private String id;
    private String userId;
    private String fileIds;
    private String metadata;
    /**
     * 最后一条消息的 seq
     */
    private Long messageSeq;
    private Long createdAt;
    private Long updatedAt;
}
