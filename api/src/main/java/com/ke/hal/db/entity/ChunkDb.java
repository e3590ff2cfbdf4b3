package com.ke.hal.db.entity;

import lombok.Data;

@Data
public class ChunkDb {
    private String id;
    private String fileId;
    private Integer seq;
    private Integer startOffset;
    private Integer endOffset;
    private String content;
    private Long createdAt;
}
