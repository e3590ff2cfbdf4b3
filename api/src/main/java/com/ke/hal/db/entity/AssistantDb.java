package com.ke.hal.db.entity;

import lombok.Data;

@Data
public class AssistantDb implements Timed {
    private String id;
    private String userId;
    private String name;
    private String description;
    private String model;
    private String instructions;
    private String tools;
    private String fileIds;
    private String metadata;
    private Long createdAt;
    private Long updatedAt;
}
