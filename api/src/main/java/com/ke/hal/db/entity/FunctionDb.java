package com.ke.hal.db.entity;

import lombok.Data;

@Data
public class FunctionDb implements Timed {
    private String id;
    private String userId;
    private String name;
    private String description;
    private String parameters;
    private Long createdAt;
    private Long updatedAt;
}
