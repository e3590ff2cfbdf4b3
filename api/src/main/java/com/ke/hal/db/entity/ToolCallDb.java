package com.ke.hal.db.entity;

import lombok.Data;

@Data
public class ToolCallDb {

    public static final String PENDING = "pending";
    public static final String COMPLETED = "completed";

    private String id;
    private String runId;
    private String type;
    private String name;
    private String arguments;
    private String output;
    private Boolean isError;
    private String status;
    /**
     * 产生该调用的模型轮次
     */
    private Integer round;
    /**
     * 同一轮次内的顺序
     */
    private Integer seq;
    private Long createdAt;
    private Long completedAt;

    public boolean isPending() {
        return PENDING.equals(status);
    }
}
