package com.ke.hal.configuration;

import lombok.Data;

@Data
public class QueueProperties {
    /**
     * redis | memory
     */
    private String type = "redis";
    private RedisProperties redis = new RedisProperties();

    @Data
    public static class RedisProperties {
        private String address = "redis://127.0.0.1:6379";
        private String password;
        private int database = 0;
        private int connectionPoolSize = 16;
    }
}
