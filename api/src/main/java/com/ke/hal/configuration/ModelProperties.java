package com.ke.hal.configuration;

import lombok.Data;

@Data
public class ModelProperties {
    private String url = "https://api.openai.com/v1";
    private String apiKey;
    private int connectTimeoutSeconds = 10;
    private int readTimeoutSeconds = 120;
    /**
     * 截断时保留的最大输入 token 数
     */
    private int maxInputTokens = 16000;
}
