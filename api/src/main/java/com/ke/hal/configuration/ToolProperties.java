package com.ke.hal.configuration;

import lombok.Data;

@Data
public class ToolProperties {
    private RetrievalToolProperties retrieval = new RetrievalToolProperties();
    private CodeInterpreterToolProperties codeInterpreter = new CodeInterpreterToolProperties();
    private ActionToolProperties action = new ActionToolProperties();

    @Data
    public static class RetrievalToolProperties {
        /**
         * 为空时使用本地 chunks 表检索
         */
        private String url;
        private int topK = 5;
        private int maxChars = 4000;
        private int maxAttempts = 3;
        private int timeoutSeconds = 30;
    }

    @Data
    public static class CodeInterpreterToolProperties {
        private String url = "http://localhost:8090/execute";
        private int timeoutSeconds = 30;
        private int maxCorrections = 3;
    }

    @Data
    public static class ActionToolProperties {
        private int timeoutSeconds = 30;
        private int maxResponseChars = 8000;
    }
}
