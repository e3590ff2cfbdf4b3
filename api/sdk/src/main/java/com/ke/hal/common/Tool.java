package com.ke.hal.common;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import lombok.Data;

import javax.validation.Valid;
import javax.validation.constraints.NotBlank;
import javax.validation.constraints.NotEmpty;
import javax.validation.constraints.NotNull;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Assistant Tool 定义
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.EXISTING_PROPERTY, property = "type", visible = true)
@JsonSubTypes({
        @JsonSubTypes.Type(value = Tool.ToolFunction.class, name = Tool.FUNCTION),
        @JsonSubTypes.Type(value = Tool.ToolRetrieval.class, name = Tool.RETRIEVAL),
        @JsonSubTypes.Type(value = Tool.ToolCodeInterpreter.class, name = Tool.CODE_INTERPRETER),
        @JsonSubTypes.Type(value = Tool.ToolAction.class, name = Tool.ACTION)
})
public abstract class Tool {

    public static final String FUNCTION = "function";
    public static final String RETRIEVAL = "retrieval";
    public static final String CODE_INTERPRETER = "code_interpreter";
    public static final String ACTION = "action";

    @NotBlank
    public abstract String getType();

    /**
     * Function Tool，由调用方提交结果
     */
    @Data
    public static class ToolFunction extends Tool {
        private String type = FUNCTION;
        @Valid
        @NotNull
        private FunctionDefinition function;

        @Override
        public String getType() {
            return FUNCTION;
        }
    }

    /**
     * Retrieval Tool
     */
    @Data
    public static class ToolRetrieval extends Tool {
        private String type = RETRIEVAL;
        @JsonProperty("file_ids")
        private List<String> fileIds = new ArrayList<>();
        @JsonProperty("top_k")
        private Integer topK = 3;

        @Override
        public String getType() {
            return RETRIEVAL;
        }
    }

    /**
     * Code Interpreter Tool
     */
    @Data
    public static class ToolCodeInterpreter extends Tool {
        private String type = CODE_INTERPRETER;

        @Override
        public String getType() {
            return CODE_INTERPRETER;
        }
    }

    /**
     * HTTP Action Tool，每个 operation 以 operation_id 作为函数名暴露给模型
     */
    @Data
    public static class ToolAction extends Tool {
        private String type = ACTION;
        @Valid
        @NotNull
        private ActionDefinition action;

        @Override
        public String getType() {
            return ACTION;
        }
    }

    @Data
    public static class FunctionDefinition {
        @NotBlank
        private String name;
        private String description;
        private Map<String, Object> parameters;
    }

    /**
     * OpenAPI 风格的 action 描述
     */
    @Data
    public static class ActionDefinition {
        private String name;
        private String description;
        @NotBlank
        @JsonProperty("server_url")
        private String serverUrl;
        private Map<String, String> headers;
        @Valid
        @NotEmpty
        private List<ActionOperation> operations;
    }

    @Data
    public static class ActionOperation {
        @NotBlank
        @JsonProperty("operation_id")
        private String operationId;
        @NotBlank
        private String method;
        @NotBlank
        private String path;
        private String description;
        @JsonProperty("content_type")
        private String contentType = "application/json";
        @JsonProperty("is_consequential")
        private boolean consequential;
        @Valid
        private List<ActionParameter> parameters = new ArrayList<>();

        /**
         * 显式的 null 视为没有参数
         */
        public void setParameters(List<ActionParameter> parameters) {
            this.parameters = parameters == null ? new ArrayList<>() : parameters;
        }
    }

    @Data
    public static class ActionParameter {
        @NotBlank
        private String name;
        /**
         * path | query | header | body
         */
        @NotBlank
        private String in = "query";
        private boolean required;
        private String description;
        private Map<String, Object> schema;
    }
}
