package com.ke.hal.function;

import lombok.Data;

import javax.validation.constraints.NotBlank;
import javax.validation.constraints.Pattern;
import java.util.Map;

public class FunctionOps {

    /**
     * 注册 function，同一 owner 下按 name 覆盖
     */
    @Data
    public static class CreateFunctionOp {

        @NotBlank
        @Pattern(regexp = "^[a-zA-Z0-9_-]{1,64}$")
        private String name;

        private String description;

        private Map<String, Object> parameters;
    }
}
