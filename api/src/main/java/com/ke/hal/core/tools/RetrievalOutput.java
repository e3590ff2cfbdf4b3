package com.ke.hal.core.tools;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.ke.hal.common.Tool;
import com.ke.hal.db.entity.ToolCallDb;
import com.ke.hal.util.JacksonUtils;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * retrieval 工具输出，results 的 index 在 run 内连续编号，模型以 [index] 引用
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class RetrievalOutput {
    private String query;
    private List<Result> results = new ArrayList<>();

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Result {
        private int index;
        @JsonProperty("file_id")
        private String fileId;
        private String text;
    }

    /**
     * 收集 run 内全部成功的检索结果
     */
    public static List<Result> collect(List<ToolCallDb> toolCalls) {
        List<Result> results = new ArrayList<>();
        for (ToolCallDb call : toolCalls) {
            if(!Tool.RETRIEVAL.equals(call.getType()) || call.isPending() || Boolean.TRUE.equals(call.getIsError())) {
                continue;
            }
            RetrievalOutput output = JacksonUtils.deserialize(call.getOutput(), RetrievalOutput.class);
            if(output != null && output.getResults() != null) {
                results.addAll(output.getResults());
            }
        }
        return results;
    }
}
