package com.ke.hal.file;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import javax.validation.constraints.NotBlank;

public class ChunkOps {

    /**
     * 写入文件文本，按 token 数切分
     */
    @Data
    public static class CreateChunksOp {

        @NotBlank
        private String text;

        @JsonProperty("chunk_size")
        private Integer chunkSize;
    }
}
