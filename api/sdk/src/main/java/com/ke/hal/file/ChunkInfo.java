package com.ke.hal.file;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

/**
 * 文件分片
 */
@Data
public class ChunkInfo {

    private String id;

    private String object = "file.chunk";

    @JsonProperty("file_id")
    private String fileId;

    private Integer seq;

    @JsonProperty("start_offset")
    private Integer startOffset;

    @JsonProperty("end_offset")
    private Integer endOffset;

    private String content;

    @JsonProperty("created_at")
    private Long createdAt;
}
