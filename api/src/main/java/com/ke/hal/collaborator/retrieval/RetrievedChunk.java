package com.ke.hal.collaborator.retrieval;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class RetrievedChunk {
    private String fileId;
    private String chunkId;
    private String text;
    private Double score;
}
