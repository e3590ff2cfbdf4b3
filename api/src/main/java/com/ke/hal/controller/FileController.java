package com.ke.hal.controller;

import com.ke.hal.common.CommonPage;
import com.ke.hal.db.entity.ChunkDb;
import com.ke.hal.file.ChunkInfo;
import com.ke.hal.file.ChunkOps;
import com.ke.hal.service.ChunkService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import javax.validation.Valid;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 文件文本分片写入，供默认检索使用
 */
@RestController
@RequestMapping("/v1/files")
public class FileController {

    @Autowired
    private ChunkService chunkService;

    @PostMapping("/{file_id}/chunks")
    public CommonPage<ChunkInfo> createChunks(
            @PathVariable("file_id") String fileId,
            @Valid @RequestBody ChunkOps.CreateChunksOp request) {
        List<ChunkInfo> chunks = chunkService.ingest(fileId, request.getText(), request.getChunkSize()).stream()
                .map(FileController::convertToInfo)
                .collect(Collectors.toList());
        return PageUtils.toPage(chunks, Integer.MAX_VALUE, ChunkInfo::getId);
    }

    private static ChunkInfo convertToInfo(ChunkDb db) {
        ChunkInfo info = new ChunkInfo();
        info.setId(db.getId());
        info.setFileId(db.getFileId());
        info.setSeq(db.getSeq());
        info.setStartOffset(db.getStartOffset());
        info.setEndOffset(db.getEndOffset());
        info.setContent(db.getContent());
        info.setCreatedAt(db.getCreatedAt());
        return info;
    }
}
