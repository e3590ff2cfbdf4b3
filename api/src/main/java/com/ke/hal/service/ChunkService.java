package com.ke.hal.service;

import com.ke.hal.db.entity.ChunkDb;
import com.ke.hal.db.repo.ChunkRepo;
import com.ke.hal.exception.BadRequestException;
import com.knuddels.jtokkit.Encodings;
import com.knuddels.jtokkit.api.Encoding;
import com.knuddels.jtokkit.api.EncodingType;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;

/**
 * 文件文本分片，供默认的 chunks 表检索使用
 */
@Service
@Slf4j
public class ChunkService {

    public static final int DEFAULT_CHUNK_TOKENS = 200;
    public static final int MAX_CHUNK_TOKENS = 4000;

    private final Encoding encoding = Encodings.newDefaultEncodingRegistry().getEncoding(EncodingType.CL100K_BASE);

    @Autowired
    private ChunkRepo chunkRepo;

    /**
     * 按 cl100k token 数等长切分并写入，offset 为字符偏移
     */
    @Transactional
    public List<ChunkDb> ingest(String fileId, String text, Integer chunkTokens) {
        if(StringUtils.isBlank(text)) {
            throw new BadRequestException("text must not be blank");
        }
        int size = chunkTokens == null ? DEFAULT_CHUNK_TOKENS : chunkTokens;
        if(size <= 0 || size > MAX_CHUNK_TOKENS) {
            throw new BadRequestException("chunk_size must be between 1 and " + MAX_CHUNK_TOKENS);
        }

        List<ChunkDb> chunks = new ArrayList<>();
        for (String piece : split(text, size)) {
            ChunkDb chunk = new ChunkDb();
            chunk.setFileId(fileId);
            chunk.setSeq(chunks.size());
            int start = chunks.isEmpty() ? 0 : chunks.get(chunks.size() - 1).getEndOffset();
            chunk.setStartOffset(start);
            chunk.setEndOffset(start + piece.length());
            chunk.setContent(piece);
            chunks.add(chunkRepo.insert(chunk));
        }
        log.info("File {} split into {} chunks of {} tokens", fileId, chunks.size(), size);
        return chunks;
    }

    public List<String> split(String text, int chunkTokens) {
        List<Integer> tokens = encoding.encode(text);
        List<String> pieces = new ArrayList<>();
        for (int from = 0; from < tokens.size(); from += chunkTokens) {
            pieces.add(encoding.decode(tokens.subList(from, Math.min(tokens.size(), from + chunkTokens))));
        }
        return pieces;
    }
}
