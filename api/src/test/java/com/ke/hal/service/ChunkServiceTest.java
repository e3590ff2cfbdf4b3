package com.ke.hal.service;

import com.ke.hal.BaseSpringTest;
import com.ke.hal.db.entity.ChunkDb;
import com.ke.hal.exception.BadRequestException;
import org.apache.commons.lang3.StringUtils;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ChunkServiceTest extends BaseSpringTest {

    @Autowired
    private ChunkService chunkService;

    @Test
    @DisplayName("切分后的 chunk 首尾相接覆盖全文")
    void chunksAreContiguous() {
        String text = StringUtils.repeat("The quick brown fox jumps over the lazy dog. ", 20);

        List<ChunkDb> chunks = chunkService.ingest("file_" + userId, text, 16);

        assertTrue(chunks.size() > 1);
        assertEquals(0, chunks.get(0).getStartOffset());
        for (int i = 1; i < chunks.size(); i++) {
            assertEquals(i, chunks.get(i).getSeq());
            assertEquals(chunks.get(i - 1).getEndOffset(), chunks.get(i).getStartOffset());
        }
        assertEquals(text.length(), chunks.get(chunks.size() - 1).getEndOffset());
        assertEquals(text, chunks.stream().map(ChunkDb::getContent).collect(Collectors.joining()));
    }

    @Test
    void shortTextIsOneChunk() {
        List<ChunkDb> chunks = chunkService.ingest("file_short_" + userId, "Paris is the capital of France.", null);

        assertEquals(1, chunks.size());
        assertEquals("Paris is the capital of France.", chunks.get(0).getContent());
    }

    @Test
    @DisplayName("chunk_size 越界或文本为空时拒绝")
    void rejectsInvalidInput() {
        assertThrows(BadRequestException.class, () -> chunkService.ingest("file_x", "text", 0));
        assertThrows(BadRequestException.class, () -> chunkService.ingest("file_x", "text", ChunkService.MAX_CHUNK_TOKENS + 1));
        assertThrows(BadRequestException.class, () -> chunkService.ingest("file_x", "  ", null));
    }
}
