package com.ke.hal.db.repo;

import com.ke.hal.db.IdGenerator;
import com.ke.hal.db.entity.ChunkDb;
import com.ke.hal.util.DateTimeUtils;
import lombok.RequiredArgsConstructor;
import org.apache.commons.collections4.CollectionUtils;
import org.apache.commons.lang3.StringUtils;
import org.jooq.DSLContext;
import org.jooq.Record;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.Collections;
import java.util.List;

import static com.ke.hal.db.Tables.CHUNK;

/**
 * 文件分片，写入后只读
 */
@Repository
@RequiredArgsConstructor
public class ChunkRepo implements BaseRepo {

    private final DSLContext dsl;
    private final IdGenerator idGenerator;

    public List<ChunkDb> findByFileIds(Collection<String> fileIds) {
        if(CollectionUtils.isEmpty(fileIds)) {
            return Collections.emptyList();
        }
        return dsl.select(CHUNK.fields())
                .from(CHUNK.TABLE)
                .where(CHUNK.FILE_ID.in(fileIds))
                .orderBy(CHUNK.FILE_ID.asc(), CHUNK.SEQ.asc())
                .fetch(this::toDb);
    }

    public ChunkDb insert(ChunkDb chunk) {
        if(StringUtils.isBlank(chunk.getId())) {
            chunk.setId(idGenerator.generateId(IdGenerator.CHUNK));
        }
        chunk.setCreatedAt(DateTimeUtils.getCurrentSeconds());

        dsl.insertInto(CHUNK.TABLE)
                .set(CHUNK.ID, chunk.getId())
                .set(CHUNK.FILE_ID, chunk.getFileId())
                .set(CHUNK.SEQ, chunk.getSeq())
                .set(CHUNK.START_OFFSET, chunk.getStartOffset())
                .set(CHUNK.END_OFFSET, chunk.getEndOffset())
                .set(CHUNK.CONTENT, chunk.getContent())
                .set(CHUNK.CREATED_AT, chunk.getCreatedAt())
                .execute();
        return chunk;
    }

    private ChunkDb toDb(Record record) {
        ChunkDb db = new ChunkDb();
        db.setId(record.get(CHUNK.ID));
        db.setFileId(record.get(CHUNK.FILE_ID));
        db.setSeq(record.get(CHUNK.SEQ));
        db.setStartOffset(record.get(CHUNK.START_OFFSET));
        db.setEndOffset(record.get(CHUNK.END_OFFSET));
        db.setContent(record.get(CHUNK.CONTENT));
        db.setCreatedAt(record.get(CHUNK.CREATED_AT));
        return db;
    }
}
