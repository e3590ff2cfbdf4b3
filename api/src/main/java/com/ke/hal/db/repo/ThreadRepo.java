package com.ke.hal.db.repo;

import com.ke.hal.db.IdGenerator;
import com.ke.hal.db.entity.ThreadDb;
import lombok.RequiredArgsConstructor;
import org.apache.commons.lang3.StringUtils;
import org.jooq.DSLContext;
import org.jooq.Record;
import org.springframework.stereotype.Repository;

import java.util.List;

import static com.ke.hal.db.Tables.THREAD;

/**
 * Thread Repository
 */
@Repository
@RequiredArgsConstructor
public class ThreadRepo implements BaseRepo {

    private final DSLContext dsl;
    private final IdGenerator idGenerator;

    public ThreadDb findById(String id) {
        return dsl.select(THREAD.fields())
                .from(THREAD.TABLE)
                .where(THREAD.ID.eq(id))
                .fetchOne(this::toDb);
    }

    /**
     * 基于游标的分页查询用户的 Thread
     */
    public List<ThreadDb> findByUserIdWithCursor(String userId, String after, String before, int limit, String order) {
        return findWithCursor(
                dsl,
                THREAD.TABLE,
                THREAD.fields(),
                THREAD.USER_ID.eq(userId),
                THREAD.CREATED_AT,
                THREAD.ID,
                after,
                before,
                limit,
                order,
                id -> {
                    ThreadDb db = findById(id);
                    return db == null ? null : db.getCreatedAt();
                },
                this::toDb
        );
    }

    public ThreadDb insert(ThreadDb thread) {
        if(StringUtils.isBlank(thread.getId())) {
            thread.setId(idGenerator.generateId(IdGenerator.THREAD));
        }
        fillCreateTime(thread);
        thread.setMessageSeq(0L);

        dsl.insertInto(THREAD.TABLE)
                .set(THREAD.ID, thread.getId())
                .set(THREAD.USER_ID, thread.getUserId())
                .set(THREAD.FILE_IDS, thread.getFileIds())
                .set(THREAD.METADATA, thread.getMetadata())
                .set(THREAD.MESSAGE_SEQ, thread.getMessageSeq())
                .set(THREAD.CREATED_AT, thread.getCreatedAt())
                .set(THREAD.UPDATED_AT, thread.getUpdatedAt())
                .execute();
        return thread;
    }

    /**
     * 更新 file_ids 与 metadata，message_seq 只由 nextMessageSeq 维护
     */
    public boolean update(ThreadDb thread) {
        fillUpdateTime(thread);

        return dsl.update(THREAD.TABLE)
                .set(THREAD.FILE_IDS, thread.getFileIds())
                .set(THREAD.METADATA, thread.getMetadata())
                .set(THREAD.UPDATED_AT, thread.getUpdatedAt())
                .where(THREAD.ID.eq(thread.getId()))
                .execute() > 0;
    }

    public boolean deleteById(String id) {
        return dsl.deleteFrom(THREAD.TABLE)
                .where(THREAD.ID.eq(id))
                .execute() > 0;
    }

    /**
     * 分配下一条消息的 seq，行锁保证同一线程内单调递增
     */
    public long nextMessageSeq(String threadId) {
        int updated = dsl.update(THREAD.TABLE)
                .set(THREAD.MESSAGE_SEQ, THREAD.MESSAGE_SEQ.plus(1))
                .where(THREAD.ID.eq(threadId))
                .execute();
        if(updated == 0) {
            throw new IllegalStateException("thread not found: " + threadId);
        }
        return dsl.select(THREAD.MESSAGE_SEQ)
                .from(THREAD.TABLE)
                .where(THREAD.ID.eq(threadId))
                .fetchOne(THREAD.MESSAGE_SEQ);
    }

    private ThreadDb toDb(Record record) {
        ThreadDb db = new ThreadDb();
        db.setId(record.get(THREAD.ID));
        db.setUserId(record.get(THREAD.USER_ID));
        db.setFileIds(record.get(THREAD.FILE_IDS));
        db.setMetadata(record.get(THREAD.METADATA));
        db.setMessageSeq(record.get(THREAD.MESSAGE_SEQ));
        db.setCreatedAt(record.get(THREAD.CREATED_AT));
        db.setUpdatedAt(record.get(THREAD.UPDATED_AT));
        return db;
    }
}
