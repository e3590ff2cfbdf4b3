package com.ke.hal.db.repo;

import com.ke.hal.db.IdGenerator;
import com.ke.hal.db.entity.MessageDb;
import com.ke.hal.util.DateTimeUtils;
import lombok.RequiredArgsConstructor;
import org.apache.commons.lang3.StringUtils;
import org.jooq.DSLContext;
import org.jooq.Record;
import org.springframework.stereotype.Repository;

import java.util.List;

import static com.ke.hal.db.Tables.MESSAGE;

/**
 * Message Repository，消息只追加不修改
 */
@Repository
@RequiredArgsConstructor
public class MessageRepo implements BaseRepo {

    private final DSLContext dsl;
    private final IdGenerator idGenerator;
    private final ThreadRepo threadRepo;

    public MessageDb findById(String threadId, String id) {
        return dsl.select(MESSAGE.fields())
                .from(MESSAGE.TABLE)
                .where(MESSAGE.ID.eq(id))
                .and(MESSAGE.THREAD_ID.eq(threadId))
                .fetchOne(this::toDb);
    }

    /**
     * 按 seq 升序返回线程内全部消息
     */
    public List<MessageDb> findByThreadId(String threadId) {
        return dsl.select(MESSAGE.fields())
                .from(MESSAGE.TABLE)
                .where(MESSAGE.THREAD_ID.eq(threadId))
                .orderBy(MESSAGE.SEQ.asc())
                .fetch(this::toDb);
    }

    public List<MessageDb> findByRunId(String threadId, String runId) {
        return dsl.select(MESSAGE.fields())
                .from(MESSAGE.TABLE)
                .where(MESSAGE.THREAD_ID.eq(threadId))
                .and(MESSAGE.RUN_ID.eq(runId))
                .orderBy(MESSAGE.SEQ.asc())
                .fetch(this::toDb);
    }

    /**
     * 基于游标的分页查询 Thread 下的 Message
     */
    public List<MessageDb> findByThreadIdWithCursor(String threadId, String after, String before, int limit, String order) {
        return findWithCursor(
                dsl,
                MESSAGE.TABLE,
                MESSAGE.fields(),
                MESSAGE.THREAD_ID.eq(threadId),
                MESSAGE.SEQ,
                MESSAGE.ID,
                after,
                before,
                limit,
                order,
                id -> {
                    MessageDb db = findById(threadId, id);
                    return db == null ? null : db.getSeq();
                },
                this::toDb
        );
    }

    public boolean updateMetadata(String threadId, String id, String metadata) {
        return dsl.update(MESSAGE.TABLE)
                .set(MESSAGE.METADATA, metadata)
                .where(MESSAGE.ID.eq(id))
                .and(MESSAGE.THREAD_ID.eq(threadId))
                .execute() > 0;
    }

    public boolean deleteById(String threadId, String id) {
        return dsl.deleteFrom(MESSAGE.TABLE)
                .where(MESSAGE.ID.eq(id))
                .and(MESSAGE.THREAD_ID.eq(threadId))
                .execute() > 0;
    }

    public int deleteByThreadId(String threadId) {
        return dsl.deleteFrom(MESSAGE.TABLE)
                .where(MESSAGE.THREAD_ID.eq(threadId))
                .execute();
    }

    /**
     * 插入 Message，需要在事务中调用以保证 seq 分配与插入的原子性
     */
    public MessageDb insert(MessageDb message) {
        if(StringUtils.isBlank(message.getId())) {
            message.setId(idGenerator.generateId(IdGenerator.MESSAGE));
        }
        message.setSeq(threadRepo.nextMessageSeq(message.getThreadId()));
        message.setCreatedAt(DateTimeUtils.getCurrentSeconds());

        dsl.insertInto(MESSAGE.TABLE)
                .set(MESSAGE.ID, message.getId())
                .set(MESSAGE.THREAD_ID, message.getThreadId())
                .set(MESSAGE.USER_ID, message.getUserId())
                .set(MESSAGE.SEQ, message.getSeq())
                .set(MESSAGE.ROLE, message.getRole())
                .set(MESSAGE.CONTENT, message.getContent())
                .set(MESSAGE.FILE_IDS, message.getFileIds())
                .set(MESSAGE.ASSISTANT_ID, message.getAssistantId())
                .set(MESSAGE.RUN_ID, message.getRunId())
                .set(MESSAGE.METADATA, message.getMetadata())
                .set(MESSAGE.CREATED_AT, message.getCreatedAt())
                .execute();
        return message;
    }

    private MessageDb toDb(Record record) {
        MessageDb db = new MessageDb();
        db.setId(record.get(MESSAGE.ID));
        db.setThreadId(record.get(MESSAGE.THREAD_ID));
        db.setUserId(record.get(MESSAGE.USER_ID));
        db.setSeq(record.get(MESSAGE.SEQ));
        db.setRole(record.get(MESSAGE.ROLE));
        db.setContent(record.get(MESSAGE.CONTENT));
        db.setFileIds(record.get(MESSAGE.FILE_IDS));
        db.setAssistantId(record.get(MESSAGE.ASSISTANT_ID));
        db.setRunId(record.get(MESSAGE.RUN_ID));
        db.setMetadata(record.get(MESSAGE.METADATA));
        db.setCreatedAt(record.get(MESSAGE.CREATED_AT));
        return db;
    }
}
