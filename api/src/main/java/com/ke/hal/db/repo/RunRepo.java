package com.ke.hal.db.repo;

import com.ke.hal.db.IdGenerator;
import com.ke.hal.db.entity.RunDb;
import com.ke.hal.util.DateTimeUtils;
import lombok.RequiredArgsConstructor;
import org.apache.commons.lang3.StringUtils;
import org.jooq.DSLContext;
import org.jooq.Record;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

import static com.ke.hal.db.Tables.RUN;

/**
 * Run Repository 运行记录数据访问层
 */
@Repository
@RequiredArgsConstructor
public class RunRepo implements BaseRepo {

    private final DSLContext dsl;
    private final IdGenerator idGenerator;

    public RunDb findById(String id) {
        return dsl.select(RUN.fields())
                .from(RUN.TABLE)
                .where(RUN.ID.eq(id))
                .fetchOne(this::toDb);
    }

    public RunDb findById(String threadId, String id) {
        return dsl.select(RUN.fields())
                .from(RUN.TABLE)
                .where(RUN.ID.eq(id))
                .and(RUN.THREAD_ID.eq(threadId))
                .fetchOne(this::toDb);
    }

    public RunDb findByIdForUpdate(String id) {
        return dsl.select(RUN.fields())
                .from(RUN.TABLE)
                .where(RUN.ID.eq(id))
                .forUpdate()
                .fetchOne(this::toDb);
    }

    /**
     * 基于游标的分页查询 Thread 下的 Run
     */
    public List<RunDb> findByThreadIdWithCursor(String threadId, String after, String before, int limit, String order) {
        return findWithCursor(
                dsl,
                RUN.TABLE,
                RUN.fields(),
                RUN.THREAD_ID.eq(threadId),
                RUN.CREATED_AT,
                RUN.ID,
                after,
                before,
                limit,
                order,
                id -> {
                    RunDb db = findById(threadId, id);
                    return db == null ? null : db.getCreatedAt();
                },
                this::toDb
        );
    }

    /**
     * 查询已过期但仍处于给定状态的 Run
     */
    public List<RunDb> findExpired(long now, Collection<String> statuses, int limit) {
        return dsl.select(RUN.fields())
                .from(RUN.TABLE)
                .where(RUN.STATUS.in(statuses))
                .and(RUN.EXPIRES_AT.le(now))
                .orderBy(RUN.EXPIRES_AT.asc())
                .limit(limit)
                .fetch(this::toDb);
    }

    /**
     * 查询处于给定状态且最近一次更新早于 updatedBefore 的 Run
     */
    public List<RunDb> findStale(String status, long updatedBefore, int limit) {
        return dsl.select(RUN.fields())
                .from(RUN.TABLE)
                .where(RUN.STATUS.eq(status))
                .and(RUN.UPDATED_AT.le(updatedBefore))
                .orderBy(RUN.UPDATED_AT.asc())
                .limit(limit)
                .fetch(this::toDb);
    }

    public RunDb insert(RunDb run) {
        if(StringUtils.isBlank(run.getId())) {
            run.setId(idGenerator.generateId(IdGenerator.RUN));
        }
        fillCreateTime(run);
        run.setVersion(0);
        if(run.getAttempts() == null) {
            run.setAttempts(0);
        }

        dsl.insertInto(RUN.TABLE)
                .set(RUN.ID, run.getId())
                .set(RUN.THREAD_ID, run.getThreadId())
                .set(RUN.ASSISTANT_ID, run.getAssistantId())
                .set(RUN.USER_ID, run.getUserId())
                .set(RUN.STATUS, run.getStatus())
                .set(RUN.REQUIRED_ACTION, run.getRequiredAction())
                .set(RUN.LAST_ERROR, run.getLastError())
                .set(RUN.SNAPSHOT, run.getSnapshot())
                .set(RUN.METADATA, run.getMetadata())
                .set(RUN.ATTEMPTS, run.getAttempts())
                .set(RUN.VERSION, run.getVersion())
                .set(RUN.CREATED_AT, run.getCreatedAt())
                .set(RUN.UPDATED_AT, run.getUpdatedAt())
                .set(RUN.EXPIRES_AT, run.getExpiresAt())
                .execute();
        return run;
    }

    /**
     * 带版本校验的状态更新，成功后 run.version 加一，metadata 由 updateMetadata 单独维护
     *
     * @return false 表示 run 已被其他写入方修改
     */
    public boolean update(RunDb run) {
        fillUpdateTime(run);
        int expectedVersion = run.getVersion();

        int updated = dsl.update(RUN.TABLE)
                .set(RUN.STATUS, run.getStatus())
                .set(RUN.REQUIRED_ACTION, run.getRequiredAction())
                .set(RUN.LAST_ERROR, run.getLastError())
                .set(RUN.ATTEMPTS, run.getAttempts())
                .set(RUN.VERSION, expectedVersion + 1)
                .set(RUN.UPDATED_AT, run.getUpdatedAt())
                .set(RUN.STARTED_AT, run.getStartedAt())
                .set(RUN.CANCELLED_AT, run.getCancelledAt())
                .set(RUN.FAILED_AT, run.getFailedAt())
                .set(RUN.COMPLETED_AT, run.getCompletedAt())
                .where(RUN.ID.eq(run.getId()))
                .and(RUN.VERSION.eq(expectedVersion))
                .execute();
        if(updated > 0) {
            run.setVersion(expectedVersion + 1);
            return true;
        }
        return false;
    }

    /**
     * metadata 不参与状态机，不校验也不递增版本
     */
    public boolean updateMetadata(String id, String metadata) {
        return dsl.update(RUN.TABLE)
                .set(RUN.METADATA, metadata)
                .set(RUN.UPDATED_AT, DateTimeUtils.getCurrentSeconds())
                .where(RUN.ID.eq(id))
                .execute() > 0;
    }

    public List<String> findIdsByThreadId(String threadId) {
        return dsl.select(RUN.ID)
                .from(RUN.TABLE)
                .where(RUN.THREAD_ID.eq(threadId))
                .fetch(RUN.ID);
    }

    public boolean existsByThreadIdAndStatus(String threadId, Collection<String> statuses) {
        return dsl.fetchExists(dsl.selectOne()
                .from(RUN.TABLE)
                .where(RUN.THREAD_ID.eq(threadId))
                .and(RUN.STATUS.in(statuses)));
    }

    public boolean deleteById(String id) {
        return dsl.deleteFrom(RUN.TABLE)
                .where(RUN.ID.eq(id))
                .execute() > 0;
    }

    private RunDb toDb(Record record) {
        RunDb db = new RunDb();
        db.setId(record.get(RUN.ID));
        db.setThreadId(record.get(RUN.THREAD_ID));
        db.setAssistantId(record.get(RUN.ASSISTANT_ID));
        db.setUserId(record.get(RUN.USER_ID));
        db.setStatus(record.get(RUN.STATUS));
        db.setRequiredAction(record.get(RUN.REQUIRED_ACTION));
        db.setLastError(record.get(RUN.LAST_ERROR));
        db.setSnapshot(record.get(RUN.SNAPSHOT));
        db.setMetadata(record.get(RUN.METADATA));
        db.setAttempts(record.get(RUN.ATTEMPTS));
        db.setVersion(record.get(RUN.VERSION));
        db.setCreatedAt(record.get(RUN.CREATED_AT));
        db.setUpdatedAt(record.get(RUN.UPDATED_AT));
        db.setExpiresAt(record.get(RUN.EXPIRES_AT));
        db.setStartedAt(record.get(RUN.STARTED_AT));
        db.setCancelledAt(record.get(RUN.CANCELLED_AT));
        db.setFailedAt(record.get(RUN.FAILED_AT));
        db.setCompletedAt(record.get(RUN.COMPLETED_AT));
        return db;
    }
}
