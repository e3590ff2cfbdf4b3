package com.ke.hal.db.repo;

import com.ke.hal.db.IdGenerator;
import com.ke.hal.db.entity.RunStepDb;
import com.ke.hal.util.DateTimeUtils;
import lombok.RequiredArgsConstructor;
import org.apache.commons.lang3.StringUtils;
import org.jooq.DSLContext;
import org.jooq.Field;
import org.jooq.Record;
import org.springframework.stereotype.Repository;

import java.util.List;

import static com.ke.hal.db.Tables.RUN_STEP;

/**
 * Run Step Repository 运行步骤数据访问层
 */
@Repository
@RequiredArgsConstructor
public class RunStepRepo implements BaseRepo {

    public static final String IN_PROGRESS = "in_progress";

    private final DSLContext dsl;
    private final IdGenerator idGenerator;

    public RunStepDb findById(String runId, String id) {
        return dsl.select(RUN_STEP.fields())
                .from(RUN_STEP.TABLE)
                .where(RUN_STEP.ID.eq(id))
                .and(RUN_STEP.RUN_ID.eq(runId))
                .fetchOne(this::toDb);
    }

    public RunStepDb findByStepNumber(String runId, long stepNumber) {
        return dsl.select(RUN_STEP.fields())
                .from(RUN_STEP.TABLE)
                .where(RUN_STEP.RUN_ID.eq(runId))
                .and(RUN_STEP.STEP_NUMBER.eq(stepNumber))
                .fetchOne(this::toDb);
    }

    /**
     * 根据 Run ID 查询 Run Step 列表
     */
    public List<RunStepDb> findByRunId(String runId) {
        return dsl.select(RUN_STEP.fields())
                .from(RUN_STEP.TABLE)
                .where(RUN_STEP.RUN_ID.eq(runId))
                .orderBy(RUN_STEP.STEP_NUMBER.asc())
                .fetch(this::toDb);
    }

    /**
     * 基于游标的分页查询，按步骤序号排序
     */
    public List<RunStepDb> findByRunIdWithCursor(String runId, String after, String before, int limit, String order) {
        return findWithCursor(
                dsl,
                RUN_STEP.TABLE,
                RUN_STEP.fields(),
                RUN_STEP.RUN_ID.eq(runId),
                RUN_STEP.STEP_NUMBER,
                RUN_STEP.ID,
                after,
                before,
                limit,
                order,
                id -> {
                    RunStepDb db = findById(runId, id);
                    return db == null ? null : db.getStepNumber();
                },
                this::toDb
        );
    }

    /**
     * 插入 Run Step
     */
    public RunStepDb insert(RunStepDb runStep) {
        if(StringUtils.isBlank(runStep.getId())) {
            runStep.setId(idGenerator.generateId(IdGenerator.RUN_STEP));
        }
        fillCreateTime(runStep);

        dsl.insertInto(RUN_STEP.TABLE)
                .set(RUN_STEP.ID, runStep.getId())
                .set(RUN_STEP.RUN_ID, runStep.getRunId())
                .set(RUN_STEP.THREAD_ID, runStep.getThreadId())
                .set(RUN_STEP.ASSISTANT_ID, runStep.getAssistantId())
                .set(RUN_STEP.USER_ID, runStep.getUserId())
                .set(RUN_STEP.TYPE, runStep.getType())
                .set(RUN_STEP.STATUS, runStep.getStatus())
                .set(RUN_STEP.STEP_NUMBER, runStep.getStepNumber())
                .set(RUN_STEP.MESSAGE_ID, runStep.getMessageId())
                .set(RUN_STEP.CREATED_AT, runStep.getCreatedAt())
                .set(RUN_STEP.UPDATED_AT, runStep.getUpdatedAt())
                .set(RUN_STEP.COMPLETED_AT, runStep.getCompletedAt())
                .execute();
        return runStep;
    }

    /**
     * 将 run 下所有 in_progress 步骤置为给定状态
     *
     * @param status completed | failed | cancelled | expired
     * @return 更新的数量
     */
    public int finishInProgress(String runId, String status) {
        long now = DateTimeUtils.getCurrentSeconds();
        Field<Long> timeField = finishTimeField(status);
        return dsl.update(RUN_STEP.TABLE)
                .set(RUN_STEP.STATUS, status)
                .set(RUN_STEP.UPDATED_AT, now)
                .set(timeField, now)
                .where(RUN_STEP.RUN_ID.eq(runId))
                .and(RUN_STEP.STATUS.eq(IN_PROGRESS))
                .execute();
    }

    public int deleteByRunId(String runId) {
        return dsl.deleteFrom(RUN_STEP.TABLE)
                .where(RUN_STEP.RUN_ID.eq(runId))
                .execute();
    }

    private static Field<Long> finishTimeField(String status) {
        switch (status) {
            case "completed":
                return RUN_STEP.COMPLETED_AT;
            case "failed":
                return RUN_STEP.FAILED_AT;
            case "cancelled":
                return RUN_STEP.CANCELLED_AT;
            case "expired":
                return RUN_STEP.EXPIRED_AT;
            default:
                throw new IllegalArgumentException("not a final step status: " + status);
        }
    }

    private RunStepDb toDb(Record record) {
        RunStepDb db = new RunStepDb();
        db.setId(record.get(RUN_STEP.ID));
        db.setRunId(record.get(RUN_STEP.RUN_ID));
        db.setThreadId(record.get(RUN_STEP.THREAD_ID));
        db.setAssistantId(record.get(RUN_STEP.ASSISTANT_ID));
        db.setUserId(record.get(RUN_STEP.USER_ID));
        db.setType(record.get(RUN_STEP.TYPE));
        db.setStatus(record.get(RUN_STEP.STATUS));
        db.setStepNumber(record.get(RUN_STEP.STEP_NUMBER));
        db.setMessageId(record.get(RUN_STEP.MESSAGE_ID));
        db.setCreatedAt(record.get(RUN_STEP.CREATED_AT));
        db.setUpdatedAt(record.get(RUN_STEP.UPDATED_AT));
        db.setCompletedAt(record.get(RUN_STEP.COMPLETED_AT));
        db.setCancelledAt(record.get(RUN_STEP.CANCELLED_AT));
        db.setFailedAt(record.get(RUN_STEP.FAILED_AT));
        db.setExpiredAt(record.get(RUN_STEP.EXPIRED_AT));
        return db;
    }
}
