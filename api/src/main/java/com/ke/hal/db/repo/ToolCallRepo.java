package com.ke.hal.db.repo;

import com.ke.hal.db.IdGenerator;
import com.ke.hal.db.entity.ToolCallDb;
import com.ke.hal.util.DateTimeUtils;
import lombok.RequiredArgsConstructor;
import org.apache.commons.lang3.StringUtils;
import org.jooq.DSLContext;
import org.jooq.Record;
import org.springframework.stereotype.Repository;

import java.util.List;

import static com.ke.hal.db.Tables.TOOL_CALL;

/**
 * ToolCall Repository
 */
@Repository
@RequiredArgsConstructor
public class ToolCallRepo implements BaseRepo {

    private final DSLContext dsl;
    private final IdGenerator idGenerator;

    public ToolCallDb findById(String id) {
        return dsl.select(TOOL_CALL.fields())
                .from(TOOL_CALL.TABLE)
                .where(TOOL_CALL.ID.eq(id))
                .fetchOne(this::toDb);
    }

    /**
     * 按 (round, seq) 顺序返回 run 的全部工具调用
     */
    public List<ToolCallDb> findByRunId(String runId) {
        return dsl.select(TOOL_CALL.fields())
                .from(TOOL_CALL.TABLE)
                .where(TOOL_CALL.RUN_ID.eq(runId))
                .orderBy(TOOL_CALL.ROUND.asc(), TOOL_CALL.SEQ.asc())
                .fetch(this::toDb);
    }

    public List<ToolCallDb> findPendingByRunId(String runId) {
        return dsl.select(TOOL_CALL.fields())
                .from(TOOL_CALL.TABLE)
                .where(TOOL_CALL.RUN_ID.eq(runId))
                .and(TOOL_CALL.STATUS.eq(ToolCallDb.PENDING))
                .orderBy(TOOL_CALL.ROUND.asc(), TOOL_CALL.SEQ.asc())
                .forUpdate()
                .fetch(this::toDb);
    }

    public ToolCallDb insert(ToolCallDb toolCall) {
        if(StringUtils.isBlank(toolCall.getId())) {
            toolCall.setId(idGenerator.generateId(IdGenerator.TOOL_CALL));
        }
        toolCall.setStatus(ToolCallDb.PENDING);
        toolCall.setIsError(false);
        toolCall.setCreatedAt(DateTimeUtils.getCurrentSeconds());

        dsl.insertInto(TOOL_CALL.TABLE)
                .set(TOOL_CALL.ID, toolCall.getId())
                .set(TOOL_CALL.RUN_ID, toolCall.getRunId())
                .set(TOOL_CALL.TYPE, toolCall.getType())
                .set(TOOL_CALL.NAME, toolCall.getName())
                .set(TOOL_CALL.ARGUMENTS, toolCall.getArguments())
                .set(TOOL_CALL.IS_ERROR, 0)
                .set(TOOL_CALL.STATUS, toolCall.getStatus())
                .set(TOOL_CALL.ROUND, toolCall.getRound())
                .set(TOOL_CALL.SEQ, toolCall.getSeq())
                .set(TOOL_CALL.CREATED_AT, toolCall.getCreatedAt())
                .execute();
        return toolCall;
    }

    /**
     * 记录工具输出，只有 pending 状态的调用可以写入，保证输出只写一次
     *
     * @return false 表示输出已存在
     */
    public boolean complete(String id, String output, boolean isError) {
        return dsl.update(TOOL_CALL.TABLE)
                .set(TOOL_CALL.OUTPUT, output)
                .set(TOOL_CALL.IS_ERROR, isError ? 1 : 0)
                .set(TOOL_CALL.STATUS, ToolCallDb.COMPLETED)
                .set(TOOL_CALL.COMPLETED_AT, DateTimeUtils.getCurrentSeconds())
                .where(TOOL_CALL.ID.eq(id))
                .and(TOOL_CALL.STATUS.eq(ToolCallDb.PENDING))
                .execute() > 0;
    }

    public int deleteByRunId(String runId) {
        return dsl.deleteFrom(TOOL_CALL.TABLE)
                .where(TOOL_CALL.RUN_ID.eq(runId))
                .execute();
    }

    private ToolCallDb toDb(Record record) {
        ToolCallDb db = new ToolCallDb();
        db.setId(record.get(TOOL_CALL.ID));
        db.setRunId(record.get(TOOL_CALL.RUN_ID));
        db.setType(record.get(TOOL_CALL.TYPE));
        db.setName(record.get(TOOL_CALL.NAME));
        db.setArguments(record.get(TOOL_CALL.ARGUMENTS));
        db.setOutput(record.get(TOOL_CALL.OUTPUT));
        Integer isError = record.get(TOOL_CALL.IS_ERROR);
        db.setIsError(isError != null && isError != 0);
        db.setStatus(record.get(TOOL_CALL.STATUS));
        db.setRound(record.get(TOOL_CALL.ROUND));
        db.setSeq(record.get(TOOL_CALL.SEQ));
        db.setCreatedAt(record.get(TOOL_CALL.CREATED_AT));
        db.setCompletedAt(record.get(TOOL_CALL.COMPLETED_AT));
        return db;
    }
}
