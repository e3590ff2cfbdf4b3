package com.ke.hal.db.repo;

import com.ke.hal.db.IdGenerator;
import com.ke.hal.db.entity.AssistantDb;
import lombok.RequiredArgsConstructor;
import org.apache.commons.lang3.StringUtils;
import org.jooq.DSLContext;
import org.jooq.Record;
import org.springframework.stereotype.Repository;

import java.util.List;

import static com.ke.hal.db.Tables.ASSISTANT;

/**
 * Assistant Repository
 */
@Repository
@RequiredArgsConstructor
public class AssistantRepo implements BaseRepo {

    private final DSLContext dsl;
    private final IdGenerator idGenerator;

    public AssistantDb findById(String id) {
        return dsl.select(ASSISTANT.fields())
                .from(ASSISTANT.TABLE)
                .where(ASSISTANT.ID.eq(id))
                .fetchOne(this::toDb);
    }

    /**
     * 基于游标的分页查询用户的 Assistant
     */
    public List<AssistantDb> findByUserIdWithCursor(String userId, String after, String before, int limit, String order) {
        return findWithCursor(
                dsl,
                ASSISTANT.TABLE,
                ASSISTANT.fields(),
                ASSISTANT.USER_ID.eq(userId),
                ASSISTANT.CREATED_AT,
                ASSISTANT.ID,
                after,
                before,
                limit,
                order,
                id -> {
                    AssistantDb db = findById(id);
                    return db == null ? null : db.getCreatedAt();
                },
                this::toDb
        );
    }

    public AssistantDb insert(AssistantDb assistant) {
        if(StringUtils.isBlank(assistant.getId())) {
            assistant.setId(idGenerator.generateId(IdGenerator.ASSISTANT));
        }
        fillCreateTime(assistant);

        dsl.insertInto(ASSISTANT.TABLE)
                .set(ASSISTANT.ID, assistant.getId())
                .set(ASSISTANT.USER_ID, assistant.getUserId())
                .set(ASSISTANT.NAME, assistant.getName())
                .set(ASSISTANT.DESCRIPTION, assistant.getDescription())
                .set(ASSISTANT.MODEL, assistant.getModel())
                .set(ASSISTANT.INSTRUCTIONS, assistant.getInstructions())
                .set(ASSISTANT.TOOLS, assistant.getTools())
                .set(ASSISTANT.FILE_IDS, assistant.getFileIds())
                .set(ASSISTANT.METADATA, assistant.getMetadata())
                .set(ASSISTANT.CREATED_AT, assistant.getCreatedAt())
                .set(ASSISTANT.UPDATED_AT, assistant.getUpdatedAt())
                .execute();
        return assistant;
    }

    public boolean update(AssistantDb assistant) {
        fillUpdateTime(assistant);

        return dsl.update(ASSISTANT.TABLE)
                .set(ASSISTANT.NAME, assistant.getName())
                .set(ASSISTANT.DESCRIPTION, assistant.getDescription())
                .set(ASSISTANT.MODEL, assistant.getModel())
                .set(ASSISTANT.INSTRUCTIONS, assistant.getInstructions())
                .set(ASSISTANT.TOOLS, assistant.getTools())
                .set(ASSISTANT.FILE_IDS, assistant.getFileIds())
                .set(ASSISTANT.METADATA, assistant.getMetadata())
                .set(ASSISTANT.UPDATED_AT, assistant.getUpdatedAt())
                .where(ASSISTANT.ID.eq(assistant.getId()))
                .execute() > 0;
    }

    public boolean deleteById(String id) {
        return dsl.deleteFrom(ASSISTANT.TABLE)
                .where(ASSISTANT.ID.eq(id))
                .execute() > 0;
    }

    private AssistantDb toDb(Record record) {
        AssistantDb db = new AssistantDb();
        db.setId(record.get(ASSISTANT.ID));
        db.setUserId(record.get(ASSISTANT.USER_ID));
        db.setName(record.get(ASSISTANT.NAME));
        db.setDescription(record.get(ASSISTANT.DESCRIPTION));
        db.setModel(record.get(ASSISTANT.MODEL));
        db.setInstructions(record.get(ASSISTANT.INSTRUCTIONS));
        db.setTools(record.get(ASSISTANT.TOOLS));
        db.setFileIds(record.get(ASSISTANT.FILE_IDS));
        db.setMetadata(record.get(ASSISTANT.METADATA));
        db.setCreatedAt(record.get(ASSISTANT.CREATED_AT));
        db.setUpdatedAt(record.get(ASSISTANT.UPDATED_AT));
        return db;
    }
}
