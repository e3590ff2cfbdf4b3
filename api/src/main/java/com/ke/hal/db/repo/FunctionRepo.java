package com.ke.hal.db.repo;

import com.ke.hal.db.IdGenerator;
import com.ke.hal.db.entity.FunctionDb;
import lombok.RequiredArgsConstructor;
import org.apache.commons.lang3.StringUtils;
import org.jooq.DSLContext;
import org.jooq.Record;
import org.springframework.stereotype.Repository;

import java.util.List;

import static com.ke.hal.db.Tables.FUNCTION;

/**
 * Function 注册表
 */
@Repository
@RequiredArgsConstructor
public class FunctionRepo implements BaseRepo {

    private final DSLContext dsl;
    private final IdGenerator idGenerator;

    public FunctionDb findByName(String userId, String name) {
        return dsl.select(FUNCTION.fields())
                .from(FUNCTION.TABLE)
                .where(FUNCTION.USER_ID.eq(userId))
                .and(FUNCTION.NAME.eq(name))
                .fetchOne(this::toDb);
    }

    public List<FunctionDb> findByUserId(String userId) {
        return dsl.select(FUNCTION.fields())
                .from(FUNCTION.TABLE)
                .where(FUNCTION.USER_ID.eq(userId))
                .orderBy(FUNCTION.NAME.asc())
                .fetch(this::toDb);
    }

    public FunctionDb insert(FunctionDb function) {
        if(StringUtils.isBlank(function.getId())) {
            function.setId(idGenerator.generateId(IdGenerator.FUNCTION));
        }
        fillCreateTime(function);

        dsl.insertInto(FUNCTION.TABLE)
                .set(FUNCTION.ID, function.getId())
                .set(FUNCTION.USER_ID, function.getUserId())
                .set(FUNCTION.NAME, function.getName())
                .set(FUNCTION.DESCRIPTION, function.getDescription())
                .set(FUNCTION.PARAMETERS, function.getParameters())
                .set(FUNCTION.CREATED_AT, function.getCreatedAt())
                .set(FUNCTION.UPDATED_AT, function.getUpdatedAt())
                .execute();
        return function;
    }

    public boolean update(FunctionDb function) {
        fillUpdateTime(function);

        return dsl.update(FUNCTION.TABLE)
                .set(FUNCTION.DESCRIPTION, function.getDescription())
                .set(FUNCTION.PARAMETERS, function.getParameters())
                .set(FUNCTION.UPDATED_AT, function.getUpdatedAt())
                .where(FUNCTION.ID.eq(function.getId()))
                .execute() > 0;
    }

    private FunctionDb toDb(Record record) {
        FunctionDb db = new FunctionDb();
        db.setId(record.get(FUNCTION.ID));
        db.setUserId(record.get(FUNCTION.USER_ID));
        db.setName(record.get(FUNCTION.NAME));
        db.setDescription(record.get(FUNCTION.DESCRIPTION));
        db.setParameters(record.get(FUNCTION.PARAMETERS));
        db.setCreatedAt(record.get(FUNCTION.CREATED_AT));
        db.setUpdatedAt(record.get(FUNCTION.UPDATED_AT));
        return db;
    }
}
