package com.ke.hal.db.repo;

import java.util.List;
import java.util.function.Function;

import org.apache.commons.lang3.StringUtils;
import org.jooq.Condition;
import org.jooq.DSLContext;
import org.jooq.Field;
import org.jooq.Record;
import org.jooq.RecordMapper;
import org.jooq.Table;
import org.jooq.impl.DSL;

import com.ke.hal.db.entity.Timed;
import com.ke.hal.util.DateTimeUtils;

/**
 * 基础 Repository 接口
 */
public interface BaseRepo {

    /**
     * 填充创建时间信息
     */
    default void fillCreateTime(Object object) {
        if(object instanceof Timed timed) {
            long now = DateTimeUtils.getCurrentSeconds();
            timed.setCreatedAt(now);
            timed.setUpdatedAt(now);
        }
    }

    /**
     * 填充更新时间信息
     */
    default void fillUpdateTime(Object object) {
        if(object instanceof Timed timed) {
            timed.setUpdatedAt(DateTimeUtils.getCurrentSeconds());
        }
    }

    /**
     * 通用的基于游标的分页查询，按 (sortField, id) 排序，同一秒内创建的记录也不会丢失或重复
     *
     * @param dsl DSL上下文
     * @param table 查询的表
     * @param fields 查询的字段
     * @param baseCondition 基础查询条件
     * @param sortField 排序字段
     * @param idField 主键字段
     * @param after 游标after参数
     * @param before 游标before参数
     * @param limit 限制条数
     * @param order 排序方式 (asc/desc)
     * @param sortKeyFunc 根据游标ID获取排序值，游标不存在时返回null
     * @param mapper 记录映射
     * @return 查询结果列表
     */
    default <T> List<T> findWithCursor(
            DSLContext dsl,
            Table<Record> table,
            Field<?>[] fields,
            Condition baseCondition,
            Field<Long> sortField,
            Field<String> idField,
            String after,
            String before,
            int limit,
            String order,
            Function<String, Long> sortKeyFunc,
            RecordMapper<Record, T> mapper) {

        boolean asc = "asc".equalsIgnoreCase(order);
        Condition condition = baseCondition;

        if (StringUtils.isNotBlank(after)) {
            Long key = sortKeyFunc.apply(after);
            if (key != null) {
                condition = condition.and(asc
                        ? DSL.row(sortField, idField).gt(key, after)
                        : DSL.row(sortField, idField).lt(key, after));
            }
        }

        if (StringUtils.isNotBlank(before)) {
            Long key = sortKeyFunc.apply(before);
            if (key != null) {
                condition = condition.and(asc
                        ? DSL.row(sortField, idField).lt(key, before)
                        : DSL.row(sortField, idField).gt(key, before));
            }
        }

        return dsl.select(fields)
                .from(table)
                .where(condition)
                .orderBy(asc ? sortField.asc() : sortField.desc(), asc ? idField.asc() : idField.desc())
                .limit(limit)
                .fetch(mapper);
    }
}
