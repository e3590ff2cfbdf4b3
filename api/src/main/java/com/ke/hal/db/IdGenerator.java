package com.ke.hal.db;

import static com.ke.hal.db.Tables.ID_SEQUENCE;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

import org.jooq.DSLContext;
import org.jooq.Record1;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import lombok.extern.slf4j.Slf4j;

/**
 * ID 生成器 生成逻辑：前缀_自增数字
 * 采用批量获取 + 内存缓存的方式提高性能
 */
@Component
@Slf4j
public class IdGenerator {

    public static final String ASSISTANT = "asst";
    public static final String THREAD = "thread";
    public static final String MESSAGE = "msg";
    public static final String RUN = "run";
    public static final String TOOL_CALL = "call";
    public static final String RUN_STEP = "step";
    public static final String FUNCTION = "func";
    public static final String CHUNK = "chunk";

    private static final int BATCH_SIZE = 100; // 每次批量获取的ID数量

    // 内存中的ID区间缓存 prefix -> IdRange
    private final ConcurrentHashMap<String, IdRange> idRangeCache = new ConcurrentHashMap<>();
    // 每个前缀的锁，确保批量获取ID时的串行性
    private final ConcurrentHashMap<String, ReentrantLock> prefixLocks = new ConcurrentHashMap<>();
    @Autowired
    private DSLContext db;

    /**
     * 生成递增ID
     *
     * @param prefix 前缀 (如 "asst", "msg", "run" 等)
     * @return 生成的 ID (如 "asst_1", "msg_123")
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW, timeout = 30)
    public String generateId(String prefix) {
        IdRange range = idRangeCache.get(prefix);
        if (range != null) {
            Long nextId = range.getNextId();
            if (nextId != null) {
                return prefix + "_" + nextId;
            }
        }

        ReentrantLock lock = prefixLocks.computeIfAbsent(prefix, k -> new ReentrantLock());
        lock.lock();
        try {
            // 双重检查，防止并发时重复获取
            range = idRangeCache.get(prefix);
            if (range != null) {
                Long nextId = range.getNextId();
                if (nextId != null) {
                    return prefix + "_" + nextId;
                }
            }

            IdRange newRange = batchAcquireIdRange(prefix);
            idRangeCache.put(prefix, newRange);
            return prefix + "_" + newRange.getNextId();
        } finally {
            lock.unlock();
        }
    }

    /**
     * 批量获取ID区间 - 使用数据库行锁保证分布式环境下的串行性
     */
    private IdRange batchAcquireIdRange(String prefix) {
        Record1<Long> existing = db.select(ID_SEQUENCE.CURRENT_VALUE)
                .from(ID_SEQUENCE.TABLE)
                .where(ID_SEQUENCE.PREFIX.eq(prefix))
                .forUpdate()
                .fetchOne();

        if (existing == null) {
            log.info("创建ID序列记录: prefix={}", prefix);
            try {
                db.insertInto(ID_SEQUENCE.TABLE)
                        .set(ID_SEQUENCE.PREFIX, prefix)
                        .set(ID_SEQUENCE.CURRENT_VALUE, (long) BATCH_SIZE)
                        .execute();
                return new IdRange(1L, BATCH_SIZE);
            } catch (DuplicateKeyException e) {
                // 其他实例已创建，重新加锁读取
                log.debug("ID序列记录已被并发创建: prefix={}", prefix);
                return batchAcquireIdRange(prefix);
            }
        }

        long startId = existing.value1() + 1;
        long endId = startId + BATCH_SIZE - 1;

        // 已经通过forUpdate()锁定了记录，不需要乐观锁
        db.update(ID_SEQUENCE.TABLE)
                .set(ID_SEQUENCE.CURRENT_VALUE, endId)
                .where(ID_SEQUENCE.PREFIX.eq(prefix))
                .execute();

        log.debug("批量获取ID区间: prefix={}, startId={}, endId={}", prefix, startId, endId);
        return new IdRange(startId, endId);
    }

    /**
     * ID区间缓存
     */
    private static class IdRange {
        private final AtomicLong currentId;
        private final long maxId;

        IdRange(long startId, long maxId) {
            this.currentId = new AtomicLong(startId);
            this.maxId = maxId;
        }

        Long getNextId() {
            long nextId = currentId.getAndIncrement();
            if (nextId > maxId) {
                return null; // 区间已用完
            }
            return nextId;
        }
    }
}
