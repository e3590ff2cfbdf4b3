package com.ke.hal.db;

import org.jooq.DataType;
import org.jooq.Field;
import org.jooq.Record;
import org.jooq.Table;
import org.jooq.impl.DSL;
import org.jooq.impl.SQLDataType;

/**
 * 表与字段定义，与 db/schema.sql 保持一致
 */
public final class Tables {

    public static final AssistantTable ASSISTANT = new AssistantTable();
    public static final ThreadTable THREAD = new ThreadTable();
    public static final MessageTable MESSAGE = new MessageTable();
    public static final RunTable RUN = new RunTable();
    public static final ToolCallTable TOOL_CALL = new ToolCallTable();
    public static final RunStepTable RUN_STEP = new RunStepTable();
    public static final FunctionTable FUNCTION = new FunctionTable();
    public static final ChunkTable CHUNK = new ChunkTable();
    public static final IdSequenceTable ID_SEQUENCE = new IdSequenceTable();

    private Tables() {
    }

    static Table<Record> table(String name) {
        return DSL.table(DSL.name(name));
    }

    static <T> Field<T> field(String name, DataType<T> type) {
        return DSL.field(DSL.name(name), type);
    }

    public static final class AssistantTable {
        public final Table<Record> TABLE = table("assistants");
        public final Field<String> ID = field("id", SQLDataType.VARCHAR);
        public final Field<String> USER_ID = field("user_id", SQLDataType.VARCHAR);
        public final Field<String> NAME = field("name", SQLDataType.VARCHAR);
        public final Field<String> DESCRIPTION = field("description", SQLDataType.VARCHAR);
        public final Field<String> MODEL = field("model", SQLDataType.VARCHAR);
        public final Field<String> INSTRUCTIONS = field("instructions", SQLDataType.CLOB);
        public final Field<String> TOOLS = field("tools", SQLDataType.CLOB);
        public final Field<String> FILE_IDS = field("file_ids", SQLDataType.CLOB);
        public final Field<String> METADATA = field("metadata", SQLDataType.CLOB);
        public final Field<Long> CREATED_AT = field("created_at", SQLDataType.BIGINT);
        public final Field<Long> UPDATED_AT = field("updated_at", SQLDataType.BIGINT);

        public Field<?>[] fields() {
            return new Field<?>[] { ID, USER_ID, NAME, DESCRIPTION, MODEL, INSTRUCTIONS, TOOLS, FILE_IDS, METADATA, CREATED_AT, UPDATED_AT };
        }
    }

    public static final class ThreadTable {
        public final Table<Record> TABLE = table("threads");
        public final Field<String> ID = field("id", SQLDataType.VARCHAR);
        public final Field<String> USER_ID = field("user_id", SQLDataType.VARCHAR);
        public final Field<String> FILE_IDS = field("file_ids", SQLDataType.CLOB);
        public final Field<String> METADATA = field("metadata", SQLDataType.CLOB);
        public final Field<Long> MESSAGE_SEQ = field("message_seq", SQLDataType.BIGINT);
        public final Field<Long> CREATED_AT = field("created_at", SQLDataType.BIGINT);
        public final Field<Long> UPDATED_AT = field("updated_at", SQLDataType.BIGINT);

        public Field<?>[] fields() {
            return new Field<?>[] { ID, USER_ID, FILE_IDS, METADATA, MESSAGE_SEQ, CREATED_AT, UPDATED_AT };
        }
    }

    public static final class MessageTable {
        public final Table<Record> TABLE = table("messages");
        public final Field<String> ID = field("id", SQLDataType.VARCHAR);
        public final Field<String> THREAD_ID = field("thread_id", SQLDataType.VARCHAR);
        public final Field<String> USER_ID = field("user_id", SQLDataType.VARCHAR);
        public final Field<Long> SEQ = field("seq", SQLDataType.BIGINT);
        public final Field<String> ROLE = field("role", SQLDataType.VARCHAR);
        public final Field<String> CONTENT = field("content", SQLDataType.CLOB);
        public final Field<String> FILE_IDS = field("file_ids", SQLDataType.CLOB);
        public final Field<String> ASSISTANT_ID = field("assistant_id", SQLDataType.VARCHAR);
        public final Field<String> RUN_ID = field("run_id", SQLDataType.VARCHAR);
        public final Field<String> METADATA = field("metadata", SQLDataType.CLOB);
        public final Field<Long> CREATED_AT = field("created_at", SQLDataType.BIGINT);

        public Field<?>[] fields() {
            return new Field<?>[] { ID, THREAD_ID, USER_ID, SEQ, ROLE, CONTENT, FILE_IDS, ASSISTANT_ID, RUN_ID, METADATA, CREATED_AT };
        }
    }

    public static final class RunTable {
        public final Table<Record> TABLE = table("runs");
        public final Field<String> ID = field("id", SQLDataType.VARCHAR);
        public final Field<String> THREAD_ID = field("thread_id", SQLDataType.VARCHAR);
        public final Field<String> ASSISTANT_ID = field("assistant_id", SQLDataType.VARCHAR);
        public final Field<String> USER_ID = field("user_id", SQLDataType.VARCHAR);
        public final Field<String> STATUS = field("status", SQLDataType.VARCHAR);
        public final Field<String> REQUIRED_ACTION = field("required_action", SQLDataType.CLOB);
        public final Field<String> LAST_ERROR = field("last_error", SQLDataType.CLOB);
        public final Field<String> SNAPSHOT = field("snapshot", SQLDataType.CLOB);
        public final Field<String> METADATA = field("metadata", SQLDataType.CLOB);
        public final Field<Integer> ATTEMPTS = field("attempts", SQLDataType.INTEGER);
        public final Field<Integer> VERSION = field("version", SQLDataType.INTEGER);
        public final Field<Long> CREATED_AT = field("created_at", SQLDataType.BIGINT);
        public final Field<Long> UPDATED_AT = field("updated_at", SQLDataType.BIGINT);
        public final Field<Long> EXPIRES_AT = field("expires_at", SQLDataType.BIGINT);
        public final Field<Long> STARTED_AT = field("started_at", SQLDataType.BIGINT);
        public final Field<Long> CANCELLED_AT = field("cancelled_at", SQLDataType.BIGINT);
        public final Field<Long> FAILED_AT = field("failed_at", SQLDataType.BIGINT);
        public final Field<Long> COMPLETED_AT = field("completed_at", SQLDataType.BIGINT);

        public Field<?>[] fields() {
            return new Field<?>[] { ID, THREAD_ID, ASSISTANT_ID, USER_ID, STATUS, REQUIRED_ACTION, LAST_ERROR, SNAPSHOT, METADATA,
                    ATTEMPTS, VERSION, CREATED_AT, UPDATED_AT, EXPIRES_AT, STARTED_AT, CANCELLED_AT, FAILED_AT, COMPLETED_AT };
        }
    }

    public static final class ToolCallTable {
        public final Table<Record> TABLE = table("tool_calls");
        public final Field<String> ID = field("id", SQLDataType.VARCHAR);
        public final Field<String> RUN_ID = field("run_id", SQLDataType.VARCHAR);
        public final Field<String> TYPE = field("type", SQLDataType.VARCHAR);
        public final Field<String> NAME = field("name", SQLDataType.VARCHAR);
        public final Field<String> ARGUMENTS = field("arguments", SQLDataType.CLOB);
        public final Field<String> OUTPUT = field("output", SQLDataType.CLOB);
        public final Field<Integer> IS_ERROR = field("is_error", SQLDataType.INTEGER);
        public final Field<String> STATUS = field("status", SQLDataType.VARCHAR);
        public final Field<Integer> ROUND = field("round", SQLDataType.INTEGER);
        public final Field<Integer> SEQ = field("seq", SQLDataType.INTEGER);
        public final Field<Long> CREATED_AT = field("created_at", SQLDataType.BIGINT);
        public final Field<Long> COMPLETED_AT = field("completed_at", SQLDataType.BIGINT);

        public Field<?>[] fields() {
            return new Field<?>[] { ID, RUN_ID, TYPE, NAME, ARGUMENTS, OUTPUT, IS_ERROR, STATUS, ROUND, SEQ, CREATED_AT, COMPLETED_AT };
        }
    }

    public static final class RunStepTable {
        public final Table<Record> TABLE = table("run_steps");
        public final Field<String> ID = field("id", SQLDataType.VARCHAR);
        public final Field<String> RUN_ID = field("run_id", SQLDataType.VARCHAR);
        public final Field<String> THREAD_ID = field("thread_id", SQLDataType.VARCHAR);
        public final Field<String> ASSISTANT_ID = field("assistant_id", SQLDataType.VARCHAR);
        public final Field<String> USER_ID = field("user_id", SQLDataType.VARCHAR);
        public final Field<String> TYPE = field("type", SQLDataType.VARCHAR);
        public final Field<String> STATUS = field("status", SQLDataType.VARCHAR);
        public final Field<Long> STEP_NUMBER = field("step_number", SQLDataType.BIGINT);
        public final Field<String> MESSAGE_ID = field("message_id", SQLDataType.VARCHAR);
        public final Field<Long> CREATED_AT = field("created_at", SQLDataType.BIGINT);
        public final Field<Long> UPDATED_AT = field("updated_at", SQLDataType.BIGINT);
        public final Field<Long> COMPLETED_AT = field("completed_at", SQLDataType.BIGINT);
        public final Field<Long> CANCELLED_AT = field("cancelled_at", SQLDataType.BIGINT);
        public final Field<Long> FAILED_AT = field("failed_at", SQLDataType.BIGINT);
        public final Field<Long> EXPIRED_AT = field("expired_at", SQLDataType.BIGINT);

        public Field<?>[] fields() {
            return new Field<?>[] { ID, RUN_ID, THREAD_ID, ASSISTANT_ID, USER_ID, TYPE, STATUS, STEP_NUMBER, MESSAGE_ID,
                    CREATED_AT, UPDATED_AT, COMPLETED_AT, CANCELLED_AT, FAILED_AT, EXPIRED_AT };
        }
    }

    public static final class FunctionTable {
        public final Table<Record> TABLE = table("functions");
        public final Field<String> ID = field("id", SQLDataType.VARCHAR);
        public final Field<String> USER_ID = field("user_id", SQLDataType.VARCHAR);
        public final Field<String> NAME = field("name", SQLDataType.VARCHAR);
        public final Field<String> DESCRIPTION = field("description", SQLDataType.CLOB);
        public final Field<String> PARAMETERS = field("parameters", SQLDataType.CLOB);
        public final Field<Long> CREATED_AT = field("created_at", SQLDataType.BIGINT);
        public final Field<Long> UPDATED_AT = field("updated_at", SQLDataType.BIGINT);

        public Field<?>[] fields() {
            return new Field<?>[] { ID, USER_ID, NAME, DESCRIPTION, PARAMETERS, CREATED_AT, UPDATED_AT };
        }
    }

    public static final class ChunkTable {
        public final Table<Record> TABLE = table("chunks");
        public final Field<String> ID = field("id", SQLDataType.VARCHAR);
        public final Field<String> FILE_ID = field("file_id", SQLDataType.VARCHAR);
        public final Field<Integer> SEQ = field("seq", SQLDataType.INTEGER);
        public final Field<Integer> START_OFFSET = field("start_offset", SQLDataType.INTEGER);
        public final Field<Integer> END_OFFSET = field("end_offset", SQLDataType.INTEGER);
        public final Field<String> CONTENT = field("content", SQLDataType.CLOB);
        public final Field<Long> CREATED_AT = field("created_at", SQLDataType.BIGINT);

        public Field<?>[] fields() {
            return new Field<?>[] { ID, FILE_ID, SEQ, START_OFFSET, END_OFFSET, CONTENT, CREATED_AT };
        }
    }

    public static final class IdSequenceTable {
        public final Table<Record> TABLE = table("id_sequence");
        public final Field<String> PREFIX = field("prefix", SQLDataType.VARCHAR);
        public final Field<Long> CURRENT_VALUE = field("current_value", SQLDataType.BIGINT);
    }
}
