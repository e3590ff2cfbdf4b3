package com.ke.hal.util;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ke.hal.exception.PersistenceException;
import org.apache.commons.lang3.StringUtils;

import java.util.Collections;
import java.util.Map;

/**
 * JSON 序列化工具，JSON 列的读写都经过这里
 */
public class JacksonUtils {

    public static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .setSerializationInclusion(JsonInclude.Include.NON_NULL);

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private JacksonUtils() {
    }

    public static String serialize(Object value) {
        if(value == null) {
            return null;
        }
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new PersistenceException("failed to serialize " + value.getClass().getSimpleName(), e);
        }
    }

    public static <T> T deserialize(String json, Class<T> type) {
        if(StringUtils.isBlank(json)) {
            return null;
        }
        try {
            return MAPPER.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new PersistenceException("failed to deserialize " + type.getSimpleName(), e);
        }
    }

    public static <T> T deserialize(String json, TypeReference<T> type) {
        if(StringUtils.isBlank(json)) {
            return null;
        }
        try {
            return MAPPER.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new PersistenceException("failed to deserialize " + type.getType(), e);
        }
    }

    /**
     * 模型给出的工具参数不保证是合法 JSON，解析失败返回 null 由调用方决定如何处理
     */
    public static Map<String, Object> toMapOrNull(String json) {
        if(StringUtils.isBlank(json)) {
            return Collections.emptyMap();
        }
        try {
            Map<String, Object> map = MAPPER.readValue(json, MAP_TYPE);
            return map == null ? Collections.emptyMap() : map;
        } catch (JsonProcessingException e) {
            return null;
        }
    }
}
