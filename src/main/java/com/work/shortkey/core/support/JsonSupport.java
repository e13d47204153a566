package com.work.shortkey.core.support;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.work.shortkey.core.exception.IntegrityViolationException;
import com.work.shortkey.core.model.RecordMetadata;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * JSON 列（metadata / 操作日志 details）的序列化与反序列化。
 */
public final class JsonSupport {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private JsonSupport() {
        throw new AssertionError("工具类不允许实例化");
    }

    public static String writeMetadata(RecordMetadata metadata) {
        if (metadata == null) {
            return null;
        }
        return write(metadata);
    }

    /**
     * 库中的 metadata 无法解析说明数据被外部改坏了，按完整性错误处理而不是静默丢弃。
     */
    public static RecordMetadata readMetadata(String json) {
        if (json == null || json.trim().isEmpty()) {
            return null;
        }
        try {
            return MAPPER.readValue(json, RecordMetadata.class);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new IntegrityViolationException("metadata 列无法解析", e);
        }
    }

    /**
     * 操作日志 details：按键值对顺序输出，便于人工排查。
     */
    public static String details(Object... keyValues) {
        if (keyValues == null || keyValues.length == 0) {
            return null;
        }
        if (keyValues.length % 2 != 0) {
            throw new IllegalArgumentException("keyValues 必须成对出现");
        }
        Map<String, Object> map = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            map.put(String.valueOf(keyValues[i]), keyValues[i + 1]);
        }
        return write(map);
    }

    private static String write(Object value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("JSON 序列化失败", e);
        }
    }
}
