package com.work.shortkey.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * 记录的可选结构化附加信息：键值属性 + 标签。
 * <p>
 * 构造时即完成校验，非法输入抛 IllegalArgumentException；“没有附加信息”用 null 表示，而不是空对象。
 */
public final class RecordMetadata {

    public static final int MAX_ENTRIES = 32;
    public static final int MAX_VALUE_LENGTH = 512;
    public static final int MAX_TAG_LENGTH = 64;

    private static final Pattern KEY_PATTERN = Pattern.compile("^[a-zA-Z][a-zA-Z0-9_.-]{0,63}$");

    private final Map<String, String> attributes;
    private final List<String> tags;

    @JsonCreator
    public RecordMetadata(@JsonProperty("attributes") Map<String, String> attributes,
                          @JsonProperty("tags") List<String> tags) {
        this.attributes = validateAttributes(attributes);
        this.tags = validateTags(tags);
    }

    public static RecordMetadata of(Map<String, String> attributes, List<String> tags) {
        return new RecordMetadata(attributes, tags);
    }

    private static Map<String, String> validateAttributes(Map<String, String> raw) {
        if (raw == null || raw.isEmpty()) {
            return Collections.emptyMap();
        }
        if (raw.size() > MAX_ENTRIES) {
            throw new IllegalArgumentException("metadata.attributes 最多 " + MAX_ENTRIES + " 项");
        }
        Map<String, String> copy = new LinkedHashMap<>();
        for (Map.Entry<String, String> e : raw.entrySet()) {
            String key = e.getKey();
            if (key == null || !KEY_PATTERN.matcher(key).matches()) {
                throw new IllegalArgumentException("metadata.attributes 键非法: " + key);
            }
            String value = e.getValue();
            if (value == null) {
                throw new IllegalArgumentException("metadata.attributes 值不能为null: " + key);
            }
            if (value.length() > MAX_VALUE_LENGTH) {
                throw new IllegalArgumentException("metadata.attributes 值过长: " + key);
            }
            copy.put(key, value);
        }
        return Collections.unmodifiableMap(copy);
    }

    private static List<String> validateTags(List<String> raw) {
        if (raw == null || raw.isEmpty()) {
            return Collections.emptyList();
        }
        Set<String> distinct = new LinkedHashSet<>();
        for (String tag : raw) {
            if (tag == null || tag.trim().isEmpty()) {
                throw new IllegalArgumentException("metadata.tags 不能包含空标签");
            }
            String t = tag.trim();
            if (t.length() > MAX_TAG_LENGTH) {
                throw new IllegalArgumentException("metadata.tags 标签过长: " + t);
            }
            distinct.add(t);
        }
        if (distinct.size() > MAX_ENTRIES) {
            throw new IllegalArgumentException("metadata.tags 最多 " + MAX_ENTRIES + " 个");
        }
        return Collections.unmodifiableList(new ArrayList<>(distinct));
    }

    public Map<String, String> getAttributes() {
        return attributes;
    }

    public List<String> getTags() {
        return tags;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof RecordMetadata)) {
            return false;
        }
        RecordMetadata that = (RecordMetadata) o;
        return attributes.equals(that.attributes) && tags.equals(that.tags);
    }

    @Override
    public int hashCode() {
        return Objects.hash(attributes, tags);
    }
}
