package com.work.shortkey.core.model;

import java.time.Instant;

/**
 * 永不分配的保留短键。
 */
public class ReservedKey {

    private final String value;
    private final String reason;
    private final Instant createdAt;

    public ReservedKey(String value, String reason, Instant createdAt) {
        if (value == null || value.trim().isEmpty()) {
            throw new IllegalArgumentException("value 不能为空");
        }
        this.value = value;
        this.reason = reason == null ? "" : reason;
        this.createdAt = createdAt;
    }

    public String getValue() {
        return value;
    }

    public String getReason() {
        return reason;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }
}
