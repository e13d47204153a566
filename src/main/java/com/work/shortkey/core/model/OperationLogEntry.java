package com.work.shortkey.core.model;

import java.time.Instant;

/**
 * 只追加的操作事实。details 为 JSON 文本（可为空）。
 */
public class OperationLogEntry {

    private final long id;
    private final long recordId;
    private final OperationKind kind;
    private final String details;
    private final Instant timestamp;

    public OperationLogEntry(long id, long recordId, OperationKind kind, String details, Instant timestamp) {
        if (kind == null) {
            throw new IllegalArgumentException("kind 不能为null");
        }
        this.id = id;
        this.recordId = recordId;
        this.kind = kind;
        this.details = details;
        this.timestamp = timestamp;
    }

    public long getId() {
        return id;
    }

    public long getRecordId() {
        return recordId;
    }

    public OperationKind getKind() {
        return kind;
    }

    public String getDetails() {
        return details;
    }

    public Instant getTimestamp() {
        return timestamp;
    }
}
