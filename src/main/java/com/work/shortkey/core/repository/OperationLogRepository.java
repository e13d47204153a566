package com.work.shortkey.core.repository;

import com.work.shortkey.core.model.OperationKind;
import com.work.shortkey.core.model.OperationLogEntry;

import java.time.Instant;
import java.util.List;

/**
 * 操作日志：只追加，从不修改或删除。
 */
public interface OperationLogRepository {

    void append(long recordId, OperationKind kind, String details, Instant timestamp);

    List<OperationLogEntry> listByRecord(long recordId);

    long countByKind(OperationKind kind);
}
