package com.work.shortkey.core.support;

import com.work.shortkey.core.model.OperationKind;
import com.work.shortkey.core.model.OperationLogEntry;
import com.work.shortkey.core.repository.OperationLogRepository;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 纯内存操作日志，只追加。
 */
public class InMemoryOperationLogRepository implements OperationLogRepository {

    private final List<OperationLogEntry> entries = new ArrayList<>();

    @Override
    public synchronized void append(long recordId, OperationKind kind, String details, Instant timestamp) {
        entries.add(new OperationLogEntry(entries.size() + 1L, recordId, kind, details, timestamp));
    }

    @Override
    public synchronized List<OperationLogEntry> listByRecord(long recordId) {
        return entries.stream()
                .filter(e -> e.getRecordId() == recordId)
                .collect(Collectors.toList());
    }

    @Override
    public synchronized long countByKind(OperationKind kind) {
        return entries.stream().filter(e -> e.getKind() == kind).count();
    }
}
