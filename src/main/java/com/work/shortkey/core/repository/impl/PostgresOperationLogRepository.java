package com.work.shortkey.core.repository.impl;

import com.work.shortkey.core.exception.IntegrityViolationException;
import com.work.shortkey.core.model.OperationKind;
import com.work.shortkey.core.model.OperationLogEntry;
import com.work.shortkey.core.repository.OperationLogRepository;
import com.work.shortkey.core.repository.entity.OperationLogEntity;
import com.work.shortkey.core.repository.mapper.OperationLogMapper;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static com.work.shortkey.core.support.ValidationUtils.requireNonNull;

@Repository
public class PostgresOperationLogRepository implements OperationLogRepository {

    private final OperationLogMapper logMapper;

    public PostgresOperationLogRepository(OperationLogMapper logMapper) {
        this.logMapper = logMapper;
    }

    @Override
    public void append(long recordId, OperationKind kind, String details, Instant timestamp) {
        requireNonNull(kind, "kind");
        requireNonNull(timestamp, "timestamp");
        int inserted = StorageExceptionTranslator.call("写入操作日志",
                () -> logMapper.append(recordId, kind.name(), details, timestamp));
        if (inserted != 1) {
            throw new IntegrityViolationException("写入操作日志失败: record=" + recordId + ", kind=" + kind);
        }
    }

    @Override
    public List<OperationLogEntry> listByRecord(long recordId) {
        List<OperationLogEntity> entities = StorageExceptionTranslator.call("查询操作日志",
                () -> logMapper.selectByRecord(recordId));
        List<OperationLogEntry> result = new ArrayList<>(entities.size());
        for (OperationLogEntity e : entities) {
            result.add(new OperationLogEntry(e.getId(), e.getRecordId(),
                    OperationKind.valueOf(e.getOperationKind()), e.getDetails(), e.getCreatedAt()));
        }
        return result;
    }

    @Override
    public long countByKind(OperationKind kind) {
        requireNonNull(kind, "kind");
        return StorageExceptionTranslator.call("统计操作日志", () -> logMapper.countByKind(kind.name()));
    }
}
