package com.work.shortkey.core.repository.impl;

import com.work.shortkey.core.exception.IntegrityViolationException;
import com.work.shortkey.core.model.AllocationRecord;
import com.work.shortkey.core.model.RecordStatus;
import com.work.shortkey.core.repository.AllocationRecordRepository;
import com.work.shortkey.core.repository.entity.AllocationRecordEntity;
import com.work.shortkey.core.repository.mapper.AllocationRecordMapper;
import com.work.shortkey.core.support.JsonSupport;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static com.work.shortkey.core.support.ValidationUtils.requireNonEmpty;
import static com.work.shortkey.core.support.ValidationUtils.requireNonNull;
import static com.work.shortkey.core.support.ValidationUtils.requirePositive;

/**
 * 基于 PostgreSQL + MyBatis-Plus 的 AllocationRecordRepository 实现
 * <p>
 * 注意：
 * 1. 所有方法都由 Service 层包在事务中调用，这里不声明 @Transactional
 * 2. fingerprint / identifier 的唯一性完全交给数据库约束裁决
 */
@Repository
public class PostgresAllocationRecordRepository implements AllocationRecordRepository {

    private final AllocationRecordMapper recordMapper;

    public PostgresAllocationRecordRepository(AllocationRecordMapper recordMapper) {
        this.recordMapper = recordMapper;
    }

    @Override
    public Optional<AllocationRecord> findByFingerprint(String fingerprint) {
        requireNonEmpty(fingerprint, "fingerprint");
        AllocationRecordEntity entity = StorageExceptionTranslator.call("按指纹查询",
                () -> recordMapper.selectByFingerprint(fingerprint));
        return Optional.ofNullable(entity).map(this::convertToRecord);
    }

    @Override
    public Optional<AllocationRecord> findActiveByIdentifier(String identifier) {
        requireNonEmpty(identifier, "identifier");
        AllocationRecordEntity entity = StorageExceptionTranslator.call("按短键查询",
                () -> recordMapper.selectActiveByIdentifier(identifier));
        return Optional.ofNullable(entity).map(this::convertToRecord);
    }

    @Override
    public boolean existsByIdentifier(String identifier) {
        requireNonEmpty(identifier, "identifier");
        return StorageExceptionTranslator.call("短键存在性检查", () -> recordMapper.existsByIdentifier(identifier));
    }

    @Override
    public AllocationRecord insert(AllocationRecord record) {
        requireNonNull(record, "record");
        requireNonEmpty(record.getFingerprint(), "record.fingerprint");

        AllocationRecordEntity entity = convertToEntity(record);
        int inserted = StorageExceptionTranslator.call("插入分配记录", () -> recordMapper.insert(entity));
        if (inserted != 1 || entity.getId() == null) {
            throw new IntegrityViolationException("插入分配记录失败: " + record.getFingerprint());
        }
        AllocationRecord saved = record.copy();
        saved.setId(entity.getId());
        return saved;
    }

    @Override
    public int assignIdentifierIfAbsent(String fingerprint, String identifier, int length, String salt, Instant assignedAt) {
        requireNonEmpty(fingerprint, "fingerprint");
        requireNonEmpty(identifier, "identifier");
        requireNonNull(assignedAt, "assignedAt");
        return StorageExceptionTranslator.call("回填短键",
                () -> recordMapper.assignIdentifierIfAbsent(fingerprint, identifier, length, salt, assignedAt));
    }

    @Override
    public int incrementAccess(String fingerprint, Instant accessedAt) {
        requireNonEmpty(fingerprint, "fingerprint");
        return StorageExceptionTranslator.call("更新访问计数",
                () -> recordMapper.incrementAccess(fingerprint, accessedAt));
    }

    @Override
    public int updateUploadInfo(String fingerprint, String storageKey, String url, Instant updatedAt) {
        requireNonEmpty(fingerprint, "fingerprint");
        return StorageExceptionTranslator.call("更新上传信息",
                () -> recordMapper.updateUploadInfo(fingerprint, storageKey, url, updatedAt));
    }

    @Override
    public int transitionStatus(String fingerprint, RecordStatus expected, RecordStatus target, Instant updatedAt) {
        requireNonEmpty(fingerprint, "fingerprint");
        requireNonNull(expected, "expected");
        requireNonNull(target, "target");
        return StorageExceptionTranslator.call("状态迁移",
                () -> recordMapper.transitionStatus(fingerprint, expected.name(), target.name(), updatedAt));
    }

    @Override
    public List<AllocationRecord> listMissingIdentifier(int limit) {
        requirePositive(limit, "limit");
        List<AllocationRecordEntity> entities = StorageExceptionTranslator.call("查询未分配短键的记录",
                () -> recordMapper.listMissingIdentifier(limit));
        List<AllocationRecord> result = new ArrayList<>(entities.size());
        for (AllocationRecordEntity e : entities) {
            result.add(convertToRecord(e));
        }
        return result;
    }

    @Override
    public long countWithIdentifier() {
        return StorageExceptionTranslator.call("统计已分配短键", recordMapper::countWithIdentifier);
    }

    @Override
    public long countMissingIdentifier() {
        return StorageExceptionTranslator.call("统计未分配短键", recordMapper::countMissingIdentifier);
    }

    private AllocationRecordEntity convertToEntity(AllocationRecord r) {
        AllocationRecordEntity e = new AllocationRecordEntity();
        e.setFingerprint(r.getFingerprint());
        e.setIdentifier(r.getIdentifier());
        e.setIdentifierLength(r.getIdentifierLength());
        e.setGenerationSalt(r.getGenerationSalt());
        e.setOriginalFilename(r.getOriginalFilename());
        e.setFileExtension(r.getFileExtension());
        e.setFileSize(r.getFileSize());
        e.setMimeType(r.getMimeType());
        e.setStorageKey(r.getStorageKey());
        e.setUrl(r.getUrl());
        e.setStatus(r.getStatus().name());
        e.setAccessCount(r.getAccessCount());
        e.setLastAccessedAt(r.getLastAccessedAt());
        e.setMetadata(JsonSupport.writeMetadata(r.getMetadata()));
        e.setCreatedAt(r.getCreatedAt());
        e.setIdentifierAssignedAt(r.getIdentifierAssignedAt());
        e.setUpdatedAt(r.getUpdatedAt());
        return e;
    }

    /**
     * 转换为领域模型，处理状态枚举转换
     */
    private AllocationRecord convertToRecord(AllocationRecordEntity e) {
        RecordStatus status;
        try {
            status = RecordStatus.valueOf(e.getStatus());
        } catch (IllegalArgumentException | NullPointerException ex) {
            throw new IntegrityViolationException("无效的记录状态: " + e.getStatus() + " for " + e.getFingerprint(), ex);
        }
        AllocationRecord r = new AllocationRecord();
        r.setId(e.getId());
        r.setFingerprint(e.getFingerprint());
        r.setIdentifier(e.getIdentifier());
        r.setIdentifierLength(e.getIdentifierLength());
        r.setGenerationSalt(e.getGenerationSalt());
        r.setOriginalFilename(e.getOriginalFilename());
        r.setFileExtension(e.getFileExtension());
        r.setFileSize(e.getFileSize() == null ? 0L : e.getFileSize());
        r.setMimeType(e.getMimeType());
        r.setStorageKey(e.getStorageKey());
        r.setUrl(e.getUrl());
        r.setStatus(status);
        r.setAccessCount(e.getAccessCount() == null ? 0L : e.getAccessCount());
        r.setLastAccessedAt(e.getLastAccessedAt());
        r.setMetadata(JsonSupport.readMetadata(e.getMetadata()));
        r.setCreatedAt(e.getCreatedAt());
        r.setIdentifierAssignedAt(e.getIdentifierAssignedAt());
        r.setUpdatedAt(e.getUpdatedAt());
        return r;
    }
}
