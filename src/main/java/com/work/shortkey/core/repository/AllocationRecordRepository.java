package com.work.shortkey.core.repository;

import com.work.shortkey.core.model.AllocationRecord;
import com.work.shortkey.core.model.RecordStatus;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * 分配记录表的数据访问抽象，真实项目中由 MyBatis-Plus 实现。
 * <p>
 * 约定：
 * 1. 唯一约束冲突以 {@link com.work.shortkey.core.exception.UniqueConflictException} 抛出，并区分 fingerprint / identifier
 * 2. 超时、连接失败以 {@link com.work.shortkey.core.exception.TransientStorageException} 抛出
 * 3. 事务边界由 Service 层统一管理
 */
public interface AllocationRecordRepository {

    Optional<AllocationRecord> findByFingerprint(String fingerprint);

    /**
     * 仅返回 ACTIVE 记录。
     */
    Optional<AllocationRecord> findActiveByIdentifier(String identifier);

    /**
     * 任意状态下是否已有记录占用该短键（短键不回收）。
     */
    boolean existsByIdentifier(String identifier);

    /**
     * 插入一条新记录；record.identifier 可以为 null（延迟分配）。
     *
     * @return 带数据库主键的记录
     */
    AllocationRecord insert(AllocationRecord record);

    /**
     * 仅当记录当前没有短键时写入短键。
     *
     * @return 更新行数；0 表示记录不存在或已有短键
     */
    int assignIdentifierIfAbsent(String fingerprint, String identifier, int length, String salt, Instant assignedAt);

    int incrementAccess(String fingerprint, Instant accessedAt);

    int updateUploadInfo(String fingerprint, String storageKey, String url, Instant updatedAt);

    /**
     * 条件状态迁移：只有当前状态为 expected 时才更新。
     */
    int transitionStatus(String fingerprint, RecordStatus expected, RecordStatus target, Instant updatedAt);

    /**
     * 按 id 升序列出尚未分配短键的 ACTIVE 记录。
     */
    List<AllocationRecord> listMissingIdentifier(int limit);

    long countWithIdentifier();

    long countMissingIdentifier();
}
