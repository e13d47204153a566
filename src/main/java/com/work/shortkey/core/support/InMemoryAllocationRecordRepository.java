package com.work.shortkey.core.support;

import com.work.shortkey.core.exception.UniqueConflictException;
import com.work.shortkey.core.model.AllocationRecord;
import com.work.shortkey.core.model.RecordStatus;
import com.work.shortkey.core.repository.AllocationRecordRepository;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * 纯内存实现，方便在没有 Postgres 的环境下演示/测试组件行为。
 * 用一把锁模拟数据库的唯一约束裁决；不具备跨进程一致性。
 */
public class InMemoryAllocationRecordRepository implements AllocationRecordRepository {

    private final Map<String, AllocationRecord> byFingerprint = new HashMap<>();
    private final Map<String, String> identifierIndex = new HashMap<>();
    private long nextId = 1L;

    @Override
    public synchronized Optional<AllocationRecord> findByFingerprint(String fingerprint) {
        AllocationRecord r = byFingerprint.get(fingerprint);
        return r == null ? Optional.empty() : Optional.of(r.copy());
    }

    @Override
    public synchronized Optional<AllocationRecord> findActiveByIdentifier(String identifier) {
        String fingerprint = identifierIndex.get(identifier);
        if (fingerprint == null) {
            return Optional.empty();
        }
        AllocationRecord r = byFingerprint.get(fingerprint);
        return r.isActive() ? Optional.of(r.copy()) : Optional.empty();
    }

    @Override
    public synchronized boolean existsByIdentifier(String identifier) {
        return identifierIndex.containsKey(identifier);
    }

    @Override
    public synchronized AllocationRecord insert(AllocationRecord record) {
        if (byFingerprint.containsKey(record.getFingerprint())) {
            throw new UniqueConflictException(UniqueConflictException.Kind.FINGERPRINT,
                    "指纹唯一约束冲突: " + record.getFingerprint(), null);
        }
        if (record.getIdentifier() != null && identifierIndex.containsKey(record.getIdentifier())) {
            throw new UniqueConflictException(UniqueConflictException.Kind.IDENTIFIER,
                    "短键唯一约束冲突: " + record.getIdentifier(), null);
        }
        AllocationRecord stored = record.copy();
        stored.setId(nextId++);
        byFingerprint.put(stored.getFingerprint(), stored);
        if (stored.getIdentifier() != null) {
            identifierIndex.put(stored.getIdentifier(), stored.getFingerprint());
        }
        return stored.copy();
    }

    @Override
    public synchronized int assignIdentifierIfAbsent(String fingerprint, String identifier, int length,
                                                     String salt, Instant assignedAt) {
        AllocationRecord r = byFingerprint.get(fingerprint);
        if (r == null || r.getIdentifier() != null || !r.isActive()) {
            return 0;
        }
        if (identifierIndex.containsKey(identifier)) {
            throw new UniqueConflictException(UniqueConflictException.Kind.IDENTIFIER,
                    "短键唯一约束冲突: " + identifier, null);
        }
        r.setIdentifier(identifier);
        r.setIdentifierLength(length);
        r.setGenerationSalt(salt);
        r.setIdentifierAssignedAt(assignedAt);
        r.setUpdatedAt(assignedAt);
        identifierIndex.put(identifier, fingerprint);
        return 1;
    }

    @Override
    public synchronized int incrementAccess(String fingerprint, Instant accessedAt) {
        AllocationRecord r = byFingerprint.get(fingerprint);
        if (r == null) {
            return 0;
        }
        r.setAccessCount(r.getAccessCount() + 1);
        r.setLastAccessedAt(accessedAt);
        r.setUpdatedAt(accessedAt);
        return 1;
    }

    @Override
    public synchronized int updateUploadInfo(String fingerprint, String storageKey, String url, Instant updatedAt) {
        AllocationRecord r = byFingerprint.get(fingerprint);
        if (r == null || !r.isActive()) {
            return 0;
        }
        r.setStorageKey(storageKey);
        r.setUrl(url);
        r.setUpdatedAt(updatedAt);
        return 1;
    }

    @Override
    public synchronized int transitionStatus(String fingerprint, RecordStatus expected, RecordStatus target,
                                             Instant updatedAt) {
        AllocationRecord r = byFingerprint.get(fingerprint);
        if (r == null || r.getStatus() != expected) {
            return 0;
        }
        r.setStatus(target);
        r.setUpdatedAt(updatedAt);
        return 1;
    }

    @Override
    public synchronized List<AllocationRecord> listMissingIdentifier(int limit) {
        return byFingerprint.values().stream()
                .filter(r -> r.getIdentifier() == null && r.isActive())
                .sorted(Comparator.comparing(AllocationRecord::getId))
                .limit(limit)
                .map(AllocationRecord::copy)
                .collect(Collectors.toList());
    }

    @Override
    public synchronized long countWithIdentifier() {
        return identifierIndex.size();
    }

    @Override
    public synchronized long countMissingIdentifier() {
        return byFingerprint.values().stream()
                .filter(r -> r.getIdentifier() == null && r.isActive())
                .count();
    }

    /**
     * 测试辅助：全部记录快照。
     */
    public synchronized List<AllocationRecord> snapshot() {
        List<AllocationRecord> all = new ArrayList<>();
        for (AllocationRecord r : byFingerprint.values()) {
            all.add(r.copy());
        }
        all.sort(Comparator.comparing(AllocationRecord::getId));
        return all;
    }
}
