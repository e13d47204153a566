package com.work.shortkey.core.service;

import com.work.shortkey.core.config.ShortKeyConfig;
import com.work.shortkey.core.exception.UniqueConflictException;
import com.work.shortkey.core.model.AllocationRecord;
import com.work.shortkey.core.model.AllocationRequest;
import com.work.shortkey.core.model.OperationKind;
import com.work.shortkey.core.model.OperationLogEntry;
import com.work.shortkey.core.model.RecordStatus;
import com.work.shortkey.core.repository.AllocationRecordRepository;
import com.work.shortkey.core.repository.OperationLogRepository;
import com.work.shortkey.core.support.JsonSupport;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static com.work.shortkey.core.support.ValidationUtils.requireNonEmpty;
import static com.work.shortkey.core.support.ValidationUtils.requireNonNull;
import static com.work.shortkey.core.support.ValidationUtils.requireValidFingerprint;
import static com.work.shortkey.core.support.ValidationUtils.requireValidIdentifier;

/**
 * 分配记录的所有写操作。
 * <p>
 * 事务边界：每个公开方法一个事务（READ_COMMITTED + 超时），记录变更与操作日志同事务提交。
 */
@Service
public class AllocationRecordStore {

    private final AllocationRecordRepository recordRepository;
    private final OperationLogRepository operationLogRepository;
    private final TransactionTemplate txTemplate;

    public AllocationRecordStore(AllocationRecordRepository recordRepository,
                                 OperationLogRepository operationLogRepository,
                                 ShortKeyConfig config,
                                 @NonNull PlatformTransactionManager transactionManager) {
        this.recordRepository = requireNonNull(recordRepository, "recordRepository");
        this.operationLogRepository = requireNonNull(operationLogRepository, "operationLogRepository");
        requireNonNull(config, "config");
        requireNonNull(transactionManager, "transactionManager");
        TransactionTemplate template = new TransactionTemplate(transactionManager);
        template.setIsolationLevel(TransactionDefinition.ISOLATION_READ_COMMITTED);
        template.setTimeout((int) Math.max(1L, config.getTransactionTimeout().getSeconds()));
        this.txTemplate = template;
    }

    /**
     * 插入带短键的新记录并写 ASSIGN 日志。
     *
     * @throws UniqueConflictException 指纹或短键已存在，kind 区分两者
     */
    public AllocationRecord commitNew(AllocationRequest request, String identifier, int length, String salt) {
        requireNonNull(request, "request");
        requireValidIdentifier(identifier);
        return txTemplate.execute(status -> {
            Instant now = Instant.now();
            AllocationRecord record = newRecord(request, now);
            record.setIdentifier(identifier);
            record.setIdentifierLength(length);
            record.setGenerationSalt(salt);
            record.setIdentifierAssignedAt(now);
            AllocationRecord saved = recordRepository.insert(record);
            operationLogRepository.append(saved.getId(), OperationKind.ASSIGN,
                    JsonSupport.details("identifier", identifier, "length", length, "salt", salt), now);
            return saved;
        });
    }

    /**
     * 只登记指纹，短键留空，由回填任务稍后分配。
     *
     * @throws UniqueConflictException 指纹已存在（kind=FINGERPRINT）
     */
    public AllocationRecord registerDeferred(AllocationRequest request) {
        requireNonNull(request, "request");
        return txTemplate.execute(status -> recordRepository.insert(newRecord(request, Instant.now())));
    }

    /**
     * 仅当记录仍没有短键时写入；已有短键时什么都不做。
     *
     * @return 写入后的记录；未写入返回 empty
     */
    public Optional<AllocationRecord> assignIdentifier(String fingerprint, String identifier, int length, String salt) {
        String fp = requireValidFingerprint(fingerprint);
        requireValidIdentifier(identifier);
        return txTemplate.execute(status -> {
            Instant now = Instant.now();
            int updated = recordRepository.assignIdentifierIfAbsent(fp, identifier, length, salt, now);
            if (updated == 0) {
                return Optional.<AllocationRecord>empty();
            }
            AllocationRecord record = recordRepository.findByFingerprint(fp).orElseThrow(
                    () -> new IllegalStateException("回填后记录不存在: " + fp));
            operationLogRepository.append(record.getId(), OperationKind.ASSIGN,
                    JsonSupport.details("identifier", identifier, "length", length, "salt", salt,
                            "backfill", true), now);
            return Optional.of(record);
        });
    }

    public void recordDedupHit(AllocationRecord record) {
        requireNonNull(record, "record");
        requireNonNull(record.getId(), "record.id");
        txTemplate.execute(status -> {
            operationLogRepository.append(record.getId(), OperationKind.DEDUP_HIT,
                    JsonSupport.details("identifier", record.getIdentifier()), Instant.now());
            return null;
        });
    }

    /**
     * 访问计数 +1 并写 ACCESS 日志。
     */
    public Optional<AllocationRecord> markAccessed(String fingerprint) {
        String fp = requireValidFingerprint(fingerprint);
        return txTemplate.execute(status -> {
            Instant now = Instant.now();
            if (recordRepository.incrementAccess(fp, now) == 0) {
                return Optional.<AllocationRecord>empty();
            }
            AllocationRecord record = recordRepository.findByFingerprint(fp).orElseThrow(
                    () -> new IllegalStateException("访问计数后记录不存在: " + fp));
            operationLogRepository.append(record.getId(), OperationKind.ACCESS, null, now);
            return Optional.of(record);
        });
    }

    /**
     * 上传完成后回写存储信息，仅 ACTIVE 记录可更新。
     *
     * @throws IllegalStateException 记录不是 ACTIVE
     */
    public Optional<AllocationRecord> updateUploadMetadata(String fingerprint, String storageKey, String url) {
        String fp = requireValidFingerprint(fingerprint);
        requireNonEmpty(storageKey, "storageKey");
        return txTemplate.execute(status -> {
            Optional<AllocationRecord> current = recordRepository.findByFingerprint(fp);
            if (!current.isPresent()) {
                return Optional.<AllocationRecord>empty();
            }
            if (!current.get().isActive()) {
                throw new IllegalStateException("记录状态为 " + current.get().getStatus() + "，不允许更新: " + fp);
            }
            Instant now = Instant.now();
            recordRepository.updateUploadInfo(fp, storageKey, url, now);
            operationLogRepository.append(current.get().getId(), OperationKind.UPDATE,
                    JsonSupport.details("storageKey", storageKey, "url", url), now);
            return recordRepository.findByFingerprint(fp);
        });
    }

    public Optional<AllocationRecord> markDeleted(String fingerprint) {
        return transition(fingerprint, RecordStatus.DELETED, OperationKind.DELETE);
    }

    public Optional<AllocationRecord> markArchived(String fingerprint) {
        return transition(fingerprint, RecordStatus.ARCHIVED, OperationKind.UPDATE);
    }

    public List<OperationLogEntry> history(long recordId) {
        return operationLogRepository.listByRecord(recordId);
    }

    private Optional<AllocationRecord> transition(String fingerprint, RecordStatus target, OperationKind kind) {
        String fp = requireValidFingerprint(fingerprint);
        return txTemplate.execute(status -> {
            Optional<AllocationRecord> current = recordRepository.findByFingerprint(fp);
            if (!current.isPresent()) {
                return Optional.<AllocationRecord>empty();
            }
            RecordStatus from = current.get().getStatus();
            if (!from.canTransitionTo(target)) {
                throw new IllegalStateException("不允许的状态迁移 " + from + " -> " + target + ": " + fp);
            }
            Instant now = Instant.now();
            if (recordRepository.transitionStatus(fp, from, target, now) == 0) {
                throw new IllegalStateException("状态已被并发修改: " + fp);
            }
            operationLogRepository.append(current.get().getId(), kind,
                    JsonSupport.details("from", from, "to", target), now);
            return recordRepository.findByFingerprint(fp);
        });
    }

    private AllocationRecord newRecord(AllocationRequest request, Instant now) {
        AllocationRecord record = new AllocationRecord();
        record.setFingerprint(request.getFingerprint());
        record.setOriginalFilename(request.getOriginalFilename());
        record.setFileExtension(request.getFileExtension());
        record.setFileSize(request.getFileSize());
        record.setMimeType(request.getMimeType());
        record.setMetadata(request.getMetadata());
        record.setStatus(RecordStatus.ACTIVE);
        record.setCreatedAt(now);
        record.setUpdatedAt(now);
        return record;
    }
}
