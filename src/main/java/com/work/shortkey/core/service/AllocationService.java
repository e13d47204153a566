package com.work.shortkey.core.service;

import com.work.shortkey.core.config.ShortKeyConfig;
import com.work.shortkey.core.exception.AllocationCancelledException;
import com.work.shortkey.core.exception.IntegrityViolationException;
import com.work.shortkey.core.exception.ShortKeyException;
import com.work.shortkey.core.exception.TransientStorageException;
import com.work.shortkey.core.exception.UniqueConflictException;
import com.work.shortkey.core.model.AllocationRecord;
import com.work.shortkey.core.model.AllocationRequest;
import com.work.shortkey.core.model.AllocationResult;
import com.work.shortkey.core.model.BatchItemOutcome;
import com.work.shortkey.core.support.metrics.ShortKeyMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Supplier;

import static com.work.shortkey.core.support.ValidationUtils.requireNonNull;
import static com.work.shortkey.core.support.ValidationUtils.requireValidFingerprint;

/**
 * 负责"为某个指纹拿到唯一短键"：先查登记表去重，再走分配循环，最后处理并发竞争。
 * <p>
 * 同一指纹并发分配时，由指纹唯一约束裁决胜者；败者读取胜者的记录作为去重命中返回。
 */
@Service
public class AllocationService {

    private static final Logger log = LoggerFactory.getLogger(AllocationService.class);

    private final FingerprintRegister register;
    private final ShortKeyAllocator allocator;
    private final AllocationRecordStore store;
    private final ShortKeyConfig config;
    private final ShortKeyMetrics metrics;

    public AllocationService(FingerprintRegister register,
                             ShortKeyAllocator allocator,
                             AllocationRecordStore store,
                             ShortKeyConfig config,
                             ShortKeyMetrics metrics) {
        this.register = requireNonNull(register, "register");
        this.allocator = requireNonNull(allocator, "allocator");
        this.store = requireNonNull(store, "store");
        this.config = requireNonNull(config, "config");
        this.metrics = requireNonNull(metrics, "metrics");
    }

    /**
     * 为请求中的指纹返回短键：已存在则去重命中，否则新分配。
     * <p>
     * 存储暂时不可用时整体重试，重试耗尽后抛 TransientStorageException。
     */
    public AllocationResult allocate(AllocationRequest request) {
        requireNonNull(request, "request");
        return withTransientRetry("allocate", () -> doAllocate(request));
    }

    /**
     * 批量分配：逐个处理，单个失败只记录在对应结果里，不影响其它条目。
     * 线程被中断时停止整个批次。
     */
    public List<BatchItemOutcome> allocateAll(List<AllocationRequest> requests) {
        requireNonNull(requests, "requests");
        List<BatchItemOutcome> outcomes = new ArrayList<>(requests.size());
        for (AllocationRequest request : requests) {
            try {
                outcomes.add(BatchItemOutcome.success(request.getFingerprint(), allocate(request)));
            } catch (AllocationCancelledException e) {
                throw e;
            } catch (ShortKeyException | IllegalArgumentException | IllegalStateException e) {
                log.warn("batch item failed fingerprint={} err={}", request.getFingerprint(), e.toString());
                outcomes.add(BatchItemOutcome.failure(request.getFingerprint(), e));
            }
        }
        return outcomes;
    }

    /**
     * 解析短键：只返回 ACTIVE 记录，并计一次访问。
     */
    public Optional<AllocationRecord> resolve(String identifier) {
        return withTransientRetry("resolve", () -> register.lookupByIdentifier(identifier)
                .flatMap(record -> store.markAccessed(record.getFingerprint())));
    }

    /**
     * 为一条已登记但还没有短键的 ACTIVE 记录分配短键（回填路径）。
     * 幂等：记录不存在、已有短键或非 ACTIVE 时直接返回 empty，不占用账本槽位。
     */
    public Optional<AllocationRecord> assignMissingIdentifier(String fingerprint) {
        String fp = requireValidFingerprint(fingerprint);
        return withTransientRetry("assign-missing", () -> {
            Optional<AllocationRecord> current = register.lookup(fp);
            if (!current.isPresent() || current.get().hasIdentifier() || !current.get().isActive()) {
                return Optional.<AllocationRecord>empty();
            }
            return Optional.ofNullable(allocator.allocate((identifier, length, salt) ->
                    store.assignIdentifier(fp, identifier, length, salt).orElse(null)));
        });
    }

    private AllocationResult doAllocate(AllocationRequest request) {
        String fingerprint = request.getFingerprint();
        Optional<AllocationRecord> existing = register.lookup(fingerprint);
        if (existing.isPresent()) {
            return onExisting(existing.get());
        }

        try {
            if (!config.isAssignOnRegister()) {
                return AllocationResult.assigned(store.registerDeferred(request));
            }
            AllocationRecord record = allocator.allocate(
                    (identifier, length, salt) -> store.commitNew(request, identifier, length, salt));
            metrics.allocated(record.getIdentifierLength());
            log.debug("short key allocated length={} id={}", record.getIdentifierLength(), record.getId());
            return AllocationResult.assigned(record);
        } catch (UniqueConflictException e) {
            if (e.getKind() != UniqueConflictException.Kind.FINGERPRINT) {
                throw e;
            }
            // 并发分配同一指纹：对方先提交
            AllocationRecord winner = register.lookup(fingerprint).orElseThrow(
                    () -> new IntegrityViolationException("指纹冲突但读不到已有记录: " + fingerprint, e));
            return onExisting(winner);
        }
    }

    private AllocationResult onExisting(AllocationRecord record) {
        if (!record.hasIdentifier() && record.isActive() && config.isAssignOnRegister()) {
            Optional<AllocationRecord> assigned = Optional.ofNullable(allocator.allocate(
                    (identifier, length, salt) ->
                            store.assignIdentifier(record.getFingerprint(), identifier, length, salt).orElse(null)));
            if (assigned.isPresent()) {
                metrics.allocated(assigned.get().getIdentifierLength());
                return AllocationResult.assigned(assigned.get());
            }
            AllocationRecord latest = register.lookup(record.getFingerprint()).orElse(record);
            return dedupHit(latest);
        }
        return dedupHit(record);
    }

    private AllocationResult dedupHit(AllocationRecord record) {
        store.recordDedupHit(record);
        metrics.dedupHit();
        return AllocationResult.dedupHit(record);
    }

    private <T> T withTransientRetry(String op, Supplier<T> attemptWork) {
        final int maxAttempts = config.getStorageRetryAttempts();
        final long maxBackoffMs = config.getStorageRetryMaxBackoff().toMillis();
        long backoffMs = config.getStorageRetryInitialBackoff().toMillis();
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return attemptWork.get();
            } catch (TransientStorageException ex) {
                if (attempt == maxAttempts) throw ex;
                metrics.transientRetry(op);
                // 0.7x ~ 1.3x：轻量抖动，避免同步冲撞
                double factor = 0.7 + ThreadLocalRandom.current().nextDouble() * 0.6;
                long sleepMs = Math.max(1L, (long) (backoffMs * factor));
                log.warn("{} transient storage error attempt={} backoff={}ms err={}", op, attempt, sleepMs, ex.toString());
                try {
                    Thread.sleep(sleepMs);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new AllocationCancelledException(op + " 重试等待时被中断");
                }
                backoffMs = Math.min(backoffMs * 2, maxBackoffMs);
            }
        }
        throw new IllegalStateException("unreachable");
    }
}
