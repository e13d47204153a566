package com.work.shortkey.core;

import com.work.shortkey.core.model.AllocationRecord;
import com.work.shortkey.core.model.AllocationRequest;
import com.work.shortkey.core.model.AllocationResult;
import com.work.shortkey.core.model.BatchItemOutcome;
import com.work.shortkey.core.model.KeyspaceStatistics;
import com.work.shortkey.core.model.OperationLogEntry;
import com.work.shortkey.core.service.AllocationRecordStore;
import com.work.shortkey.core.service.AllocationService;
import com.work.shortkey.core.service.FingerprintRegister;
import com.work.shortkey.core.service.ReservedKeyFilter;
import com.work.shortkey.core.service.ShortKeyBackfillService;
import com.work.shortkey.core.service.ShortKeyStatisticsService;

import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * 门面（Facade）层，对上传流水线与管理接口暴露最少的调用面。
 */
public class ShortKeyComponent {

    private final AllocationService allocationService;
    private final FingerprintRegister register;
    private final AllocationRecordStore store;
    private final ReservedKeyFilter reservedKeyFilter;
    private final ShortKeyBackfillService backfillService;
    private final ShortKeyStatisticsService statisticsService;

    public ShortKeyComponent(AllocationService allocationService,
                             FingerprintRegister register,
                             AllocationRecordStore store,
                             ReservedKeyFilter reservedKeyFilter,
                             ShortKeyBackfillService backfillService,
                             ShortKeyStatisticsService statisticsService) {
        this.allocationService = allocationService;
        this.register = register;
        this.store = store;
        this.reservedKeyFilter = reservedKeyFilter;
        this.backfillService = backfillService;
        this.statisticsService = statisticsService;
    }

    /**
     * 推荐用法：上传前按内容指纹申请短键，已存在时直接复用。
     */
    public AllocationResult allocate(AllocationRequest request) {
        return allocationService.allocate(request);
    }

    public List<BatchItemOutcome> allocateAll(List<AllocationRequest> requests) {
        return allocationService.allocateAll(requests);
    }

    public Optional<AllocationRecord> lookup(String fingerprint) {
        return register.lookup(fingerprint);
    }

    public Optional<AllocationRecord> resolve(String identifier) {
        return allocationService.resolve(identifier);
    }

    public Optional<AllocationRecord> completeUpload(String fingerprint, String storageKey, String url) {
        return store.updateUploadMetadata(fingerprint, storageKey, url);
    }

    public Optional<AllocationRecord> delete(String fingerprint) {
        return store.markDeleted(fingerprint);
    }

    public Optional<AllocationRecord> archive(String fingerprint) {
        return store.markArchived(fingerprint);
    }

    /**
     * 指纹对应记录的操作日志；记录不存在时返回空列表。
     */
    public List<OperationLogEntry> history(String fingerprint) {
        return register.lookup(fingerprint)
                .map(record -> store.history(record.getId()))
                .orElse(Collections.emptyList());
    }

    public int reloadReservedKeys() {
        return reservedKeyFilter.reload();
    }

    public boolean addReservedKey(String value, String reason) {
        return reservedKeyFilter.addReserved(value, reason);
    }

    public int backfill(int limit) {
        return backfillService.backfill(limit);
    }

    public KeyspaceStatistics statistics() {
        return statisticsService.snapshot();
    }
}
