package com.work.shortkey.core.service;

import com.work.shortkey.core.exception.AllocationCancelledException;
import com.work.shortkey.core.exception.KeyspaceExhaustedException;
import com.work.shortkey.core.exception.ShortKeyException;
import com.work.shortkey.core.model.AllocationRecord;
import com.work.shortkey.core.repository.AllocationRecordRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

import static com.work.shortkey.core.support.ValidationUtils.requireNonNull;
import static com.work.shortkey.core.support.ValidationUtils.requirePositive;

/**
 * 为没有短键的 ACTIVE 记录补分配短键。
 * <p>
 * 幂等：只处理 identifier 为空的记录，写入条件为 identifier IS NULL，重复执行不会改动已分配的记录。
 */
@Service
public class ShortKeyBackfillService {

    private static final Logger log = LoggerFactory.getLogger(ShortKeyBackfillService.class);

    private final AllocationRecordRepository recordRepository;
    private final AllocationService allocationService;

    public ShortKeyBackfillService(AllocationRecordRepository recordRepository,
                                   AllocationService allocationService) {
        this.recordRepository = requireNonNull(recordRepository, "recordRepository");
        this.allocationService = requireNonNull(allocationService, "allocationService");
    }

    /**
     * @return 本轮实际写入短键的记录数
     */
    public int backfill(int limit) {
        requirePositive(limit, "limit");
        List<AllocationRecord> pending = recordRepository.listMissingIdentifier(limit);
        if (pending.isEmpty()) {
            return 0;
        }
        int assigned = 0;
        int failed = 0;
        for (AllocationRecord record : pending) {
            try {
                if (allocationService.assignMissingIdentifier(record.getFingerprint()).isPresent()) {
                    assigned++;
                }
            } catch (AllocationCancelledException | KeyspaceExhaustedException e) {
                // 中断或空间耗尽时整轮停止，剩余记录留给下一轮
                log.warn("short key backfill stopped assigned={} err={}", assigned, e.toString());
                throw e;
            } catch (ShortKeyException e) {
                failed++;
                log.warn("short key backfill failed fingerprint={} err={}", record.getFingerprint(), e.toString());
            }
        }
        log.info("short key backfill finished scanned={} assigned={} failed={}", pending.size(), assigned, failed);
        return assigned;
    }
}
