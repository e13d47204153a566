package com.work.shortkey.core.service;

import com.work.shortkey.core.config.ShortKeyConfig;
import com.work.shortkey.core.model.KeyspaceStatistics;
import com.work.shortkey.core.repository.AllocationRecordRepository;
import org.springframework.stereotype.Service;

import static com.work.shortkey.core.support.ValidationUtils.requireNonNull;

@Service
public class ShortKeyStatisticsService {

    private final KeyspaceLedger ledger;
    private final ReservedKeyFilter reservedKeyFilter;
    private final AllocationRecordRepository recordRepository;
    private final ShortKeyConfig config;

    public ShortKeyStatisticsService(KeyspaceLedger ledger,
                                     ReservedKeyFilter reservedKeyFilter,
                                     AllocationRecordRepository recordRepository,
                                     ShortKeyConfig config) {
        this.ledger = requireNonNull(ledger, "ledger");
        this.reservedKeyFilter = requireNonNull(reservedKeyFilter, "reservedKeyFilter");
        this.recordRepository = requireNonNull(recordRepository, "recordRepository");
        this.config = requireNonNull(config, "config");
    }

    public KeyspaceStatistics snapshot() {
        return new KeyspaceStatistics(
                ledger.snapshot(),
                reservedKeyFilter.size(),
                recordRepository.countWithIdentifier(),
                recordRepository.countMissingIdentifier(),
                config.getCharset());
    }
}
