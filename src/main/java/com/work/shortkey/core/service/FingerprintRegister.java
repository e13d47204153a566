package com.work.shortkey.core.service;

import com.work.shortkey.core.model.AllocationRecord;
import com.work.shortkey.core.repository.AllocationRecordRepository;
import org.springframework.stereotype.Service;

import java.util.Optional;

import static com.work.shortkey.core.support.ValidationUtils.requireNonNull;
import static com.work.shortkey.core.support.ValidationUtils.requireValidFingerprint;
import static com.work.shortkey.core.support.ValidationUtils.requireValidIdentifier;

/**
 * 指纹登记表：只读查询。
 * <p>
 * 存储异常原样抛出（TransientStorageException），不会被当作“不存在”。
 */
@Service
public class FingerprintRegister {

    private final AllocationRecordRepository recordRepository;

    public FingerprintRegister(AllocationRecordRepository recordRepository) {
        this.recordRepository = requireNonNull(recordRepository, "recordRepository");
    }

    /**
     * 按指纹查询，返回任意状态的记录。
     */
    public Optional<AllocationRecord> lookup(String fingerprint) {
        return recordRepository.findByFingerprint(requireValidFingerprint(fingerprint));
    }

    /**
     * 按短键查询，只返回 ACTIVE 记录。
     */
    public Optional<AllocationRecord> lookupByIdentifier(String identifier) {
        return recordRepository.findActiveByIdentifier(requireValidIdentifier(identifier));
    }
}
