package com.work.shortkey.core.service;

import com.work.shortkey.core.config.ShortKeyConfig;
import com.work.shortkey.core.exception.KeyspaceExhaustedException;
import com.work.shortkey.core.exception.ShortKeyException;
import com.work.shortkey.core.model.KeyspaceLedgerEntry;
import com.work.shortkey.core.model.SlotReservation;
import com.work.shortkey.core.repository.KeyspaceLedgerRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static com.work.shortkey.core.support.ValidationUtils.requireNonNull;

/**
 * 按长度记账的短键空间账本。
 * <p>
 * 注意：
 * 1. consumed 只增不减，exhausted 只会 false -> true
 * 2. 每个方法都是单条 SQL 的原子操作，不依赖外部事务
 * 3. consumed 是“已消耗的分配预算”，不是精确的占用数
 */
@Service
public class KeyspaceLedger {

    private static final Logger log = LoggerFactory.getLogger(KeyspaceLedger.class);

    /**
     * 并发建行时可能多次读到“无可用长度”，有限次重试即可收敛。
     */
    private static final int MAX_CREATE_ROUNDS = 8;

    private final KeyspaceLedgerRepository ledgerRepository;
    private final ShortKeyConfig config;

    public KeyspaceLedger(KeyspaceLedgerRepository ledgerRepository, ShortKeyConfig config) {
        this.ledgerRepository = requireNonNull(ledgerRepository, "ledgerRepository");
        this.config = requireNonNull(config, "config");
    }

    /**
     * 返回当前可分配的最小长度；没有可用长度时按 max+1 建一行新长度。
     *
     * @throws KeyspaceExhaustedException 需要的长度超过 maxLength
     */
    public int currentLength() {
        int minLength = config.getMinLength();
        for (int round = 0; round < MAX_CREATE_ROUNDS; round++) {
            Optional<KeyspaceLedgerEntry> open = ledgerRepository.findSmallestOpen(minLength);
            if (open.isPresent()) {
                return open.get().getLength();
            }
            int next = ledgerRepository.findMaxLength()
                    .map(max -> Math.max(max + 1, minLength))
                    .orElse(minLength);
            if (next > config.getMaxLength()) {
                throw new KeyspaceExhaustedException(
                        "短键空间已耗尽，所需长度 " + next + " 超过上限 " + config.getMaxLength(), next - 1);
            }
            long capacity = config.capacityOf(next);
            if (ledgerRepository.insertIfAbsent(next, capacity, Instant.now())) {
                log.info("keyspace ledger opened length={} capacity={}", next, capacity);
            }
        }
        throw new ShortKeyException("确定当前分配长度失败（并发建行重试耗尽）");
    }

    /**
     * 原子地为 length 消耗一个槽位。已耗尽的长度不会被递增，返回未授予的 reservation。
     */
    public SlotReservation reserveSlot(int length) {
        SlotReservation slot = ledgerRepository.incrementConsumed(length, Instant.now());
        if (slot.isLastSlot()) {
            log.info("keyspace length={} reached capacity at sequence={}", length, slot.getSequence());
        }
        return slot;
    }

    /**
     * 强制把 length 标记为耗尽（单长度尝试预算用尽时的升级路径）。
     *
     * @return 本次调用是否真正改变了状态
     */
    public boolean markExhausted(int length) {
        boolean changed = ledgerRepository.markExhausted(length, Instant.now()) == 1;
        if (changed) {
            log.info("keyspace length={} forced exhausted", length);
        }
        return changed;
    }

    public boolean isExhausted(int length) {
        return ledgerRepository.findByLength(length)
                .map(KeyspaceLedgerEntry::isExhausted)
                .orElse(false);
    }

    public List<KeyspaceLedgerEntry> snapshot() {
        return ledgerRepository.listAll();
    }
}
