package com.work.shortkey.core.repository;

import com.work.shortkey.core.model.KeyspaceLedgerEntry;
import com.work.shortkey.core.model.SlotReservation;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * 短键长度账本的数据访问抽象。每个方法本身必须是原子的。
 */
public interface KeyspaceLedgerRepository {

    /**
     * 最小的、未耗尽且不小于 minLength 的长度。
     */
    Optional<KeyspaceLedgerEntry> findSmallestOpen(int minLength);

    /**
     * 当前已存在的最大长度；账本为空时返回 empty。
     */
    Optional<Integer> findMaxLength();

    Optional<KeyspaceLedgerEntry> findByLength(int length);

    /**
     * 幂等创建：并发创建同一长度时，后到者为 no-op 而不是冲突。
     *
     * @return 是否真正插入了新行
     */
    boolean insertIfAbsent(int length, long capacity, Instant now);

    /**
     * 原子地 consumed + 1，若达到 capacity 则同时置 exhausted = true。已耗尽的行不做任何修改。
     * 递增前的序号与是否因此耗尽都来自同一次更新。
     *
     * @return 行不存在或已耗尽时返回 refused
     */
    SlotReservation incrementConsumed(int length, Instant now);

    /**
     * 强制耗尽：consumed = max(consumed, capacity)，exhausted = true。
     *
     * @return 更新行数（已耗尽时为 0）
     */
    int markExhausted(int length, Instant now);

    List<KeyspaceLedgerEntry> listAll();
}
