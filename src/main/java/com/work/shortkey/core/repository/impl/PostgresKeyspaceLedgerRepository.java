package com.work.shortkey.core.repository.impl;

import com.work.shortkey.core.model.KeyspaceLedgerEntry;
import com.work.shortkey.core.model.SlotReservation;
import com.work.shortkey.core.repository.KeyspaceLedgerRepository;
import com.work.shortkey.core.repository.entity.KeyspaceLedgerEntity;
import com.work.shortkey.core.repository.mapper.KeyspaceLedgerMapper;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 基于 PostgreSQL + MyBatis-Plus 的账本实现。每个方法对应一条原子 SQL。
 */
@Repository
public class PostgresKeyspaceLedgerRepository implements KeyspaceLedgerRepository {

    private final KeyspaceLedgerMapper ledgerMapper;

    public PostgresKeyspaceLedgerRepository(KeyspaceLedgerMapper ledgerMapper) {
        this.ledgerMapper = ledgerMapper;
    }

    @Override
    public Optional<KeyspaceLedgerEntry> findSmallestOpen(int minLength) {
        KeyspaceLedgerEntity entity = StorageExceptionTranslator.call("查询当前长度",
                () -> ledgerMapper.selectSmallestOpen(minLength));
        return Optional.ofNullable(entity).map(this::convertToEntry);
    }

    @Override
    public Optional<Integer> findMaxLength() {
        return Optional.ofNullable(StorageExceptionTranslator.call("查询最大长度", ledgerMapper::selectMaxLength));
    }

    @Override
    public Optional<KeyspaceLedgerEntry> findByLength(int length) {
        KeyspaceLedgerEntity entity = StorageExceptionTranslator.call("查询账本行",
                () -> ledgerMapper.selectByLength(length));
        return Optional.ofNullable(entity).map(this::convertToEntry);
    }

    @Override
    public boolean insertIfAbsent(int length, long capacity, Instant now) {
        return StorageExceptionTranslator.call("创建账本行",
                () -> ledgerMapper.insertIfAbsent(length, capacity, now)) > 0;
    }

    @Override
    public SlotReservation incrementConsumed(int length, Instant now) {
        KeyspaceLedgerEntity updated = StorageExceptionTranslator.call("预留账本额度",
                () -> ledgerMapper.incrementConsumed(length, now));
        if (updated == null) {
            return SlotReservation.refused(length);
        }
        // RETURNING 给出的是递增后的值
        return SlotReservation.granted(length, updated.getConsumed() - 1, Boolean.TRUE.equals(updated.getExhausted()));
    }

    @Override
    public int markExhausted(int length, Instant now) {
        return StorageExceptionTranslator.call("标记长度耗尽", () -> ledgerMapper.markExhausted(length, now));
    }

    @Override
    public List<KeyspaceLedgerEntry> listAll() {
        List<KeyspaceLedgerEntity> entities = StorageExceptionTranslator.call("查询账本", ledgerMapper::selectAllOrdered);
        List<KeyspaceLedgerEntry> result = new ArrayList<>(entities.size());
        for (KeyspaceLedgerEntity e : entities) {
            result.add(convertToEntry(e));
        }
        return result;
    }

    private KeyspaceLedgerEntry convertToEntry(KeyspaceLedgerEntity e) {
        return new KeyspaceLedgerEntry(
                e.getKeyLength(),
                e.getConsumed() == null ? 0L : e.getConsumed(),
                e.getCapacity(),
                Boolean.TRUE.equals(e.getExhausted()),
                e.getUpdatedAt()
        );
    }
}
