package com.work.shortkey.core.support;

import com.work.shortkey.core.model.KeyspaceLedgerEntry;
import com.work.shortkey.core.model.SlotReservation;
import com.work.shortkey.core.repository.KeyspaceLedgerRepository;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * 纯内存账本实现，语义与 PostgresKeyspaceLedgerRepository 的单语句原子操作一致。
 */
public class InMemoryKeyspaceLedgerRepository implements KeyspaceLedgerRepository {

    private final TreeMap<Integer, KeyspaceLedgerEntry> rows = new TreeMap<>();

    @Override
    public synchronized Optional<KeyspaceLedgerEntry> findSmallestOpen(int minLength) {
        for (Map.Entry<Integer, KeyspaceLedgerEntry> e : rows.tailMap(minLength, true).entrySet()) {
            if (!e.getValue().isExhausted()) {
                return Optional.of(e.getValue());
            }
        }
        return Optional.empty();
    }

    @Override
    public synchronized Optional<Integer> findMaxLength() {
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.lastKey());
    }

    @Override
    public synchronized Optional<KeyspaceLedgerEntry> findByLength(int length) {
        return Optional.ofNullable(rows.get(length));
    }

    @Override
    public synchronized boolean insertIfAbsent(int length, long capacity, Instant now) {
        if (rows.containsKey(length)) {
            return false;
        }
        rows.put(length, new KeyspaceLedgerEntry(length, 0L, capacity, false, now));
        return true;
    }

    @Override
    public synchronized SlotReservation incrementConsumed(int length, Instant now) {
        KeyspaceLedgerEntry cur = rows.get(length);
        if (cur == null || cur.isExhausted()) {
            return SlotReservation.refused(length);
        }
        long next = cur.getConsumed() + 1;
        boolean exhausted = next >= cur.getCapacity();
        rows.put(length, new KeyspaceLedgerEntry(length, next, cur.getCapacity(), exhausted, now));
        return SlotReservation.granted(length, cur.getConsumed(), exhausted);
    }

    @Override
    public synchronized int markExhausted(int length, Instant now) {
        KeyspaceLedgerEntry cur = rows.get(length);
        if (cur == null || cur.isExhausted()) {
            return 0;
        }
        rows.put(length, new KeyspaceLedgerEntry(length, Math.max(cur.getConsumed(), cur.getCapacity()),
                cur.getCapacity(), true, now));
        return 1;
    }

    @Override
    public synchronized List<KeyspaceLedgerEntry> listAll() {
        return new ArrayList<>(rows.values());
    }
}
