package com.work.shortkey.core.model;

import java.time.Instant;

/**
 * 某一长度的短键账本行。
 * <p>
 * 不变量：consumed 单调不减；exhausted 只会 false -> true；exhausted == (consumed >= capacity)。
 */
public class KeyspaceLedgerEntry {

    private final int length;
    private final long consumed;
    private final long capacity;
    private final boolean exhausted;
    private final Instant updatedAt;

    public KeyspaceLedgerEntry(int length, long consumed, long capacity, boolean exhausted, Instant updatedAt) {
        if (length <= 0) {
            throw new IllegalArgumentException("length 必须大于0");
        }
        if (consumed < 0) {
            throw new IllegalArgumentException("consumed 不能为负数");
        }
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity 必须大于0");
        }
        this.length = length;
        this.consumed = consumed;
        this.capacity = capacity;
        this.exhausted = exhausted;
        this.updatedAt = updatedAt;
    }

    public int getLength() {
        return length;
    }

    public long getConsumed() {
        return consumed;
    }

    public long getCapacity() {
        return capacity;
    }

    public boolean isExhausted() {
        return exhausted;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public double usageRatio() {
        return (double) Math.min(consumed, capacity) / capacity;
    }

    @Override
    public String toString() {
        return "KeyspaceLedgerEntry{length=" + length + ", consumed=" + consumed
                + ", capacity=" + capacity + ", exhausted=" + exhausted + '}';
    }
}
