package com.work.shortkey.core.model;

/**
 * reserveSlot 的结果：只代表该长度上消耗了一份“预算”，并不锁定任何具体短键。
 */
public class SlotReservation {

    private final int length;
    private final long sequence;
    private final boolean granted;
    private final boolean lastSlot;

    private SlotReservation(int length, long sequence, boolean granted, boolean lastSlot) {
        this.length = length;
        this.sequence = sequence;
        this.granted = granted;
        this.lastSlot = lastSlot;
    }

    public static SlotReservation granted(int length, long sequence, boolean lastSlot) {
        return new SlotReservation(length, sequence, true, lastSlot);
    }

    /**
     * 该长度已耗尽，未发生任何计数变化。
     */
    public static SlotReservation refused(int length) {
        return new SlotReservation(length, -1L, false, false);
    }

    public int getLength() {
        return length;
    }

    /**
     * 递增前的 consumed 值；未授予时为 -1。
     */
    public long getSequence() {
        return sequence;
    }

    public boolean isGranted() {
        return granted;
    }

    /**
     * 本次预留导致该长度被标记为耗尽。
     */
    public boolean isLastSlot() {
        return lastSlot;
    }
}
