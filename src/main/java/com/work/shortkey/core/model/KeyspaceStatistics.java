package com.work.shortkey.core.model;

import java.util.Collections;
import java.util.List;

/**
 * 短键空间统计快照。
 */
public class KeyspaceStatistics {

    private final List<KeyspaceLedgerEntry> lengths;
    private final int reservedKeyCount;
    private final long assignedIdentifierCount;
    private final long pendingIdentifierCount;
    private final String charset;

    public KeyspaceStatistics(List<KeyspaceLedgerEntry> lengths,
                              int reservedKeyCount,
                              long assignedIdentifierCount,
                              long pendingIdentifierCount,
                              String charset) {
        this.lengths = lengths == null ? Collections.emptyList() : Collections.unmodifiableList(lengths);
        this.reservedKeyCount = reservedKeyCount;
        this.assignedIdentifierCount = assignedIdentifierCount;
        this.pendingIdentifierCount = pendingIdentifierCount;
        this.charset = charset;
    }

    public List<KeyspaceLedgerEntry> getLengths() {
        return lengths;
    }

    public int getReservedKeyCount() {
        return reservedKeyCount;
    }

    public long getAssignedIdentifierCount() {
        return assignedIdentifierCount;
    }

    public long getPendingIdentifierCount() {
        return pendingIdentifierCount;
    }

    public String getCharset() {
        return charset;
    }

    public int getCharsetSize() {
        return charset == null ? 0 : charset.length();
    }
}
