package com.work.shortkey.app.web.dto;

import java.util.List;

public class StatisticsView {

    private String charset;
    private int charsetSize;
    private int reservedKeyCount;
    private long assignedIdentifierCount;
    private long pendingIdentifierCount;
    private List<LengthView> lengths;

    public String getCharset() {
        return charset;
    }

    public void setCharset(String charset) {
        this.charset = charset;
    }

    public int getCharsetSize() {
        return charsetSize;
    }

    public void setCharsetSize(int charsetSize) {
        this.charsetSize = charsetSize;
    }

    public int getReservedKeyCount() {
        return reservedKeyCount;
    }

    public void setReservedKeyCount(int reservedKeyCount) {
        this.reservedKeyCount = reservedKeyCount;
    }

    public long getAssignedIdentifierCount() {
        return assignedIdentifierCount;
    }

    public void setAssignedIdentifierCount(long assignedIdentifierCount) {
        this.assignedIdentifierCount = assignedIdentifierCount;
    }

    public long getPendingIdentifierCount() {
        return pendingIdentifierCount;
    }

    public void setPendingIdentifierCount(long pendingIdentifierCount) {
        this.pendingIdentifierCount = pendingIdentifierCount;
    }

    public List<LengthView> getLengths() {
        return lengths;
    }

    public void setLengths(List<LengthView> lengths) {
        this.lengths = lengths;
    }
}
