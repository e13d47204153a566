package com.work.shortkey.core.exception;

/**
 * 所有允许的长度均已耗尽（或单次分配的升级次数超过硬上限）。
 * <p>
 * 致命错误：重试无法解决，需要调整配置（例如提高 maxLength）。
 */
public class KeyspaceExhaustedException extends ShortKeyException {

    private final int lastLength;

    public KeyspaceExhaustedException(String message, int lastLength) {
        super(message);
        this.lastLength = lastLength;
    }

    public int getLastLength() {
        return lastLength;
    }
}
