package com.work.shortkey.core.exception;

/**
 * 分配在两次尝试之间被中断（线程中断标记）。不会留下部分写入的记录。
 */
public class AllocationCancelledException extends ShortKeyException {

    public AllocationCancelledException(String message) {
        super(message);
    }
}
