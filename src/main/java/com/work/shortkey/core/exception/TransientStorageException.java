package com.work.shortkey.core.exception;

/**
 * 可重试的存储异常：连接获取超时、语句/事务超时、连接中断等。
 * <p>
 * 与“记录不存在”严格区分：查询失败时绝不返回空结果。
 */
public class TransientStorageException extends ShortKeyException {

    public TransientStorageException(String message) {
        super(message);
    }

    public TransientStorageException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
