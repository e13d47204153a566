package com.work.shortkey.core.exception;

/**
 * 组件内部的统⼀异常类型，便于业务侧捕获或转换为 HTTP 错误码。
 */
public class ShortKeyException extends RuntimeException {

    public ShortKeyException(String message) {
        super(message);
    }

    public ShortKeyException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * 标识该异常是否可通过重试解决（用于存储超时、连接抖动等场景）。
     * 默认不可重试。
     */
    public boolean isRetryable() {
        return false;
    }
}
