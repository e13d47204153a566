package com.work.shortkey.core.exception;

/**
 * 非预期的约束冲突（既不是 fingerprint 唯一约束，也不是 identifier 唯一约束），
 * 或状态机被违反。总是向上抛出，不做静默处理。
 */
public class IntegrityViolationException extends ShortKeyException {

    public IntegrityViolationException(String message) {
        super(message);
    }

    public IntegrityViolationException(String message, Throwable cause) {
        super(message, cause);
    }
}
