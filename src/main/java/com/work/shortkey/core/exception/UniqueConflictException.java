package com.work.shortkey.core.exception;

/**
 * 插入/赋值时命中了承载正确性的唯一约束。
 * <p>
 * 仅在组件内部流转：FINGERPRINT 视为去重命中，IDENTIFIER 视为碰撞并重试，均不向调用方暴露。
 */
public class UniqueConflictException extends ShortKeyException {

    public enum Kind {
        FINGERPRINT,
        IDENTIFIER
    }

    private final Kind kind;

    public UniqueConflictException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }
}
