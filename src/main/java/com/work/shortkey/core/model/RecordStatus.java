package com.work.shortkey.core.model;

/**
 * 记录状态：只允许 ACTIVE -> DELETED / ARCHIVED，不可回退。
 */
public enum RecordStatus {
    ACTIVE,
    DELETED,
    ARCHIVED;

    public boolean canTransitionTo(RecordStatus target) {
        return this == ACTIVE && target != ACTIVE;
    }
}
