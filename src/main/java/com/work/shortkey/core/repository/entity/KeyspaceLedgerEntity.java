package com.work.shortkey.core.repository.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;

import java.time.Instant;

/**
 * 短键长度账本表实体类
 */
@TableName("keyspace_ledger")
public class KeyspaceLedgerEntity {

    @TableId(value = "key_length", type = IdType.INPUT)
    private Integer keyLength;

    private Long consumed;

    private Long capacity;

    private Boolean exhausted;

    private Instant createdAt;

    private Instant updatedAt;

    public KeyspaceLedgerEntity() {
    }

    public Integer getKeyLength() {
        return keyLength;
    }

    public void setKeyLength(Integer keyLength) {
        this.keyLength = keyLength;
    }

    public Long getConsumed() {
        return consumed;
    }

    public void setConsumed(Long consumed) {
        this.consumed = consumed;
    }

    public Long getCapacity() {
        return capacity;
    }

    public void setCapacity(Long capacity) {
        this.capacity = capacity;
    }

    public Boolean getExhausted() {
        return exhausted;
    }

    public void setExhausted(Boolean exhausted) {
        this.exhausted = exhausted;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }
}
