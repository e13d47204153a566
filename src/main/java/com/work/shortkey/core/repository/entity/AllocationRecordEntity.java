package com.work.shortkey.core.repository.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;

import java.time.Instant;

/**
 * 分配记录表实体类
 */
@TableName("allocation_record")
public class AllocationRecordEntity {

    @TableId(type = IdType.AUTO)
    private Long id;

    private String fingerprint;

    private String identifier;

    private Integer identifierLength;

    private String generationSalt;

    private String originalFilename;

    private String fileExtension;

    private Long fileSize;

    private String mimeType;

    private String storageKey;

    private String url;

    private String status;

    private Long accessCount;

    private Instant lastAccessedAt;

    /**
     * JSON 文本，对应 RecordMetadata；为空表示没有附加信息
     */
    private String metadata;

    private Instant createdAt;

    private Instant identifierAssignedAt;

    private Instant updatedAt;

    public AllocationRecordEntity() {
    }

    public Long getId() {
        return id;
    }

    public void setId(Long id) {
        this.id = id;
    }

    public String getFingerprint() {
        return fingerprint;
    }

    public void setFingerprint(String fingerprint) {
        this.fingerprint = fingerprint;
    }

    public String getIdentifier() {
        return identifier;
    }

    public void setIdentifier(String identifier) {
        this.identifier = identifier;
    }

    public Integer getIdentifierLength() {
        return identifierLength;
    }

    public void setIdentifierLength(Integer identifierLength) {
        this.identifierLength = identifierLength;
    }

    public String getGenerationSalt() {
        return generationSalt;
    }

    public void setGenerationSalt(String generationSalt) {
        this.generationSalt = generationSalt;
    }

    public String getOriginalFilename() {
        return originalFilename;
    }

    public void setOriginalFilename(String originalFilename) {
        this.originalFilename = originalFilename;
    }

    public String getFileExtension() {
        return fileExtension;
    }

    public void setFileExtension(String fileExtension) {
        this.fileExtension = fileExtension;
    }

    public Long getFileSize() {
        return fileSize;
    }

    public void setFileSize(Long fileSize) {
        this.fileSize = fileSize;
    }

    public String getMimeType() {
        return mimeType;
    }

    public void setMimeType(String mimeType) {
        this.mimeType = mimeType;
    }

    public String getStorageKey() {
        return storageKey;
    }

    public void setStorageKey(String storageKey) {
        this.storageKey = storageKey;
    }

    public String getUrl() {
        return url;
    }

    public void setUrl(String url) {
        this.url = url;
    }

    public String getStatus() {
        return status;
    }

    public void setStatus(String status) {
        this.status = status;
    }

    public Long getAccessCount() {
        return accessCount;
    }

    public void setAccessCount(Long accessCount) {
        this.accessCount = accessCount;
    }

    public Instant getLastAccessedAt() {
        return lastAccessedAt;
    }

    public void setLastAccessedAt(Instant lastAccessedAt) {
        this.lastAccessedAt = lastAccessedAt;
    }

    public String getMetadata() {
        return metadata;
    }

    public void setMetadata(String metadata) {
        this.metadata = metadata;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public Instant getIdentifierAssignedAt() {
        return identifierAssignedAt;
    }

    public void setIdentifierAssignedAt(Instant identifierAssignedAt) {
        this.identifierAssignedAt = identifierAssignedAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }
}
