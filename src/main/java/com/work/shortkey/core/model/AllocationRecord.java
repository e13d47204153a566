package com.work.shortkey.core.model;

import java.time.Instant;

/**
 * 指纹 -> 短键 的分配记录。
 * <p>
 * 注意：
 * 1. fingerprint 全局唯一，创建后不可修改
 * 2. identifier 只会从“无”变为“有”一次，之后不可修改
 * 3. status 只允许 ACTIVE -> DELETED / ARCHIVED
 * 4. 此对象是某一时刻的读取快照，修改它不会写回存储
 */
public class AllocationRecord {

    private Long id;
    private String fingerprint;
    private String identifier;
    private Integer identifierLength;
    private String generationSalt;
    private String originalFilename;
    private String fileExtension;
    private long fileSize;
    private String mimeType;
    private String storageKey;
    private String url;
    private RecordStatus status = RecordStatus.ACTIVE;
    private long accessCount;
    private Instant lastAccessedAt;
    private RecordMetadata metadata;
    private Instant createdAt;
    private Instant identifierAssignedAt;
    private Instant updatedAt;

    public boolean hasIdentifier() {
        return identifier != null;
    }

    public boolean isActive() {
        return status == RecordStatus.ACTIVE;
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

    public long getFileSize() {
        return fileSize;
    }

    public void setFileSize(long fileSize) {
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

    public RecordStatus getStatus() {
        return status;
    }

    public void setStatus(RecordStatus status) {
        this.status = status;
    }

    public long getAccessCount() {
        return accessCount;
    }

    public void setAccessCount(long accessCount) {
        this.accessCount = accessCount;
    }

    public Instant getLastAccessedAt() {
        return lastAccessedAt;
    }

    public void setLastAccessedAt(Instant lastAccessedAt) {
        this.lastAccessedAt = lastAccessedAt;
    }

    public RecordMetadata getMetadata() {
        return metadata;
    }

    public void setMetadata(RecordMetadata metadata) {
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

    /**
     * 拷贝一份快照，内存实现用它避免把内部状态泄露给调用方。
     */
    public AllocationRecord copy() {
        AllocationRecord r = new AllocationRecord();
        r.id = id;
        r.fingerprint = fingerprint;
        r.identifier = identifier;
        r.identifierLength = identifierLength;
        r.generationSalt = generationSalt;
        r.originalFilename = originalFilename;
        r.fileExtension = fileExtension;
        r.fileSize = fileSize;
        r.mimeType = mimeType;
        r.storageKey = storageKey;
        r.url = url;
        r.status = status;
        r.accessCount = accessCount;
        r.lastAccessedAt = lastAccessedAt;
        r.metadata = metadata;
        r.createdAt = createdAt;
        r.identifierAssignedAt = identifierAssignedAt;
        r.updatedAt = updatedAt;
        return r;
    }

    @Override
    public String toString() {
        return "AllocationRecord{id=" + id + ", fingerprint=" + fingerprint + ", identifier=" + identifier
                + ", length=" + identifierLength + ", status=" + status + '}';
    }
}
