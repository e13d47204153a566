package com.work.shortkey.core.model;

/**
 * 分配结果：新分配时携带 (identifier, length, salt)；去重命中时携带已有记录。
 */
public class AllocationResult {

    private final AllocationRecord record;
    private final boolean dedupHit;

    private AllocationResult(AllocationRecord record, boolean dedupHit) {
        if (record == null) {
            throw new IllegalArgumentException("record 不能为null");
        }
        this.record = record;
        this.dedupHit = dedupHit;
    }

    public static AllocationResult assigned(AllocationRecord record) {
        return new AllocationResult(record, false);
    }

    public static AllocationResult dedupHit(AllocationRecord record) {
        return new AllocationResult(record, true);
    }

    public AllocationRecord getRecord() {
        return record;
    }

    public boolean isDedupHit() {
        return dedupHit;
    }

    public String getIdentifier() {
        return record.getIdentifier();
    }

    public Integer getLength() {
        return record.getIdentifierLength();
    }

    public String getSalt() {
        return record.getGenerationSalt();
    }

    /**
     * 便捷方法：identifier + 扩展名。最终存储键由上传流水线自行决定，这里只是常见约定。
     */
    public String storageKeyFor(String extension) {
        if (record.getIdentifier() == null) {
            return null;
        }
        return extension == null ? record.getIdentifier() : record.getIdentifier() + extension;
    }
}
