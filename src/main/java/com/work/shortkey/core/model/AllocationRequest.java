package com.work.shortkey.core.model;

import java.util.Locale;

import static com.work.shortkey.core.support.ValidationUtils.requireMaxLength;
import static com.work.shortkey.core.support.ValidationUtils.requireNonEmpty;
import static com.work.shortkey.core.support.ValidationUtils.requireNonNegative;
import static com.work.shortkey.core.support.ValidationUtils.requireValidFingerprint;

/**
 * 上传流水线提交的分配请求：内容指纹 + 原始文件信息。
 */
public class AllocationRequest {

    private static final String DEFAULT_MIME_TYPE = "application/octet-stream";

    /**
     * 与 allocation_record 表的列宽一致，超长输入在进入分配循环前就拒绝。
     */
    public static final int MAX_FILENAME_LENGTH = 1024;
    public static final int MAX_EXTENSION_LENGTH = 64;
    public static final int MAX_MIME_TYPE_LENGTH = 255;

    private final String fingerprint;
    private final String originalFilename;
    private final String fileExtension;
    private final long fileSize;
    private final String mimeType;
    private final RecordMetadata metadata;

    public AllocationRequest(String fingerprint,
                             String originalFilename,
                             long fileSize,
                             String mimeType,
                             RecordMetadata metadata) {
        this.fingerprint = requireValidFingerprint(fingerprint);
        this.originalFilename = requireMaxLength(requireNonEmpty(originalFilename, "originalFilename"),
                MAX_FILENAME_LENGTH, "originalFilename");
        this.fileExtension = requireMaxLength(extensionOf(originalFilename), MAX_EXTENSION_LENGTH, "fileExtension");
        this.fileSize = requireNonNegative(fileSize, "fileSize");
        this.mimeType = requireMaxLength(
                (mimeType == null || mimeType.trim().isEmpty()) ? DEFAULT_MIME_TYPE : mimeType.trim(),
                MAX_MIME_TYPE_LENGTH, "mimeType");
        this.metadata = metadata;
    }

    public static AllocationRequest of(String fingerprint, String originalFilename, long fileSize, String mimeType) {
        return new AllocationRequest(fingerprint, originalFilename, fileSize, mimeType, null);
    }

    /**
     * 小写扩展名（含前导点）；没有扩展名时返回空串。
     */
    static String extensionOf(String filename) {
        String name = filename.trim();
        int slash = Math.max(name.lastIndexOf('/'), name.lastIndexOf('\\'));
        if (slash >= 0) {
            name = name.substring(slash + 1);
        }
        int dot = name.lastIndexOf('.');
        if (dot <= 0 || dot == name.length() - 1) {
            return "";
        }
        return name.substring(dot).toLowerCase(Locale.ROOT);
    }

    public String getFingerprint() {
        return fingerprint;
    }

    public String getOriginalFilename() {
        return originalFilename;
    }

    public String getFileExtension() {
        return fileExtension;
    }

    public long getFileSize() {
        return fileSize;
    }

    public String getMimeType() {
        return mimeType;
    }

    public RecordMetadata getMetadata() {
        return metadata;
    }
}
