package com.work.shortkey.app.web.dto;

import com.work.shortkey.core.model.AllocationRequest;

import javax.validation.constraints.NotBlank;
import javax.validation.constraints.PositiveOrZero;
import javax.validation.constraints.Size;

import java.util.List;
import java.util.Map;

/**
 * 上传前申请短键的请求体。
 */
public class AllocateRequest {

    @NotBlank(message = "fingerprint 不能为空")
    private String fingerprint;

    @NotBlank(message = "originalFilename 不能为空")
    @Size(max = AllocationRequest.MAX_FILENAME_LENGTH, message = "originalFilename 过长")
    private String originalFilename;

    @PositiveOrZero(message = "fileSize 不能为负数")
    private long fileSize;

    @Size(max = AllocationRequest.MAX_MIME_TYPE_LENGTH, message = "mimeType 过长")
    private String mimeType;
    private Map<String, String> attributes;
    private List<String> tags;

    public String getFingerprint() {
        return fingerprint;
    }

    public void setFingerprint(String fingerprint) {
        this.fingerprint = fingerprint;
    }

    public String getOriginalFilename() {
        return originalFilename;
    }

    public void setOriginalFilename(String originalFilename) {
        this.originalFilename = originalFilename;
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

    public Map<String, String> getAttributes() {
        return attributes;
    }

    public void setAttributes(Map<String, String> attributes) {
        this.attributes = attributes;
    }

    public List<String> getTags() {
        return tags;
    }

    public void setTags(List<String> tags) {
        this.tags = tags;
    }
}
