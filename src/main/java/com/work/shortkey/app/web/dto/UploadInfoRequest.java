package com.work.shortkey.app.web.dto;

import javax.validation.constraints.NotBlank;

/**
 * 上传完成后回写存储位置。
 */
public class UploadInfoRequest {

    @NotBlank(message = "storageKey 不能为空")
    private String storageKey;

    private String url;

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
}
