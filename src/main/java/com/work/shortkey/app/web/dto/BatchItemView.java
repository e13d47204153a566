package com.work.shortkey.app.web.dto;

/**
 * 批量分配中单个条目的结果；失败时 error 非空。
 */
public class BatchItemView {

    private String fingerprint;
    private boolean success;
    private ShortKeyView result;
    private String error;

    public String getFingerprint() {
        return fingerprint;
    }

    public void setFingerprint(String fingerprint) {
        this.fingerprint = fingerprint;
    }

    public boolean isSuccess() {
        return success;
    }

    public void setSuccess(boolean success) {
        this.success = success;
    }

    public ShortKeyView getResult() {
        return result;
    }

    public void setResult(ShortKeyView result) {
        this.result = result;
    }

    public String getError() {
        return error;
    }

    public void setError(String error) {
        this.error = error;
    }
}
