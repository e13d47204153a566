package com.work.shortkey.core.model;

/**
 * 批量分配中单个文件的结果：成功则有 result，失败则有 error，二者互斥。
 */
public class BatchItemOutcome {

    private final String fingerprint;
    private final AllocationResult result;
    private final RuntimeException error;

    private BatchItemOutcome(String fingerprint, AllocationResult result, RuntimeException error) {
        this.fingerprint = fingerprint;
        this.result = result;
        this.error = error;
    }

    public static BatchItemOutcome success(String fingerprint, AllocationResult result) {
        return new BatchItemOutcome(fingerprint, result, null);
    }

    public static BatchItemOutcome failure(String fingerprint, RuntimeException error) {
        return new BatchItemOutcome(fingerprint, null, error);
    }

    public boolean isSuccess() {
        return error == null;
    }

    public String getFingerprint() {
        return fingerprint;
    }

    public AllocationResult getResult() {
        return result;
    }

    public RuntimeException getError() {
        return error;
    }
}
