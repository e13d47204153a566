package com.work.shortkey.app.config;

import com.work.shortkey.core.config.ShortKeyConfig;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * 仅存在于 app 包，用于从 application.yml 读取配置。
 * 再由配置类转换为 core 包所需的 {@link ShortKeyConfig}。
 */
@ConfigurationProperties(prefix = "shortkey")
public class ShortKeyProperties {

    private String charset = ShortKeyConfig.DEFAULT_CHARSET;
    private int minLength = 4;
    private int maxLength = 12;
    /**
     * 每个长度预留给保留短键的比例
     */
    private double reservedMargin = 0.001;

    /**
     * 单个长度最多使用到容量的多少比例就升级
     */
    private double maxUtilization = 0.85;

    /**
     * 按长度覆盖容量（测试/压测用）
     */
    private Map<Integer, Long> capacityOverrides = new HashMap<>();

    private int maxAttemptsPerLength = 100;
    private int maxEscalations = 3;
    private Duration transactionTimeout = Duration.ofSeconds(5);
    /**
     * 保留短键缓存刷新间隔
     */
    private Duration reservedRefresh = Duration.ofMinutes(10);

    private int storageRetryAttempts = 3;
    private Duration storageRetryInitialBackoff = Duration.ofMillis(20);
    private Duration storageRetryMaxBackoff = Duration.ofMillis(200);
    /**
     * false 时只登记指纹，短键由回填任务异步分配
     */
    private boolean assignOnRegister = true;

    private boolean backfillEnabled = false;
    /**
     * 每轮回填最多处理多少条记录
     */
    private int backfillBatchSize = 200;

    private long backfillIntervalMs = 60000;

    public String getCharset() {
        return charset;
    }

    public void setCharset(String charset) {
        this.charset = charset;
    }

    public int getMinLength() {
        return minLength;
    }

    public void setMinLength(int minLength) {
        this.minLength = minLength;
    }

    public int getMaxLength() {
        return maxLength;
    }

    public void setMaxLength(int maxLength) {
        this.maxLength = maxLength;
    }

    public double getReservedMargin() {
        return reservedMargin;
    }

    public void setReservedMargin(double reservedMargin) {
        this.reservedMargin = reservedMargin;
    }

    public double getMaxUtilization() {
        return maxUtilization;
    }

    public void setMaxUtilization(double maxUtilization) {
        this.maxUtilization = maxUtilization;
    }

    public Map<Integer, Long> getCapacityOverrides() {
        return capacityOverrides;
    }

    public void setCapacityOverrides(Map<Integer, Long> capacityOverrides) {
        this.capacityOverrides = capacityOverrides;
    }

    public int getMaxAttemptsPerLength() {
        return maxAttemptsPerLength;
    }

    public void setMaxAttemptsPerLength(int maxAttemptsPerLength) {
        this.maxAttemptsPerLength = maxAttemptsPerLength;
    }

    public int getMaxEscalations() {
        return maxEscalations;
    }

    public void setMaxEscalations(int maxEscalations) {
        this.maxEscalations = maxEscalations;
    }

    public Duration getTransactionTimeout() {
        return transactionTimeout;
    }

    public void setTransactionTimeout(Duration transactionTimeout) {
        this.transactionTimeout = transactionTimeout;
    }

    public Duration getReservedRefresh() {
        return reservedRefresh;
    }

    public void setReservedRefresh(Duration reservedRefresh) {
        this.reservedRefresh = reservedRefresh;
    }

    public int getStorageRetryAttempts() {
        return storageRetryAttempts;
    }

    public void setStorageRetryAttempts(int storageRetryAttempts) {
        this.storageRetryAttempts = storageRetryAttempts;
    }

    public Duration getStorageRetryInitialBackoff() {
        return storageRetryInitialBackoff;
    }

    public void setStorageRetryInitialBackoff(Duration storageRetryInitialBackoff) {
        this.storageRetryInitialBackoff = storageRetryInitialBackoff;
    }

    public Duration getStorageRetryMaxBackoff() {
        return storageRetryMaxBackoff;
    }

    public void setStorageRetryMaxBackoff(Duration storageRetryMaxBackoff) {
        this.storageRetryMaxBackoff = storageRetryMaxBackoff;
    }

    public boolean isAssignOnRegister() {
        return assignOnRegister;
    }

    public void setAssignOnRegister(boolean assignOnRegister) {
        this.assignOnRegister = assignOnRegister;
    }

    public boolean isBackfillEnabled() {
        return backfillEnabled;
    }

    public void setBackfillEnabled(boolean backfillEnabled) {
        this.backfillEnabled = backfillEnabled;
    }

    public int getBackfillBatchSize() {
        return backfillBatchSize;
    }

    public void setBackfillBatchSize(int backfillBatchSize) {
        this.backfillBatchSize = backfillBatchSize;
    }

    public long getBackfillIntervalMs() {
        return backfillIntervalMs;
    }

    public void setBackfillIntervalMs(long backfillIntervalMs) {
        this.backfillIntervalMs = backfillIntervalMs;
    }
}
