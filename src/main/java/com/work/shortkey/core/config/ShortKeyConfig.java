package com.work.shortkey.core.config;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.time.Duration;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

import static com.work.shortkey.core.support.ValidationUtils.requireNonEmpty;
import static com.work.shortkey.core.support.ValidationUtils.requirePositive;

/**
 * 纯组件侧的配置定义，不依赖任意框架。宿主应用（如 Spring Boot）只需在装配时
 * 将自身读取到的配置参数注入即可，确保 core 包保持与业务、框架解耦。
 */
public class ShortKeyConfig {

    /**
     * 默认字符集：数字 + 小写字母 + 大写字母，共 62 个字符。
     */
    public static final String DEFAULT_CHARSET =
            "0123456789abcdefghijklmnopqrstuvwxyzABCDEFGHIJKLMNOPQRSTUVWXYZ";

    private static final BigDecimal LONG_MAX = BigDecimal.valueOf(Long.MAX_VALUE);

    private final String charset;
    private final int minLength;
    private final int maxLength;
    private final double reservedMargin;
    private final double maxUtilization;
    private final Map<Integer, Long> capacityOverrides;
    private final int maxAttemptsPerLength;
    private final int maxEscalations;
    private final Duration transactionTimeout;
    private final Duration reservedRefresh;
    private final int storageRetryAttempts;
    private final Duration storageRetryInitialBackoff;
    private final Duration storageRetryMaxBackoff;
    private final boolean assignOnRegister;

    private ShortKeyConfig(Builder b) {
        this.charset = requireNonEmpty(b.charset, "charset");
        if (charset.chars().distinct().count() != charset.length()) {
            throw new IllegalArgumentException("charset 中存在重复字符");
        }
        this.minLength = requirePositive(b.minLength, "minLength");
        if (b.maxLength < b.minLength) {
            throw new IllegalArgumentException("maxLength 不能小于 minLength");
        }
        this.maxLength = b.maxLength;
        if (b.reservedMargin < 0 || b.reservedMargin >= 1) {
            throw new IllegalArgumentException("reservedMargin 必须位于 [0, 1)");
        }
        this.reservedMargin = b.reservedMargin;
        if (b.maxUtilization <= 0 || b.maxUtilization > 1) {
            throw new IllegalArgumentException("maxUtilization 必须位于 (0, 1]");
        }
        this.maxUtilization = b.maxUtilization;
        this.capacityOverrides = Collections.unmodifiableMap(new HashMap<>(b.capacityOverrides));
        this.maxAttemptsPerLength = requirePositive(b.maxAttemptsPerLength, "maxAttemptsPerLength");
        if (b.maxEscalations < 0) {
            throw new IllegalArgumentException("maxEscalations 不能为负数");
        }
        this.maxEscalations = b.maxEscalations;
        this.transactionTimeout = requirePositive(b.transactionTimeout, "transactionTimeout");
        this.reservedRefresh = requirePositive(b.reservedRefresh, "reservedRefresh");
        this.storageRetryAttempts = requirePositive(b.storageRetryAttempts, "storageRetryAttempts");
        this.storageRetryInitialBackoff = requirePositive(b.storageRetryInitialBackoff, "storageRetryInitialBackoff");
        this.storageRetryMaxBackoff = requirePositive(b.storageRetryMaxBackoff, "storageRetryMaxBackoff");
        this.assignOnRegister = b.assignOnRegister;
    }

    public static ShortKeyConfig defaultConfig() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * 某长度可用于分配的“预算”：charsetSize^length 扣除保留份额后再乘以最大使用率，向下取整。
     * <p>
     * 存在覆盖值时直接使用覆盖值；结果至少为 1，超过 long 范围时截断为 Long.MAX_VALUE。
     */
    public long capacityOf(int length) {
        Long override = capacityOverrides.get(length);
        if (override != null) {
            return Math.max(1L, override);
        }
        BigDecimal total = new BigDecimal(BigInteger.valueOf(charset.length()).pow(length));
        BigDecimal usable = total
                .multiply(BigDecimal.valueOf(1.0d - reservedMargin))
                .multiply(BigDecimal.valueOf(maxUtilization))
                .setScale(0, RoundingMode.FLOOR);
        if (usable.compareTo(LONG_MAX) >= 0) {
            return Long.MAX_VALUE;
        }
        return Math.max(1L, usable.longValueExact());
    }

    public String getCharset() {
        return charset;
    }

    public int getMinLength() {
        return minLength;
    }

    public int getMaxLength() {
        return maxLength;
    }

    public double getReservedMargin() {
        return reservedMargin;
    }

    public double getMaxUtilization() {
        return maxUtilization;
    }

    public Map<Integer, Long> getCapacityOverrides() {
        return capacityOverrides;
    }

    public int getMaxAttemptsPerLength() {
        return maxAttemptsPerLength;
    }

    public int getMaxEscalations() {
        return maxEscalations;
    }

    public Duration getTransactionTimeout() {
        return transactionTimeout;
    }

    public Duration getReservedRefresh() {
        return reservedRefresh;
    }

    public int getStorageRetryAttempts() {
        return storageRetryAttempts;
    }

    public Duration getStorageRetryInitialBackoff() {
        return storageRetryInitialBackoff;
    }

    public Duration getStorageRetryMaxBackoff() {
        return storageRetryMaxBackoff;
    }

    public boolean isAssignOnRegister() {
        return assignOnRegister;
    }

    public static final class Builder {
        private String charset = DEFAULT_CHARSET;
        private int minLength = 4;
        private int maxLength = 12;
        private double reservedMargin = 0.001d;
        private double maxUtilization = 0.85d;
        private final Map<Integer, Long> capacityOverrides = new HashMap<>();
        private int maxAttemptsPerLength = 100;
        private int maxEscalations = 3;
        private Duration transactionTimeout = Duration.ofSeconds(5);
        private Duration reservedRefresh = Duration.ofMinutes(10);
        private int storageRetryAttempts = 3;
        private Duration storageRetryInitialBackoff = Duration.ofMillis(20);
        private Duration storageRetryMaxBackoff = Duration.ofMillis(200);
        private boolean assignOnRegister = true;

        private Builder() {
        }

        public Builder charset(String charset) {
            this.charset = charset;
            return this;
        }

        public Builder minLength(int minLength) {
            this.minLength = minLength;
            return this;
        }

        public Builder maxLength(int maxLength) {
            this.maxLength = maxLength;
            return this;
        }

        public Builder reservedMargin(double reservedMargin) {
            this.reservedMargin = reservedMargin;
            return this;
        }

        public Builder maxUtilization(double maxUtilization) {
            this.maxUtilization = maxUtilization;
            return this;
        }

        public Builder capacityOverride(int length, long capacity) {
            this.capacityOverrides.put(length, capacity);
            return this;
        }

        public Builder capacityOverrides(Map<Integer, Long> overrides) {
            if (overrides != null) {
                this.capacityOverrides.putAll(overrides);
            }
            return this;
        }

        public Builder maxAttemptsPerLength(int maxAttemptsPerLength) {
            this.maxAttemptsPerLength = maxAttemptsPerLength;
            return this;
        }

        public Builder maxEscalations(int maxEscalations) {
            this.maxEscalations = maxEscalations;
            return this;
        }

        public Builder transactionTimeout(Duration transactionTimeout) {
            this.transactionTimeout = transactionTimeout;
            return this;
        }

        public Builder reservedRefresh(Duration reservedRefresh) {
            this.reservedRefresh = reservedRefresh;
            return this;
        }

        public Builder storageRetryAttempts(int storageRetryAttempts) {
            this.storageRetryAttempts = storageRetryAttempts;
            return this;
        }

        public Builder storageRetryInitialBackoff(Duration storageRetryInitialBackoff) {
            this.storageRetryInitialBackoff = storageRetryInitialBackoff;
            return this;
        }

        public Builder storageRetryMaxBackoff(Duration storageRetryMaxBackoff) {
            this.storageRetryMaxBackoff = storageRetryMaxBackoff;
            return this;
        }

        public Builder assignOnRegister(boolean assignOnRegister) {
            this.assignOnRegister = assignOnRegister;
            return this;
        }

        public ShortKeyConfig build() {
            return new ShortKeyConfig(this);
        }
    }
}
