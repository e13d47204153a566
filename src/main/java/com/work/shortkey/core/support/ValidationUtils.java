package com.work.shortkey.core.support;

import java.time.Duration;
import java.util.regex.Pattern;

/**
 * 参数校验工具类，统一参数校验逻辑，减少代码重复
 */
public final class ValidationUtils {

    /**
     * 指纹：SHA-512 的小写十六进制表示，固定 128 位。
     */
    private static final Pattern FINGERPRINT_PATTERN = Pattern.compile("^[0-9a-f]{128}$");

    /**
     * 短键：仅允许字母与数字，长度 1~32（长度上限远大于实际可配置的最大长度）。
     */
    private static final Pattern IDENTIFIER_PATTERN = Pattern.compile("^[0-9a-zA-Z]{1,32}$");

    private ValidationUtils() {
        throw new AssertionError("工具类不允许实例化");
    }

    /**
     * 校验字符串参数不为空
     */
    public static String requireNonEmpty(String value, String paramName) {
        if (value == null || value.trim().isEmpty()) {
            throw new IllegalArgumentException(paramName + " 不能为空");
        }
        return value;
    }

    /**
     * 校验对象不为null
     */
    public static <T> T requireNonNull(T value, String paramName) {
        if (value == null) {
            throw new IllegalArgumentException(paramName + " 不能为null");
        }
        return value;
    }

    /**
     * 校验Duration必须大于0
     */
    public static Duration requirePositive(Duration duration, String paramName) {
        requireNonNull(duration, paramName);
        if (duration.isNegative() || duration.isZero()) {
            throw new IllegalArgumentException(paramName + " 必须大于0");
        }
        return duration;
    }

    public static int requirePositive(int value, String paramName) {
        if (value <= 0) {
            throw new IllegalArgumentException(paramName + " 必须大于0");
        }
        return value;
    }

    /**
     * 校验字符串长度不超过对应列宽。null 视为合法，由调用方决定是否必填。
     */
    public static String requireMaxLength(String value, int maxLength, String paramName) {
        if (value != null && value.length() > maxLength) {
            throw new IllegalArgumentException(paramName + " 长度不能超过 " + maxLength);
        }
        return value;
    }

    /**
     * 校验long值必须非负
     */
    public static long requireNonNegative(long value, String paramName) {
        if (value < 0) {
            throw new IllegalArgumentException(paramName + " 不能为负数");
        }
        return value;
    }

    /**
     * 校验指纹格式。大写输入统一转为小写后再校验，返回规范化后的值。
     */
    public static String requireValidFingerprint(String fingerprint) {
        requireNonEmpty(fingerprint, "fingerprint");
        String normalized = fingerprint.trim().toLowerCase(java.util.Locale.ROOT);
        if (!FINGERPRINT_PATTERN.matcher(normalized).matches()) {
            throw new IllegalArgumentException("fingerprint 非法，必须是 128 位十六进制 SHA-512 摘要");
        }
        return normalized;
    }

    /**
     * 校验短键格式（大小写敏感，不做规范化）。
     */
    public static String requireValidIdentifier(String identifier) {
        requireNonEmpty(identifier, "identifier");
        if (!IDENTIFIER_PATTERN.matcher(identifier).matches()) {
            throw new IllegalArgumentException("identifier 非法，只允许 1~32 位的字母与数字");
        }
        return identifier;
    }
}
