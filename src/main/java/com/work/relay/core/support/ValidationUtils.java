package com.work.relay.core.support;

import java.time.Duration;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * 参数校验工具类，统一参数校验逻辑，减少代码重复
 */
public final class ValidationUtils {

    /**
     * EVM 地址：0x + 40 位十六进制，大小写不敏感（checksum 不在这里校验）。
     */
    private static final Pattern ADDRESS_PATTERN = Pattern.compile("^0x[0-9a-fA-F]{40}$");

    private static final Pattern HEX_PATTERN = Pattern.compile("^0x([0-9a-fA-F]{2})+$");

    private ValidationUtils() {
        throw new AssertionError("工具类不允许实例化");
    }

    /**
     * 校验字符串参数不为空
     */
    public static String requireNonEmpty(String value, String paramName) {
        if (value == null || value.trim().isEmpty()) {
            throw new IllegalArgumentException(paramName + " must be present");
        }
        return value;
    }

    /**
     * 校验对象不为null
     */
    public static <T> T requireNonNull(T value, String paramName) {
        if (value == null) {
            throw new IllegalArgumentException(paramName + " must be present");
        }
        return value;
    }

    /**
     * 校验Duration必须大于0
     */
    public static Duration requirePositive(Duration duration, String paramName) {
        requireNonNull(duration, paramName);
        if (duration.isNegative() || duration.isZero()) {
            throw new IllegalArgumentException(paramName + " must be positive");
        }
        return duration;
    }

    /**
     * 校验long值必须非负
     */
    public static long requireNonNegative(long value, String paramName) {
        if (value < 0) {
            throw new IllegalArgumentException(paramName + " must not be negative");
        }
        return value;
    }

    /**
     * 校验 0x 前缀的十六进制串（call data、签名），返回小写形式。
     */
    public static String requireHex(String value, String paramName) {
        requireNonEmpty(value, paramName);
        String trimmed = value.trim();
        if (!HEX_PATTERN.matcher(trimmed).matches()) {
            throw new IllegalArgumentException(paramName + " must be 0x-prefixed hex");
        }
        return trimmed.toLowerCase(Locale.ROOT);
    }

    /**
     * 校验地址格式，并返回统一的小写形式。
     * <p>所有落库/比较的地址都必须先经过这里，否则 checksum 大小写会绕过唯一约束。</p>
     */
    public static String requireAddress(String address, String paramName) {
        requireNonEmpty(address, paramName);
        String trimmed = address.trim();
        if (!ADDRESS_PATTERN.matcher(trimmed).matches()) {
            throw new IllegalArgumentException(paramName + " is not a valid address");
        }
        return trimmed.toLowerCase(Locale.ROOT);
    }
}
