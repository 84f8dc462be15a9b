package com.work.relay.core.support;

import java.math.BigInteger;

import static com.work.relay.core.support.ValidationUtils.requireNonEmpty;

/**
 * LSP6 风格的 relay nonce：uint256，高 128 位是 channel id，低 128 位是 channel 内序号。
 */
public final class CallNonces {

    private static final int CHANNEL_SHIFT = 128;
    private static final BigInteger UINT256_LIMIT = BigInteger.ONE.shiftLeft(256);

    private CallNonces() {
        throw new AssertionError("工具类不允许实例化");
    }

    /**
     * 解析十进制或 0x 十六进制的 nonce。
     * <p>落库统一用 {@link BigInteger#toString()} 的十进制形式，保证同一个 nonce 只有一种写法。</p>
     */
    public static BigInteger parse(String raw) {
        requireNonEmpty(raw, "nonce");
        String s = raw.trim();
        BigInteger value;
        try {
            if (s.startsWith("0x") || s.startsWith("0X")) {
                value = new BigInteger(s.substring(2), 16);
            } else {
                value = new BigInteger(s);
            }
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("nonce is not a number", e);
        }
        if (value.signum() < 0 || value.compareTo(UINT256_LIMIT) >= 0) {
            throw new ArithmeticException("nonce out of uint256 range: " + s);
        }
        return value;
    }

    /**
     * channel_id = nonce >> 128。超出 int 范围直接抛 {@link ArithmeticException}。
     */
    public static int channelId(BigInteger callNonce) {
        return callNonce.shiftRight(CHANNEL_SHIFT).intValueExact();
    }
}
