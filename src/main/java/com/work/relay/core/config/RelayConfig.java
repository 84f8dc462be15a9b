package com.work.relay.core.config;

import java.time.Duration;
import java.time.ZoneId;
import java.time.ZoneOffset;

/**
 * 纯组件侧的配置定义，不依赖任意框架。宿主应用（如 Spring Boot）只需在装配时
 * 将自身读取到的配置参数注入即可，确保 core 包保持与业务、框架解耦。
 */
public class RelayConfig {

    private final long defaultMonthlyAllowance;
    private final Duration attestationWindow;
    private final Duration lockTtl;
    private final Duration lockWaitTimeout;
    private final int transactionTimeoutSeconds;
    private final long chainId;
    private final ZoneId resetZone;

    public RelayConfig(long defaultMonthlyAllowance,
                       Duration attestationWindow,
                       Duration lockTtl,
                       Duration lockWaitTimeout,
                       int transactionTimeoutSeconds,
                       long chainId,
                       ZoneId resetZone) {
        this.defaultMonthlyAllowance = defaultMonthlyAllowance;
        this.attestationWindow = attestationWindow;
        this.lockTtl = lockTtl;
        this.lockWaitTimeout = lockWaitTimeout;
        this.transactionTimeoutSeconds = transactionTimeoutSeconds;
        this.chainId = chainId;
        this.resetZone = resetZone;
    }

    public static RelayConfig defaultConfig() {
        return new RelayConfig(650_000L, Duration.ofSeconds(5), Duration.ofSeconds(10), Duration.ofSeconds(5),
                5, 4201L, ZoneOffset.UTC);
    }

    /**
     * 新 profile 首次访问时的默认月度额度。
     */
    public long getDefaultMonthlyAllowance() {
        return defaultMonthlyAllowance;
    }

    /**
     * 自签名时间戳允许的偏差（双向）。
     */
    public Duration getAttestationWindow() {
        return attestationWindow;
    }

    public Duration getLockTtl() {
        return lockTtl;
    }

    public Duration getLockWaitTimeout() {
        return lockWaitTimeout;
    }

    public int getTransactionTimeoutSeconds() {
        return transactionTimeoutSeconds;
    }

    public long getChainId() {
        return chainId;
    }

    public ZoneId getResetZone() {
        return resetZone;
    }
}
