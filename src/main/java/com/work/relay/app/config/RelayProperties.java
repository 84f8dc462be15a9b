package com.work.relay.app.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * 仅存在于 app 包，用于从 application.yml 读取配置。
 * 再由配置类转换为 core 包所需的 {@link com.work.relay.core.config.RelayConfig}。
 */
@ConfigurationProperties(prefix = "relay")
public class RelayProperties {

    /**
     * 新 profile 的默认月度额度（gas）。
     */
    private long defaultMonthlyAllowance = 650_000L;

    /**
     * 自签名时间戳允许的偏差。
     */
    private Duration attestationWindow = Duration.ofSeconds(5);

    /**
     * local 或 redis。多实例共享同一个 relayer 钱包时必须用 redis。
     */
    private String lockMode = "local";
    private Duration lockTtl = Duration.ofSeconds(10);
    private Duration lockWaitTimeout = Duration.ofSeconds(5);
    private int transactionTimeoutSeconds = 5;

    /**
     * memory 或 redis
     */
    private String queueMode = "memory";

    /**
     * 月度重置所在时区，resetDate 按此时区的下月 1 号计算。
     */
    private String resetZone = "UTC";

    private int dispatchBatchSize = 50;
    private long dispatchIntervalMillis = 500L;

    private int settlementBatchSize = 200;
    private long settlementScanIntervalMillis = 2_000L;

    /**
     * 投递后超过该时长仍未广播的 PENDING 交易会被重新入队。
     */
    private Duration handOffStaleAfter = Duration.ofSeconds(60);
    private int handOffSweepBatchSize = 100;
    private long handOffSweepIntervalMillis = 15_000L;

    private long keyManagerCacheSize = 10_000L;

    public long getDefaultMonthlyAllowance() {
        return defaultMonthlyAllowance;
    }

    public void setDefaultMonthlyAllowance(long defaultMonthlyAllowance) {
        this.defaultMonthlyAllowance = defaultMonthlyAllowance;
    }

    public Duration getAttestationWindow() {
        return attestationWindow;
    }

    public void setAttestationWindow(Duration attestationWindow) {
        this.attestationWindow = attestationWindow;
    }

    public String getLockMode() {
        return lockMode;
    }

    public void setLockMode(String lockMode) {
        this.lockMode = lockMode;
    }

    public Duration getLockTtl() {
        return lockTtl;
    }

    public void setLockTtl(Duration lockTtl) {
        this.lockTtl = lockTtl;
    }

    public Duration getLockWaitTimeout() {
        return lockWaitTimeout;
    }

    public void setLockWaitTimeout(Duration lockWaitTimeout) {
        this.lockWaitTimeout = lockWaitTimeout;
    }

    public int getTransactionTimeoutSeconds() {
        return transactionTimeoutSeconds;
    }

    public void setTransactionTimeoutSeconds(int transactionTimeoutSeconds) {
        this.transactionTimeoutSeconds = transactionTimeoutSeconds;
    }

    public String getQueueMode() {
        return queueMode;
    }

    public void setQueueMode(String queueMode) {
        this.queueMode = queueMode;
    }

    public String getResetZone() {
        return resetZone;
    }

    public void setResetZone(String resetZone) {
        this.resetZone = resetZone;
    }

    public int getDispatchBatchSize() {
        return dispatchBatchSize;
    }

    public void setDispatchBatchSize(int dispatchBatchSize) {
        this.dispatchBatchSize = dispatchBatchSize;
    }

    public long getDispatchIntervalMillis() {
        return dispatchIntervalMillis;
    }

    public void setDispatchIntervalMillis(long dispatchIntervalMillis) {
        this.dispatchIntervalMillis = dispatchIntervalMillis;
    }

    public int getSettlementBatchSize() {
        return settlementBatchSize;
    }

    public void setSettlementBatchSize(int settlementBatchSize) {
        this.settlementBatchSize = settlementBatchSize;
    }

    public long getSettlementScanIntervalMillis() {
        return settlementScanIntervalMillis;
    }

    public void setSettlementScanIntervalMillis(long settlementScanIntervalMillis) {
        this.settlementScanIntervalMillis = settlementScanIntervalMillis;
    }

    public Duration getHandOffStaleAfter() {
        return handOffStaleAfter;
    }

    public void setHandOffStaleAfter(Duration handOffStaleAfter) {
        this.handOffStaleAfter = handOffStaleAfter;
    }

    public int getHandOffSweepBatchSize() {
        return handOffSweepBatchSize;
    }

    public void setHandOffSweepBatchSize(int handOffSweepBatchSize) {
        this.handOffSweepBatchSize = handOffSweepBatchSize;
    }

    public long getHandOffSweepIntervalMillis() {
        return handOffSweepIntervalMillis;
    }

    public void setHandOffSweepIntervalMillis(long handOffSweepIntervalMillis) {
        this.handOffSweepIntervalMillis = handOffSweepIntervalMillis;
    }

    public long getKeyManagerCacheSize() {
        return keyManagerCacheSize;
    }

    public void setKeyManagerCacheSize(long keyManagerCacheSize) {
        this.keyManagerCacheSize = keyManagerCacheSize;
    }
}
