package com.work.relay.core.model;

import java.time.Instant;

/**
 * 对应 relay_transactions 表：一次 relay 请求从授权到链上结果的完整记录。
 * <p>
 * (callNonce, channelId, signerAddress) 在存储层唯一，防止同一份签名授权被重放。
 */
public class RelayTransaction {

    private Long id;

    /**
     * 发起调用的 profile。
     */
    private String profileAddress;

    /**
     * 十进制规范形式的 uint256 nonce。
     */
    private String callNonce;

    private String signature;

    private String callData;

    private Integer channelId;

    private RelayTxStatus status;

    private String signerAddress;

    /**
     * relayer 钱包上的 nonce，由 RelaySequencer 分配。
     */
    private Long relayerNonce;

    private String relayerAddress;

    private Long estimatedGas;

    /**
     * 结算时回填的实际 gas，PENDING 时为 0。
     */
    private Long gasUsed;

    /**
     * 预先签名得到的链上交易 hash。
     */
    private String settledHash;

    private Long payerQuotaId;

    /**
     * 为空表示由自身 quota 支付。
     */
    private Long payerDelegationId;

    /**
     * 调用目标（profile 的 key manager）与结算 hash 所用的 gas price（十进制），
     * 补投递时据此重建工作项。
     */
    private String keyManager;

    private String gasPrice;

    /**
     * 最近一次投递执行队列的时间。
     */
    private Instant handedOffAt;

    /**
     * 执行器广播成功的时间，为空表示尚未广播。
     */
    private Instant broadcastAt;

    private Instant createdAt;

    private Instant updatedAt;

    public PayerRef getPayer() {
        return PayerRef.of(payerQuotaId, payerDelegationId, null);
    }

    public Long getId() {
        return id;
    }

    public void setId(Long id) {
        this.id = id;
    }

    public String getProfileAddress() {
        return profileAddress;
    }

    public void setProfileAddress(String profileAddress) {
        this.profileAddress = profileAddress;
    }

    public String getCallNonce() {
        return callNonce;
    }

    public void setCallNonce(String callNonce) {
        this.callNonce = callNonce;
    }

    public String getSignature() {
        return signature;
    }

    public void setSignature(String signature) {
        this.signature = signature;
    }

    public String getCallData() {
        return callData;
    }

    public void setCallData(String callData) {
        this.callData = callData;
    }

    public Integer getChannelId() {
        return channelId;
    }

    public void setChannelId(Integer channelId) {
        this.channelId = channelId;
    }

    public RelayTxStatus getStatus() {
        return status;
    }

    public void setStatus(RelayTxStatus status) {
        this.status = status;
    }

    public String getSignerAddress() {
        return signerAddress;
    }

    public void setSignerAddress(String signerAddress) {
        this.signerAddress = signerAddress;
    }

    public Long getRelayerNonce() {
        return relayerNonce;
    }

    public void setRelayerNonce(Long relayerNonce) {
        this.relayerNonce = relayerNonce;
    }

    public String getRelayerAddress() {
        return relayerAddress;
    }

    public void setRelayerAddress(String relayerAddress) {
        this.relayerAddress = relayerAddress;
    }

    public Long getEstimatedGas() {
        return estimatedGas;
    }

    public void setEstimatedGas(Long estimatedGas) {
        this.estimatedGas = estimatedGas;
    }

    public Long getGasUsed() {
        return gasUsed;
    }

    public void setGasUsed(Long gasUsed) {
        this.gasUsed = gasUsed;
    }

    public String getSettledHash() {
        return settledHash;
    }

    public void setSettledHash(String settledHash) {
        this.settledHash = settledHash;
    }

    public Long getPayerQuotaId() {
        return payerQuotaId;
    }

    public void setPayerQuotaId(Long payerQuotaId) {
        this.payerQuotaId = payerQuotaId;
    }

    public Long getPayerDelegationId() {
        return payerDelegationId;
    }

    public void setPayerDelegationId(Long payerDelegationId) {
        this.payerDelegationId = payerDelegationId;
    }

    public String getKeyManager() {
        return keyManager;
    }

    public void setKeyManager(String keyManager) {
        this.keyManager = keyManager;
    }

    public String getGasPrice() {
        return gasPrice;
    }

    public void setGasPrice(String gasPrice) {
        this.gasPrice = gasPrice;
    }

    public Instant getHandedOffAt() {
        return handedOffAt;
    }

    public void setHandedOffAt(Instant handedOffAt) {
        this.handedOffAt = handedOffAt;
    }

    public Instant getBroadcastAt() {
        return broadcastAt;
    }

    public void setBroadcastAt(Instant broadcastAt) {
        this.broadcastAt = broadcastAt;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }

    @Override
    public String toString() {
        return "RelayTransaction{" +
                "id=" + id +
                ", profile='" + profileAddress + '\'' +
                ", channelId=" + channelId +
                ", status=" + status +
                ", relayerNonce=" + relayerNonce +
                ", settledHash='" + settledHash + '\'' +
                '}';
    }
}
