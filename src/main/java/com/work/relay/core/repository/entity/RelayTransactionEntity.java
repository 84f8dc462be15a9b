package com.work.relay.core.repository.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;

import java.time.Instant;

@TableName("relay_transactions")
public class RelayTransactionEntity {

    @TableId(type = IdType.AUTO)
    private Long id;

    private String profileAddress;

    private String callNonce;

    private String signature;

    private String callData;

    private Integer channelId;

    private String status;

    private String signerAddress;

    private Long relayerNonce;

    private String relayerAddress;

    private Long estimatedGas;

    private Long gasUsed;

    private String settledHash;

    private Long payerQuotaId;

    private Long payerDelegationId;

    private String keyManager;

    private String gasPrice;

    private Instant handedOffAt;

    private Instant broadcastAt;

    private Instant createdAt;

    private Instant updatedAt;

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

    public String getStatus() {
        return status;
    }

    public void setStatus(String status) {
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
}
