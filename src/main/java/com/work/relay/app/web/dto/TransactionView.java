package com.work.relay.app.web.dto;

import com.work.relay.core.model.RelayTransaction;

import java.time.Instant;

/**
 * 对外的交易视图，不包含签名原文。
 */
public class TransactionView {

    private Long id;
    private String address;
    private String nonce;
    private String abi;
    private Integer channelId;
    private String status;
    private String signerAddress;
    private Long relayerNonce;
    private String relayerAddress;
    private Long estimatedGas;
    private Long gasUsed;
    private String hash;
    private Long payerQuotaId;
    private Long payerDelegationId;
    private Instant createdAt;
    private Instant updatedAt;

    public static TransactionView from(RelayTransaction tx) {
        TransactionView v = new TransactionView();
        v.id = tx.getId();
        v.address = tx.getProfileAddress();
        v.nonce = tx.getCallNonce();
        v.abi = tx.getCallData();
        v.channelId = tx.getChannelId();
        v.status = tx.getStatus() == null ? null : tx.getStatus().name();
        v.signerAddress = tx.getSignerAddress();
        v.relayerNonce = tx.getRelayerNonce();
        v.relayerAddress = tx.getRelayerAddress();
        v.estimatedGas = tx.getEstimatedGas();
        v.gasUsed = tx.getGasUsed();
        v.hash = tx.getSettledHash();
        v.payerQuotaId = tx.getPayerQuotaId();
        v.payerDelegationId = tx.getPayerDelegationId();
        v.createdAt = tx.getCreatedAt();
        v.updatedAt = tx.getUpdatedAt();
        return v;
    }

    public Long getId() {
        return id;
    }

    public String getAddress() {
        return address;
    }

    public String getNonce() {
        return nonce;
    }

    public String getAbi() {
        return abi;
    }

    public Integer getChannelId() {
        return channelId;
    }

    public String getStatus() {
        return status;
    }

    public String getSignerAddress() {
        return signerAddress;
    }

    public Long getRelayerNonce() {
        return relayerNonce;
    }

    public String getRelayerAddress() {
        return relayerAddress;
    }

    public Long getEstimatedGas() {
        return estimatedGas;
    }

    public Long getGasUsed() {
        return gasUsed;
    }

    public String getHash() {
        return hash;
    }

    public Long getPayerQuotaId() {
        return payerQuotaId;
    }

    public Long getPayerDelegationId() {
        return payerDelegationId;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }
}
