package com.work.relay.core.model;

import java.math.BigInteger;

/**
 * 交给异步执行器的工作项（至少一次投递），消费方必须按 transactionId 幂等处理。
 */
public class RelayWorkItem {

    private long transactionId;
    private String keyManager;
    private long payerQuotaId;
    private Long payerDelegationId;
    /** 计算 settlement hash 时使用的 gas price（十进制），广播时必须原样复用。 */
    private String gasPrice;

    public RelayWorkItem() {
    }

    public RelayWorkItem(long transactionId, String keyManager, PayerRef payer, BigInteger gasPrice) {
        this.transactionId = transactionId;
        this.keyManager = keyManager;
        this.payerQuotaId = payer.getQuotaId();
        this.payerDelegationId = payer.getDelegationId();
        this.gasPrice = gasPrice.toString();
    }

    /**
     * 由已落库的交易重建工作项，用于补投递。
     */
    public static RelayWorkItem of(RelayTransaction tx) {
        return new RelayWorkItem(tx.getId(), tx.getKeyManager(), tx.getPayer(), new BigInteger(tx.getGasPrice()));
    }

    public long getTransactionId() {
        return transactionId;
    }

    public void setTransactionId(long transactionId) {
        this.transactionId = transactionId;
    }

    public String getKeyManager() {
        return keyManager;
    }

    public void setKeyManager(String keyManager) {
        this.keyManager = keyManager;
    }

    public long getPayerQuotaId() {
        return payerQuotaId;
    }

    public void setPayerQuotaId(long payerQuotaId) {
        this.payerQuotaId = payerQuotaId;
    }

    public Long getPayerDelegationId() {
        return payerDelegationId;
    }

    public void setPayerDelegationId(Long payerDelegationId) {
        this.payerDelegationId = payerDelegationId;
    }

    public String getGasPrice() {
        return gasPrice;
    }

    public void setGasPrice(String gasPrice) {
        this.gasPrice = gasPrice;
    }

    @Override
    public String toString() {
        return "RelayWorkItem{transactionId=" + transactionId + ", keyManager='" + keyManager + "'}";
    }
}
