package com.work.relay.core.chain;

import java.math.BigInteger;

/**
 * 一次待转发的 executeRelayCall 调用。gasLimit/gasPrice 在估算后补齐。
 */
public final class RelayCall {

    private final String keyManager;
    private final BigInteger callNonce;
    private final String callData;
    private final String signature;
    private final long gasLimit;
    private final BigInteger gasPrice;

    public RelayCall(String keyManager, BigInteger callNonce, String callData, String signature) {
        this(keyManager, callNonce, callData, signature, 0L, null);
    }

    private RelayCall(String keyManager, BigInteger callNonce, String callData, String signature,
                      long gasLimit, BigInteger gasPrice) {
        this.keyManager = keyManager;
        this.callNonce = callNonce;
        this.callData = callData;
        this.signature = signature;
        this.gasLimit = gasLimit;
        this.gasPrice = gasPrice;
    }

    public RelayCall withGas(long gasLimit, BigInteger gasPrice) {
        return new RelayCall(keyManager, callNonce, callData, signature, gasLimit, gasPrice);
    }

    public String getKeyManager() {
        return keyManager;
    }

    public BigInteger getCallNonce() {
        return callNonce;
    }

    public String getCallData() {
        return callData;
    }

    public String getSignature() {
        return signature;
    }

    public long getGasLimit() {
        return gasLimit;
    }

    public BigInteger getGasPrice() {
        return gasPrice;
    }
}
