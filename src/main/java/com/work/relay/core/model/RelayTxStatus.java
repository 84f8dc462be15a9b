package com.work.relay.core.model;

/**
 * relay 交易状态机：PENDING -> {CONFIRMED, FAILED}。组件只会创建 PENDING。
 */
public enum RelayTxStatus {
    PENDING,
    CONFIRMED,
    FAILED;

    public boolean isTerminal() {
        return this != PENDING;
    }
}
