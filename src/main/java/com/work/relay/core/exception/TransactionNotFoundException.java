package com.work.relay.core.exception;

public class TransactionNotFoundException extends RelayException {

    public TransactionNotFoundException(long transactionId) {
        super(RelayErrorCode.NOT_FOUND, "transaction not found", "relay transaction 不存在: id=" + transactionId);
    }
}
