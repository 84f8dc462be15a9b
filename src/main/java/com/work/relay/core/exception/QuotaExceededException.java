package com.work.relay.core.exception;

/**
 * 自身额度与所有被授予的委托额度都无法覆盖本次预估 gas。
 */
public class QuotaExceededException extends RelayException {

    public QuotaExceededException(String message) {
        super(RelayErrorCode.QUOTA_EXCEEDED, "gas limit reached", message);
    }
}
