package com.work.relay.core.exception;

/**
 * 交易已处于另一个终态，拒绝再次改写。
 */
public class IllegalStateTransitionException extends RelayException {

    public IllegalStateTransitionException(String message) {
        super(RelayErrorCode.ILLEGAL_STATE_TRANSITION, "illegal status transition", message);
    }
}
