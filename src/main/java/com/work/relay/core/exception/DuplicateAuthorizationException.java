package com.work.relay.core.exception;

/**
 * (call_nonce, channel_id, signer_address) 已被使用过，即重放。
 */
public class DuplicateAuthorizationException extends RelayException {

    public DuplicateAuthorizationException(String message, Throwable cause) {
        super(RelayErrorCode.DUPLICATE_AUTHORIZATION, "authorization already used", message, cause);
    }
}
