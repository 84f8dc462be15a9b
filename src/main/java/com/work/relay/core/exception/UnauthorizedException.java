package com.work.relay.core.exception;

/**
 * 签名无法恢复出 signer，或 signer 没有 profile 的执行权限。
 */
public class UnauthorizedException extends RelayException {

    public UnauthorizedException(String message) {
        super(RelayErrorCode.UNAUTHORIZED, "unauthorized", message);
    }

    public UnauthorizedException(String message, Throwable cause) {
        super(RelayErrorCode.UNAUTHORIZED, "unauthorized", message, cause);
    }
}
