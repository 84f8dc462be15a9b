package com.work.relay.core.exception;

/**
 * 签名格式错误或无法恢复公钥。对外与 {@link UnauthorizedException} 同语义。
 */
public class SignatureInvalidException extends UnauthorizedException {

    public SignatureInvalidException(String message) {
        super(message);
    }

    public SignatureInvalidException(String message, Throwable cause) {
        super(message, cause);
    }
}
