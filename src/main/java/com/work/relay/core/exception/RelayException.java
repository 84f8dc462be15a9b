package com.work.relay.core.exception;

/**
 * 组件内部的统一异常类型，便于业务侧捕获或转换为接口错误码。
 * <p>
 * {@link #getPublicMessage()} 是可以返回给调用方的粗粒度描述；{@link #getMessage()} 只用于日志。
 */
public class RelayException extends RuntimeException {

    private final RelayErrorCode code;
    private final String publicMessage;

    public RelayException(RelayErrorCode code, String publicMessage, String message) {
        super(message);
        this.code = code;
        this.publicMessage = publicMessage;
    }

    public RelayException(RelayErrorCode code, String publicMessage, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.publicMessage = publicMessage;
    }

    public RelayErrorCode getCode() {
        return code;
    }

    public String getPublicMessage() {
        return publicMessage;
    }
}
