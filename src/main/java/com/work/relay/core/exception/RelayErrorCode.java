package com.work.relay.core.exception;

/**
 * 对外稳定的错误码，与 HTTP 状态一一对应，由 web 层统一翻译。
 */
public enum RelayErrorCode {
    ARGUMENT_ERROR,
    UNAUTHORIZED,
    QUOTA_EXCEEDED,
    DUPLICATE_AUTHORIZATION,
    GAS_ESTIMATION_FAILED,
    UPSTREAM_FAILURE,
    NOT_FOUND,
    ILLEGAL_STATE_TRANSITION,
    INTERNAL
}
