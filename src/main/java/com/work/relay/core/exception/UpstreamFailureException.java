package com.work.relay.core.exception;

/**
 * 链节点、存储或队列不可用。不在组件内重试。
 */
public class UpstreamFailureException extends RelayException {

    public UpstreamFailureException(String message, Throwable cause) {
        super(RelayErrorCode.UPSTREAM_FAILURE, "upstream unavailable", message, cause);
    }
}
