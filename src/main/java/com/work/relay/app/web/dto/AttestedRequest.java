package com.work.relay.app.web.dto;

import javax.validation.constraints.NotBlank;
import javax.validation.constraints.NotNull;
import javax.validation.constraints.Positive;

/**
 * 带时间戳自签名的请求公共部分。
 */
public abstract class AttestedRequest {

    /** 客户端 epoch 毫秒，与服务端时间偏差需在窗口内。 */
    @NotNull(message = "timestamp must be present")
    @Positive(message = "timestamp must be present")
    private Long timestamp;

    @NotBlank(message = "signature must be present")
    private String signature;

    public Long getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(Long timestamp) {
        this.timestamp = timestamp;
    }

    public String getSignature() {
        return signature;
    }

    public void setSignature(String signature) {
        this.signature = signature;
    }
}
