package com.work.relay.app.web.dto;

import javax.validation.constraints.NotBlank;
import javax.validation.constraints.NotNull;
import javax.validation.constraints.PositiveOrZero;

/**
 * 结算通知：CONFIRMED 或 FAILED，附带实际 gas。
 */
public class UpdateStatusRequest {

    @NotBlank(message = "status must be present")
    private String status;

    @NotNull(message = "gasUsed must be present")
    @PositiveOrZero(message = "gasUsed must not be negative")
    private Long gasUsed;

    public String getStatus() {
        return status;
    }

    public void setStatus(String status) {
        this.status = status;
    }

    public Long getGasUsed() {
        return gasUsed;
    }

    public void setGasUsed(Long gasUsed) {
        this.gasUsed = gasUsed;
    }
}
