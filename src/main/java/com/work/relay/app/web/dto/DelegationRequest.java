package com.work.relay.app.web.dto;

import javax.validation.constraints.NotBlank;
import javax.validation.constraints.PositiveOrZero;

/**
 * 授予/撤销委托。撤销时 monthlyAllowance 可不传。
 */
public class DelegationRequest extends AttestedRequest {

    @NotBlank(message = "approver must be present")
    private String approver;

    @NotBlank(message = "approved must be present")
    private String approved;

    @PositiveOrZero(message = "monthlyAllowance must not be negative")
    private Long monthlyAllowance;

    public String getApprover() {
        return approver;
    }

    public void setApprover(String approver) {
        this.approver = approver;
    }

    public String getApproved() {
        return approved;
    }

    public void setApproved(String approved) {
        this.approved = approved;
    }

    public Long getMonthlyAllowance() {
        return monthlyAllowance;
    }

    public void setMonthlyAllowance(Long monthlyAllowance) {
        this.monthlyAllowance = monthlyAllowance;
    }
}
