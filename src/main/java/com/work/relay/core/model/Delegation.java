package com.work.relay.core.model;

import java.time.Instant;

/**
 * 对应 delegations 表：approver 愿意为 approved 的调用支付至多 monthlyAllowance 的 gas，
 * 实际扣费同时记在 approver 自身的 {@link Quota} 上。
 * <p>
 * 每个有序对 (approver, approved) 至多一行。
 */
public class Delegation {

    private final long id;
    private final String approverAddress;
    private final String approvedAddress;
    private final long monthlyAllowance;
    private long used;
    private final Instant createdAt;
    private Instant updatedAt;

    public Delegation(long id, String approverAddress, String approvedAddress,
                      long monthlyAllowance, long used, Instant createdAt, Instant updatedAt) {
        this.id = id;
        this.approverAddress = approverAddress;
        this.approvedAddress = approvedAddress;
        this.monthlyAllowance = monthlyAllowance;
        this.used = used;
        this.createdAt = createdAt;
        this.updatedAt = updatedAt;
    }

    /**
     * 委托自身能否覆盖本次调用。注意这里是严格小于：used + gas 恰好等于额度时也视为不可用。
     */
    public boolean canCover(long gas) {
        return used + gas < monthlyAllowance;
    }

    public long getId() {
        return id;
    }

    public String getApproverAddress() {
        return approverAddress;
    }

    public String getApprovedAddress() {
        return approvedAddress;
    }

    public long getMonthlyAllowance() {
        return monthlyAllowance;
    }

    public long getUsed() {
        return used;
    }

    public void setUsed(long used) {
        this.used = used;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }

    @Override
    public String toString() {
        return "Delegation{" +
                "id=" + id +
                ", approver='" + approverAddress + '\'' +
                ", approved='" + approvedAddress + '\'' +
                ", monthlyAllowance=" + monthlyAllowance +
                ", used=" + used +
                '}';
    }
}
