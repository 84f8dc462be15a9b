package com.work.relay.core.model;

import java.time.Instant;

/**
 * 对应 quotas 表：profile 自身的月度 gas 额度与已用量。
 * <p>
 * 一个 profile 只有一行（profile_address 唯一）。used 在一个周期内只增不减，月度清零由外部任务负责。
 */
public class Quota {

    private final long id;
    private final String profileAddress;
    private final long monthlyAllowance;
    private long used;
    private final Instant createdAt;
    private Instant updatedAt;

    public Quota(long id, String profileAddress, long monthlyAllowance, long used, Instant createdAt, Instant updatedAt) {
        if (used < 0) {
            throw new IllegalArgumentException("used 不能为负数");
        }
        this.id = id;
        this.profileAddress = profileAddress;
        this.monthlyAllowance = monthlyAllowance;
        this.used = used;
        this.createdAt = createdAt;
        this.updatedAt = updatedAt;
    }

    /**
     * used + gas <= monthly_allowance。
     */
    public boolean canCover(long gas) {
        return used + gas <= monthlyAllowance;
    }

    /**
     * 剩余可用额度，透支时为 0。
     */
    public long headroom() {
        return Math.max(0L, monthlyAllowance - used);
    }

    public long getId() {
        return id;
    }

    public String getProfileAddress() {
        return profileAddress;
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
        return "Quota{" +
                "id=" + id +
                ", profileAddress='" + profileAddress + '\'' +
                ", monthlyAllowance=" + monthlyAllowance +
                ", used=" + used +
                '}';
    }
}
