package com.work.relay.app.web.dto;

import com.work.relay.core.model.QuotaStatus;

/**
 * 额度汇总；quota 为已用量，totalQuota 为总额度，resetDate 为下月 1 号的 epoch 毫秒。
 */
public class QuotaResponse {

    private final long quota;
    private final String unit;
    private final long totalQuota;
    private final long resetDate;

    public QuotaResponse(long quota, String unit, long totalQuota, long resetDate) {
        this.quota = quota;
        this.unit = unit;
        this.totalQuota = totalQuota;
        this.resetDate = resetDate;
    }

    public static QuotaResponse from(QuotaStatus status) {
        return new QuotaResponse(status.getUsed(), status.getUnit(), status.getTotal(), status.getResetDate());
    }

    public long getQuota() {
        return quota;
    }

    public String getUnit() {
        return unit;
    }

    public long getTotalQuota() {
        return totalQuota;
    }

    public long getResetDate() {
        return resetDate;
    }
}
