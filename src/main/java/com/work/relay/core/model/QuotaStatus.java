package com.work.relay.core.model;

/**
 * 额度汇总视图（只读）：回答“我一共还能花多少”，不是“下一笔谁付”。
 */
public class QuotaStatus {

    public static final String UNIT_GAS = "gas";

    private final long used;
    private final long total;
    private final long resetDate;

    public QuotaStatus(long used, long total, long resetDate) {
        this.used = used;
        this.total = total;
        this.resetDate = resetDate;
    }

    public long getUsed() {
        return used;
    }

    public long getTotal() {
        return total;
    }

    public String getUnit() {
        return UNIT_GAS;
    }

    /**
     * 下个月 1 号 00:00 的 epoch 毫秒。
     */
    public long getResetDate() {
        return resetDate;
    }
}
