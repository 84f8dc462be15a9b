package com.work.relay.core.model;

/**
 * 本次调用由谁付费。
 * <ul>
 *   <li>OWN_QUOTA：profile 自身的 quota，delegationId 为空</li>
 *   <li>DELEGATION：某条委托；quotaId 指向 approver 的 quota，两行都要扣费</li>
 * </ul>
 */
public final class PayerRef {

    public enum Kind {
        OWN_QUOTA,
        DELEGATION
    }

    private final Kind kind;
    private final long quotaId;
    private final Long delegationId;
    private final String payerAddress;

    private PayerRef(Kind kind, long quotaId, Long delegationId, String payerAddress) {
        this.kind = kind;
        this.quotaId = quotaId;
        this.delegationId = delegationId;
        this.payerAddress = payerAddress;
    }

    public static PayerRef ownQuota(Quota quota) {
        return new PayerRef(Kind.OWN_QUOTA, quota.getId(), null, quota.getProfileAddress());
    }

    public static PayerRef delegation(Delegation delegation, Quota approverQuota) {
        return new PayerRef(Kind.DELEGATION, approverQuota.getId(), delegation.getId(), delegation.getApproverAddress());
    }

    /**
     * 从落库的两列恢复。
     */
    public static PayerRef of(long quotaId, Long delegationId, String payerAddress) {
        return new PayerRef(delegationId == null ? Kind.OWN_QUOTA : Kind.DELEGATION, quotaId, delegationId, payerAddress);
    }

    public Kind getKind() {
        return kind;
    }

    public long getQuotaId() {
        return quotaId;
    }

    public Long getDelegationId() {
        return delegationId;
    }

    public String getPayerAddress() {
        return payerAddress;
    }

    @Override
    public String toString() {
        return "PayerRef{" + kind + ", quotaId=" + quotaId + ", delegationId=" + delegationId + ", payer=" + payerAddress + '}';
    }
}
