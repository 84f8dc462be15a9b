package com.work.relay.app.web.dto;

import com.work.relay.core.model.Delegation;

import java.time.Instant;

public class DelegationView {

    private final long id;
    private final String approver;
    private final String approved;
    private final long monthlyAllowance;
    private final long used;
    private final Instant createdAt;
    private final Instant updatedAt;

    private DelegationView(Delegation d) {
        this.id = d.getId();
        this.approver = d.getApproverAddress();
        this.approved = d.getApprovedAddress();
        this.monthlyAllowance = d.getMonthlyAllowance();
        this.used = d.getUsed();
        this.createdAt = d.getCreatedAt();
        this.updatedAt = d.getUpdatedAt();
    }

    public static DelegationView from(Delegation d) {
        return new DelegationView(d);
    }

    public long getId() {
        return id;
    }

    public String getApprover() {
        return approver;
    }

    public String getApproved() {
        return approved;
    }

    public long getMonthlyAllowance() {
        return monthlyAllowance;
    }

    public long getUsed() {
        return used;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }
}
