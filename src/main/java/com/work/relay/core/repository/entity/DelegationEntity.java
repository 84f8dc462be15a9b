package com.work.relay.core.repository.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;

import java.time.Instant;

/**
 * delegations 表实体，(approver_address, approved_address) 唯一。
 */
@TableName("delegations")
public class DelegationEntity {

    @TableId(type = IdType.AUTO)
    private Long id;

    private String approverAddress;

    private String approvedAddress;

    private Long monthlyAllowance;

    private Long used;

    private Instant createdAt;

    private Instant updatedAt;

    public Long getId() {
        return id;
    }

    public void setId(Long id) {
        this.id = id;
    }

    public String getApproverAddress() {
        return approverAddress;
    }

    public void setApproverAddress(String approverAddress) {
        this.approverAddress = approverAddress;
    }

    public String getApprovedAddress() {
        return approvedAddress;
    }

    public void setApprovedAddress(String approvedAddress) {
        this.approvedAddress = approvedAddress;
    }

    public Long getMonthlyAllowance() {
        return monthlyAllowance;
    }

    public void setMonthlyAllowance(Long monthlyAllowance) {
        this.monthlyAllowance = monthlyAllowance;
    }

    public Long getUsed() {
        return used;
    }

    public void setUsed(Long used) {
        this.used = used;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }
}
