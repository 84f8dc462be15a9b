package com.work.relay.core.repository.impl;

import com.work.relay.core.exception.QuotaExceededException;
import com.work.relay.core.model.Delegation;
import com.work.relay.core.repository.DelegationRepository;
import com.work.relay.core.repository.entity.DelegationEntity;
import com.work.relay.core.repository.mapper.DelegationMapper;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static com.work.relay.core.support.ValidationUtils.requireNonEmpty;
import static com.work.relay.core.support.ValidationUtils.requireNonNegative;

/**
 * 基于 PostgreSQL + MyBatis-Plus 的 DelegationRepository 实现
 */
@Repository
public class PostgresDelegationRepository implements DelegationRepository {

    private final DelegationMapper delegationMapper;

    public PostgresDelegationRepository(DelegationMapper delegationMapper) {
        this.delegationMapper = delegationMapper;
    }

    @Override
    public List<Delegation> lockGrantedTo(String approvedAddress) {
        requireNonEmpty(approvedAddress, "approvedAddress");
        return toDelegations(delegationMapper.lockByApproved(approvedAddress));
    }

    @Override
    public List<Delegation> findGrantedTo(String approvedAddress) {
        requireNonEmpty(approvedAddress, "approvedAddress");
        return toDelegations(delegationMapper.selectByApproved(approvedAddress));
    }

    @Override
    public List<Delegation> findGrantedBy(String approverAddress) {
        requireNonEmpty(approverAddress, "approverAddress");
        return toDelegations(delegationMapper.selectByApprover(approverAddress));
    }

    @Override
    public Delegation upsert(String approverAddress, String approvedAddress, long monthlyAllowance) {
        requireNonEmpty(approverAddress, "approverAddress");
        requireNonEmpty(approvedAddress, "approvedAddress");
        requireNonNegative(monthlyAllowance, "monthlyAllowance");

        delegationMapper.upsert(approverAddress, approvedAddress, monthlyAllowance, Instant.now());
        return toDelegation(delegationMapper.selectByPair(approverAddress, approvedAddress));
    }

    @Override
    public boolean delete(String approverAddress, String approvedAddress) {
        requireNonEmpty(approverAddress, "approverAddress");
        requireNonEmpty(approvedAddress, "approvedAddress");
        return delegationMapper.deleteByPair(approverAddress, approvedAddress) > 0;
    }

    @Override
    public void addDelegationUsed(long delegationId, long gas) {
        requireNonNegative(gas, "gas");
        int updated = delegationMapper.addUsed(delegationId, gas, Instant.now());
        if (updated != 1) {
            throw new QuotaExceededException("委托扣费被额度守卫拒绝: delegationId=" + delegationId + ", gas=" + gas);
        }
    }

    private List<Delegation> toDelegations(List<DelegationEntity> entities) {
        List<Delegation> result = new ArrayList<>(entities.size());
        for (DelegationEntity entity : entities) {
            result.add(toDelegation(entity));
        }
        return result;
    }

    private Delegation toDelegation(DelegationEntity e) {
        return new Delegation(e.getId(), e.getApproverAddress(), e.getApprovedAddress(),
                e.getMonthlyAllowance(), e.getUsed(), e.getCreatedAt(), e.getUpdatedAt());
    }
}
