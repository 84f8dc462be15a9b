package com.work.relay.core.repository;

import com.work.relay.core.model.Delegation;

import java.util.List;

/**
 * 委托（approved quota）存储抽象，结果统一按 id 升序返回。
 */
public interface DelegationRepository {

    /**
     * 行锁加载所有授予给 approved 的委托。
     */
    List<Delegation> lockGrantedTo(String approvedAddress);

    List<Delegation> findGrantedTo(String approvedAddress);

    List<Delegation> findGrantedBy(String approverAddress);

    /**
     * 按 (approver, approved) upsert：已存在则只改额度，used 保留。
     */
    Delegation upsert(String approverAddress, String approvedAddress, long monthlyAllowance);

    boolean delete(String approverAddress, String approvedAddress);

    /**
     * used += gas，存储层保证 used <= monthly_allowance。
     */
    void addDelegationUsed(long delegationId, long gas);
}
