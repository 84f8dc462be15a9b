package com.work.relay.core.support;

import com.work.relay.core.exception.DuplicateAuthorizationException;
import com.work.relay.core.exception.QuotaExceededException;
import com.work.relay.core.model.Delegation;
import com.work.relay.core.model.Quota;
import com.work.relay.core.model.RelayTransaction;
import com.work.relay.core.model.RelayTxStatus;
import com.work.relay.core.repository.DelegationRepository;
import com.work.relay.core.repository.QuotaRepository;
import com.work.relay.core.repository.RelayTransactionRepository;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 纯内存实现，方便在没有 Postgres 的环境下演示与测试组件行为。
 * <p>
 * 注意：该实现没有事务与行锁，单个方法内部由一把互斥锁保证原子性；
 * 跨方法的串行化依赖调用方持有的 relayer 锁。不具备跨进程一致性。
 * <p>
 * 不支持回滚：插入交易后扣费失败时，已插入的记录会保留下来。
 * “插入与扣费同成同败”只由 Postgres 实现在同一个数据库事务里保证，
 * 基于本类的测试不能用来证明这一点。
 */
public class InMemoryRelayStore implements QuotaRepository, DelegationRepository, RelayTransactionRepository {

    private final Object mutex = new Object();

    private final Set<String> profiles = new HashSet<>();
    private final Map<String, Quota> quotasByProfile = new HashMap<>();
    private final Map<Long, Quota> quotasById = new HashMap<>();
    private final Map<Long, Delegation> delegations = new LinkedHashMap<>();
    private final Map<Long, RelayTransaction> transactions = new LinkedHashMap<>();
    private final Set<String> authorizationKeys = new HashSet<>();

    private final AtomicLong quotaIds = new AtomicLong(1);
    private final AtomicLong delegationIds = new AtomicLong(1);
    private final AtomicLong transactionIds = new AtomicLong(1);

    // ---------------------------------------------------------------- quota

    @Override
    public Quota ensureQuota(String profileAddress, long defaultMonthlyAllowance) {
        synchronized (mutex) {
            profiles.add(profileAddress);
            Quota quota = quotasByProfile.get(profileAddress);
            if (quota == null) {
                Instant now = Instant.now();
                quota = new Quota(quotaIds.getAndIncrement(), profileAddress, defaultMonthlyAllowance, 0L, now, now);
                quotasByProfile.put(profileAddress, quota);
                quotasById.put(quota.getId(), quota);
            }
            return copy(quota);
        }
    }

    @Override
    public Quota lockByProfile(String profileAddress) {
        return findByProfile(profileAddress);
    }

    @Override
    public Quota findByProfile(String profileAddress) {
        synchronized (mutex) {
            Quota quota = quotasByProfile.get(profileAddress);
            return quota == null ? null : copy(quota);
        }
    }

    @Override
    public List<Quota> findByProfiles(Collection<String> profileAddresses) {
        List<Quota> result = new ArrayList<>();
        synchronized (mutex) {
            for (String profile : profileAddresses) {
                Quota quota = quotasByProfile.get(profile);
                if (quota != null) {
                    result.add(copy(quota));
                }
            }
        }
        return result;
    }

    @Override
    public void addUsed(long quotaId, long gas) {
        synchronized (mutex) {
            Quota quota = quotasById.get(quotaId);
            if (quota == null || !quota.canCover(gas)) {
                throw new QuotaExceededException("quota 扣费被额度守卫拒绝: quotaId=" + quotaId + ", gas=" + gas);
            }
            quota.setUsed(quota.getUsed() + gas);
            quota.setUpdatedAt(Instant.now());
        }
    }

    /**
     * 仅用于测试/运维：直接设置额度与已用量（对应外部的月度重置等流程）。
     */
    public void putQuota(String profileAddress, long monthlyAllowance, long used) {
        synchronized (mutex) {
            profiles.add(profileAddress);
            Quota existing = quotasByProfile.get(profileAddress);
            long id = existing == null ? quotaIds.getAndIncrement() : existing.getId();
            Instant now = Instant.now();
            Quota quota = new Quota(id, profileAddress, monthlyAllowance, used, now, now);
            quotasByProfile.put(profileAddress, quota);
            quotasById.put(id, quota);
        }
    }

    // ----------------------------------------------------------- delegation

    @Override
    public List<Delegation> lockGrantedTo(String approvedAddress) {
        return findGrantedTo(approvedAddress);
    }

    @Override
    public List<Delegation> findGrantedTo(String approvedAddress) {
        List<Delegation> result = new ArrayList<>();
        synchronized (mutex) {
            for (Delegation d : delegations.values()) {
                if (d.getApprovedAddress().equals(approvedAddress)) {
                    result.add(copy(d));
                }
            }
        }
        result.sort(Comparator.comparingLong(Delegation::getId));
        return result;
    }

    @Override
    public List<Delegation> findGrantedBy(String approverAddress) {
        List<Delegation> result = new ArrayList<>();
        synchronized (mutex) {
            for (Delegation d : delegations.values()) {
                if (d.getApproverAddress().equals(approverAddress)) {
                    result.add(copy(d));
                }
            }
        }
        result.sort(Comparator.comparingLong(Delegation::getId));
        return result;
    }

    @Override
    public Delegation upsert(String approverAddress, String approvedAddress, long monthlyAllowance) {
        synchronized (mutex) {
            if (!profiles.contains(approverAddress) || !profiles.contains(approvedAddress)) {
                throw new IllegalStateException("profile 未注册: " + approverAddress + " / " + approvedAddress);
            }
            Instant now = Instant.now();
            Delegation existing = findPair(approverAddress, approvedAddress);
            Delegation next;
            if (existing == null) {
                next = new Delegation(delegationIds.getAndIncrement(), approverAddress, approvedAddress,
                        monthlyAllowance, 0L, now, now);
            } else {
                next = new Delegation(existing.getId(), approverAddress, approvedAddress,
                        monthlyAllowance, existing.getUsed(), existing.getCreatedAt(), now);
            }
            delegations.put(next.getId(), next);
            return copy(next);
        }
    }

    @Override
    public boolean delete(String approverAddress, String approvedAddress) {
        synchronized (mutex) {
            Delegation existing = findPair(approverAddress, approvedAddress);
            if (existing == null) {
                return false;
            }
            delegations.remove(existing.getId());
            return true;
        }
    }

    @Override
    public void addDelegationUsed(long delegationId, long gas) {
        synchronized (mutex) {
            Delegation d = delegations.get(delegationId);
            if (d == null || d.getUsed() + gas > d.getMonthlyAllowance()) {
                throw new QuotaExceededException("委托扣费被额度守卫拒绝: delegationId=" + delegationId + ", gas=" + gas);
            }
            d.setUsed(d.getUsed() + gas);
            d.setUpdatedAt(Instant.now());
        }
    }

    /**
     * 仅用于测试：直接设置某条委托的已用量。
     */
    public void setDelegationUsed(long delegationId, long used) {
        synchronized (mutex) {
            delegations.get(delegationId).setUsed(used);
        }
    }

    private Delegation findPair(String approver, String approved) {
        for (Delegation d : delegations.values()) {
            if (d.getApproverAddress().equals(approver) && d.getApprovedAddress().equals(approved)) {
                return d;
            }
        }
        return null;
    }

    // ---------------------------------------------------------- transaction

    @Override
    public void lockRelayer(String relayerAddress) {
        // 进程内由 RelayerLockCoordinator 串行化，这里无需额外动作
    }

    @Override
    public Long findLatestPendingRelayerNonce(String relayerAddress) {
        synchronized (mutex) {
            Long max = null;
            for (RelayTransaction tx : transactions.values()) {
                if (tx.getStatus() == RelayTxStatus.PENDING && relayerAddress.equals(tx.getRelayerAddress())) {
                    if (max == null || tx.getRelayerNonce() > max) {
                        max = tx.getRelayerNonce();
                    }
                }
            }
            return max;
        }
    }

    @Override
    public RelayTransaction insert(RelayTransaction tx) {
        synchronized (mutex) {
            String key = tx.getCallNonce() + "|" + tx.getChannelId() + "|" + tx.getSignerAddress();
            if (!authorizationKeys.add(key)) {
                throw new DuplicateAuthorizationException("重复的授权: " + key, null);
            }
            long id = transactionIds.getAndIncrement();
            tx.setId(id);
            transactions.put(id, copy(tx));
            return tx;
        }
    }

    @Override
    public RelayTransaction findById(long id) {
        synchronized (mutex) {
            RelayTransaction tx = transactions.get(id);
            return tx == null ? null : copy(tx);
        }
    }

    @Override
    public List<RelayTransaction> listByProfile(String profileAddress) {
        List<RelayTransaction> result = new ArrayList<>();
        synchronized (mutex) {
            for (RelayTransaction tx : transactions.values()) {
                if (tx.getProfileAddress().equals(profileAddress)) {
                    result.add(copy(tx));
                }
            }
        }
        result.sort(Comparator.comparing(RelayTransaction::getCreatedAt)
                .thenComparing(RelayTransaction::getId)
                .reversed());
        return result;
    }

    @Override
    public List<RelayTransaction> listPending(int limit) {
        List<RelayTransaction> result = new ArrayList<>();
        synchronized (mutex) {
            for (RelayTransaction tx : transactions.values()) {
                if (tx.getStatus() == RelayTxStatus.PENDING) {
                    result.add(copy(tx));
                }
            }
        }
        result.sort(Comparator.comparing(RelayTransaction::getRelayerNonce));
        return result.size() > limit ? new ArrayList<>(result.subList(0, limit)) : result;
    }

    @Override
    public int updateStatus(long id, RelayTxStatus status, long gasUsed, Instant updatedAt) {
        synchronized (mutex) {
            RelayTransaction tx = transactions.get(id);
            if (tx == null || tx.getStatus() != RelayTxStatus.PENDING) {
                return 0;
            }
            tx.setStatus(status);
            tx.setGasUsed(gasUsed);
            tx.setUpdatedAt(updatedAt);
            return 1;
        }
    }

    @Override
    public List<RelayTransaction> listUndispatched(Instant handedOffBefore, int limit) {
        List<RelayTransaction> result = new ArrayList<>();
        synchronized (mutex) {
            for (RelayTransaction tx : transactions.values()) {
                if (tx.getStatus() == RelayTxStatus.PENDING && tx.getBroadcastAt() == null
                        && tx.getHandedOffAt() != null && tx.getHandedOffAt().isBefore(handedOffBefore)) {
                    result.add(copy(tx));
                }
            }
        }
        result.sort(Comparator.comparing(RelayTransaction::getRelayerNonce));
        return result.size() > limit ? new ArrayList<>(result.subList(0, limit)) : result;
    }

    @Override
    public int markHandedOff(long id, Instant handedOffAt) {
        synchronized (mutex) {
            RelayTransaction tx = transactions.get(id);
            if (tx == null || tx.getStatus() != RelayTxStatus.PENDING || tx.getBroadcastAt() != null) {
                return 0;
            }
            tx.setHandedOffAt(handedOffAt);
            return 1;
        }
    }

    @Override
    public int markBroadcast(long id, Instant broadcastAt) {
        synchronized (mutex) {
            RelayTransaction tx = transactions.get(id);
            if (tx == null || tx.getBroadcastAt() != null) {
                return 0;
            }
            tx.setBroadcastAt(broadcastAt);
            return 1;
        }
    }

    // ---------------------------------------------------------------- copy

    private static Quota copy(Quota q) {
        return new Quota(q.getId(), q.getProfileAddress(), q.getMonthlyAllowance(), q.getUsed(),
                q.getCreatedAt(), q.getUpdatedAt());
    }

    private static Delegation copy(Delegation d) {
        return new Delegation(d.getId(), d.getApproverAddress(), d.getApprovedAddress(),
                d.getMonthlyAllowance(), d.getUsed(), d.getCreatedAt(), d.getUpdatedAt());
    }

    private static RelayTransaction copy(RelayTransaction s) {
        RelayTransaction t = new RelayTransaction();
        t.setId(s.getId());
        t.setProfileAddress(s.getProfileAddress());
        t.setCallNonce(s.getCallNonce());
        t.setSignature(s.getSignature());
        t.setCallData(s.getCallData());
        t.setChannelId(s.getChannelId());
        t.setStatus(s.getStatus());
        t.setSignerAddress(s.getSignerAddress());
        t.setRelayerNonce(s.getRelayerNonce());
        t.setRelayerAddress(s.getRelayerAddress());
        t.setEstimatedGas(s.getEstimatedGas());
        t.setGasUsed(s.getGasUsed());
        t.setSettledHash(s.getSettledHash());
        t.setPayerQuotaId(s.getPayerQuotaId());
        t.setPayerDelegationId(s.getPayerDelegationId());
        t.setKeyManager(s.getKeyManager());
        t.setGasPrice(s.getGasPrice());
        t.setHandedOffAt(s.getHandedOffAt());
        t.setBroadcastAt(s.getBroadcastAt());
        t.setCreatedAt(s.getCreatedAt());
        t.setUpdatedAt(s.getUpdatedAt());
        return t;
    }
}
