package com.work.relay.core.repository;

import com.work.relay.core.model.RelayTransaction;
import com.work.relay.core.model.RelayTxStatus;

import java.time.Instant;
import java.util.List;

/**
 * relay 交易存储抽象。
 */
public interface RelayTransactionRepository {

    /**
     * 在当前事务内串行化同一 relayer 的 nonce 计算与插入（跨进程）。
     */
    void lockRelayer(String relayerAddress);

    /**
     * 该 relayer 所有 PENDING 交易中最大的 relayer_nonce，没有则返回 null。
     */
    Long findLatestPendingRelayerNonce(String relayerAddress);

    /**
     * 插入并回填 id；唯一约束冲突抛 DuplicateAuthorizationException。
     */
    RelayTransaction insert(RelayTransaction tx);

    RelayTransaction findById(long id);

    /**
     * 按创建时间倒序。
     */
    List<RelayTransaction> listByProfile(String profileAddress);

    /**
     * 最老的 PENDING 交易，供结算轮询使用。
     */
    List<RelayTransaction> listPending(int limit);

    /**
     * PENDING、尚未广播、且最近一次投递早于 handedOffBefore 的交易，按 relayer_nonce 升序。
     */
    List<RelayTransaction> listUndispatched(Instant handedOffBefore, int limit);

    /**
     * 记录一次（重新）投递；交易已广播或已终结时不更新。
     */
    int markHandedOff(long id, Instant handedOffAt);

    /**
     * 记录首次广播成功的时间，重复调用不覆盖。
     */
    int markBroadcast(long id, Instant broadcastAt);

    /**
     * 仅当当前状态为 PENDING 时更新，返回受影响行数。
     */
    int updateStatus(long id, RelayTxStatus status, long gasUsed, Instant updatedAt);
}
