package com.work.relay.core.repository.impl;

import com.work.relay.core.exception.DuplicateAuthorizationException;
import com.work.relay.core.model.RelayTransaction;
import com.work.relay.core.model.RelayTxStatus;
import com.work.relay.core.repository.RelayTransactionRepository;
import com.work.relay.core.repository.entity.RelayTransactionEntity;
import com.work.relay.core.repository.mapper.RelayTransactionMapper;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static com.work.relay.core.support.ValidationUtils.requireNonEmpty;
import static com.work.relay.core.support.ValidationUtils.requireNonNull;

/**
 * 基于 PostgreSQL + MyBatis-Plus 的 RelayTransactionRepository 实现
 * <p>
 * 重放保护依赖表上的 UNIQUE(call_nonce, channel_id, signer_address)，这里只负责把冲突翻译成领域异常。
 */
@Repository
public class PostgresRelayTransactionRepository implements RelayTransactionRepository {

    private final RelayTransactionMapper txMapper;

    public PostgresRelayTransactionRepository(RelayTransactionMapper txMapper) {
        this.txMapper = txMapper;
    }

    @Override
    public void lockRelayer(String relayerAddress) {
        requireNonEmpty(relayerAddress, "relayerAddress");
        txMapper.advisoryLockRelayer(relayerAddress);
    }

    @Override
    public Long findLatestPendingRelayerNonce(String relayerAddress) {
        requireNonEmpty(relayerAddress, "relayerAddress");
        return txMapper.selectLatestPendingRelayerNonce(relayerAddress);
    }

    @Override
    public RelayTransaction insert(RelayTransaction tx) {
        requireNonNull(tx, "tx");
        RelayTransactionEntity entity = toEntity(tx);
        try {
            txMapper.insert(entity);
        } catch (DuplicateKeyException e) {
            throw new DuplicateAuthorizationException("重复的授权: nonce=" + tx.getCallNonce()
                    + ", channel=" + tx.getChannelId() + ", signer=" + tx.getSignerAddress(), e);
        }
        tx.setId(entity.getId());
        return tx;
    }

    @Override
    public RelayTransaction findById(long id) {
        RelayTransactionEntity entity = txMapper.selectByTxId(id);
        return entity == null ? null : toModel(entity);
    }

    @Override
    public List<RelayTransaction> listByProfile(String profileAddress) {
        requireNonEmpty(profileAddress, "profileAddress");
        return toModels(txMapper.selectByProfile(profileAddress));
    }

    @Override
    public List<RelayTransaction> listPending(int limit) {
        return toModels(txMapper.selectPending(Math.max(1, limit)));
    }

    @Override
    public int updateStatus(long id, RelayTxStatus status, long gasUsed, Instant updatedAt) {
        requireNonNull(status, "status");
        return txMapper.updateStatusFromPending(id, status.name(), gasUsed, updatedAt);
    }

    @Override
    public List<RelayTransaction> listUndispatched(Instant handedOffBefore, int limit) {
        requireNonNull(handedOffBefore, "handedOffBefore");
        return toModels(txMapper.selectUndispatched(handedOffBefore, Math.max(1, limit)));
    }

    @Override
    public int markHandedOff(long id, Instant handedOffAt) {
        requireNonNull(handedOffAt, "handedOffAt");
        return txMapper.updateHandedOff(id, handedOffAt);
    }

    @Override
    public int markBroadcast(long id, Instant broadcastAt) {
        requireNonNull(broadcastAt, "broadcastAt");
        return txMapper.updateBroadcast(id, broadcastAt);
    }

    private List<RelayTransaction> toModels(List<RelayTransactionEntity> entities) {
        List<RelayTransaction> result = new ArrayList<>(entities.size());
        for (RelayTransactionEntity entity : entities) {
            result.add(toModel(entity));
        }
        return result;
    }

    private RelayTransactionEntity toEntity(RelayTransaction tx) {
        RelayTransactionEntity e = new RelayTransactionEntity();
        e.setProfileAddress(tx.getProfileAddress());
        e.setCallNonce(tx.getCallNonce());
        e.setSignature(tx.getSignature());
        e.setCallData(tx.getCallData());
        e.setChannelId(tx.getChannelId());
        e.setStatus(tx.getStatus().name());
        e.setSignerAddress(tx.getSignerAddress());
        e.setRelayerNonce(tx.getRelayerNonce());
        e.setRelayerAddress(tx.getRelayerAddress());
        e.setEstimatedGas(tx.getEstimatedGas());
        e.setGasUsed(tx.getGasUsed());
        e.setSettledHash(tx.getSettledHash());
        e.setPayerQuotaId(tx.getPayerQuotaId());
        e.setPayerDelegationId(tx.getPayerDelegationId());
        e.setKeyManager(tx.getKeyManager());
        e.setGasPrice(tx.getGasPrice());
        e.setHandedOffAt(tx.getHandedOffAt());
        e.setBroadcastAt(tx.getBroadcastAt());
        e.setCreatedAt(tx.getCreatedAt());
        e.setUpdatedAt(tx.getUpdatedAt());
        return e;
    }

    private RelayTransaction toModel(RelayTransactionEntity e) {
        RelayTransaction tx = new RelayTransaction();
        tx.setId(e.getId());
        tx.setProfileAddress(e.getProfileAddress());
        tx.setCallNonce(e.getCallNonce());
        tx.setSignature(e.getSignature());
        tx.setCallData(e.getCallData());
        tx.setChannelId(e.getChannelId());
        tx.setStatus(RelayTxStatus.valueOf(e.getStatus()));
        tx.setSignerAddress(e.getSignerAddress());
        tx.setRelayerNonce(e.getRelayerNonce());
        tx.setRelayerAddress(e.getRelayerAddress());
        tx.setEstimatedGas(e.getEstimatedGas());
        tx.setGasUsed(e.getGasUsed());
        tx.setSettledHash(e.getSettledHash());
        tx.setPayerQuotaId(e.getPayerQuotaId());
        tx.setPayerDelegationId(e.getPayerDelegationId());
        tx.setKeyManager(e.getKeyManager());
        tx.setGasPrice(e.getGasPrice());
        tx.setHandedOffAt(e.getHandedOffAt());
        tx.setBroadcastAt(e.getBroadcastAt());
        tx.setCreatedAt(e.getCreatedAt());
        tx.setUpdatedAt(e.getUpdatedAt());
        return tx;
    }
}
