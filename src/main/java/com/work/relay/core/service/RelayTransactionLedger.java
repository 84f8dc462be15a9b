package com.work.relay.core.service;

import com.work.relay.core.chain.RelayCall;
import com.work.relay.core.chain.RelayChainClient;
import com.work.relay.core.config.RelayConfig;
import com.work.relay.core.exception.DuplicateAuthorizationException;
import com.work.relay.core.exception.IllegalStateTransitionException;
import com.work.relay.core.exception.TransactionNotFoundException;
import com.work.relay.core.exception.UpstreamFailureException;
import com.work.relay.core.lock.RelayerLockCoordinator;
import com.work.relay.core.model.PayerRef;
import com.work.relay.core.model.RelayTransaction;
import com.work.relay.core.model.RelayTxStatus;
import com.work.relay.core.repository.RelayTransactionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static com.work.relay.core.support.ValidationUtils.requireNonEmpty;
import static com.work.relay.core.support.ValidationUtils.requireNonNegative;
import static com.work.relay.core.support.ValidationUtils.requireNonNull;
import static com.work.relay.core.support.ValidationUtils.requirePositive;

/**
 * relay 交易账本与状态机：PENDING -> {CONFIRMED, FAILED}。
 * <p>
 * 事务边界：选择付费方、计算 relayer nonce、插入交易、扣费在同一个事务里完成，
 * 外层再包一把 relayer 锁，保证同一个 relayer 的 nonce 串行分配。
 */
@Service
public class RelayTransactionLedger {

    private static final Logger log = LoggerFactory.getLogger(RelayTransactionLedger.class);

    private final RelayTransactionRepository transactionRepository;
    private final QuotaResolver quotaResolver;
    private final RelaySequencer sequencer;
    private final RelayChainClient chainClient;
    private final RelayerLockCoordinator lockCoordinator;
    private final TransactionTemplate txTemplate;
    private final Clock clock;

    public RelayTransactionLedger(RelayTransactionRepository transactionRepository,
                                  QuotaResolver quotaResolver,
                                  RelaySequencer sequencer,
                                  RelayChainClient chainClient,
                                  RelayerLockCoordinator lockCoordinator,
                                  RelayConfig config,
                                  Clock clock,
                                  @NonNull PlatformTransactionManager transactionManager) {
        this.transactionRepository = requireNonNull(transactionRepository, "transactionRepository");
        this.quotaResolver = requireNonNull(quotaResolver, "quotaResolver");
        this.sequencer = requireNonNull(sequencer, "sequencer");
        this.chainClient = requireNonNull(chainClient, "chainClient");
        this.lockCoordinator = requireNonNull(lockCoordinator, "lockCoordinator");
        this.clock = requireNonNull(clock, "clock");
        requireNonNull(config, "config");
        requireNonNull(transactionManager, "transactionManager");
        TransactionTemplate template = new TransactionTemplate(transactionManager);
        template.setIsolationLevel(TransactionDefinition.ISOLATION_READ_COMMITTED);
        template.setTimeout(config.getTransactionTimeoutSeconds());
        this.txTemplate = template;
    }

    /**
     * 原子地选择付费方、扣费并插入 PENDING 交易。
     * <p>
     * 先插入后扣费：重放在唯一约束上失败时还没有发生任何扣费。任一步失败整体回滚。
     *
     * @param call         已补齐 gasLimit/gasPrice 的调用
     * @param estimatedGas 本次预估 gas，即扣费数额
     */
    public RelayTransaction createTransaction(String profile, String signer, int channelId,
                                              RelayCall call, long estimatedGas) {
        requireNonEmpty(profile, "profile");
        requireNonEmpty(signer, "signer");
        requireNonNull(call, "call");
        requireNonNegative(estimatedGas, "estimatedGas");

        final String relayer = chainClient.relayerAddress();
        try {
            RelayTransaction created = lockCoordinator.executeWithLock(relayer, owner ->
                    txTemplate.execute(status -> {
                        transactionRepository.lockRelayer(relayer);
                        PayerRef payer = quotaResolver.resolvePayer(profile, estimatedGas);
                        long relayerNonce = sequencer.nextRelayerNonce(relayer);
                        String settledHash = chainClient.computeSettlementHash(call, relayerNonce);

                        RelayTransaction tx = newPendingTransaction(profile, signer, channelId, call,
                                estimatedGas, relayer, relayerNonce, settledHash, payer);
                        transactionRepository.insert(tx);
                        quotaResolver.debit(payer, estimatedGas);
                        return tx;
                    }));
            log.info("[relay] 交易已创建, id={}, profile={}, relayerNonce={}, payer={}",
                    created.getId(), profile, created.getRelayerNonce(), created.getPayer());
            return created;
        } catch (DuplicateAuthorizationException e) {
            log.warn("[relay] 重放的授权, profile={}, signer={}, nonce={}, channel={}",
                    profile, signer, call.getCallNonce(), channelId);
            throw e;
        } catch (DataAccessException | TransactionException e) {
            throw new UpstreamFailureException("创建 relay 交易时存储失败: profile=" + profile, e);
        }
    }

    /**
     * 结算通知：只有 PENDING 可以迁移；重复提交相同终态视为幂等，返回当前记录。
     */
    public RelayTransaction updateStatus(long transactionId, RelayTxStatus target, long gasUsed) {
        requireNonNull(target, "status");
        requireNonNegative(gasUsed, "gasUsed");
        if (!target.isTerminal()) {
            throw new IllegalArgumentException("status must be CONFIRMED or FAILED");
        }
        RelayTransaction current = getTransaction(transactionId);
        if (current.getStatus() == RelayTxStatus.PENDING) {
            int updated = transactionRepository.updateStatus(transactionId, target, gasUsed, clock.instant());
            if (updated == 1) {
                log.info("[relay] 交易状态迁移, id={}, PENDING -> {}, gasUsed={}", transactionId, target, gasUsed);
                return getTransaction(transactionId);
            }
            // 与其他结算通知并发，重新读取后按终态判断
            current = getTransaction(transactionId);
        }
        if (current.getStatus() == target) {
            return current;
        }
        throw new IllegalStateTransitionException("交易 " + transactionId + " 已是 " + current.getStatus()
                + "，不能再迁移到 " + target);
    }

    public RelayTransaction getTransaction(long transactionId) {
        RelayTransaction tx = transactionRepository.findById(transactionId);
        if (tx == null) {
            throw new TransactionNotFoundException(transactionId);
        }
        return tx;
    }

    /**
     * 按创建时间倒序。
     */
    public List<RelayTransaction> listByProfile(String profile) {
        requireNonEmpty(profile, "profile");
        return transactionRepository.listByProfile(profile);
    }

    public List<RelayTransaction> listPending(int limit) {
        return transactionRepository.listPending(limit);
    }

    /**
     * 最近一次投递已超过 staleAfter 仍未广播的 PENDING 交易，按 relayer nonce 升序。
     */
    public List<RelayTransaction> listUndispatched(Duration staleAfter, int limit) {
        requirePositive(staleAfter, "staleAfter");
        return transactionRepository.listUndispatched(clock.instant().minus(staleAfter), limit);
    }

    /**
     * 记录一次重新投递，返回 false 表示交易已广播或已终结。
     */
    public boolean markHandedOff(long transactionId) {
        try {
            return transactionRepository.markHandedOff(transactionId, clock.instant()) == 1;
        } catch (DataAccessException e) {
            throw new UpstreamFailureException("记录投递时间失败: id=" + transactionId, e);
        }
    }

    /**
     * 记录广播成功；已记录过时保持首次时间。
     */
    public void markBroadcast(long transactionId) {
        try {
            transactionRepository.markBroadcast(transactionId, clock.instant());
        } catch (DataAccessException e) {
            throw new UpstreamFailureException("记录广播时间失败: id=" + transactionId, e);
        }
    }

    private RelayTransaction newPendingTransaction(String profile, String signer, int channelId, RelayCall call,
                                                   long estimatedGas, String relayer, long relayerNonce,
                                                   String settledHash, PayerRef payer) {
        Instant now = clock.instant();
        RelayTransaction tx = new RelayTransaction();
        tx.setProfileAddress(profile);
        tx.setCallNonce(call.getCallNonce().toString());
        tx.setSignature(call.getSignature());
        tx.setCallData(call.getCallData());
        tx.setChannelId(channelId);
        tx.setStatus(RelayTxStatus.PENDING);
        tx.setSignerAddress(signer);
        tx.setRelayerNonce(relayerNonce);
        tx.setRelayerAddress(relayer);
        tx.setEstimatedGas(estimatedGas);
        tx.setGasUsed(0L);
        tx.setSettledHash(settledHash);
        tx.setPayerQuotaId(payer.getQuotaId());
        tx.setPayerDelegationId(payer.getDelegationId());
        tx.setKeyManager(call.getKeyManager());
        tx.setGasPrice(call.getGasPrice().toString());
        tx.setHandedOffAt(now);
        tx.setCreatedAt(now);
        tx.setUpdatedAt(now);
        return tx;
    }
}
