package com.work.relay.core.service;

import com.work.relay.core.chain.RelayCall;
import com.work.relay.core.chain.RelayChainClient;
import com.work.relay.core.exception.RelayException;
import com.work.relay.core.model.QuotaStatus;
import com.work.relay.core.model.RelayTransaction;
import com.work.relay.core.model.RelayWorkItem;
import com.work.relay.core.queue.RelayWorkQueue;
import com.work.relay.core.support.CallNonces;
import com.work.relay.core.support.RelayMessages;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.util.List;

import static com.work.relay.core.support.ValidationUtils.requireAddress;
import static com.work.relay.core.support.ValidationUtils.requireHex;
import static com.work.relay.core.support.ValidationUtils.requireNonEmpty;
import static com.work.relay.core.support.ValidationUtils.requireNonNull;

/**
 * 请求期的协调者，本身不持有状态。
 * <p>
 * 顺序：参数校验 -> key manager -> 授权 -> 估算 gas/gas price（锁外） -> 账本原子写入 -> 投递执行队列。
 * 授权通过之前不会产生任何副作用。
 */
@Service
public class RelayOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(RelayOrchestrator.class);

    private final AuthorizationService authorizationService;
    private final RelayTransactionLedger ledger;
    private final QuotaReportService quotaReportService;
    private final RelayChainClient chainClient;
    private final RelayWorkQueue workQueue;

    public RelayOrchestrator(AuthorizationService authorizationService,
                             RelayTransactionLedger ledger,
                             QuotaReportService quotaReportService,
                             RelayChainClient chainClient,
                             RelayWorkQueue workQueue) {
        this.authorizationService = requireNonNull(authorizationService, "authorizationService");
        this.ledger = requireNonNull(ledger, "ledger");
        this.quotaReportService = requireNonNull(quotaReportService, "quotaReportService");
        this.chainClient = requireNonNull(chainClient, "chainClient");
        this.workQueue = requireNonNull(workQueue, "workQueue");
    }

    /**
     * 执行一次 relay，返回预先计算好的 settlement hash。
     */
    public String execute(String profileAddress, String nonce, String callData, String signature) {
        String profile = requireAddress(profileAddress, "address");
        requireNonEmpty(nonce, "nonce");
        String payload = requireHex(callData, "abi");
        String sig = requireHex(signature, "signature");
        BigInteger callNonce = CallNonces.parse(nonce);
        int channelId = CallNonces.channelId(callNonce);

        String keyManager = chainClient.resolveKeyManager(profile);
        String signer = authorizationService.authorizeRelayCall(profile, keyManager, callNonce, payload, sig);

        RelayCall call = new RelayCall(keyManager, callNonce, payload, sig);
        long estimatedGas = chainClient.estimateGas(call);
        BigInteger gasPrice = chainClient.currentGasPrice();

        RelayTransaction tx = ledger.createTransaction(profile, signer, channelId,
                call.withGas(estimatedGas, gasPrice), estimatedGas);
        handOff(tx);
        return tx.getSettledHash();
    }

    /**
     * 自签名查询额度。
     */
    public QuotaStatus quotaStatus(String profileAddress, long timestampMillis, String signature) {
        String profile = requireAddress(profileAddress, "address");
        if (timestampMillis <= 0) {
            throw new IllegalArgumentException("timestamp must be present");
        }
        String sig = requireHex(signature, "signature");
        byte[] digest = RelayMessages.quotaAttestationDigest(profile, timestampMillis);
        authorizationService.verifyAttestation(profile, timestampMillis, sig, digest);
        return quotaReportService.computeAvailableQuota(profile);
    }

    public List<RelayTransaction> listTransactions(String profileAddress) {
        return ledger.listByProfile(requireAddress(profileAddress, "address"));
    }

    /**
     * 交易已提交后投递。投递失败时交易保持 PENDING，由补投递扫描重新入队；
     * 已分配的 relayer nonce 必须被广播，否则其后的 nonce 都无法上链。
     */
    private void handOff(RelayTransaction tx) {
        try {
            workQueue.enqueue(RelayWorkItem.of(tx));
        } catch (RelayException e) {
            log.error("[relay] 投递执行队列失败，交易保持 PENDING 等待补投递, id={}, relayerNonce={}",
                    tx.getId(), tx.getRelayerNonce(), e);
            throw e;
        }
    }
}
