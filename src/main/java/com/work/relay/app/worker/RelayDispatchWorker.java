package com.work.relay.app.worker;

import com.work.relay.app.config.RelayProperties;
import com.work.relay.core.chain.RelayCall;
import com.work.relay.core.chain.RelayChainClient;
import com.work.relay.core.exception.RelayException;
import com.work.relay.core.exception.UpstreamFailureException;
import com.work.relay.core.model.RelayTransaction;
import com.work.relay.core.model.RelayTxStatus;
import com.work.relay.core.model.RelayWorkItem;
import com.work.relay.core.queue.RelayWorkQueue;
import com.work.relay.core.queue.RelayWorkQueueEntry;
import com.work.relay.core.service.RelayTransactionLedger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 执行队列的消费端：按落库时分配的 relayer nonce 重新签名并广播。
 * <p>
 * 按 transactionId 幂等：交易已不是 PENDING 或已记录过广播时直接 ACK。
 * 上游不可用时 NACK 回队列等待下一轮，本 worker 内部不做重试。
 */
@Component
public class RelayDispatchWorker {

    private static final Logger log = LoggerFactory.getLogger(RelayDispatchWorker.class);

    private final RelayWorkQueue workQueue;
    private final RelayTransactionLedger ledger;
    private final RelayChainClient chainClient;
    private final RelayProperties properties;
    private final AtomicBoolean running = new AtomicBoolean(false);

    public RelayDispatchWorker(RelayWorkQueue workQueue,
                               RelayTransactionLedger ledger,
                               RelayChainClient chainClient,
                               RelayProperties properties) {
        this.workQueue = workQueue;
        this.ledger = ledger;
        this.chainClient = chainClient;
        this.properties = properties;
    }

    @Scheduled(fixedDelayString = "${relay.dispatch-interval-millis:500}")
    public void drain() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        try {
            List<RelayWorkQueueEntry> entries = workQueue.pullBatch(Math.max(1, properties.getDispatchBatchSize()));
            List<RelayWorkQueueEntry> failed = new ArrayList<>();
            for (RelayWorkQueueEntry entry : entries) {
                RelayWorkItem item = entry.getItem();
                try {
                    dispatch(item);
                    workQueue.ack(entry);
                } catch (UpstreamFailureException e) {
                    log.warn("[relay] 广播失败，放回队列, item={}, err={}", item, e.getMessage());
                    failed.add(entry);
                } catch (RelayException e) {
                    log.error("[relay] 工作项无法处理，丢弃, item={}, code={}", item, e.getCode(), e);
                    workQueue.ack(entry);
                }
            }
            workQueue.nack(failed);
        } finally {
            running.set(false);
        }
    }

    void dispatch(RelayWorkItem item) {
        RelayTransaction tx = ledger.getTransaction(item.getTransactionId());
        if (tx.getStatus() != RelayTxStatus.PENDING) {
            log.debug("[relay] 交易已结算，跳过, id={}, status={}", tx.getId(), tx.getStatus());
            return;
        }
        if (tx.getBroadcastAt() != null) {
            log.debug("[relay] 交易已广播，跳过重复投递, id={}, broadcastAt={}", tx.getId(), tx.getBroadcastAt());
            return;
        }
        RelayCall call = new RelayCall(item.getKeyManager(), new BigInteger(tx.getCallNonce()),
                tx.getCallData(), tx.getSignature())
                .withGas(tx.getEstimatedGas(), new BigInteger(item.getGasPrice()));
        String hash = chainClient.broadcast(call, tx.getRelayerNonce());
        if (!hash.equalsIgnoreCase(tx.getSettledHash())) {
            log.warn("[relay] 广播 hash 与落库 hash 不一致, id={}, stored={}, actual={}",
                    tx.getId(), tx.getSettledHash(), hash);
        }
        log.info("[relay] 交易已广播, id={}, relayerNonce={}, hash={}", tx.getId(), tx.getRelayerNonce(), hash);
        ledger.markBroadcast(tx.getId());
    }
}
