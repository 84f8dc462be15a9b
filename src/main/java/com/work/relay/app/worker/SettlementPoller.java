package com.work.relay.app.worker;

import com.work.relay.app.config.RelayProperties;
import com.work.relay.core.chain.RelayChainClient;
import com.work.relay.core.chain.SettlementReceipt;
import com.work.relay.core.exception.RelayException;
import com.work.relay.core.model.RelayTransaction;
import com.work.relay.core.model.RelayTxStatus;
import com.work.relay.core.service.RelayTransactionLedger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 后台轮询 receipt，receipt 出现后把 PENDING 交易迁移到 CONFIRMED / FAILED，并回填实际 gas。
 */
@Component
public class SettlementPoller {

    private static final Logger log = LoggerFactory.getLogger(SettlementPoller.class);

    private final RelayTransactionLedger ledger;
    private final RelayChainClient chainClient;
    private final RelayProperties properties;
    private final AtomicBoolean running = new AtomicBoolean(false);

    public SettlementPoller(RelayTransactionLedger ledger,
                            RelayChainClient chainClient,
                            RelayProperties properties) {
        this.ledger = ledger;
        this.chainClient = chainClient;
        this.properties = properties;
    }

    @Scheduled(fixedDelayString = "${relay.settlement-scan-interval-millis:2000}")
    public void pollReceipts() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        try {
            List<RelayTransaction> pending = ledger.listPending(Math.max(1, properties.getSettlementBatchSize()));
            for (RelayTransaction tx : pending) {
                String txHash = tx.getSettledHash();
                if (txHash == null || txHash.trim().isEmpty()) {
                    continue;
                }
                SettlementReceipt receipt;
                try {
                    receipt = chainClient.getReceipt(txHash);
                } catch (RelayException e) {
                    log.warn("Receipt query failed. id={} txHash={} err={}", tx.getId(), txHash, e.getMessage());
                    continue;
                }
                if (receipt == null) {
                    continue;
                }
                RelayTxStatus target = receipt.isSuccess() ? RelayTxStatus.CONFIRMED : RelayTxStatus.FAILED;
                try {
                    ledger.updateStatus(tx.getId(), target, receipt.getGasUsed());
                    log.info("Receipt arrived. id={} txHash={} blockNumber={} success={}",
                            tx.getId(), txHash, receipt.getBlockNumber(), receipt.isSuccess());
                } catch (RelayException e) {
                    log.warn("Settle failed. id={} txHash={} err={}", tx.getId(), txHash, e.getMessage());
                }
            }
        } finally {
            running.set(false);
        }
    }
}
