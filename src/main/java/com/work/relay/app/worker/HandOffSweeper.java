package com.work.relay.app.worker;

import com.work.relay.app.config.RelayProperties;
import com.work.relay.core.exception.RelayException;
import com.work.relay.core.model.RelayTransaction;
import com.work.relay.core.model.RelayWorkItem;
import com.work.relay.core.queue.RelayWorkQueue;
import com.work.relay.core.service.RelayTransactionLedger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 补投递：
 * - 启动时把执行队列 pending 中未 ACK 的条目放回主队列
 * - 定时扫描已落库、投递后超过阈值仍未广播的 PENDING 交易，按 relayer nonce 升序重新入队
 *
 * 覆盖两种情况：提交后投递失败；执行器在 ACK 前宕机或进程内队列随重启丢失。
 * 重复入队由执行器按 transactionId 幂等吸收。
 */
@Component
public class HandOffSweeper implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(HandOffSweeper.class);

    private final RelayTransactionLedger ledger;
    private final RelayWorkQueue workQueue;
    private final RelayProperties properties;
    private final AtomicBoolean running = new AtomicBoolean(false);

    public HandOffSweeper(RelayTransactionLedger ledger,
                          RelayWorkQueue workQueue,
                          RelayProperties properties) {
        this.ledger = ledger;
        this.workQueue = workQueue;
        this.properties = properties;
    }

    @Override
    public void run(ApplicationArguments args) {
        try {
            int moved = workQueue.requeueInFlight();
            log.info("[relay] 启动恢复执行队列, requeued={}", moved);
        } catch (DataAccessException e) {
            // 交给定时扫描兜底
            log.warn("[relay] 启动恢复执行队列失败, err={}", e.getMessage());
        }
    }

    @Scheduled(fixedDelayString = "${relay.hand-off-sweep-interval-millis:15000}")
    public void sweep() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        try {
            List<RelayTransaction> stale = ledger.listUndispatched(properties.getHandOffStaleAfter(),
                    Math.max(1, properties.getHandOffSweepBatchSize()));
            for (RelayTransaction tx : stale) {
                try {
                    if (!ledger.markHandedOff(tx.getId())) {
                        continue;
                    }
                    workQueue.enqueue(RelayWorkItem.of(tx));
                    log.warn("[relay] 未广播的交易已重新入队, id={}, relayerNonce={}, lastHandOff={}",
                            tx.getId(), tx.getRelayerNonce(), tx.getHandedOffAt());
                } catch (RelayException e) {
                    // 队列或存储不可用，本轮停止，下一轮再扫
                    log.warn("[relay] 补投递失败, id={}, code={}, err={}", tx.getId(), e.getCode(), e.getMessage());
                    return;
                }
            }
        } finally {
            running.set(false);
        }
    }
}
