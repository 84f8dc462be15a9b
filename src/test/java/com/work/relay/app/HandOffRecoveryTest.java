package com.work.relay.app;

import com.work.relay.app.chain.MockPermissionChecker;
import com.work.relay.app.chain.MockRelayChainClient;
import com.work.relay.app.chain.web3j.Web3jSignatureVerifier;
import com.work.relay.app.config.RelayProperties;
import com.work.relay.app.worker.HandOffSweeper;
import com.work.relay.app.worker.RelayDispatchWorker;
import com.work.relay.app.worker.SettlementPoller;
import com.work.relay.core.config.RelayConfig;
import com.work.relay.core.exception.UpstreamFailureException;
import com.work.relay.core.lock.RelayerLockCoordinator;
import com.work.relay.core.model.RelayTransaction;
import com.work.relay.core.model.RelayTxStatus;
import com.work.relay.core.model.RelayWorkItem;
import com.work.relay.core.service.AuthorizationService;
import com.work.relay.core.service.QuotaReportService;
import com.work.relay.core.service.QuotaResolver;
import com.work.relay.core.service.RelayOrchestrator;
import com.work.relay.core.service.RelaySequencer;
import com.work.relay.core.service.RelayTransactionLedger;
import com.work.relay.core.support.InMemoryRelayStore;
import com.work.relay.core.support.InMemoryRelayWorkQueue;
import com.work.relay.core.support.InMemoryRelayerLockManager;
import com.work.relay.core.support.RelayMessages;
import com.work.relay.core.support.TestSigners;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.transaction.PlatformTransactionManager;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.mock;

/**
 * 投递失败或执行器宕机后，已分配的 relayer nonce 仍然会被广播并结算，nonce 序列不留空洞。
 */
public class HandOffRecoveryTest {

    private static final String PROFILE = "0x00000000000000000000000000000000000000a1";
    private static final String RELAYER = "0x00000000000000000000000000000000000000aa";
    private static final String ABI = "0xabcdef";
    private static final Instant T0 = Instant.parse("2026-03-01T00:00:00Z");

    /**
     * 第一次投递前先执行给定动作（模拟提交与投递之间插入的并发请求），然后失败。
     */
    private static final class FirstEnqueueFails extends InMemoryRelayWorkQueue {
        private Runnable beforeFailure = () -> { };
        private boolean failed;

        @Override
        public synchronized void enqueue(RelayWorkItem item) {
            if (!failed) {
                failed = true;
                beforeFailure.run();
                throw new UpstreamFailureException("queue unavailable", null);
            }
            super.enqueue(item);
        }
    }

    private RelayConfig config;
    private InMemoryRelayStore store;
    private FirstEnqueueFails queue;
    private MockRelayChainClient chain;
    private RelayOrchestrator orchestrator;
    private RelayTransactionLedger ledger;
    private RelayProperties props;
    private RelayDispatchWorker dispatchWorker;
    private SettlementPoller settlementPoller;

    @BeforeEach
    public void setUp() {
        config = RelayConfig.defaultConfig();
        store = new InMemoryRelayStore();
        queue = new FirstEnqueueFails();
        chain = new MockRelayChainClient(RELAYER, 100_000L);
        Clock clock = Clock.fixed(T0, ZoneOffset.UTC);
        AuthorizationService authorization = new AuthorizationService(new Web3jSignatureVerifier(),
                new MockPermissionChecker(Collections.singletonList(TestSigners.address(TestSigners.ALICE))),
                config, clock);
        ledger = ledgerAt(clock);
        orchestrator = new RelayOrchestrator(authorization, ledger,
                new QuotaReportService(store, store, config, clock), chain, queue);

        props = new RelayProperties();
        props.setHandOffStaleAfter(Duration.ofSeconds(60));
        dispatchWorker = new RelayDispatchWorker(queue, ledger, chain, props);
        settlementPoller = new SettlementPoller(ledger, chain, props);
    }

    private RelayTransactionLedger ledgerAt(Clock clock) {
        return new RelayTransactionLedger(store,
                new QuotaResolver(store, store, config),
                new RelaySequencer(store, chain),
                chain,
                new RelayerLockCoordinator(new InMemoryRelayerLockManager(), config),
                config, clock, mock(PlatformTransactionManager.class));
    }

    private HandOffSweeper sweeperAfter(Duration elapsed) {
        return new HandOffSweeper(ledgerAt(Clock.fixed(T0.plus(elapsed), ZoneOffset.UTC)), queue, props);
    }

    private String signCall(long nonce) {
        byte[] digest = RelayMessages.relayCallDigest(config.getChainId(), chain.resolveKeyManager(PROFILE),
                BigInteger.valueOf(nonce), ABI);
        return TestSigners.sign(digest, TestSigners.ALICE);
    }

    private List<RelayTransaction> byRelayerNonce() {
        List<RelayTransaction> txs = new ArrayList<>(orchestrator.listTransactions(PROFILE));
        txs.sort(Comparator.comparing(RelayTransaction::getRelayerNonce));
        return txs;
    }

    @Test
    public void failed_hand_off_with_concurrent_request_leaves_no_nonce_gap() {
        String concurrentSig = signCall(2);
        queue.beforeFailure = () -> orchestrator.execute(PROFILE, "2", ABI, concurrentSig);

        assertThrows(UpstreamFailureException.class, () -> orchestrator.execute(PROFILE, "1", ABI, signCall(1)));
        orchestrator.execute(PROFILE, "3", ABI, signCall(3));

        List<RelayTransaction> txs = byRelayerNonce();
        assertEquals(3, txs.size());
        for (int i = 0; i < txs.size(); i++) {
            assertEquals(i, txs.get(i).getRelayerNonce().longValue());
            assertEquals(RelayTxStatus.PENDING, txs.get(i).getStatus());
        }
        RelayTransaction gap = txs.get(0);
        assertEquals("1", gap.getCallNonce());

        dispatchWorker.drain();
        assertNull(ledger.getTransaction(gap.getId()).getBroadcastAt());

        // 阈值之内不补投递
        sweeperAfter(Duration.ofSeconds(10)).sweep();
        assertEquals(0L, queue.backlog());

        sweeperAfter(Duration.ofMinutes(2)).sweep();
        assertEquals(1L, queue.backlog());
        dispatchWorker.drain();
        assertNotNull(ledger.getTransaction(gap.getId()).getBroadcastAt());

        settlementPoller.pollReceipts();
        for (RelayTransaction tx : byRelayerNonce()) {
            assertEquals(RelayTxStatus.CONFIRMED, tx.getStatus());
        }

        sweeperAfter(Duration.ofMinutes(10)).sweep();
        assertEquals(0L, queue.backlog());
    }

    @Test
    public void items_pulled_by_a_crashed_worker_are_recovered_on_startup() {
        queue.failed = true;
        orchestrator.execute(PROFILE, "1", ABI, signCall(1));
        orchestrator.execute(PROFILE, "2", ABI, signCall(2));
        // 拉取后未 ACK 即宕机
        assertEquals(2, queue.pullBatch(10).size());
        dispatchWorker.drain();
        assertEquals(0L, chain.getOnChainNonce(RELAYER));

        sweeperAfter(Duration.ZERO).run(null);
        dispatchWorker.drain();

        assertEquals(2L, chain.getOnChainNonce(RELAYER));
        assertEquals(0L, queue.backlog());
        for (RelayTransaction tx : byRelayerNonce()) {
            assertNotNull(tx.getBroadcastAt());
        }
    }
}
