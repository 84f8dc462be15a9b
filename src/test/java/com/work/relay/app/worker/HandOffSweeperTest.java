package com.work.relay.app.worker;

import com.work.relay.app.config.RelayProperties;
import com.work.relay.core.exception.UpstreamFailureException;
import com.work.relay.core.model.RelayTransaction;
import com.work.relay.core.model.RelayTxStatus;
import com.work.relay.core.model.RelayWorkItem;
import com.work.relay.core.queue.RelayWorkQueue;
import com.work.relay.core.service.RelayTransactionLedger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.data.redis.RedisConnectionFailureException;

import java.time.Duration;
import java.util.Arrays;
import java.util.Collections;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

public class HandOffSweeperTest {

    private static final String KEY_MANAGER = "0x00000000000000000000000000000000000000c1";

    private RelayTransactionLedger ledger;
    private RelayWorkQueue queue;
    private HandOffSweeper sweeper;

    @BeforeEach
    public void setUp() {
        ledger = mock(RelayTransactionLedger.class);
        queue = mock(RelayWorkQueue.class);
        RelayProperties props = new RelayProperties();
        props.setHandOffStaleAfter(Duration.ofSeconds(30));
        props.setHandOffSweepBatchSize(20);
        sweeper = new HandOffSweeper(ledger, queue, props);
    }

    private static RelayTransaction pending(long id, long relayerNonce) {
        RelayTransaction tx = new RelayTransaction();
        tx.setId(id);
        tx.setStatus(RelayTxStatus.PENDING);
        tx.setRelayerNonce(relayerNonce);
        tx.setKeyManager(KEY_MANAGER);
        tx.setGasPrice("12");
        tx.setPayerQuotaId(2L);
        tx.setPayerDelegationId(5L);
        return tx;
    }

    @Test
    public void stale_transaction_is_rebuilt_and_requeued() {
        when(ledger.listUndispatched(Duration.ofSeconds(30), 20))
                .thenReturn(Collections.singletonList(pending(1, 0)));
        when(ledger.markHandedOff(1L)).thenReturn(true);

        sweeper.sweep();

        ArgumentCaptor<RelayWorkItem> item = ArgumentCaptor.forClass(RelayWorkItem.class);
        verify(queue).enqueue(item.capture());
        assertEquals(1L, item.getValue().getTransactionId());
        assertEquals(KEY_MANAGER, item.getValue().getKeyManager());
        assertEquals("12", item.getValue().getGasPrice());
        assertEquals(2L, item.getValue().getPayerQuotaId());
        assertEquals(Long.valueOf(5L), item.getValue().getPayerDelegationId());
    }

    @Test
    public void transaction_broadcast_meanwhile_is_not_requeued() {
        when(ledger.listUndispatched(any(Duration.class), anyInt()))
                .thenReturn(Collections.singletonList(pending(2, 1)));
        when(ledger.markHandedOff(2L)).thenReturn(false);

        sweeper.sweep();

        verify(queue, never()).enqueue(any());
    }

    @Test
    public void queue_failure_stops_the_round() {
        when(ledger.listUndispatched(any(Duration.class), anyInt()))
                .thenReturn(Arrays.asList(pending(3, 2), pending(4, 3)));
        when(ledger.markHandedOff(anyLong())).thenReturn(true);
        doThrow(new UpstreamFailureException("redis down", null)).when(queue).enqueue(any(RelayWorkItem.class));

        sweeper.sweep();

        verify(queue, times(1)).enqueue(any(RelayWorkItem.class));
        verify(ledger, never()).markHandedOff(eq(4L));
    }

    @Test
    public void startup_moves_in_flight_items_back() {
        when(queue.requeueInFlight()).thenReturn(3);

        sweeper.run(null);

        verify(queue).requeueInFlight();
    }

    @Test
    public void startup_tolerates_unreachable_queue() {
        when(queue.requeueInFlight()).thenThrow(new RedisConnectionFailureException("refused"));

        sweeper.run(null);

        verify(queue).requeueInFlight();
    }
}
