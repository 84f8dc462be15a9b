package com.work.relay.core.support;

import com.work.relay.core.model.PayerRef;
import com.work.relay.core.model.RelayWorkItem;
import com.work.relay.core.queue.RelayWorkQueueEntry;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class InMemoryRelayWorkQueueTest {

    private static RelayWorkItem item(long id) {
        return new RelayWorkItem(id, "0xkm", PayerRef.of(1L, null, null), BigInteger.ONE);
    }

    @Test
    public void pulled_items_stay_pending_until_acked() {
        InMemoryRelayWorkQueue queue = new InMemoryRelayWorkQueue();
        queue.enqueue(item(1));
        queue.enqueue(item(2));

        List<RelayWorkQueueEntry> batch = queue.pullBatch(10);
        assertEquals(2, batch.size());
        assertEquals(1L, batch.get(0).getItem().getTransactionId());
        assertEquals(2, queue.backlog());
        assertTrue(queue.pullBatch(10).isEmpty());

        queue.ack(batch.get(0));
        queue.ack(batch.get(1));
        assertEquals(0, queue.backlog());
    }

    @Test
    public void nacked_items_are_redelivered_first() {
        InMemoryRelayWorkQueue queue = new InMemoryRelayWorkQueue();
        queue.enqueue(item(1));
        queue.enqueue(item(2));

        List<RelayWorkQueueEntry> first = queue.pullBatch(1);
        queue.nack(Collections.singletonList(first.get(0)));

        List<RelayWorkQueueEntry> again = queue.pullBatch(2);
        assertEquals(1L, again.get(0).getItem().getTransactionId());
        assertEquals(2L, again.get(1).getItem().getTransactionId());
    }

    @Test
    public void unacked_items_are_requeued_ahead_of_new_work() {
        InMemoryRelayWorkQueue queue = new InMemoryRelayWorkQueue();
        queue.enqueue(item(1));
        queue.enqueue(item(2));
        queue.pullBatch(2);
        queue.enqueue(item(3));

        assertEquals(2, queue.requeueInFlight());

        List<RelayWorkQueueEntry> again = queue.pullBatch(3);
        assertEquals(1L, again.get(0).getItem().getTransactionId());
        assertEquals(2L, again.get(1).getItem().getTransactionId());
        assertEquals(3L, again.get(2).getItem().getTransactionId());
    }
}
