package com.work.relay.core.support;

import com.work.relay.core.model.RelayWorkItem;
import com.work.relay.core.queue.RelayWorkQueue;
import com.work.relay.core.queue.RelayWorkQueueEntry;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;

/**
 * 进程内队列，单实例部署或测试使用，进程重启后丢失。
 */
public class InMemoryRelayWorkQueue implements RelayWorkQueue {

    private final Deque<RelayWorkQueueEntry> main = new ArrayDeque<>();
    private final List<RelayWorkQueueEntry> pending = new ArrayList<>();

    @Override
    public synchronized void enqueue(RelayWorkItem item) {
        main.addLast(new RelayWorkQueueEntry(item, String.valueOf(item.getTransactionId())));
    }

    @Override
    public synchronized List<RelayWorkQueueEntry> pullBatch(int batchSize) {
        List<RelayWorkQueueEntry> entries = new ArrayList<>();
        while (entries.size() < batchSize && !main.isEmpty()) {
            RelayWorkQueueEntry entry = main.pollFirst();
            pending.add(entry);
            entries.add(entry);
        }
        return entries;
    }

    @Override
    public synchronized void ack(RelayWorkQueueEntry entry) {
        pending.remove(entry);
    }

    @Override
    public synchronized void nack(List<RelayWorkQueueEntry> entries) {
        List<RelayWorkQueueEntry> reversed = new ArrayList<>(entries);
        Collections.reverse(reversed);
        for (RelayWorkQueueEntry entry : reversed) {
            if (pending.remove(entry)) {
                main.addFirst(entry);
            }
        }
    }

    @Override
    public synchronized int requeueInFlight() {
        int moved = pending.size();
        for (int i = pending.size() - 1; i >= 0; i--) {
            main.addFirst(pending.get(i));
        }
        pending.clear();
        return moved;
    }

    @Override
    public synchronized long backlog() {
        return main.size() + pending.size();
    }
}
