package com.work.relay.core.queue;

import com.work.relay.core.model.RelayWorkItem;

import java.util.List;

/**
 * 异步执行队列：“取出 -> 处理 -> ACK”，至少一次投递。
 */
public interface RelayWorkQueue {

    /**
     * 投递一个工作项。失败时抛 UpstreamFailureException，已提交的交易行不会被回滚。
     */
    void enqueue(RelayWorkItem item);

    /**
     * 批量拉取，被拉取的条目在 ack 之前不会被其他消费者看到。
     */
    List<RelayWorkQueueEntry> pullBatch(int batchSize);

    void ack(RelayWorkQueueEntry entry);

    /**
     * 把处理失败的条目放回主队列，保持原有顺序。
     */
    void nack(List<RelayWorkQueueEntry> entries);

    /**
     * 把 pending 中所有未 ACK 的条目放回主队列（消费者在 ACK 前宕机后的恢复），返回移动的条数。
     * 多实例部署时也会移动其他实例正在处理的条目，消费方按 transactionId 幂等。
     */
    int requeueInFlight();

    long backlog();
}
