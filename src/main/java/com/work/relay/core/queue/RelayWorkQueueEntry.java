package com.work.relay.core.queue;

import com.work.relay.core.model.RelayWorkItem;

/**
 * 队列条目：反序列化后的工作项 + 原始载荷（ACK 时按原文删除）。
 */
public final class RelayWorkQueueEntry {

    private final RelayWorkItem item;
    private final String rawPayload;

    public RelayWorkQueueEntry(RelayWorkItem item, String rawPayload) {
        this.item = item;
        this.rawPayload = rawPayload;
    }

    public RelayWorkItem getItem() {
        return item;
    }

    public String getRawPayload() {
        return rawPayload;
    }
}
