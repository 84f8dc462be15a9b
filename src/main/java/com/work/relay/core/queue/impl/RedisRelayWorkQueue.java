package com.work.relay.core.queue.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.work.relay.core.exception.RelayErrorCode;
import com.work.relay.core.exception.RelayException;
import com.work.relay.core.exception.UpstreamFailureException;
import com.work.relay.core.model.RelayWorkItem;
import com.work.relay.core.queue.RelayWorkQueue;
import com.work.relay.core.queue.RelayWorkQueueEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Redis 执行队列，使用 main/pending 双列表保证“取出 -> 处理 -> ACK”流程具备幂等性。
 */
public class RedisRelayWorkQueue implements RelayWorkQueue {

    private static final Logger log = LoggerFactory.getLogger(RedisRelayWorkQueue.class);

    /** 主队列 key，保存待执行的工作项。 */
    static final String MAIN_KEY = "relay:exec:queue";
    /** pending 队列 key，临时保存正在执行的工作项。 */
    static final String PENDING_KEY = "relay:exec:pending";

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;

    public RedisRelayWorkQueue(StringRedisTemplate redisTemplate, ObjectMapper objectMapper) {
        this.redisTemplate = Objects.requireNonNull(redisTemplate, "redisTemplate");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    }

    @Override
    public void enqueue(RelayWorkItem item) {
        String payload;
        try {
            payload = objectMapper.writeValueAsString(item);
        } catch (JsonProcessingException e) {
            throw new RelayException(RelayErrorCode.INTERNAL, "internal error", "序列化工作项失败: " + item, e);
        }
        try {
            redisTemplate.opsForList().leftPush(MAIN_KEY, payload);
        } catch (DataAccessException e) {
            throw new UpstreamFailureException("投递工作项失败: " + item, e);
        }
    }

    @Override
    public List<RelayWorkQueueEntry> pullBatch(int batchSize) {
        List<RelayWorkQueueEntry> entries = new ArrayList<>();
        for (int i = 0; i < batchSize; i++) {
            String payload = redisTemplate.opsForList().rightPopAndLeftPush(MAIN_KEY, PENDING_KEY);
            if (payload == null) {
                break;
            }
            try {
                RelayWorkItem item = objectMapper.readValue(payload, RelayWorkItem.class);
                entries.add(new RelayWorkQueueEntry(item, payload));
            } catch (JsonProcessingException e) {
                // 丢弃无法解析的条目，ACK 掉，避免阻塞
                log.warn("[relay] 丢弃无法解析的工作项: {}", payload, e);
                redisTemplate.opsForList().remove(PENDING_KEY, 1, payload);
            }
        }
        return entries;
    }

    @Override
    public void ack(RelayWorkQueueEntry entry) {
        redisTemplate.opsForList().remove(PENDING_KEY, 1, entry.getRawPayload());
    }

    @Override
    public void nack(List<RelayWorkQueueEntry> entries) {
        if (entries.isEmpty()) {
            return;
        }
        List<RelayWorkQueueEntry> reversed = new ArrayList<>(entries);
        Collections.reverse(reversed);
        for (RelayWorkQueueEntry entry : reversed) {
            redisTemplate.opsForList().remove(PENDING_KEY, 1, entry.getRawPayload());
            redisTemplate.opsForList().rightPush(MAIN_KEY, entry.getRawPayload());
        }
    }

    @Override
    public int requeueInFlight() {
        Long size = redisTemplate.opsForList().size(PENDING_KEY);
        long inFlight = size == null ? 0L : size;
        int moved = 0;
        // 只搬运启动时已在 pending 中的条数，不追逐并发新拉取的条目
        for (long i = 0; i < inFlight; i++) {
            String payload = redisTemplate.opsForList().rightPopAndLeftPush(PENDING_KEY, MAIN_KEY);
            if (payload == null) {
                break;
            }
            moved++;
        }
        if (moved > 0) {
            log.warn("[relay] 已将 {} 个未 ACK 的工作项放回主队列", moved);
        }
        return moved;
    }

    @Override
    public long backlog() {
        Long queueSize = redisTemplate.opsForList().size(MAIN_KEY);
        Long pendingSize = redisTemplate.opsForList().size(PENDING_KEY);
        long main = queueSize == null ? 0L : queueSize;
        long pending = pendingSize == null ? 0L : pendingSize;
        return main + pending;
    }
}
