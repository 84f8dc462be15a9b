package com.work.relay.core.lock.impl;

import com.work.relay.core.exception.UpstreamFailureException;
import com.work.relay.core.lock.RelayerLockManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;

import java.time.Duration;
import java.util.Collections;

import static com.work.relay.core.support.ValidationUtils.requireNonEmpty;
import static com.work.relay.core.support.ValidationUtils.requireNonNull;
import static com.work.relay.core.support.ValidationUtils.requirePositive;

/**
 * 基于 Redis 的分布式 relayer 锁（多实例共享同一个 relayer 钱包时使用）
 * <p>
 * 加锁用 SET NX PX；释放用 Lua 脚本校验 owner，防止误删其他实例的锁。
 */
public class RedisRelayerLockManager implements RelayerLockManager {

    private static final String LOCK_KEY_PREFIX = "relay:lock:";
    private static final Logger log = LoggerFactory.getLogger(RedisRelayerLockManager.class);

    private static final String UNLOCK_SCRIPT =
            "if redis.call('get', KEYS[1]) == ARGV[1] then " +
            "    return redis.call('del', KEYS[1]) " +
            "else " +
            "    return 0 " +
            "end";

    private final StringRedisTemplate redisTemplate;
    private final DefaultRedisScript<Long> unlockScript;

    public RedisRelayerLockManager(StringRedisTemplate redisTemplate) {
        this.redisTemplate = requireNonNull(redisTemplate, "redisTemplate");
        this.unlockScript = new DefaultRedisScript<>();
        this.unlockScript.setScriptText(UNLOCK_SCRIPT);
        this.unlockScript.setResultType(Long.class);
    }

    @Override
    public boolean tryLock(String relayer, String lockOwner, Duration ttl) {
        requireNonEmpty(relayer, "relayer");
        requireNonEmpty(lockOwner, "lockOwner");
        requirePositive(ttl, "ttl");
        try {
            Boolean result = redisTemplate.opsForValue().setIfAbsent(LOCK_KEY_PREFIX + relayer, lockOwner, ttl);
            return Boolean.TRUE.equals(result);
        } catch (Exception e) {
            throw new UpstreamFailureException("Redis 加锁异常: " + relayer, e);
        }
    }

    @Override
    public void unlock(String relayer, String lockOwner) {
        requireNonEmpty(relayer, "relayer");
        requireNonEmpty(lockOwner, "lockOwner");
        Long result = redisTemplate.execute(unlockScript, Collections.singletonList(LOCK_KEY_PREFIX + relayer), lockOwner);
        if (result == null || result == 0) {
            // 锁已过期或已被他人持有
            log.debug("[relay] unlock noop, relayer={}, owner={}", relayer, lockOwner);
        }
    }
}
