package com.work.relay.core.support;

import com.work.relay.core.lock.RelayerLockManager;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 使用 ConcurrentHashMap 实现的进程内锁，单实例部署或测试使用。
 */
public class InMemoryRelayerLockManager implements RelayerLockManager {

    private static class LockInfo {
        final String owner;
        final Instant expireAt;

        LockInfo(String owner, Instant expireAt) {
            this.owner = owner;
            this.expireAt = expireAt;
        }
    }

    private final Map<String, LockInfo> locks = new ConcurrentHashMap<>();

    @Override
    public boolean tryLock(String relayer, String lockOwner, Duration ttl) {
        LockInfo newLock = new LockInfo(lockOwner, Instant.now().plus(ttl));
        LockInfo current = locks.compute(relayer, (key, existing) -> {
            if (existing == null || existing.expireAt.isBefore(Instant.now()) || existing.owner.equals(lockOwner)) {
                return newLock;
            }
            return existing;
        });
        return current == newLock;
    }

    @Override
    public void unlock(String relayer, String lockOwner) {
        locks.computeIfPresent(relayer, (key, existing) -> existing.owner.equals(lockOwner) ? null : existing);
    }
}
