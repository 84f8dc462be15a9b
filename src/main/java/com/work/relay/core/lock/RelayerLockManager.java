package com.work.relay.core.lock;

import java.time.Duration;

/**
 * 提供 per-relayer 的互斥锁能力。默认实现使用内存 ConcurrentHashMap，
 * 多实例部署时切换为 Redis 实现。
 */
public interface RelayerLockManager {

    /**
     * 尝试获取 relayer 维度的锁（非阻塞）。
     *
     * @param relayer   relayer 地址
     * @param lockOwner 当前线程/节点的标识
     * @param ttl       锁超时时间
     * @return true 表示加锁成功
     */
    boolean tryLock(String relayer, String lockOwner, Duration ttl);

    /**
     * 释放锁（若锁已超时/转移，实际实现需要自行判断）。
     */
    void unlock(String relayer, String lockOwner);
}
