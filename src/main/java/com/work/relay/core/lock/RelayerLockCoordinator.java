package com.work.relay.core.lock;

import com.work.relay.core.config.RelayConfig;
import com.work.relay.core.exception.UpstreamFailureException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.net.InetAddress;
import java.util.UUID;

import static com.work.relay.core.support.ValidationUtils.requireNonEmpty;
import static com.work.relay.core.support.ValidationUtils.requireNonNull;

/**
 * relayer 维度的互斥协调器：同一个 relayer 钱包的 nonce 计算 + 扣费 + 插入必须串行。
 * <p>
 * 拿不到锁时在 lockWaitTimeout 内短暂轮询，超时视为上游不可用，不做业务重试。
 * 若调用时已处于事务中，则在事务 commit/rollback 之后才释放。
 */
@Component
public class RelayerLockCoordinator {

    private static final Logger log = LoggerFactory.getLogger(RelayerLockCoordinator.class);

    private static final long POLL_INTERVAL_MS = 2L;

    private final RelayerLockManager lockManager;
    private final RelayConfig config;

    public RelayerLockCoordinator(RelayerLockManager lockManager, RelayConfig config) {
        this.lockManager = requireNonNull(lockManager, "lockManager");
        this.config = requireNonNull(config, "config");
    }

    @FunctionalInterface
    public interface LockCallback<T> {
        T doInLock(String lockOwner);
    }

    public <T> T executeWithLock(String relayer, LockCallback<T> action) {
        requireNonEmpty(relayer, "relayer");
        requireNonNull(action, "action");

        final String lockOwner = buildLockOwner();
        acquire(relayer, lockOwner);
        boolean releaseByTxCallback = false;
        try {
            releaseByTxCallback = registerReleaseCallback(relayer, lockOwner);
            return action.doInLock(lockOwner);
        } finally {
            if (!releaseByTxCallback) {
                releaseSafely(relayer, lockOwner);
            }
        }
    }

    private void acquire(String relayer, String owner) {
        long deadline = System.nanoTime() + config.getLockWaitTimeout().toNanos();
        while (true) {
            if (lockManager.tryLock(relayer, owner, config.getLockTtl())) {
                return;
            }
            if (System.nanoTime() >= deadline) {
                throw new UpstreamFailureException("relayer lock contention: " + relayer, null);
            }
            try {
                Thread.sleep(POLL_INTERVAL_MS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new UpstreamFailureException("等待 relayer 锁被中断: " + relayer, e);
            }
        }
    }

    /**
     * 若处于事务中，则在 commit/rollback 后释放锁；否则交由调用方 finally 释放。
     */
    private boolean registerReleaseCallback(String relayer, String owner) {
        if (!TransactionSynchronizationManager.isActualTransactionActive()) {
            return false;
        }
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCompletion(int status) {
                releaseSafely(relayer, owner);
            }
        });
        return true;
    }

    /**
     * 释放锁时不向外抛异常，避免在 finally 或事务钩子中覆盖原始错误；锁最终会按 ttl 过期。
     */
    private void releaseSafely(String relayer, String owner) {
        try {
            lockManager.unlock(relayer, owner);
        } catch (Exception e) {
            log.warn("[relay] 释放 relayer 锁失败, relayer={}, owner={}", relayer, owner, e);
        }
    }

    /**
     * 生成“机器名 + 线程 ID + UUID”的锁持有者标识，便于排查日志。
     */
    private String buildLockOwner() {
        try {
            String host = InetAddress.getLocalHost().getHostName();
            return host + "-" + Thread.currentThread().getId() + "-" + UUID.randomUUID();
        } catch (Exception ex) {
            return "unknown-" + Thread.currentThread().getId() + "-" + UUID.randomUUID();
        }
    }
}
