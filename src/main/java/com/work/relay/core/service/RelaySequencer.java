package com.work.relay.core.service;

import com.work.relay.core.chain.RelayChainClient;
import com.work.relay.core.repository.RelayTransactionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import static com.work.relay.core.support.ValidationUtils.requireNonEmpty;
import static com.work.relay.core.support.ValidationUtils.requireNonNull;

/**
 * relayer 钱包 nonce 的唯一来源。
 * <p>
 * 只要有 PENDING 交易，nonce 就由账本推导（最大 PENDING nonce + 1）；否则回退到链上 pending 计数。
 * 进程内不缓存“下一个 nonce”，调用方必须已持有 relayer 锁并处于插入所在的事务中。
 */
@Service
public class RelaySequencer {

    private static final Logger log = LoggerFactory.getLogger(RelaySequencer.class);

    private final RelayTransactionRepository transactionRepository;
    private final RelayChainClient chainClient;

    public RelaySequencer(RelayTransactionRepository transactionRepository, RelayChainClient chainClient) {
        this.transactionRepository = requireNonNull(transactionRepository, "transactionRepository");
        this.chainClient = requireNonNull(chainClient, "chainClient");
    }

    public long nextRelayerNonce(String relayerAddress) {
        requireNonEmpty(relayerAddress, "relayerAddress");
        Long latestPending = transactionRepository.findLatestPendingRelayerNonce(relayerAddress);
        if (latestPending != null) {
            return latestPending + 1;
        }
        long onChain = chainClient.getOnChainNonce(relayerAddress);
        log.debug("[relay] 无 PENDING 交易，使用链上 nonce, relayer={}, nonce={}", relayerAddress, onChain);
        return onChain;
    }
}
