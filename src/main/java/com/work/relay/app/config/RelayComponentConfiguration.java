package com.work.relay.app.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.work.relay.app.chain.MockPermissionChecker;
import com.work.relay.app.chain.MockRelayChainClient;
import com.work.relay.app.chain.web3j.Web3jSignatureVerifier;
import com.work.relay.core.chain.PermissionChecker;
import com.work.relay.core.chain.RelayChainClient;
import com.work.relay.core.chain.SignatureVerifier;
import com.work.relay.core.config.RelayConfig;
import com.work.relay.core.lock.RelayerLockManager;
import com.work.relay.core.lock.impl.RedisRelayerLockManager;
import com.work.relay.core.queue.RelayWorkQueue;
import com.work.relay.core.queue.impl.RedisRelayWorkQueue;
import com.work.relay.core.support.InMemoryRelayWorkQueue;
import com.work.relay.core.support.InMemoryRelayerLockManager;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Clock;
import java.time.ZoneId;

/**
 * 将核心组件装配为 Spring Bean。
 * Postgres 仓储通过 @Repository 自动扫描，核心服务通过 @Service 自动扫描。
 */
@Configuration
@EnableConfigurationProperties({RelayProperties.class, ChainProperties.class})
public class RelayComponentConfiguration {

    @Bean
    public RelayConfig relayConfig(RelayProperties properties, ChainProperties chainProperties) {
        return new RelayConfig(
                properties.getDefaultMonthlyAllowance(),
                properties.getAttestationWindow(),
                properties.getLockTtl(),
                properties.getLockWaitTimeout(),
                properties.getTransactionTimeoutSeconds(),
                chainProperties.getChainId(),
                ZoneId.of(properties.getResetZone())
        );
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * 签名恢复是纯本地计算，mock/web3j 两种模式都用 web3j 实现。
     */
    @Bean
    public SignatureVerifier signatureVerifier() {
        return new Web3jSignatureVerifier();
    }

    @Bean
    @ConditionalOnProperty(prefix = "relay", name = "lock-mode", havingValue = "local", matchIfMissing = true)
    public RelayerLockManager inMemoryRelayerLockManager() {
        return new InMemoryRelayerLockManager();
    }

    @Bean
    @ConditionalOnProperty(prefix = "relay", name = "lock-mode", havingValue = "redis")
    public RelayerLockManager redisRelayerLockManager(StringRedisTemplate redisTemplate) {
        return new RedisRelayerLockManager(redisTemplate);
    }

    @Bean
    @ConditionalOnProperty(prefix = "relay", name = "queue-mode", havingValue = "memory", matchIfMissing = true)
    public RelayWorkQueue inMemoryRelayWorkQueue() {
        return new InMemoryRelayWorkQueue();
    }

    @Bean
    @ConditionalOnProperty(prefix = "relay", name = "queue-mode", havingValue = "redis")
    public RelayWorkQueue redisRelayWorkQueue(StringRedisTemplate redisTemplate, ObjectMapper objectMapper) {
        return new RedisRelayWorkQueue(redisTemplate, objectMapper);
    }

    /**
     * 默认使用 mock；chain.mode=web3j 时由 Web3jConfiguration 提供实现。
     */
    @Bean
    @ConditionalOnProperty(prefix = "chain", name = "mode", havingValue = "mock", matchIfMissing = true)
    public RelayChainClient mockRelayChainClient(ChainProperties properties) {
        return new MockRelayChainClient(properties.getMockRelayerAddress(), properties.getMockEstimatedGas());
    }

    @Bean
    @ConditionalOnProperty(prefix = "chain", name = "mode", havingValue = "mock", matchIfMissing = true)
    public PermissionChecker mockPermissionChecker(ChainProperties properties) {
        return new MockPermissionChecker(properties.getMockAllowedSigners());
    }
}
