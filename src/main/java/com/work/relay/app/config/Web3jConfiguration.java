package com.work.relay.app.config;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.work.relay.app.chain.web3j.Web3jPermissionChecker;
import com.work.relay.app.chain.web3j.Web3jRelayChainClient;
import com.work.relay.core.chain.PermissionChecker;
import com.work.relay.core.chain.RelayChainClient;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.web3j.crypto.Credentials;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.http.HttpService;

import static com.work.relay.core.support.ValidationUtils.requireNonEmpty;

/**
 * Web3j 装配：
 * 当 chain.mode=web3j 时启用。
 */
@Configuration
@ConditionalOnProperty(prefix = "chain", name = "mode", havingValue = "web3j")
public class Web3jConfiguration {

    @Bean
    public Web3j web3j(ChainProperties properties) {
        return Web3j.build(new HttpService(properties.getRpcUrl()));
    }

    @Bean
    public Credentials relayerCredentials(ChainProperties properties) {
        return Credentials.create(requireNonEmpty(properties.getRelayerPrivateKey(), "chain.relayer-private-key"));
    }

    @Bean
    public RelayChainClient web3jRelayChainClient(Web3j web3j,
                                                  Credentials relayerCredentials,
                                                  ChainProperties chainProperties,
                                                  RelayProperties relayProperties) {
        // profile 的 owner（key manager）在其生命周期内不变，缓存即可
        Cache<String, String> keyManagers = Caffeine.newBuilder()
                .maximumSize(relayProperties.getKeyManagerCacheSize())
                .build();
        return new Web3jRelayChainClient(web3j, relayerCredentials, chainProperties.getChainId(), keyManagers);
    }

    @Bean
    public PermissionChecker web3jPermissionChecker(Web3j web3j, Credentials relayerCredentials) {
        return new Web3jPermissionChecker(web3j, relayerCredentials.getAddress());
    }
}
