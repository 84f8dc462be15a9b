package com.work.relay.app.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * 链连接配置（宿主侧）。
 *
 * mode=mock: 使用 MockRelayChainClient + MockPermissionChecker
 * mode=web3j: 使用 Web3jRelayChainClient + Web3jPermissionChecker
 */
@ConfigurationProperties(prefix = "chain")
public class ChainProperties {

    /**
     * mock 或 web3j
     */
    private String mode = "mock";

    /**
     * Web3j HTTP RPC 地址，例如 http://localhost:8545
     */
    private String rpcUrl = "http://localhost:8545";

    /**
     * 参与 relay 签名原文的 chainId，同时用于 EIP-155 交易签名。
     */
    private long chainId = 4201L;

    /**
     * relayer 钱包私钥（web3j 模式必填），只从环境变量注入，不要写进配置文件。
     */
    private String relayerPrivateKey;

    private long mockEstimatedGas = 21_000L;

    private String mockRelayerAddress = "0x00000000000000000000000000000000000000aa";

    /**
     * mock 模式下允许的 signer；为空表示放行所有能恢复出来的 signer。
     */
    private List<String> mockAllowedSigners = new ArrayList<>();

    public String getMode() {
        return mode;
    }

    public void setMode(String mode) {
        this.mode = mode;
    }

    public String getRpcUrl() {
        return rpcUrl;
    }

    public void setRpcUrl(String rpcUrl) {
        this.rpcUrl = rpcUrl;
    }

    public long getChainId() {
        return chainId;
    }

    public void setChainId(long chainId) {
        this.chainId = chainId;
    }

    public String getRelayerPrivateKey() {
        return relayerPrivateKey;
    }

    public void setRelayerPrivateKey(String relayerPrivateKey) {
        this.relayerPrivateKey = relayerPrivateKey;
    }

    public long getMockEstimatedGas() {
        return mockEstimatedGas;
    }

    public void setMockEstimatedGas(long mockEstimatedGas) {
        this.mockEstimatedGas = mockEstimatedGas;
    }

    public String getMockRelayerAddress() {
        return mockRelayerAddress;
    }

    public void setMockRelayerAddress(String mockRelayerAddress) {
        this.mockRelayerAddress = mockRelayerAddress;
    }

    public List<String> getMockAllowedSigners() {
        return mockAllowedSigners;
    }

    public void setMockAllowedSigners(List<String> mockAllowedSigners) {
        this.mockAllowedSigners = mockAllowedSigners;
    }
}
