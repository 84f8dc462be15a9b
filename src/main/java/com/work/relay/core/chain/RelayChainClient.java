package com.work.relay.core.chain;

import java.math.BigInteger;

/**
 * 链交互端口，由宿主应用实现（web3j / mock）。
 * <p>
 * 网络异常统一包装为 UpstreamFailureException；估算失败为 GasEstimationFailedException。
 */
public interface RelayChainClient {

    /**
     * 唯一的出资 relayer 钱包地址（小写）。
     */
    String relayerAddress();

    /**
     * profile 的 key manager 地址（profile.owner()）。
     */
    String resolveKeyManager(String profileAddress);

    /**
     * 以 relayer 身份预估 keyManager.executeRelayCall(signature, nonce, payload) 的 gas。
     */
    long estimateGas(RelayCall call);

    /**
     * 当前 gas price，在进入原子区之前读取。
     */
    BigInteger currentGasPrice();

    /**
     * eth_getTransactionCount(wallet, pending)。
     */
    long getOnChainNonce(String walletAddress);

    /**
     * 用 relayer 私钥按给定 nonce 签出交易并返回其 hash，不广播。相同输入必须得到相同结果。
     */
    String computeSettlementHash(RelayCall call, long relayerNonce);

    /**
     * 签名并广播，返回链上 hash。
     */
    String broadcast(RelayCall call, long relayerNonce);

    /**
     * 查询回执，尚未打包返回 null。
     */
    SettlementReceipt getReceipt(String transactionHash);
}
