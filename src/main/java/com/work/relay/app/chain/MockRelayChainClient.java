package com.work.relay.app.chain;

import com.work.relay.core.chain.RelayCall;
import com.work.relay.core.chain.RelayChainClient;
import com.work.relay.core.chain.SettlementReceipt;
import org.web3j.crypto.Hash;
import org.web3j.utils.Numeric;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 内存版链客户端，仅用于本地演示与测试，真实部署请使用 chain.mode=web3j。
 */
public class MockRelayChainClient implements RelayChainClient {

    private static final BigInteger GAS_PRICE = BigInteger.valueOf(1_000_000_000L);

    private final String relayerAddress;
    private final long estimatedGas;
    private final Map<String, Long> latestNonce = new ConcurrentHashMap<>();
    private final Map<String, SettlementReceipt> receipts = new ConcurrentHashMap<>();
    private final AtomicLong blockNumber = new AtomicLong(1);

    public MockRelayChainClient(String relayerAddress, long estimatedGas) {
        this.relayerAddress = relayerAddress.toLowerCase(Locale.ROOT);
        this.estimatedGas = estimatedGas;
    }

    @Override
    public String relayerAddress() {
        return relayerAddress;
    }

    /**
     * 由 profile 地址稳定地派生出一个 key manager 地址。
     */
    @Override
    public String resolveKeyManager(String profileAddress) {
        String hash = Hash.sha3String("km:" + profileAddress.toLowerCase(Locale.ROOT));
        return "0x" + hash.substring(hash.length() - 40);
    }

    @Override
    public long estimateGas(RelayCall call) {
        return estimatedGas;
    }

    @Override
    public BigInteger currentGasPrice() {
        return GAS_PRICE;
    }

    @Override
    public long getOnChainNonce(String walletAddress) {
        return latestNonce.getOrDefault(walletAddress, -1L) + 1;
    }

    @Override
    public String computeSettlementHash(RelayCall call, long relayerNonce) {
        String material = call.getKeyManager() + "|" + call.getCallNonce() + "|" + call.getCallData() + "|"
                + call.getGasLimit() + "|" + call.getGasPrice() + "|" + relayerNonce;
        return Numeric.toHexString(Hash.sha3(material.getBytes(StandardCharsets.UTF_8)));
    }

    @Override
    public String broadcast(RelayCall call, long relayerNonce) {
        latestNonce.merge(relayerAddress, relayerNonce, Math::max);
        String hash = computeSettlementHash(call, relayerNonce);
        receipts.putIfAbsent(hash, new SettlementReceipt(true, call.getGasLimit(), blockNumber.getAndIncrement()));
        return hash;
    }

    @Override
    public SettlementReceipt getReceipt(String transactionHash) {
        return receipts.get(transactionHash);
    }
}
