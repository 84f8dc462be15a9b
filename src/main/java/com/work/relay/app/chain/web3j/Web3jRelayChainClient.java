package com.work.relay.app.chain.web3j;

import com.github.benmanes.caffeine.cache.Cache;
import com.work.relay.core.chain.RelayCall;
import com.work.relay.core.chain.RelayChainClient;
import com.work.relay.core.chain.SettlementReceipt;
import com.work.relay.core.exception.GasEstimationFailedException;
import com.work.relay.core.exception.UpstreamFailureException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.web3j.abi.FunctionEncoder;
import org.web3j.abi.FunctionReturnDecoder;
import org.web3j.abi.TypeReference;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.DynamicBytes;
import org.web3j.abi.datatypes.Function;
import org.web3j.abi.datatypes.Type;
import org.web3j.abi.datatypes.generated.Uint256;
import org.web3j.crypto.Credentials;
import org.web3j.crypto.Hash;
import org.web3j.crypto.RawTransaction;
import org.web3j.crypto.TransactionEncoder;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.core.DefaultBlockParameterName;
import org.web3j.protocol.core.methods.request.Transaction;
import org.web3j.protocol.core.methods.response.EthCall;
import org.web3j.protocol.core.methods.response.EthEstimateGas;
import org.web3j.protocol.core.methods.response.EthGetTransactionReceipt;
import org.web3j.protocol.core.methods.response.EthSendTransaction;
import org.web3j.protocol.core.methods.response.TransactionReceipt;
import org.web3j.utils.Numeric;

import java.io.IOException;
import java.math.BigInteger;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * 基于 Web3j 的 relay 链客户端：
 * - 解析 profile.owner() 得到 key manager（Caffeine 缓存）
 * - eth_estimateGas / eth_gasPrice / eth_getTransactionCount
 * - 以 relayer 私钥签出 keyManager.executeRelayCall(signature, nonce, payload) 并广播
 * - eth_getTransactionReceipt
 *
 * 说明：签名是确定性的（RFC 6979），同一组 (call, gas, nonce) 得到同一个交易 hash，
 * 因此可以在落库前算出 settlement hash，广播时再原样签一次。
 */
public class Web3jRelayChainClient implements RelayChainClient {

    private static final Logger log = LoggerFactory.getLogger(Web3jRelayChainClient.class);

    private final Web3j web3j;
    private final Credentials credentials;
    private final long chainId;
    private final Cache<String, String> keyManagers;

    public Web3jRelayChainClient(Web3j web3j, Credentials credentials, long chainId, Cache<String, String> keyManagers) {
        this.web3j = web3j;
        this.credentials = credentials;
        this.chainId = chainId;
        this.keyManagers = keyManagers;
    }

    @Override
    public String relayerAddress() {
        return credentials.getAddress().toLowerCase(Locale.ROOT);
    }

    @Override
    public String resolveKeyManager(String profileAddress) {
        return keyManagers.get(profileAddress, this::queryOwner);
    }

    @SuppressWarnings({"rawtypes", "unchecked"})
    private String queryOwner(String profileAddress) {
        Function owner = new Function("owner",
                Collections.emptyList(),
                Collections.singletonList(new TypeReference<Address>() {
                }));
        String data = FunctionEncoder.encode(owner);
        try {
            EthCall resp = web3j.ethCall(
                    Transaction.createEthCallTransaction(credentials.getAddress(), profileAddress, data),
                    DefaultBlockParameterName.LATEST).send();
            if (resp.hasError()) {
                throw new UpstreamFailureException("owner() 调用失败: " + resp.getError().getMessage(), null);
            }
            List<Type> decoded = FunctionReturnDecoder.decode(resp.getValue(), owner.getOutputParameters());
            if (decoded.isEmpty()) {
                throw new IllegalArgumentException("address is not a profile");
            }
            return ((Address) decoded.get(0)).getValue().toLowerCase(Locale.ROOT);
        } catch (IOException e) {
            throw new UpstreamFailureException("owner() 调用失败: " + profileAddress, e);
        }
    }

    @Override
    public long estimateGas(RelayCall call) {
        Transaction tx = Transaction.createEthCallTransaction(credentials.getAddress(), call.getKeyManager(),
                encodeExecuteRelayCall(call));
        try {
            EthEstimateGas resp = web3j.ethEstimateGas(tx).send();
            if (resp.hasError()) {
                throw new GasEstimationFailedException("eth_estimateGas 失败: " + resp.getError().getMessage());
            }
            return resp.getAmountUsed().longValueExact();
        } catch (IOException e) {
            throw new UpstreamFailureException("eth_estimateGas 请求失败", e);
        } catch (ArithmeticException e) {
            throw new GasEstimationFailedException("预估 gas 超出范围", e);
        }
    }

    @Override
    public BigInteger currentGasPrice() {
        try {
            return web3j.ethGasPrice().send().getGasPrice();
        } catch (IOException e) {
            throw new UpstreamFailureException("eth_gasPrice 请求失败", e);
        }
    }

    @Override
    public long getOnChainNonce(String walletAddress) {
        try {
            return web3j.ethGetTransactionCount(walletAddress, DefaultBlockParameterName.PENDING)
                    .send()
                    .getTransactionCount()
                    .longValueExact();
        } catch (IOException e) {
            throw new UpstreamFailureException("eth_getTransactionCount 请求失败: " + walletAddress, e);
        }
    }

    @Override
    public String computeSettlementHash(RelayCall call, long relayerNonce) {
        return Hash.sha3(sign(call, relayerNonce));
    }

    @Override
    public String broadcast(RelayCall call, long relayerNonce) {
        String signed = sign(call, relayerNonce);
        try {
            EthSendTransaction resp = web3j.ethSendRawTransaction(signed).send();
            if (resp.hasError()) {
                String message = resp.getError().getMessage();
                // 至少一次投递：同一笔交易再次广播时节点会返回 already known
                if (message != null && message.toLowerCase(Locale.ROOT).contains("already known")) {
                    log.info("[relay] 交易已在节点中, relayerNonce={}", relayerNonce);
                    return Hash.sha3(signed);
                }
                throw new UpstreamFailureException("eth_sendRawTransaction 失败: " + message, null);
            }
            return resp.getTransactionHash();
        } catch (IOException e) {
            throw new UpstreamFailureException("eth_sendRawTransaction 请求失败", e);
        }
    }

    @Override
    public SettlementReceipt getReceipt(String transactionHash) {
        try {
            EthGetTransactionReceipt resp = web3j.ethGetTransactionReceipt(transactionHash).send();
            Optional<TransactionReceipt> receiptOpt = resp.getTransactionReceipt();
            if (!receiptOpt.isPresent()) {
                return null;
            }
            TransactionReceipt r = receiptOpt.get();
            return new SettlementReceipt(r.isStatusOK(), r.getGasUsed().longValue(), r.getBlockNumber().longValue());
        } catch (IOException e) {
            log.warn("Web3j getTransactionReceipt failed. txHash={} err={}", transactionHash, e.getMessage());
            throw new UpstreamFailureException("eth_getTransactionReceipt 请求失败: " + transactionHash, e);
        }
    }

    private String sign(RelayCall call, long relayerNonce) {
        RawTransaction raw = RawTransaction.createTransaction(
                BigInteger.valueOf(relayerNonce),
                call.getGasPrice(),
                BigInteger.valueOf(call.getGasLimit()),
                call.getKeyManager(),
                BigInteger.ZERO,
                encodeExecuteRelayCall(call));
        return Numeric.toHexString(TransactionEncoder.signMessage(raw, chainId, credentials));
    }

    static String encodeExecuteRelayCall(RelayCall call) {
        Function function = new Function("executeRelayCall",
                Arrays.asList(
                        new DynamicBytes(Numeric.hexStringToByteArray(call.getSignature())),
                        new Uint256(call.getCallNonce()),
                        new DynamicBytes(Numeric.hexStringToByteArray(call.getCallData()))),
                Collections.emptyList());
        return FunctionEncoder.encode(function);
    }
}
