package com.work.relay.core.support;

import org.web3j.crypto.Hash;
import org.web3j.utils.Numeric;

import java.io.ByteArrayOutputStream;
import java.math.BigInteger;

/**
 * 各类签名原文（digest）的拼装，等价于 solidity 的 keccak256(abi.encodePacked(...))。
 * <p>
 * 签名方对 digest 做 EIP-191 personal_sign，这里只负责算出 digest 本身。
 */
public final class RelayMessages {

    private RelayMessages() {
        throw new AssertionError("工具类不允许实例化");
    }

    /**
     * executeRelayCall 的签名原文：(uint256 chainId, address keyManager, uint256 nonce, bytes payload)。
     */
    public static byte[] relayCallDigest(long chainId, String keyManager, BigInteger callNonce, String callData) {
        return new Packed()
                .uint256(BigInteger.valueOf(chainId))
                .address(keyManager)
                .uint256(callNonce)
                .bytes(callData)
                .keccak();
    }

    /**
     * 查询额度时的自签名：(address profile, uint256 timestamp)。
     */
    public static byte[] quotaAttestationDigest(String profile, long timestampMillis) {
        return new Packed()
                .address(profile)
                .uint256(BigInteger.valueOf(timestampMillis))
                .keccak();
    }

    /**
     * 授予/撤销委托时由 approver 的 signer 签名：(address approver, address approved, uint256 allowance, uint256 timestamp)。
     */
    public static byte[] delegationAttestationDigest(String approver, String approved, long monthlyAllowance, long timestampMillis) {
        return new Packed()
                .address(approver)
                .address(approved)
                .uint256(BigInteger.valueOf(monthlyAllowance))
                .uint256(BigInteger.valueOf(timestampMillis))
                .keccak();
    }

    private static final class Packed {
        private final ByteArrayOutputStream out = new ByteArrayOutputStream();

        Packed uint256(BigInteger value) {
            byte[] b = Numeric.toBytesPadded(value, 32);
            out.write(b, 0, b.length);
            return this;
        }

        Packed address(String address) {
            byte[] b = Numeric.hexStringToByteArray(address);
            if (b.length != 20) {
                throw new IllegalArgumentException("address must be 20 bytes");
            }
            out.write(b, 0, b.length);
            return this;
        }

        Packed bytes(String hex) {
            byte[] b = Numeric.hexStringToByteArray(hex);
            out.write(b, 0, b.length);
            return this;
        }

        byte[] keccak() {
            return Hash.sha3(out.toByteArray());
        }
    }
}
