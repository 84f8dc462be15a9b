package com.work.relay.core.chain;

/**
 * 从 EIP-191 personal_sign 签名中恢复 signer 地址。
 */
public interface SignatureVerifier {

    /**
     * @param digest    32 字节原文摘要
     * @param signature 65 字节 r||s||v 的十六进制
     * @return 小写 signer 地址
     * @throws com.work.relay.core.exception.SignatureInvalidException 签名无法恢复
     */
    String recoverSigner(byte[] digest, String signature);
}
