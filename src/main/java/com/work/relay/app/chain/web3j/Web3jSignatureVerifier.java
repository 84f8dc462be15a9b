package com.work.relay.app.chain.web3j;

import com.work.relay.core.chain.SignatureVerifier;
import com.work.relay.core.exception.SignatureInvalidException;
import org.web3j.crypto.Keys;
import org.web3j.crypto.Sign;
import org.web3j.utils.Numeric;

import java.math.BigInteger;
import java.security.SignatureException;
import java.util.Arrays;

/**
 * EIP-191 personal_sign 的 signer 恢复（等价于 ethers.verifyMessage(arrayify(digest), signature)）。
 */
public class Web3jSignatureVerifier implements SignatureVerifier {

    private static final int SIGNATURE_LENGTH = 65;

    @Override
    public String recoverSigner(byte[] digest, String signature) {
        byte[] raw;
        try {
            raw = Numeric.hexStringToByteArray(signature);
        } catch (RuntimeException e) {
            throw new SignatureInvalidException("签名不是合法的十六进制", e);
        }
        if (raw.length != SIGNATURE_LENGTH) {
            throw new SignatureInvalidException("签名长度应为 65 字节, 实际 " + raw.length);
        }
        byte v = raw[64];
        if (v < 27) {
            v += 27;
        }
        Sign.SignatureData data = new Sign.SignatureData(v,
                Arrays.copyOfRange(raw, 0, 32),
                Arrays.copyOfRange(raw, 32, 64));
        try {
            BigInteger publicKey = Sign.signedPrefixedMessageToKey(digest, data);
            return "0x" + Keys.getAddress(publicKey);
        } catch (SignatureException | RuntimeException e) {
            throw new SignatureInvalidException("无法从签名恢复 signer", e);
        }
    }
}
