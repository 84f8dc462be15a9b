package com.work.relay.core.support;

import org.web3j.crypto.ECKeyPair;
import org.web3j.crypto.Keys;
import org.web3j.crypto.Sign;
import org.web3j.utils.Numeric;

import java.math.BigInteger;

/**
 * 测试用确定性私钥与 personal_sign 签名。
 */
public final class TestSigners {

    public static final ECKeyPair ALICE = ECKeyPair.create(new BigInteger("1f2e3d4c5b6a79881f2e3d4c5b6a79881f2e3d4c5b6a79881f2e3d4c5b6a7988", 16));
    public static final ECKeyPair BOB = ECKeyPair.create(new BigInteger("2a3b4c5d6e7f80912a3b4c5d6e7f80912a3b4c5d6e7f80912a3b4c5d6e7f8091", 16));

    private TestSigners() {
    }

    public static String address(ECKeyPair keyPair) {
        return "0x" + Keys.getAddress(keyPair);
    }

    /**
     * r || s || v 的十六进制形式，与钱包 personal_sign 的输出一致。
     */
    public static String sign(byte[] digest, ECKeyPair keyPair) {
        Sign.SignatureData data = Sign.signPrefixedMessage(digest, keyPair);
        byte[] out = new byte[65];
        System.arraycopy(data.getR(), 0, out, 0, 32);
        System.arraycopy(data.getS(), 0, out, 32, 32);
        out[64] = data.getV()[0];
        return Numeric.toHexString(out);
    }
}
