package com.work.relay.app.chain.web3j;

import com.work.relay.core.chain.PermissionChecker;
import com.work.relay.core.exception.UpstreamFailureException;
import org.web3j.abi.FunctionEncoder;
import org.web3j.abi.FunctionReturnDecoder;
import org.web3j.abi.TypeReference;
import org.web3j.abi.datatypes.DynamicBytes;
import org.web3j.abi.datatypes.Function;
import org.web3j.abi.datatypes.Type;
import org.web3j.abi.datatypes.generated.Bytes32;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.core.DefaultBlockParameterName;
import org.web3j.protocol.core.methods.request.Transaction;
import org.web3j.protocol.core.methods.response.EthCall;
import org.web3j.utils.Numeric;

import java.io.IOException;
import java.util.Collections;
import java.util.List;

/**
 * 读取 profile 的 ERC725Y 存储：AddressPermissions:Permissions:&lt;signer&gt;，权限字非 0 即视为可执行。
 */
public class Web3jPermissionChecker implements PermissionChecker {

    /**
     * bytes10(keccak256("AddressPermissions")) + bytes2(0) 的前缀，后接 20 字节 signer 地址。
     */
    static final String PERMISSIONS_KEY_PREFIX = "4b80742de2bf82acb3630000";

    private final Web3j web3j;
    private final String callerAddress;

    public Web3jPermissionChecker(Web3j web3j, String callerAddress) {
        this.web3j = web3j;
        this.callerAddress = callerAddress;
    }

    @Override
    @SuppressWarnings({"rawtypes", "unchecked"})
    public boolean hasPermission(String profileAddress, String signerAddress) {
        Function getData = new Function("getData",
                Collections.singletonList(new Bytes32(permissionsKey(signerAddress))),
                Collections.singletonList(new TypeReference<DynamicBytes>() {
                }));
        try {
            EthCall resp = web3j.ethCall(
                    Transaction.createEthCallTransaction(callerAddress, profileAddress, FunctionEncoder.encode(getData)),
                    DefaultBlockParameterName.LATEST).send();
            if (resp.hasError()) {
                throw new UpstreamFailureException("getData 调用失败: " + resp.getError().getMessage(), null);
            }
            List<Type> decoded = FunctionReturnDecoder.decode(resp.getValue(), getData.getOutputParameters());
            if (decoded.isEmpty()) {
                return false;
            }
            return isNonZero(((DynamicBytes) decoded.get(0)).getValue());
        } catch (IOException e) {
            throw new UpstreamFailureException("getData 请求失败: profile=" + profileAddress, e);
        }
    }

    static byte[] permissionsKey(String signerAddress) {
        return Numeric.hexStringToByteArray(PERMISSIONS_KEY_PREFIX + Numeric.cleanHexPrefix(signerAddress));
    }

    private static boolean isNonZero(byte[] value) {
        for (byte b : value) {
            if (b != 0) {
                return true;
            }
        }
        return false;
    }
}
