package com.work.relay.app.web.dto;

import javax.validation.Valid;
import javax.validation.constraints.NotBlank;
import javax.validation.constraints.NotNull;

/**
 * relay 执行请求：profile 地址 + 已签名的调用。
 */
public class ExecuteRelayRequest {

    @NotBlank(message = "address must be present")
    private String address;

    @Valid
    @NotNull(message = "transaction must be present")
    private SignedCall transaction;

    public String getAddress() {
        return address;
    }

    public void setAddress(String address) {
        this.address = address;
    }

    public SignedCall getTransaction() {
        return transaction;
    }

    public void setTransaction(SignedCall transaction) {
        this.transaction = transaction;
    }

    public static class SignedCall {

        /** 十进制或 0x 十六进制的 uint256 nonce。 */
        @NotBlank(message = "nonce must be present")
        private String nonce;

        /** key manager 要转发给 profile 的 payload。 */
        @NotBlank(message = "abi must be present")
        private String abi;

        @NotBlank(message = "signature must be present")
        private String signature;

        public String getNonce() {
            return nonce;
        }

        public void setNonce(String nonce) {
            this.nonce = nonce;
        }

        public String getAbi() {
            return abi;
        }

        public void setAbi(String abi) {
            this.abi = abi;
        }

        public String getSignature() {
            return signature;
        }

        public void setSignature(String signature) {
            this.signature = signature;
        }
    }
}
