package com.work.relay.app.web.dto;

public class ExecuteRelayResponse {

    private final String transactionHash;

    public ExecuteRelayResponse(String transactionHash) {
        this.transactionHash = transactionHash;
    }

    public String getTransactionHash() {
        return transactionHash;
    }
}
