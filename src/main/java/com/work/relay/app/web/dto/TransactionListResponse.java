package com.work.relay.app.web.dto;

import java.util.List;

public class TransactionListResponse {

    private final List<TransactionView> transactions;

    public TransactionListResponse(List<TransactionView> transactions) {
        this.transactions = transactions;
    }

    public List<TransactionView> getTransactions() {
        return transactions;
    }
}
