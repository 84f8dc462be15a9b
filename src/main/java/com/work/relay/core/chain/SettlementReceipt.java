package com.work.relay.core.chain;

/**
 * 链上回执的最小视图。
 */
public class SettlementReceipt {

    private final boolean success;
    private final long gasUsed;
    private final long blockNumber;

    public SettlementReceipt(boolean success, long gasUsed, long blockNumber) {
        this.success = success;
        this.gasUsed = gasUsed;
        this.blockNumber = blockNumber;
    }

    public boolean isSuccess() {
        return success;
    }

    public long getGasUsed() {
        return gasUsed;
    }

    public long getBlockNumber() {
        return blockNumber;
    }
}
