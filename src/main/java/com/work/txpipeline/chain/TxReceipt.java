package com.work.txpipeline.chain;

/**
 * 最小 receipt 表达。status：1 成功，0 回滚。
 */
public class TxReceipt {
    private final String txHash;
    private final int status;
    private final long blockNumber;
    private final long gasUsed;
    private final long effectiveGasPrice;

    public TxReceipt(String txHash, int status, long blockNumber, long gasUsed, long effectiveGasPrice) {
        this.txHash = txHash;
        this.status = status;
        this.blockNumber = blockNumber;
        this.gasUsed = gasUsed;
        this.effectiveGasPrice = effectiveGasPrice;
    }

    public String getTxHash() {
        return txHash;
    }

    public int getStatus() {
        return status;
    }

    public boolean isSuccess() {
        return status == 1;
    }

    public long getBlockNumber() {
        return blockNumber;
    }

    public long getGasUsed() {
        return gasUsed;
    }

    public long getEffectiveGasPrice() {
        return effectiveGasPrice;
    }
}
