package com.work.txpipeline.chain;

/**
 * 节点给出的费用参考（wei）：最新区块 base fee 与建议的 priority fee。
 */
public final class FeeSuggestion {

    private final long baseFeePerGas;
    private final long priorityFeePerGas;

    public FeeSuggestion(long baseFeePerGas, long priorityFeePerGas) {
        this.baseFeePerGas = baseFeePerGas;
        this.priorityFeePerGas = priorityFeePerGas;
    }

    public long getBaseFeePerGas() {
        return baseFeePerGas;
    }

    public long getPriorityFeePerGas() {
        return priorityFeePerGas;
    }
}
