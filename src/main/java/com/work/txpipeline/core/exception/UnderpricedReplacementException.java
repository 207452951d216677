package com.work.txpipeline.core.exception;

/**
 * 替换交易的费用不足（节点拒绝，或在费用上限内无法满足最小加价）。
 */
public class UnderpricedReplacementException extends TxPipelineException {

    public UnderpricedReplacementException(String message) {
        super(message);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
