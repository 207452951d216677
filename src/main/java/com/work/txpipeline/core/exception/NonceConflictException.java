package com.work.txpipeline.core.exception;

/**
 * 节点返回 nonce too low：该 nonce 已被占用，调用方需要重新分配。
 */
public class NonceConflictException extends TxPipelineException {

    private final long nonce;

    public NonceConflictException(String message, long nonce) {
        super(message);
        this.nonce = nonce;
    }

    public long getNonce() {
        return nonce;
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
