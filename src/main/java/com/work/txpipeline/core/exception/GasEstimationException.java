package com.work.txpipeline.core.exception;

/**
 * gas 估算失败；Intent 保持 CREATED，不消耗 nonce。
 */
public class GasEstimationException extends TxPipelineException {

    public GasEstimationException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
