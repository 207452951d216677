package com.work.txpipeline.core.exception;

/**
 * 在等待时间内未拿到签名地址维度的锁。
 */
public class AddressLockTimeoutException extends TxPipelineException {

    public AddressLockTimeoutException(String message) {
        super(message);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
