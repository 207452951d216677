package com.work.txpipeline.core.exception;

/**
 * 交易流水线的统一异常类型，便于业务侧捕获或转换为 HTTP 错误码。
 */
public class TxPipelineException extends RuntimeException {

    public TxPipelineException(String message) {
        super(message);
    }

    public TxPipelineException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * 标识该异常是否可通过重试解决（重新分配 nonce、网络抖动等场景）。
     * 默认不可重试。
     */
    public boolean isRetryable() {
        return false;
    }
}
