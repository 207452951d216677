package com.work.txpipeline.core.exception;

public class ReceiptTimeoutException extends TxPipelineException {

    public ReceiptTimeoutException(String message) {
        super(message);
    }
}
