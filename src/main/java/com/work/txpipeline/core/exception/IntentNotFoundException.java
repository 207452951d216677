package com.work.txpipeline.core.exception;

public class IntentNotFoundException extends TxPipelineException {

    public IntentNotFoundException(String message) {
        super(message);
    }
}
