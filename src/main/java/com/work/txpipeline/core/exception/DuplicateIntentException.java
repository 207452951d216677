package com.work.txpipeline.core.exception;

/**
 * intent_key 已存在。注册入口会吞掉该异常并返回已有 Intent，仅在仓储层内部抛出。
 */
public class DuplicateIntentException extends TxPipelineException {

    private final String intentKey;

    public DuplicateIntentException(String intentKey) {
        super("intent already registered: " + intentKey);
        this.intentKey = intentKey;
    }

    public String getIntentKey() {
        return intentKey;
    }
}
