package com.work.txpipeline.domain;

import java.util.Map;

/**
 * 注册 Intent 的入参。
 */
public class IntentRequest {

    private final String intentKey;
    private final String signingAddress;
    private final BuiltCall call;
    private final Map<String, Object> metadata;

    public IntentRequest(String intentKey, String signingAddress, BuiltCall call, Map<String, Object> metadata) {
        this.intentKey = intentKey;
        this.signingAddress = signingAddress;
        this.call = call;
        this.metadata = metadata;
    }

    public String getIntentKey() {
        return intentKey;
    }

    public String getSigningAddress() {
        return signingAddress;
    }

    public BuiltCall getCall() {
        return call;
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }
}
