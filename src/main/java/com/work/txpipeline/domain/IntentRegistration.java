package com.work.txpipeline.domain;

import com.work.txpipeline.repository.entity.TxIntentEntity;

/**
 * register 的结果：duplicate=true 表示 intent_key 已存在，返回的是已有 Intent。
 */
public final class IntentRegistration {

    private final TxIntentEntity intent;
    private final boolean duplicate;

    public IntentRegistration(TxIntentEntity intent, boolean duplicate) {
        this.intent = intent;
        this.duplicate = duplicate;
    }

    public TxIntentEntity getIntent() {
        return intent;
    }

    public boolean isDuplicate() {
        return duplicate;
    }
}
