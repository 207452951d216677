package com.work.txpipeline.domain;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Intent 生命周期。
 *
 * <pre>
 * CREATED   -> ALLOCATED | FAILED
 * ALLOCATED -> SENT | FAILED
 * SENT      -> SENT (fee-bump 替换) | CONFIRMED | FAILED
 * REPLACED  -> SENT | CONFIRMED | FAILED
 * CONFIRMED, FAILED 为终态
 * </pre>
 *
 * REPLACED 只为兼容历史数据保留：替换交易时 Intent 保持 SENT，"被替换"体现在 Send 的 replaced_by 上。
 */
public enum IntentStatus {
    CREATED,
    ALLOCATED,
    SENT,
    REPLACED,
    CONFIRMED,
    FAILED;

    public boolean isTerminal() {
        return this == CONFIRMED || this == FAILED;
    }

    /**
     * 已广播、等待上链。
     */
    public boolean isInFlight() {
        return this == SENT || this == REPLACED;
    }

    public boolean canTransitionTo(IntentStatus next) {
        return allowedNext().contains(next);
    }

    public Set<IntentStatus> allowedNext() {
        switch (this) {
            case CREATED:
                return EnumSet.of(ALLOCATED, FAILED);
            case ALLOCATED:
                return EnumSet.of(SENT, FAILED);
            case SENT:
            case REPLACED:
                return EnumSet.of(SENT, CONFIRMED, FAILED);
            default:
                return Collections.emptySet();
        }
    }
}
