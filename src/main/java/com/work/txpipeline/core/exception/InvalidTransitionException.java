package com.work.txpipeline.core.exception;

/**
 * 状态机不允许的迁移，或 compare-and-set 时存储状态已被并发修改。属于编程错误，不重试。
 */
public class InvalidTransitionException extends TxPipelineException {

    public InvalidTransitionException(String message) {
        super(message);
    }
}
