package com.work.txpipeline.core.exception;

/**
 * 链 RPC 调用失败。
 *
 * <p>{@code transport=true}：IO/超时，请求可能已到达节点；{@code false}：节点返回了 JSON-RPC error，
 * message 为节点原始错误文本（仅用于分类和日志，不对外暴露）。</p>
 */
public class ChainRpcException extends TxPipelineException {

    private final boolean transport;

    public ChainRpcException(String message, boolean transport) {
        super(message);
        this.transport = transport;
    }

    public ChainRpcException(String message, Throwable cause) {
        super(message, cause);
        this.transport = true;
    }

    public boolean isTransport() {
        return transport;
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
