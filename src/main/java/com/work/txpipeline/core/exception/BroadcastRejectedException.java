package com.work.txpipeline.core.exception;

/**
 * 节点拒绝了广播。
 *
 * <p>{@code definitive=false} 表示失败发生在传输层（超时/连接失败），无法确定交易是否已进入 mempool。</p>
 */
public class BroadcastRejectedException extends TxPipelineException {

    public enum Kind {
        ALREADY_KNOWN,
        NONCE_TOO_LOW,
        UNDERPRICED,
        OTHER
    }

    private final Kind kind;
    private final boolean definitive;

    public BroadcastRejectedException(Kind kind, boolean definitive, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.definitive = definitive;
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isDefinitive() {
        return definitive;
    }

    @Override
    public boolean isRetryable() {
        return kind == Kind.OTHER && !definitive;
    }
}
