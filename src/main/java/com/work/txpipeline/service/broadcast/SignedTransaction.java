package com.work.txpipeline.service.broadcast;

/**
 * 已签名的原始交易及其 hash（keccak256(raw)）。
 */
public final class SignedTransaction {

    private final byte[] raw;
    private final String txHash;

    public SignedTransaction(byte[] raw, String txHash) {
        this.raw = raw;
        this.txHash = txHash;
    }

    public byte[] getRaw() {
        return raw;
    }

    public String getTxHash() {
        return txHash;
    }
}
