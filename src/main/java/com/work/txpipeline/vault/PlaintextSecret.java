package com.work.txpipeline.vault;

import java.util.Arrays;

/**
 * 解密后的明文缓冲区，close 后清零且不可再读。
 */
public final class PlaintextSecret implements AutoCloseable {

    private final byte[] bytes;
    private volatile boolean closed;

    PlaintextSecret(byte[] bytes) {
        this.bytes = bytes;
    }

    public byte[] bytes() {
        if (closed) {
            throw new IllegalStateException("plaintext already wiped");
        }
        return bytes;
    }

    public int length() {
        return bytes.length;
    }

    @Override
    public void close() {
        Arrays.fill(bytes, (byte) 0);
        closed = true;
    }
}
