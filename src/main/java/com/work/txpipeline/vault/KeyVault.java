package com.work.txpipeline.vault;

import java.util.function.Function;

/**
 * 信封加密：每条密文一把随机 DEK，DEK 由主密钥包裹后与密文一起存放。
 *
 * <p>purpose 作为 AEAD 关联数据绑定到密文上；解密时 purpose 不一致、密文被篡改、
 * 或包裹 DEK 的主密钥不可用，都抛出 {@link com.work.txpipeline.core.exception.AuthenticationException}。</p>
 */
public interface KeyVault {

    /**
     * @param plaintext 明文（调用方负责在使用后清零）
     * @param purpose   用途标签，例如 {@code wallet:0xabc...}
     * @return 自描述的密文 blob
     */
    byte[] encrypt(byte[] plaintext, String purpose);

    /**
     * 返回的明文在 close 时清零，调用方应使用 try-with-resources。
     */
    PlaintextSecret decrypt(byte[] blob, String purpose);

    /**
     * 只在回调内可见明文，回调返回后立即清零。
     */
    default <T> T withDecrypted(byte[] blob, String purpose, Function<byte[], T> fn) {
        try (PlaintextSecret secret = decrypt(blob, purpose)) {
            return fn.apply(secret.bytes());
        }
    }

    /**
     * 用当前主密钥重新包裹 DEK，负载密文保持不变。
     */
    byte[] rewrap(byte[] blob);

    /**
     * 读取 blob 头部记录的主密钥 id（不解密）。
     */
    String keyIdOf(byte[] blob);

    String currentKeyId();
}
