package com.work.txpipeline.vault;

import com.work.txpipeline.core.exception.AuthenticationException;
import com.work.txpipeline.core.exception.TxPipelineException;

import javax.crypto.AEADBadTagException;
import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Arrays;

import static com.work.txpipeline.core.support.ValidationUtils.requireNonEmpty;
import static com.work.txpipeline.core.support.ValidationUtils.requireNonNull;

/**
 * AES-256-GCM 信封加密。
 *
 * <pre>
 * blob = version(1) | keyIdLen(1) | keyId | wrappedDek(60) | nonce(12) | ciphertext | tag(16)
 * wrappedDek = iv(12) | AES-GCM(masterKey, dek, aad = "dek:" + keyId) (32 + 16)
 * payload    = AES-GCM(dek, plaintext, aad = purpose)
 * </pre>
 */
public class EnvelopeKeyVault implements KeyVault {

    static final byte VERSION = 1;

    private static final String CIPHER = "AES/GCM/NoPadding";
    private static final int DEK_LENGTH = 32;
    private static final int IV_LENGTH = 12;
    private static final int TAG_LENGTH = 16;
    static final int WRAPPED_DEK_LENGTH = IV_LENGTH + DEK_LENGTH + TAG_LENGTH;

    private final MasterKeyProvider keys;
    private final SecureRandom random;

    public EnvelopeKeyVault(MasterKeyProvider keys, SecureRandom random) {
        this.keys = requireNonNull(keys, "keys");
        this.random = requireNonNull(random, "random");
    }

    @Override
    public byte[] encrypt(byte[] plaintext, String purpose) {
        requireNonNull(plaintext, "plaintext");
        requireNonEmpty(purpose, "purpose");
        MasterKey master = keys.current();
        byte[] dek = randomBytes(DEK_LENGTH);
        try {
            byte[] wrapped = wrap(master, dek);
            byte[] nonce = randomBytes(IV_LENGTH);
            byte[] sealed = gcm(Cipher.ENCRYPT_MODE, dek, nonce, purpose.getBytes(StandardCharsets.UTF_8), plaintext);
            return new Envelope(master.getId(), wrapped, nonce, sealed).toBytes();
        } finally {
            Arrays.fill(dek, (byte) 0);
        }
    }

    @Override
    public PlaintextSecret decrypt(byte[] blob, String purpose) {
        requireNonEmpty(purpose, "purpose");
        Envelope envelope = Envelope.parse(blob);
        byte[] dek = unwrap(envelope);
        try {
            byte[] plaintext = gcm(Cipher.DECRYPT_MODE, dek, envelope.nonce, purpose.getBytes(StandardCharsets.UTF_8), envelope.sealed);
            return new PlaintextSecret(plaintext);
        } finally {
            Arrays.fill(dek, (byte) 0);
        }
    }

    @Override
    public byte[] rewrap(byte[] blob) {
        Envelope envelope = Envelope.parse(blob);
        MasterKey master = keys.current();
        byte[] dek = unwrap(envelope);
        try {
            return new Envelope(master.getId(), wrap(master, dek), envelope.nonce, envelope.sealed).toBytes();
        } finally {
            Arrays.fill(dek, (byte) 0);
        }
    }

    @Override
    public String keyIdOf(byte[] blob) {
        return Envelope.parse(blob).keyId;
    }

    @Override
    public String currentKeyId() {
        return keys.current().getId();
    }

    private byte[] wrap(MasterKey master, byte[] dek) {
        byte[] iv = randomBytes(IV_LENGTH);
        byte[] sealed = gcm(Cipher.ENCRYPT_MODE, master.material(), iv, wrapAad(master.getId()), dek);
        return ByteBuffer.allocate(WRAPPED_DEK_LENGTH).put(iv).put(sealed).array();
    }

    private byte[] unwrap(Envelope envelope) {
        MasterKey master = keys.find(envelope.keyId);
        if (master == null) {
            throw new AuthenticationException("unknown master key id: " + envelope.keyId);
        }
        byte[] iv = Arrays.copyOfRange(envelope.wrappedDek, 0, IV_LENGTH);
        byte[] sealed = Arrays.copyOfRange(envelope.wrappedDek, IV_LENGTH, WRAPPED_DEK_LENGTH);
        return gcm(Cipher.DECRYPT_MODE, master.material(), iv, wrapAad(master.getId()), sealed);
    }

    private static byte[] wrapAad(String keyId) {
        return ("dek:" + keyId).getBytes(StandardCharsets.UTF_8);
    }

    private byte[] randomBytes(int n) {
        byte[] b = new byte[n];
        random.nextBytes(b);
        return b;
    }

    private static byte[] gcm(int mode, byte[] key, byte[] iv, byte[] aad, byte[] input) {
        try {
            Cipher cipher = Cipher.getInstance(CIPHER);
            cipher.init(mode, new SecretKeySpec(key, "AES"), new GCMParameterSpec(TAG_LENGTH * 8, iv));
            cipher.updateAAD(aad);
            return cipher.doFinal(input);
        } catch (AEADBadTagException e) {
            throw new AuthenticationException("ciphertext authentication failed", e);
        } catch (GeneralSecurityException e) {
            throw new TxPipelineException("vault cipher failure", e);
        }
    }

    /**
     * blob 的二进制布局。解析失败统一视为认证失败。
     */
    static final class Envelope {
        final String keyId;
        final byte[] wrappedDek;
        final byte[] nonce;
        final byte[] sealed;

        Envelope(String keyId, byte[] wrappedDek, byte[] nonce, byte[] sealed) {
            this.keyId = keyId;
            this.wrappedDek = wrappedDek;
            this.nonce = nonce;
            this.sealed = sealed;
        }

        byte[] toBytes() {
            byte[] id = keyId.getBytes(StandardCharsets.UTF_8);
            return ByteBuffer.allocate(2 + id.length + wrappedDek.length + nonce.length + sealed.length)
                    .put(VERSION)
                    .put((byte) id.length)
                    .put(id)
                    .put(wrappedDek)
                    .put(nonce)
                    .put(sealed)
                    .array();
        }

        static Envelope parse(byte[] blob) {
            if (blob == null || blob.length < 2) {
                throw new AuthenticationException("malformed ciphertext");
            }
            if (blob[0] != VERSION) {
                throw new AuthenticationException("unsupported ciphertext version: " + blob[0]);
            }
            int idLen = blob[1] & 0xff;
            int minLength = 2 + idLen + WRAPPED_DEK_LENGTH + IV_LENGTH + TAG_LENGTH;
            if (idLen == 0 || blob.length < minLength) {
                throw new AuthenticationException("malformed ciphertext");
            }
            ByteBuffer buf = ByteBuffer.wrap(blob, 2, blob.length - 2);
            byte[] id = new byte[idLen];
            buf.get(id);
            byte[] wrapped = new byte[WRAPPED_DEK_LENGTH];
            buf.get(wrapped);
            byte[] nonce = new byte[IV_LENGTH];
            buf.get(nonce);
            byte[] sealed = new byte[buf.remaining()];
            buf.get(sealed);
            return new Envelope(new String(id, StandardCharsets.UTF_8), wrapped, nonce, sealed);
        }
    }
}
