package com.work.txpipeline.vault;

import com.work.txpipeline.core.exception.AuthenticationException;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.util.Base64;
import java.util.HashMap;
import java.util.Map;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class EnvelopeKeyVaultTest {

    private static final String PURPOSE = "wallet:0x00000000000000000000000000000000000000aa";

    private static String randomKey() {
        byte[] k = new byte[32];
        new SecureRandom().nextBytes(k);
        return Base64.getEncoder().encodeToString(k);
    }

    private static EnvelopeKeyVault vault(String keyId, String key, String previous) {
        Map<String, String> env = new HashMap<>();
        env.put("MK", key);
        env.put("MK_ID", keyId);
        if (previous != null) {
            env.put("MK_PREV", previous);
        }
        return new EnvelopeKeyVault(new EnvironmentMasterKeyProvider(env, "MK", "MK_ID", "MK_PREV"), new SecureRandom());
    }

    @Test
    public void decrypt_returns_original_bytes_for_any_length() {
        EnvelopeKeyVault v = vault("k1", randomKey(), null);
        Random rnd = new Random(42);
        for (int len : new int[]{0, 1, 31, 32, 33, 1024}) {
            byte[] plain = new byte[len];
            rnd.nextBytes(plain);
            byte[] blob = v.encrypt(plain, PURPOSE);
            try (PlaintextSecret s = v.decrypt(blob, PURPOSE)) {
                assertArrayEquals(plain, s.bytes());
            }
        }
    }

    @Test
    public void same_plaintext_encrypts_to_different_blobs() {
        EnvelopeKeyVault v = vault("k1", randomKey(), null);
        byte[] plain = "secret".getBytes(StandardCharsets.UTF_8);
        assertFalse(java.util.Arrays.equals(v.encrypt(plain, PURPOSE), v.encrypt(plain, PURPOSE)));
    }

    @Test
    public void any_flipped_byte_fails_authentication() {
        EnvelopeKeyVault v = vault("k1", randomKey(), null);
        byte[] blob = v.encrypt("0123456789abcdef0123456789abcdef".getBytes(StandardCharsets.UTF_8), PURPOSE);
        for (int i = 0; i < blob.length; i++) {
            byte[] tampered = blob.clone();
            tampered[i] ^= 0x01;
            assertThrows(AuthenticationException.class, () -> v.decrypt(tampered, PURPOSE), "byte " + i);
        }
    }

    @Test
    public void truncated_blob_fails_authentication() {
        EnvelopeKeyVault v = vault("k1", randomKey(), null);
        byte[] blob = v.encrypt(new byte[]{1, 2, 3}, PURPOSE);
        byte[] truncated = java.util.Arrays.copyOf(blob, blob.length - 1);
        assertThrows(AuthenticationException.class, () -> v.decrypt(truncated, PURPOSE));
        assertThrows(AuthenticationException.class, () -> v.decrypt(new byte[0], PURPOSE));
    }

    @Test
    public void blob_is_bound_to_its_purpose() {
        EnvelopeKeyVault v = vault("k1", randomKey(), null);
        byte[] blob = v.encrypt(new byte[]{7, 7, 7}, PURPOSE);
        assertThrows(AuthenticationException.class, () -> v.decrypt(blob, "wallet:0x00000000000000000000000000000000000000bb"));
    }

    @Test
    public void unknown_master_key_fails_closed() {
        byte[] blob = vault("k1", randomKey(), null).encrypt(new byte[]{1}, PURPOSE);
        EnvelopeKeyVault other = vault("k2", randomKey(), null);
        assertThrows(AuthenticationException.class, () -> other.decrypt(blob, PURPOSE));
    }

    @Test
    public void wrong_master_key_with_same_id_fails_closed() {
        byte[] blob = vault("k1", randomKey(), null).encrypt(new byte[]{1}, PURPOSE);
        EnvelopeKeyVault other = vault("k1", randomKey(), null);
        assertThrows(AuthenticationException.class, () -> other.decrypt(blob, PURPOSE));
    }

    @Test
    public void rewrap_moves_dek_to_current_key_and_keeps_payload() {
        String k1 = randomKey();
        String k2 = randomKey();
        EnvelopeKeyVault before = vault("k1", k1, null);
        byte[] plain = "api-secret".getBytes(StandardCharsets.UTF_8);
        byte[] blob = before.encrypt(plain, PURPOSE);

        EnvelopeKeyVault rotating = vault("k2", k2, "k1:" + k1);
        byte[] rewrapped = rotating.rewrap(blob);
        assertEquals("k1", rotating.keyIdOf(blob));
        assertEquals("k2", rotating.keyIdOf(rewrapped));

        EnvelopeKeyVault after = vault("k2", k2, null);
        assertArrayEquals(plain, after.withDecrypted(rewrapped, PURPOSE, byte[]::clone));
        assertThrows(AuthenticationException.class, () -> after.decrypt(blob, PURPOSE));
    }

    @Test
    public void plaintext_is_wiped_on_close() {
        EnvelopeKeyVault v = vault("k1", randomKey(), null);
        byte[] blob = v.encrypt(new byte[]{9, 9, 9, 9}, PURPOSE);
        PlaintextSecret s = v.decrypt(blob, PURPOSE);
        byte[] buffer = s.bytes();
        s.close();
        assertArrayEquals(new byte[4], buffer);
        assertThrows(IllegalStateException.class, s::bytes);
    }
}
