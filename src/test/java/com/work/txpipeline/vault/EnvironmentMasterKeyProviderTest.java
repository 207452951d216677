package com.work.txpipeline.vault;

import org.junit.jupiter.api.Test;

import java.util.Base64;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class EnvironmentMasterKeyProviderTest {

    private static String key(int fill) {
        byte[] k = new byte[32];
        java.util.Arrays.fill(k, (byte) fill);
        return Base64.getEncoder().encodeToString(k);
    }

    @Test
    public void missing_master_key_fails_startup() {
        Map<String, String> env = new HashMap<>();
        assertThrows(IllegalStateException.class, () -> new EnvironmentMasterKeyProvider(env, "MK", "MK_ID", "MK_PREV"));
    }

    @Test
    public void key_id_defaults_when_not_configured() {
        Map<String, String> env = new HashMap<>();
        env.put("MK", key(1));
        EnvironmentMasterKeyProvider p = new EnvironmentMasterKeyProvider(env, "MK", "MK_ID", "MK_PREV");
        assertEquals(EnvironmentMasterKeyProvider.DEFAULT_KEY_ID, p.current().getId());
    }

    @Test
    public void previous_keys_are_resolvable_by_id() {
        Map<String, String> env = new HashMap<>();
        env.put("MK", key(1));
        env.put("MK_ID", "k3");
        env.put("MK_PREV", "k1:" + key(2) + ", k2:" + key(3));
        EnvironmentMasterKeyProvider p = new EnvironmentMasterKeyProvider(env, "MK", "MK_ID", "MK_PREV");
        assertEquals("k3", p.current().getId());
        assertNotNull(p.find("k1"));
        assertNotNull(p.find("k2"));
        assertNull(p.find("k4"));
    }

    @Test
    public void rejects_short_key_and_bad_base64() {
        Map<String, String> env = new HashMap<>();
        env.put("MK", Base64.getEncoder().encodeToString(new byte[16]));
        assertThrows(IllegalArgumentException.class, () -> new EnvironmentMasterKeyProvider(env, "MK", "MK_ID", "MK_PREV"));

        env.put("MK", "not base64 !!");
        assertThrows(IllegalStateException.class, () -> new EnvironmentMasterKeyProvider(env, "MK", "MK_ID", "MK_PREV"));
    }

    @Test
    public void rejects_malformed_previous_entry() {
        Map<String, String> env = new HashMap<>();
        env.put("MK", key(1));
        env.put("MK_PREV", key(2));
        assertThrows(IllegalStateException.class, () -> new EnvironmentMasterKeyProvider(env, "MK", "MK_ID", "MK_PREV"));
    }
}
