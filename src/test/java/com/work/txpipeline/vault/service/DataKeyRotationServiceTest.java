package com.work.txpipeline.vault.service;

import com.work.txpipeline.vault.EnvelopeKeyVault;
import com.work.txpipeline.vault.EnvironmentMasterKeyProvider;
import com.work.txpipeline.vault.KeyVault;
import com.work.txpipeline.vault.repository.entity.ApiCredentialEntity;
import com.work.txpipeline.vault.repository.entity.WalletEntity;
import com.work.txpipeline.vault.repository.mapper.ApiCredentialMapper;
import com.work.txpipeline.vault.repository.mapper.WalletMapper;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.security.SecureRandom;
import java.util.Arrays;
import java.util.Base64;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class DataKeyRotationServiceTest {

    private static final String K1 = key();
    private static final String K2 = key();

    private static String key() {
        byte[] k = new byte[32];
        new SecureRandom().nextBytes(k);
        return Base64.getEncoder().encodeToString(k);
    }

    private static KeyVault vault(String id, String material, String previous) {
        Map<String, String> env = new HashMap<>();
        env.put("MK", material);
        env.put("MK_ID", id);
        if (previous != null) {
            env.put("MK_PREV", previous);
        }
        return new EnvelopeKeyVault(new EnvironmentMasterKeyProvider(env, "MK", "MK_ID", "MK_PREV"), new SecureRandom());
    }

    private static WalletEntity wallet(long id, byte[] blob) {
        WalletEntity w = new WalletEntity();
        w.setId(id);
        w.setAddress(String.format("0x%040x", id));
        w.setPrivkeyEnc(blob);
        return w;
    }

    @Test
    public void rewraps_old_blobs_and_skips_current_ones() {
        KeyVault old = vault("k1", K1, null);
        KeyVault current = vault("k2", K2, "k1:" + K1);
        byte[] secret = new byte[]{1, 2, 3, 4};
        WalletEntity stale = wallet(1L, old.encrypt(secret, "wallet:a"));
        WalletEntity fresh = wallet(2L, current.encrypt(secret, "wallet:b"));

        ApiCredentialEntity cred = new ApiCredentialEntity();
        cred.setId(10L);
        cred.setProvider("exchange");
        cred.setSecretEnc(old.encrypt(secret, "api-credential:1:exchange:secret"));

        WalletMapper walletMapper = mock(WalletMapper.class);
        when(walletMapper.listAfterId(0L, 200)).thenReturn(Arrays.asList(stale, fresh));
        when(walletMapper.replaceKeyBlob(anyLong(), any(byte[].class), any(byte[].class))).thenReturn(1);
        ApiCredentialMapper credentialMapper = mock(ApiCredentialMapper.class);
        when(credentialMapper.listAfterId(0L, 200)).thenReturn(Collections.singletonList(cred));
        when(credentialMapper.replaceBlobs(anyLong(), any(byte[].class), any(byte[].class), any())).thenReturn(1);

        DataKeyRotationService service = new DataKeyRotationService(walletMapper, credentialMapper, current);
        DataKeyRotationService.RotationReport report = service.rotateDataKeys();

        assertEquals("k2", report.getKeyId());
        assertEquals(1, report.getWalletsRewrapped());
        assertEquals(1, report.getCredentialsRewrapped());
        assertEquals(1, report.getSkipped());

        ArgumentCaptor<byte[]> next = ArgumentCaptor.forClass(byte[].class);
        verify(walletMapper).replaceKeyBlob(eq(1L), eq(stale.getPrivkeyEnc()), next.capture());
        verify(walletMapper, never()).replaceKeyBlob(eq(2L), any(byte[].class), any(byte[].class));

        KeyVault afterRetire = vault("k2", K2, null);
        assertEquals("k2", afterRetire.keyIdOf(next.getValue()));
        assertArrayEquals(secret, afterRetire.withDecrypted(next.getValue(), "wallet:a", byte[]::clone));
    }

    @Test
    public void concurrent_change_is_counted_as_skipped() {
        KeyVault old = vault("k1", K1, null);
        KeyVault current = vault("k2", K2, "k1:" + K1);
        WalletMapper walletMapper = mock(WalletMapper.class);
        when(walletMapper.listAfterId(0L, 200)).thenReturn(Collections.singletonList(wallet(1L, old.encrypt(new byte[]{1}, "wallet:a"))));
        when(walletMapper.replaceKeyBlob(anyLong(), any(byte[].class), any(byte[].class))).thenReturn(0);

        DataKeyRotationService service = new DataKeyRotationService(walletMapper, mock(ApiCredentialMapper.class), current);
        DataKeyRotationService.RotationReport report = service.rotateDataKeys();

        assertEquals(0, report.getWalletsRewrapped());
        assertEquals(1, report.getSkipped());
    }
}
