package com.work.txpipeline.vault.service;

import com.work.txpipeline.vault.KeyVault;
import com.work.txpipeline.vault.repository.entity.ApiCredentialEntity;
import com.work.txpipeline.vault.repository.entity.WalletEntity;
import com.work.txpipeline.vault.repository.mapper.ApiCredentialMapper;
import com.work.txpipeline.vault.repository.mapper.WalletMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

import static com.work.txpipeline.core.support.ValidationUtils.requireNonNull;

/**
 * 主密钥轮换：把所有密文的 DEK 重新包裹到当前主密钥下，负载密文不变。
 *
 * <p>逐行 compare-and-set，可重复执行；已经在当前主密钥下的行直接跳过。</p>
 */
@Service
public class DataKeyRotationService {

    private static final Logger log = LoggerFactory.getLogger(DataKeyRotationService.class);

    static final int PAGE_SIZE = 200;

    private final WalletMapper walletMapper;
    private final ApiCredentialMapper credentialMapper;
    private final KeyVault vault;

    public DataKeyRotationService(WalletMapper walletMapper, ApiCredentialMapper credentialMapper, KeyVault vault) {
        this.walletMapper = requireNonNull(walletMapper, "walletMapper");
        this.credentialMapper = requireNonNull(credentialMapper, "credentialMapper");
        this.vault = requireNonNull(vault, "vault");
    }

    public static final class RotationReport {
        private final String keyId;
        private final int walletsRewrapped;
        private final int credentialsRewrapped;
        private final int skipped;

        public RotationReport(String keyId, int walletsRewrapped, int credentialsRewrapped, int skipped) {
            this.keyId = keyId;
            this.walletsRewrapped = walletsRewrapped;
            this.credentialsRewrapped = credentialsRewrapped;
            this.skipped = skipped;
        }

        public String getKeyId() {
            return keyId;
        }

        public int getWalletsRewrapped() {
            return walletsRewrapped;
        }

        public int getCredentialsRewrapped() {
            return credentialsRewrapped;
        }

        public int getSkipped() {
            return skipped;
        }
    }

    public RotationReport rotateDataKeys() {
        String current = vault.currentKeyId();
        int wallets = 0;
        int credentials = 0;
        int skipped = 0;

        long afterId = 0L;
        List<WalletEntity> walletPage;
        do {
            walletPage = walletMapper.listAfterId(afterId, PAGE_SIZE);
            for (WalletEntity w : walletPage) {
                afterId = w.getId();
                if (current.equals(vault.keyIdOf(w.getPrivkeyEnc()))) {
                    skipped++;
                    continue;
                }
                if (walletMapper.replaceKeyBlob(w.getId(), w.getPrivkeyEnc(), vault.rewrap(w.getPrivkeyEnc())) == 1) {
                    wallets++;
                } else {
                    log.warn("wallet changed during rotation, skipped id={} address={}", w.getId(), w.getAddress());
                    skipped++;
                }
            }
        } while (walletPage.size() == PAGE_SIZE);

        afterId = 0L;
        List<ApiCredentialEntity> credentialPage;
        do {
            credentialPage = credentialMapper.listAfterId(afterId, PAGE_SIZE);
            for (ApiCredentialEntity c : credentialPage) {
                afterId = c.getId();
                boolean secretCurrent = current.equals(vault.keyIdOf(c.getSecretEnc()));
                boolean metaCurrent = c.getMetaEnc() == null || current.equals(vault.keyIdOf(c.getMetaEnc()));
                if (secretCurrent && metaCurrent) {
                    skipped++;
                    continue;
                }
                byte[] secretEnc = secretCurrent ? c.getSecretEnc() : vault.rewrap(c.getSecretEnc());
                byte[] metaEnc = metaCurrent ? c.getMetaEnc() : vault.rewrap(c.getMetaEnc());
                if (credentialMapper.replaceBlobs(c.getId(), c.getSecretEnc(), secretEnc, metaEnc) == 1) {
                    credentials++;
                } else {
                    log.warn("credential changed during rotation, skipped id={} provider={}", c.getId(), c.getProvider());
                    skipped++;
                }
            }
        } while (credentialPage.size() == PAGE_SIZE);

        log.info("data key rotation done keyId={} wallets={} credentials={} skipped={}", current, wallets, credentials, skipped);
        return new RotationReport(current, wallets, credentials, skipped);
    }
}
