package com.work.txpipeline.vault.service;

import com.work.txpipeline.core.exception.AuthenticationException;
import com.work.txpipeline.core.exception.TxPipelineException;
import com.work.txpipeline.vault.KeyVault;
import com.work.txpipeline.vault.PlaintextSecret;
import com.work.txpipeline.vault.repository.entity.WalletEntity;
import com.work.txpipeline.vault.repository.mapper.WalletMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.web3j.crypto.Credentials;
import org.web3j.crypto.ECKeyPair;
import org.web3j.crypto.Keys;
import org.web3j.utils.Numeric;

import java.security.GeneralSecurityException;
import java.time.Instant;
import java.util.Arrays;
import java.util.function.Function;

import static com.work.txpipeline.core.support.ValidationUtils.requireAddress;
import static com.work.txpipeline.core.support.ValidationUtils.requireNonNull;

/**
 * 签名钱包：私钥只以密文落库，解密后的明文只在 {@link #withCredentials} 的回调内存在。
 */
@Service
public class WalletKeyService {

    private static final Logger log = LoggerFactory.getLogger(WalletKeyService.class);

    private static final int PRIVATE_KEY_LENGTH = 32;

    private final WalletMapper walletMapper;
    private final KeyVault vault;

    public WalletKeyService(WalletMapper walletMapper, KeyVault vault) {
        this.walletMapper = requireNonNull(walletMapper, "walletMapper");
        this.vault = requireNonNull(vault, "vault");
    }

    static String purposeFor(String address) {
        return "wallet:" + address;
    }

    public WalletEntity createWallet(Long userId) {
        ECKeyPair pair;
        try {
            pair = Keys.createEcKeyPair();
        } catch (GeneralSecurityException e) {
            throw new TxPipelineException("key generation failed", e);
        }
        byte[] privateKey = Numeric.toBytesPadded(pair.getPrivateKey(), PRIVATE_KEY_LENGTH);
        try {
            return store(userId, pair, privateKey);
        } finally {
            Arrays.fill(privateKey, (byte) 0);
        }
    }

    /**
     * 导入已有私钥。调用方负责清零传入的数组。
     */
    public WalletEntity importWallet(Long userId, byte[] privateKey) {
        requireNonNull(privateKey, "privateKey");
        if (privateKey.length != PRIVATE_KEY_LENGTH) {
            throw new IllegalArgumentException("privateKey 必须为 32 字节");
        }
        return store(userId, ECKeyPair.create(privateKey), privateKey);
    }

    private WalletEntity store(Long userId, ECKeyPair pair, byte[] privateKey) {
        String address = "0x" + Keys.getAddress(pair).toLowerCase();
        WalletEntity wallet = new WalletEntity();
        wallet.setUserId(userId);
        wallet.setAddress(address);
        wallet.setPrivkeyEnc(vault.encrypt(privateKey, purposeFor(address)));
        wallet.setCreatedAt(Instant.now());
        try {
            walletMapper.insert(wallet);
        } catch (DuplicateKeyException e) {
            throw new IllegalArgumentException("wallet already exists: " + address, e);
        }
        log.info("wallet stored address={} userId={} keyId={}", address, userId, vault.currentKeyId());
        return wallet;
    }

    public WalletEntity findWallet(String address) {
        return walletMapper.selectByAddress(requireAddress(address, "address"));
    }

    /**
     * 在回调内提供签名凭证。解密出的私钥字节在回调返回后清零。
     */
    public <T> T withCredentials(String address, Function<Credentials, T> fn) {
        requireNonNull(fn, "fn");
        String normalized = requireAddress(address, "address");
        WalletEntity wallet = walletMapper.selectByAddress(normalized);
        if (wallet == null) {
            throw new AuthenticationException("no wallet registered for address " + normalized);
        }
        try (PlaintextSecret key = vault.decrypt(wallet.getPrivkeyEnc(), purposeFor(normalized))) {
            Credentials credentials = Credentials.create(ECKeyPair.create(key.bytes()));
            if (!credentials.getAddress().equalsIgnoreCase(normalized)) {
                throw new AuthenticationException("decrypted key does not match wallet " + normalized);
            }
            return fn.apply(credentials);
        }
    }
}
