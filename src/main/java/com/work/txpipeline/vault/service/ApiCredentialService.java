package com.work.txpipeline.vault.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.work.txpipeline.core.exception.TxPipelineException;
import com.work.txpipeline.vault.KeyVault;
import com.work.txpipeline.vault.repository.entity.ApiCredentialEntity;
import com.work.txpipeline.vault.repository.mapper.ApiCredentialMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Instant;
import java.util.Arrays;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

import static com.work.txpipeline.core.support.ValidationUtils.requireNonEmpty;
import static com.work.txpipeline.core.support.ValidationUtils.requireNonNull;

/**
 * 第三方 API 凭证：每个 (userId, provider) 一条，secret 与 meta 分别以 JSON 加密存储。
 */
@Service
public class ApiCredentialService {

    private static final Logger log = LoggerFactory.getLogger(ApiCredentialService.class);

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<Map<String, Object>>() {
    };

    private final ApiCredentialMapper mapper;
    private final KeyVault vault;
    private final ObjectMapper objectMapper;

    public ApiCredentialService(ApiCredentialMapper mapper, KeyVault vault, ObjectMapper objectMapper) {
        this.mapper = requireNonNull(mapper, "mapper");
        this.vault = requireNonNull(vault, "vault");
        this.objectMapper = requireNonNull(objectMapper, "objectMapper");
    }

    static String secretPurpose(long userId, String provider) {
        return "api-credential:" + userId + ":" + provider + ":secret";
    }

    static String metaPurpose(long userId, String provider) {
        return "api-credential:" + userId + ":" + provider + ":meta";
    }

    /**
     * 解密后的凭证，只在 {@link #withCredential} 回调内可见。
     */
    public static final class ApiCredential {
        private final Map<String, Object> secret;
        private final Map<String, Object> meta;

        ApiCredential(Map<String, Object> secret, Map<String, Object> meta) {
            this.secret = Collections.unmodifiableMap(secret);
            this.meta = meta == null ? Collections.<String, Object>emptyMap() : Collections.unmodifiableMap(meta);
        }

        public Map<String, Object> getSecret() {
            return secret;
        }

        public Map<String, Object> getMeta() {
            return meta;
        }
    }

    public void upsert(long userId, String provider, Map<String, Object> secret, Map<String, Object> meta) {
        requireNonEmpty(provider, "provider");
        requireNonNull(secret, "secret");
        byte[] secretEnc = seal(secret, secretPurpose(userId, provider));
        byte[] metaEnc = meta == null ? null : seal(meta, metaPurpose(userId, provider));
        mapper.upsert(userId, provider, secretEnc, metaEnc, Instant.now());
        log.info("api credential stored userId={} provider={}", userId, provider);
    }

    public <T> Optional<T> withCredential(long userId, String provider, Function<ApiCredential, T> fn) {
        requireNonEmpty(provider, "provider");
        requireNonNull(fn, "fn");
        ApiCredentialEntity row = mapper.selectByUserAndProvider(userId, provider);
        if (row == null) {
            return Optional.empty();
        }
        Map<String, Object> secret = open(row.getSecretEnc(), secretPurpose(userId, provider));
        Map<String, Object> meta = row.getMetaEnc() == null ? null : open(row.getMetaEnc(), metaPurpose(userId, provider));
        return Optional.ofNullable(fn.apply(new ApiCredential(secret, meta)));
    }

    public boolean delete(long userId, String provider) {
        requireNonEmpty(provider, "provider");
        boolean deleted = mapper.deleteByUserAndProvider(userId, provider) > 0;
        log.info("api credential delete userId={} provider={} deleted={}", userId, provider, deleted);
        return deleted;
    }

    private byte[] seal(Map<String, Object> value, String purpose) {
        byte[] json;
        try {
            json = objectMapper.writeValueAsBytes(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("credential is not serializable", e);
        }
        try {
            return vault.encrypt(json, purpose);
        } finally {
            Arrays.fill(json, (byte) 0);
        }
    }

    private Map<String, Object> open(byte[] blob, String purpose) {
        return vault.withDecrypted(blob, purpose, bytes -> {
            try {
                return objectMapper.readValue(bytes, MAP_TYPE);
            } catch (IOException e) {
                throw new TxPipelineException("stored credential is not valid json", e);
            }
        });
    }
}
