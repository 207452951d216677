package com.work.txpipeline.vault;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Base64;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import static com.work.txpipeline.core.support.ValidationUtils.requireNonEmpty;
import static com.work.txpipeline.core.support.ValidationUtils.requireNonNull;

/**
 * 从环境变量读取主密钥：
 * <ul>
 *   <li>主密钥：base64 编码的 32 字节</li>
 *   <li>主密钥 id：可选，缺省为 {@value #DEFAULT_KEY_ID}</li>
 *   <li>旧密钥：可选，{@code id:base64,id:base64}，仅用于解包轮换前的 DEK</li>
 * </ul>
 */
public class EnvironmentMasterKeyProvider implements MasterKeyProvider {

    private static final Logger log = LoggerFactory.getLogger(EnvironmentMasterKeyProvider.class);

    static final String DEFAULT_KEY_ID = "k1";

    private final MasterKey current;
    private final Map<String, MasterKey> keys;

    public EnvironmentMasterKeyProvider(Map<String, String> env, String masterKeyVar, String keyIdVar, String previousKeysVar) {
        requireNonNull(env, "env");
        requireNonEmpty(masterKeyVar, "masterKeyVar");
        String encoded = env.get(masterKeyVar);
        if (encoded == null || encoded.trim().isEmpty()) {
            throw new IllegalStateException("environment variable " + masterKeyVar + " is not set");
        }
        String keyId = keyIdVar == null ? null : env.get(keyIdVar);
        if (keyId == null || keyId.trim().isEmpty()) {
            keyId = DEFAULT_KEY_ID;
        }
        this.current = new MasterKey(keyId.trim(), decode(encoded, masterKeyVar));

        Map<String, MasterKey> all = new LinkedHashMap<>();
        all.put(current.getId(), current);
        String previous = previousKeysVar == null ? null : env.get(previousKeysVar);
        if (previous != null && !previous.trim().isEmpty()) {
            for (String entry : previous.split(",")) {
                String trimmed = entry.trim();
                if (trimmed.isEmpty()) {
                    continue;
                }
                int sep = trimmed.indexOf(':');
                if (sep <= 0) {
                    throw new IllegalStateException(previousKeysVar + " entries must be id:base64");
                }
                String id = trimmed.substring(0, sep);
                if (all.containsKey(id)) {
                    throw new IllegalStateException("duplicate master key id " + id);
                }
                all.put(id, new MasterKey(id, decode(trimmed.substring(sep + 1), previousKeysVar)));
            }
        }
        this.keys = Collections.unmodifiableMap(all);
        log.info("master keys loaded current={} known={}", current.getId(), keys.keySet());
    }

    private static byte[] decode(String encoded, String var) {
        try {
            return Base64.getDecoder().decode(encoded.trim());
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException(var + " is not valid base64", e);
        }
    }

    @Override
    public MasterKey current() {
        return current;
    }

    @Override
    public MasterKey find(String keyId) {
        return keys.get(keyId);
    }
}
