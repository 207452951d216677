package com.work.txpipeline.vault;

import java.nio.charset.StandardCharsets;

import static com.work.txpipeline.core.support.ValidationUtils.requireNonEmpty;
import static com.work.txpipeline.core.support.ValidationUtils.requireNonNull;

/**
 * 主密钥（AES-256）。只存在于内存，从不落库。
 */
public final class MasterKey {

    public static final int KEY_LENGTH = 32;

    private final String id;
    private final byte[] material;

    public MasterKey(String id, byte[] material) {
        this.id = requireNonEmpty(id, "id");
        requireNonNull(material, "material");
        if (material.length != KEY_LENGTH) {
            throw new IllegalArgumentException("master key must be " + KEY_LENGTH + " bytes, got " + material.length);
        }
        if (id.getBytes(StandardCharsets.UTF_8).length > 255) {
            throw new IllegalArgumentException("master key id too long: " + id);
        }
        this.material = material.clone();
    }

    public String getId() {
        return id;
    }

    byte[] material() {
        return material;
    }

    @Override
    public String toString() {
        return "MasterKey{id=" + id + "}";
    }
}
