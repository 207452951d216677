package com.work.txpipeline.vault.repository.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;

import java.time.Instant;

@TableName("api_credentials")
public class ApiCredentialEntity {

    @TableId(type = IdType.AUTO)
    private Long id;

    private Long userId;

    private String provider;

    private byte[] secretEnc;

    /**
     * 可为空。
     */
    private byte[] metaEnc;

    private Instant createdAt;

    private Instant updatedAt;

    public Long getId() {
        return id;
    }

    public void setId(Long id) {
        this.id = id;
    }

    public Long getUserId() {
        return userId;
    }

    public void setUserId(Long userId) {
        this.userId = userId;
    }

    public String getProvider() {
        return provider;
    }

    public void setProvider(String provider) {
        this.provider = provider;
    }

    public byte[] getSecretEnc() {
        return secretEnc;
    }

    public void setSecretEnc(byte[] secretEnc) {
        this.secretEnc = secretEnc;
    }

    public byte[] getMetaEnc() {
        return metaEnc;
    }

    public void setMetaEnc(byte[] metaEnc) {
        this.metaEnc = metaEnc;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }
}
