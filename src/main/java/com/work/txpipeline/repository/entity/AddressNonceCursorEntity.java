package com.work.txpipeline.repository.entity;

import com.baomidou.mybatisplus.annotation.TableName;

import java.time.Instant;

@TableName("address_nonce_cursor")
public class AddressNonceCursorEntity {

    private Long chainId;

    private String address;

    private Long nextNonce;

    private Instant updatedAt;

    public Long getChainId() {
        return chainId;
    }

    public void setChainId(Long chainId) {
        this.chainId = chainId;
    }

    public String getAddress() {
        return address;
    }

    public void setAddress(String address) {
        this.address = address;
    }

    public Long getNextNonce() {
        return nextNonce;
    }

    public void setNextNonce(Long nextNonce) {
        this.nextNonce = nextNonce;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }
}
