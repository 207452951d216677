package com.work.txpipeline.web.dto;

import java.time.Instant;

/**
 * 钱包对外视图：只含地址，不含任何密钥材料。
 */
public class WalletView {

    private Long userId;
    private String address;
    private Instant createdAt;

    public Long getUserId() {
        return userId;
    }

    public void setUserId(Long userId) {
        this.userId = userId;
    }

    public String getAddress() {
        return address;
    }

    public void setAddress(String address) {
        this.address = address;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }
}
