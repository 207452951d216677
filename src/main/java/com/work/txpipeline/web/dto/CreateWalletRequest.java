package com.work.txpipeline.web.dto;

import javax.validation.constraints.NotNull;
import javax.validation.constraints.Pattern;

public class CreateWalletRequest {

    @NotNull(message = "userId 不能为空")
    private Long userId;

    /**
     * 可选：导入已有私钥（0x + 64 位十六进制）。为空时生成新钥。
     */
    @Pattern(regexp = "^0x[0-9a-fA-F]{64}$", message = "privateKey 格式错误")
    private String privateKey;

    public Long getUserId() {
        return userId;
    }

    public void setUserId(Long userId) {
        this.userId = userId;
    }

    public String getPrivateKey() {
        return privateKey;
    }

    public void setPrivateKey(String privateKey) {
        this.privateKey = privateKey;
    }

    @Override
    public String toString() {
        return "CreateWalletRequest{userId=" + userId + ", privateKey=" + (privateKey == null ? "null" : "***") + "}";
    }
}
