package com.work.txpipeline.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 主密钥来源：这里只配置环境变量的名字，密钥本身从不写进配置文件。
 */
@ConfigurationProperties(prefix = "vault")
public class VaultProperties {

    private String masterKeyEnv = "TXP_MASTER_KEY";

    private String masterKeyIdEnv = "TXP_MASTER_KEY_ID";

    /**
     * 轮换期间保留的旧密钥：id:base64,id:base64
     */
    private String previousKeysEnv = "TXP_PREVIOUS_MASTER_KEYS";

    public String getMasterKeyEnv() {
        return masterKeyEnv;
    }

    public void setMasterKeyEnv(String masterKeyEnv) {
        this.masterKeyEnv = masterKeyEnv;
    }

    public String getMasterKeyIdEnv() {
        return masterKeyIdEnv;
    }

    public void setMasterKeyIdEnv(String masterKeyIdEnv) {
        this.masterKeyIdEnv = masterKeyIdEnv;
    }

    public String getPreviousKeysEnv() {
        return previousKeysEnv;
    }

    public void setPreviousKeysEnv(String previousKeysEnv) {
        this.previousKeysEnv = previousKeysEnv;
    }
}
