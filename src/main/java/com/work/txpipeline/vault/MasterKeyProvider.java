package com.work.txpipeline.vault;

public interface MasterKeyProvider {

    /**
     * 新密文使用的主密钥。
     */
    MasterKey current();

    /**
     * 按 id 查找主密钥（当前或轮换前的旧密钥）；未知返回 null。
     */
    MasterKey find(String keyId);
}
