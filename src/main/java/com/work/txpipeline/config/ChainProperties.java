package com.work.txpipeline.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * 链访问配置。
 *
 * chain.mode:
 * - mock: 使用内存链（默认，便于本地联调）
 * - web3j: 使用 Web3j 连接真实节点
 */
@ConfigurationProperties(prefix = "chain")
public class ChainProperties {

    private String mode = "mock";

    private String rpcUrl = "http://localhost:8545";

    private Duration requestTimeout = Duration.ofSeconds(10);

    public String getMode() {
        return mode;
    }

    public void setMode(String mode) {
        this.mode = mode;
    }

    public String getRpcUrl() {
        return rpcUrl;
    }

    public void setRpcUrl(String rpcUrl) {
        this.rpcUrl = rpcUrl;
    }

    public Duration getRequestTimeout() {
        return requestTimeout;
    }

    public void setRequestTimeout(Duration requestTimeout) {
        this.requestTimeout = requestTimeout;
    }
}
