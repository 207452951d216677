package com.work.txpipeline.config;

import com.work.txpipeline.chain.ChainConnector;
import com.work.txpipeline.chain.web3j.Web3jChainConnector;
import okhttp3.OkHttpClient;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.http.HttpService;

/**
 * Web3j 装配：chain.mode=web3j 时启用。
 */
@Configuration
@ConditionalOnProperty(prefix = "chain", name = "mode", havingValue = "web3j")
public class Web3jConfiguration {

    @Bean(destroyMethod = "shutdown")
    public Web3j web3j(ChainProperties properties) {
        OkHttpClient client = new OkHttpClient.Builder()
                .callTimeout(properties.getRequestTimeout())
                .build();
        return Web3j.build(new HttpService(properties.getRpcUrl(), client));
    }

    @Bean
    public ChainConnector web3jChainConnector(Web3j web3j) {
        return new Web3jChainConnector(web3j);
    }
}
