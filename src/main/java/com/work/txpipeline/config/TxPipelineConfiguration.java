package com.work.txpipeline.config;

import com.work.txpipeline.chain.ChainConnector;
import com.work.txpipeline.chain.MockChainConnector;
import com.work.txpipeline.core.exception.ChainRpcException;
import com.work.txpipeline.core.lock.AddressLockCoordinator;
import com.work.txpipeline.core.lock.AddressLockManager;
import com.work.txpipeline.core.lock.impl.RedisAddressLockManager;
import com.work.txpipeline.core.support.InMemoryAddressLockManager;
import com.work.txpipeline.core.support.RetryPolicy;
import com.work.txpipeline.support.metrics.NoopPipelineMetrics;
import com.work.txpipeline.support.metrics.PipelineMetrics;
import com.work.txpipeline.vault.EnvelopeKeyVault;
import com.work.txpipeline.vault.EnvironmentMasterKeyProvider;
import com.work.txpipeline.vault.KeyVault;
import com.work.txpipeline.vault.MasterKeyProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.security.SecureRandom;

@Configuration
@EnableConfigurationProperties({TxPipelineProperties.class, ChainProperties.class, VaultProperties.class})
public class TxPipelineConfiguration {

    /**
     * 链上 RPC 统一的有界重试：只重试传输层失败。
     */
    @Bean
    public RetryPolicy rpcRetryPolicy(TxPipelineProperties props) {
        return new RetryPolicy(props.getRpcMaxAttempts(), props.getRpcBackoffBase(), props.getRpcBackoffMax(),
                e -> e instanceof ChainRpcException && ((ChainRpcException) e).isTransport());
    }

    @Bean
    @ConditionalOnProperty(prefix = "txpipeline", name = "redis-lock-enabled", havingValue = "true")
    public AddressLockManager redisAddressLockManager(StringRedisTemplate redisTemplate) {
        return new RedisAddressLockManager(redisTemplate);
    }

    @Bean
    @ConditionalOnMissingBean(AddressLockManager.class)
    public AddressLockManager inMemoryAddressLockManager() {
        return new InMemoryAddressLockManager();
    }

    @Bean
    public AddressLockCoordinator addressLockCoordinator(AddressLockManager lockManager, TxPipelineProperties props) {
        return new AddressLockCoordinator(lockManager, props.getLockTtl(), props.getLockWaitTimeout());
    }

    @Bean
    @ConditionalOnMissingBean(PipelineMetrics.class)
    public PipelineMetrics pipelineMetrics() {
        return new NoopPipelineMetrics();
    }

    @Bean
    public SecureRandom secureRandom() {
        return new SecureRandom();
    }

    /**
     * 主密钥只从进程环境读取；缺失时启动失败。
     */
    @Bean
    @ConditionalOnMissingBean(MasterKeyProvider.class)
    public MasterKeyProvider masterKeyProvider(VaultProperties vault) {
        return new EnvironmentMasterKeyProvider(System.getenv(),
                vault.getMasterKeyEnv(), vault.getMasterKeyIdEnv(), vault.getPreviousKeysEnv());
    }

    @Bean
    public KeyVault keyVault(MasterKeyProvider masterKeyProvider, SecureRandom secureRandom) {
        return new EnvelopeKeyVault(masterKeyProvider, secureRandom);
    }

    @Bean
    @ConditionalOnProperty(prefix = "chain", name = "mode", havingValue = "mock", matchIfMissing = true)
    public ChainConnector mockChainConnector() {
        return new MockChainConnector();
    }
}
