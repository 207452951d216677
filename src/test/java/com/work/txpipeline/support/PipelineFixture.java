package com.work.txpipeline.support;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.work.txpipeline.chain.ChainConnector;
import com.work.txpipeline.config.TxPipelineProperties;
import com.work.txpipeline.core.exception.ChainRpcException;
import com.work.txpipeline.core.lock.AddressLockCoordinator;
import com.work.txpipeline.core.support.InMemoryAddressLockManager;
import com.work.txpipeline.core.support.RetryPolicy;
import com.work.txpipeline.support.metrics.NoopPipelineMetrics;
import com.work.txpipeline.support.metrics.PipelineMetrics;
import com.work.txpipeline.service.TxPipelineService;
import com.work.txpipeline.service.allocator.FeeOracle;
import com.work.txpipeline.service.allocator.NonceFeeAllocator;
import com.work.txpipeline.service.broadcast.BroadcastErrorClassifier;
import com.work.txpipeline.service.broadcast.Broadcaster;
import com.work.txpipeline.service.broadcast.TransactionSigner;
import com.work.txpipeline.service.ledger.IntentLedger;
import com.work.txpipeline.service.reconcile.ReceiptReconciler;
import com.work.txpipeline.vault.EnvelopeKeyVault;
import com.work.txpipeline.vault.EnvironmentMasterKeyProvider;
import com.work.txpipeline.vault.KeyVault;
import com.work.txpipeline.vault.repository.entity.WalletEntity;
import com.work.txpipeline.vault.repository.mapper.WalletMapper;
import com.work.txpipeline.vault.service.WalletKeyService;
import org.web3j.utils.Numeric;

import java.security.SecureRandom;
import java.time.Duration;
import java.util.Base64;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * 单元测试用的完整流水线：内存账本 + 内存锁 + 可替换的链与签名器，重试无退避。
 */
public class PipelineFixture {

    public static final String PRIVATE_KEY = "0x4c0883a69102937d6231471b5dbb6204fe5129617082792ae468d01a3f362318";
    public static final String TO = "0x00000000000000000000000000000000000000aa";

    public final TxPipelineProperties props;
    public final InMemoryTxLedgerRepository repository = new InMemoryTxLedgerRepository();
    public final PipelineMetrics metrics = new NoopPipelineMetrics();
    public final KeyVault vault;
    public final WalletKeyService wallets;

    public ChainConnector chain;
    public TransactionSigner signer;
    public RetryPolicy retryPolicy;
    public IntentLedger ledger;
    public FeeOracle feeOracle;
    public AddressLockCoordinator lockCoordinator;
    public NonceFeeAllocator allocator;
    public Broadcaster broadcaster;
    public TxPipelineService pipeline;
    public ReceiptReconciler reconciler;

    public PipelineFixture() {
        this.props = defaultProperties();
        this.vault = newVault();
        this.wallets = new WalletKeyService(inMemoryWalletMapper(), vault);
    }

    public static TxPipelineProperties defaultProperties() {
        TxPipelineProperties p = new TxPipelineProperties();
        p.setChainId(8453L);
        p.setFeeCacheTtl(Duration.ZERO);
        p.setRpcMaxAttempts(3);
        p.setRpcBackoffBase(Duration.ZERO);
        p.setRpcBackoffMax(Duration.ZERO);
        p.setStuckThreshold(Duration.ZERO);
        p.setReceiptWorkers(2);
        return p;
    }

    public static KeyVault newVault() {
        byte[] master = new byte[32];
        new SecureRandom().nextBytes(master);
        Map<String, String> env = new HashMap<>();
        env.put("TXP_MASTER_KEY", Base64.getEncoder().encodeToString(master));
        return new EnvelopeKeyVault(new EnvironmentMasterKeyProvider(env, "TXP_MASTER_KEY", "TXP_MASTER_KEY_ID", "TXP_PREVIOUS_MASTER_KEYS"),
                new SecureRandom());
    }

    /**
     * 导入固定测试私钥并返回其地址。
     */
    public String importDefaultWallet() {
        return wallets.importWallet(1L, Numeric.hexStringToByteArray(PRIVATE_KEY)).getAddress();
    }

    /**
     * 用给定的链（为空则用真实签名器）组装全部组件。props 需在此之前调整好。
     */
    public PipelineFixture build(ChainConnector chain, TransactionSigner signer) {
        this.chain = chain;
        this.signer = signer == null ? new TransactionSigner(wallets) : signer;
        this.retryPolicy = new RetryPolicy(props.getRpcMaxAttempts(), props.getRpcBackoffBase(), props.getRpcBackoffMax(),
                e -> e instanceof ChainRpcException && ((ChainRpcException) e).isTransport());
        this.ledger = new IntentLedger(repository, new ObjectMapper(), props, metrics);
        this.feeOracle = new FeeOracle(chain, props, retryPolicy);
        this.lockCoordinator = new AddressLockCoordinator(new InMemoryAddressLockManager(), props.getLockTtl(), props.getLockWaitTimeout());
        this.allocator = new NonceFeeAllocator(ledger, chain, feeOracle, lockCoordinator, props, retryPolicy, metrics);
        this.broadcaster = new Broadcaster(ledger, chain, this.signer, new BroadcastErrorClassifier(), retryPolicy, metrics);
        this.pipeline = new TxPipelineService(ledger, allocator, broadcaster, lockCoordinator, props, retryPolicy, metrics);
        this.reconciler = new ReceiptReconciler(ledger, chain, pipeline, broadcaster, props, retryPolicy, metrics);
        return this;
    }

    private static WalletMapper inMemoryWalletMapper() {
        Map<String, WalletEntity> byAddress = new ConcurrentHashMap<>();
        AtomicLong ids = new AtomicLong();
        WalletMapper mapper = mock(WalletMapper.class);
        when(mapper.insert(any(WalletEntity.class))).thenAnswer(inv -> {
            WalletEntity w = inv.getArgument(0);
            w.setId(ids.incrementAndGet());
            byAddress.put(w.getAddress(), w);
            return 1;
        });
        when(mapper.selectByAddress(anyString())).thenAnswer(inv -> byAddress.get((String) inv.getArgument(0)));
        return mapper;
    }
}
