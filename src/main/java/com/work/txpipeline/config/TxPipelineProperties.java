package com.work.txpipeline.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * 交易流水线配置项（txpipeline.*）。
 */
@ConfigurationProperties(prefix = "txpipeline")
public class TxPipelineProperties {

    /**
     * 链 id，写入 EIP-1559 交易的 chainId 字段。
     */
    private long chainId = 1L;

    /**
     * gas 估算结果的安全余量：gasLimit = estimate * (1 + margin)。
     */
    private double gasLimitMargin = 0.20;

    /**
     * 替换交易的最小费用倍数（相对前一笔）。
     */
    private double feeBumpFactor = 1.10;

    /**
     * 节点返回 underpriced 时，每次在倍数上追加的步长。
     */
    private double underpricedBumpStep = 0.05;

    /**
     * maxFeePerGas 上限。
     */
    private long maxFeeCapWei = 150_000_000_000L;

    private long minPriorityFeeWei = 1_000_000_000L;

    private long maxPriorityFeeWei = 2_000_000_000L;

    /**
     * baseFee 的放大系数，抵御下一区块 baseFee 上涨。
     */
    private double surgeMultiplier = 1.2;

    /**
     * 费用建议的缓存时长。
     */
    private Duration feeCacheTtl = Duration.ofSeconds(2);

    /**
     * 单次 RPC 调用的最大尝试次数（含首次）。
     */
    private int rpcMaxAttempts = 3;

    private Duration rpcBackoffBase = Duration.ofMillis(500);

    private Duration rpcBackoffMax = Duration.ofSeconds(8);

    /**
     * nonce 冲突 / underpriced 时重新分配的最大次数。
     */
    private int maxReallocations = 3;

    /**
     * receipt 对账周期（@Scheduled 直接读取配置键）。
     */
    private Duration reconcileInterval = Duration.ofSeconds(5);

    private int reconcileBatchSize = 200;

    /**
     * 并行查询 receipt 的 worker 数。
     */
    private int receiptWorkers = 8;

    /**
     * 最新一笔广播后超过该时长仍无 receipt，视为卡住并触发替换。
     */
    private Duration stuckThreshold = Duration.ofSeconds(90);

    /**
     * 最新一笔广播后链已前进该数量的块仍无 receipt，同样视为卡住；0 表示只看时长。
     */
    private long stuckBlocks = 0L;

    /**
     * 自动替换的最大次数，超过后 Intent 以 receipt 超时失败。
     */
    private int maxReplacements = 3;

    /**
     * ALLOCATED 停留超过该时长视为进程在广播与落库之间崩溃，需要恢复。
     */
    private Duration allocatedOrphanTimeout = Duration.ofMinutes(2);

    private Duration lockTtl = Duration.ofSeconds(10);

    private Duration lockWaitTimeout = Duration.ofSeconds(5);

    /**
     * 多实例部署时开启 Redis 锁；关闭时使用进程内锁。
     */
    private boolean redisLockEnabled = false;

    public long getChainId() {
        return chainId;
    }

    public void setChainId(long chainId) {
        this.chainId = chainId;
    }

    public double getGasLimitMargin() {
        return gasLimitMargin;
    }

    public void setGasLimitMargin(double gasLimitMargin) {
        this.gasLimitMargin = gasLimitMargin;
    }

    public double getFeeBumpFactor() {
        return feeBumpFactor;
    }

    public void setFeeBumpFactor(double feeBumpFactor) {
        this.feeBumpFactor = feeBumpFactor;
    }

    public double getUnderpricedBumpStep() {
        return underpricedBumpStep;
    }

    public void setUnderpricedBumpStep(double underpricedBumpStep) {
        this.underpricedBumpStep = underpricedBumpStep;
    }

    public long getMaxFeeCapWei() {
        return maxFeeCapWei;
    }

    public void setMaxFeeCapWei(long maxFeeCapWei) {
        this.maxFeeCapWei = maxFeeCapWei;
    }

    public long getMinPriorityFeeWei() {
        return minPriorityFeeWei;
    }

    public void setMinPriorityFeeWei(long minPriorityFeeWei) {
        this.minPriorityFeeWei = minPriorityFeeWei;
    }

    public long getMaxPriorityFeeWei() {
        return maxPriorityFeeWei;
    }

    public void setMaxPriorityFeeWei(long maxPriorityFeeWei) {
        this.maxPriorityFeeWei = maxPriorityFeeWei;
    }

    public double getSurgeMultiplier() {
        return surgeMultiplier;
    }

    public void setSurgeMultiplier(double surgeMultiplier) {
        this.surgeMultiplier = surgeMultiplier;
    }

    public Duration getFeeCacheTtl() {
        return feeCacheTtl;
    }

    public void setFeeCacheTtl(Duration feeCacheTtl) {
        this.feeCacheTtl = feeCacheTtl;
    }

    public int getRpcMaxAttempts() {
        return rpcMaxAttempts;
    }

    public void setRpcMaxAttempts(int rpcMaxAttempts) {
        this.rpcMaxAttempts = rpcMaxAttempts;
    }

    public Duration getRpcBackoffBase() {
        return rpcBackoffBase;
    }

    public void setRpcBackoffBase(Duration rpcBackoffBase) {
        this.rpcBackoffBase = rpcBackoffBase;
    }

    public Duration getRpcBackoffMax() {
        return rpcBackoffMax;
    }

    public void setRpcBackoffMax(Duration rpcBackoffMax) {
        this.rpcBackoffMax = rpcBackoffMax;
    }

    public int getMaxReallocations() {
        return maxReallocations;
    }

    public void setMaxReallocations(int maxReallocations) {
        this.maxReallocations = maxReallocations;
    }

    public Duration getReconcileInterval() {
        return reconcileInterval;
    }

    public void setReconcileInterval(Duration reconcileInterval) {
        this.reconcileInterval = reconcileInterval;
    }

    public int getReconcileBatchSize() {
        return reconcileBatchSize;
    }

    public void setReconcileBatchSize(int reconcileBatchSize) {
        this.reconcileBatchSize = reconcileBatchSize;
    }

    public int getReceiptWorkers() {
        return receiptWorkers;
    }

    public void setReceiptWorkers(int receiptWorkers) {
        this.receiptWorkers = receiptWorkers;
    }

    public Duration getStuckThreshold() {
        return stuckThreshold;
    }

    public void setStuckThreshold(Duration stuckThreshold) {
        this.stuckThreshold = stuckThreshold;
    }

    public long getStuckBlocks() {
        return stuckBlocks;
    }

    public void setStuckBlocks(long stuckBlocks) {
        this.stuckBlocks = stuckBlocks;
    }

    public int getMaxReplacements() {
        return maxReplacements;
    }

    public void setMaxReplacements(int maxReplacements) {
        this.maxReplacements = maxReplacements;
    }

    public Duration getAllocatedOrphanTimeout() {
        return allocatedOrphanTimeout;
    }

    public void setAllocatedOrphanTimeout(Duration allocatedOrphanTimeout) {
        this.allocatedOrphanTimeout = allocatedOrphanTimeout;
    }

    public Duration getLockTtl() {
        return lockTtl;
    }

    public void setLockTtl(Duration lockTtl) {
        this.lockTtl = lockTtl;
    }

    public Duration getLockWaitTimeout() {
        return lockWaitTimeout;
    }

    public void setLockWaitTimeout(Duration lockWaitTimeout) {
        this.lockWaitTimeout = lockWaitTimeout;
    }

    public boolean isRedisLockEnabled() {
        return redisLockEnabled;
    }

    public void setRedisLockEnabled(boolean redisLockEnabled) {
        this.redisLockEnabled = redisLockEnabled;
    }
}
