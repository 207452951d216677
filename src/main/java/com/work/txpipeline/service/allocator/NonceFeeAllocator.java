package com.work.txpipeline.service.allocator;

import com.work.txpipeline.chain.ChainConnector;
import com.work.txpipeline.config.TxPipelineProperties;
import com.work.txpipeline.core.exception.GasEstimationException;
import com.work.txpipeline.core.exception.InvalidTransitionException;
import com.work.txpipeline.core.exception.NonceConflictException;
import com.work.txpipeline.core.exception.UnderpricedReplacementException;
import com.work.txpipeline.core.lock.AddressLockCoordinator;
import com.work.txpipeline.core.support.RetryPolicy;
import com.work.txpipeline.domain.Allocation;
import com.work.txpipeline.domain.BuiltCall;
import com.work.txpipeline.domain.FeeParams;
import com.work.txpipeline.domain.IntentStatus;
import com.work.txpipeline.repository.entity.TxIntentEntity;
import com.work.txpipeline.repository.entity.TxSendEntity;
import com.work.txpipeline.service.ledger.IntentLedger;
import com.work.txpipeline.support.metrics.PipelineMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;

import static com.work.txpipeline.core.support.ValidationUtils.requireAddress;
import static com.work.txpipeline.core.support.ValidationUtils.requireNonNull;

/**
 * nonce 与费用分配。
 *
 * <p>nonce = max(账本游标, 链上 pending nonce)，在签名地址锁内读取、推进并记录。
 * gas 估算与费用报价在加锁之前完成：估算失败不消耗 nonce，Intent 保持 CREATED。</p>
 */
@Service
public class NonceFeeAllocator {

    private static final Logger log = LoggerFactory.getLogger(NonceFeeAllocator.class);

    private final IntentLedger ledger;
    private final ChainConnector chain;
    private final FeeOracle feeOracle;
    private final AddressLockCoordinator lockCoordinator;
    private final TxPipelineProperties props;
    private final RetryPolicy retryPolicy;
    private final PipelineMetrics metrics;

    public NonceFeeAllocator(IntentLedger ledger,
                             ChainConnector chain,
                             FeeOracle feeOracle,
                             AddressLockCoordinator lockCoordinator,
                             TxPipelineProperties props,
                             RetryPolicy rpcRetryPolicy,
                             PipelineMetrics metrics) {
        this.ledger = requireNonNull(ledger, "ledger");
        this.chain = requireNonNull(chain, "chain");
        this.feeOracle = requireNonNull(feeOracle, "feeOracle");
        this.lockCoordinator = requireNonNull(lockCoordinator, "lockCoordinator");
        this.props = requireNonNull(props, "props");
        this.retryPolicy = requireNonNull(rpcRetryPolicy, "rpcRetryPolicy");
        this.metrics = requireNonNull(metrics, "metrics");
    }

    /**
     * 为 CREATED 的 Intent 分配 nonce；对 ALLOCATED 的 Intent 则重新分配（上一个 nonce 已被占用）。
     */
    public Allocation allocate(long intentId, String signingAddress) {
        TxIntentEntity intent = ledger.require(intentId);
        String address = requireAddress(signingAddress, "signingAddress");
        if (!address.equals(intent.getSigningAddress())) {
            throw new IllegalArgumentException("intent " + intentId + " is signed by " + intent.getSigningAddress() + ", not " + address);
        }
        IntentStatus status = IntentLedger.statusOf(intent);
        if (status != IntentStatus.CREATED && status != IntentStatus.ALLOCATED) {
            throw new InvalidTransitionException(String.format("intent %d cannot be allocated in %s", intentId, status));
        }
        Long previousNonce = status == IntentStatus.ALLOCATED ? intent.getAllocatedNonce() : null;

        long gasLimit = resolveGasLimit(intent, ledger.builtCall(intent));
        FeeParams fees = feeOracle.quote();

        Allocation allocation = lockCoordinator.executeWithLock(intent.getChainId(), address, owner -> {
            long chainNext = retryPolicy.execute("getPendingNonce", () -> chain.getPendingNonce(address));
            Long ledgerNext = ledger.nextNonce(intent.getChainId(), address);
            long nonce = Math.max(chainNext, ledgerNext == null ? 0L : ledgerNext);
            Allocation a = new Allocation(nonce, fees, gasLimit);
            ledger.recordAllocation(intent, previousNonce, a);
            log.info("nonce allocated intentId={} address={} nonce={} chainNext={} ledgerNext={} owner={}",
                    intentId, address, nonce, chainNext, ledgerNext, owner);
            return a;
        });
        metrics.allocation(previousNonce == null ? "allocated" : "reallocated");
        return allocation;
    }

    /**
     * 节点拒绝了首笔交易的费用：保持 nonce，按倍数上调费用后重新记录。
     */
    public Allocation reprice(long intentId, Allocation current, double bumpFactor) {
        TxIntentEntity intent = ledger.require(intentId);
        FeeParams fees = bumpedFees(current.getFees(), bumpFactor);
        Allocation repriced = current.withFees(fees);
        lockCoordinator.executeWithLock(intent.getChainId(), intent.getSigningAddress(), owner -> {
            ledger.recordAllocation(intent, current.getNonce(), repriced);
            return null;
        });
        log.info("allocation repriced intentId={} nonce={} {} -> {}", intentId, current.getNonce(), current.getFees(), fees);
        metrics.allocation("repriced");
        return repriced;
    }

    /**
     * 替换交易：沿用 prior 的 nonce 与 gas limit，费用至少为 prior 的 bumpFactor 倍。
     *
     * @throws UnderpricedReplacementException 在 maxFeeCap 以内无法满足最小加价
     * @throws NonceConflictException          该 nonce 已在链上被消耗
     * @throws InvalidTransitionException      prior 已被另一笔替换交易取代
     */
    public Allocation allocateReplacement(long intentId, TxSendEntity prior, double bumpFactor) {
        TxIntentEntity intent = ledger.require(intentId);
        IntentStatus status = IntentLedger.statusOf(intent);
        if (!status.isInFlight()) {
            throw new InvalidTransitionException(String.format("intent %d cannot be replaced in %s", intentId, status));
        }
        FeeParams priorFees = new FeeParams(prior.getMaxFeePerGas(), prior.getMaxPriorityFeePerGas());
        FeeParams fees = bumpedFees(priorFees, bumpFactor);
        return lockCoordinator.executeWithLock(intent.getChainId(), intent.getSigningAddress(), owner -> {
            ledger.requireLiveSend(intentId, prior);
            long latest = retryPolicy.execute("getLatestNonce", () -> chain.getLatestNonce(intent.getSigningAddress()));
            if (latest > prior.getNonce()) {
                throw new NonceConflictException("nonce " + prior.getNonce() + " already mined for " + intent.getSigningAddress(), prior.getNonce());
            }
            log.info("replacement allocated intentId={} nonce={} {} -> {}", intentId, prior.getNonce(), priorFees, fees);
            metrics.allocation("replacement");
            return new Allocation(prior.getNonce(), fees, prior.getGasLimit());
        });
    }

    /**
     * 放弃未广播成功的分配（仅在该 nonce 仍是游标头部时回退）。
     */
    public boolean release(long intentId) {
        TxIntentEntity intent = ledger.require(intentId);
        if (intent.getAllocatedNonce() == null) {
            return false;
        }
        return lockCoordinator.executeWithLock(intent.getChainId(), intent.getSigningAddress(),
                owner -> ledger.releaseNonce(intent, intent.getAllocatedNonce()));
    }

    FeeParams bumpedFees(FeeParams prior, double bumpFactor) {
        FeeParams required = prior.bumped(bumpFactor);
        FeeParams market = feeOracle.quote();
        long priority = Math.max(required.getMaxPriorityFeePerGas(), market.getMaxPriorityFeePerGas());
        long maxFee = Math.max(Math.max(required.getMaxFeePerGas(), market.getMaxFeePerGas()), priority);
        if (maxFee > props.getMaxFeeCapWei()) {
            metrics.allocation("fee_cap_exceeded");
            throw new UnderpricedReplacementException(String.format(
                    "replacement needs maxFee %d above cap %d", maxFee, props.getMaxFeeCapWei()));
        }
        FeeParams fees = new FeeParams(maxFee, priority);
        if (!fees.covers(required)) {
            throw new UnderpricedReplacementException("replacement fees " + fees + " below required " + required);
        }
        return fees;
    }

    private long resolveGasLimit(TxIntentEntity intent, BuiltCall call) {
        if (call.getGasLimitHint() != null) {
            return call.getGasLimitHint();
        }
        long estimate;
        try {
            estimate = retryPolicy.execute("estimateGas", () -> chain.estimateGas(intent.getSigningAddress(), call));
        } catch (RuntimeException e) {
            log.warn("gas estimation failed intentId={} address={} err={}", intent.getId(), intent.getSigningAddress(), e.toString());
            metrics.allocation("gas_estimation_failed");
            throw new GasEstimationException("gas estimation failed for intent " + intent.getId(), e);
        }
        return BigDecimal.valueOf(estimate)
                .multiply(BigDecimal.valueOf(1.0d + props.getGasLimitMargin()))
                .setScale(0, RoundingMode.CEILING)
                .longValueExact();
    }
}
