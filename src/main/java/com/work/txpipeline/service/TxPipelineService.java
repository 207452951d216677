package com.work.txpipeline.service;

import com.work.txpipeline.config.TxPipelineProperties;
import com.work.txpipeline.core.exception.AddressLockTimeoutException;
import com.work.txpipeline.core.exception.AuthenticationException;
import com.work.txpipeline.core.exception.BroadcastRejectedException;
import com.work.txpipeline.core.exception.GasEstimationException;
import com.work.txpipeline.core.exception.IntentNotFoundException;
import com.work.txpipeline.core.exception.InvalidTransitionException;
import com.work.txpipeline.core.exception.NonceConflictException;
import com.work.txpipeline.core.exception.TxPipelineException;
import com.work.txpipeline.core.exception.UnderpricedReplacementException;
import com.work.txpipeline.core.lock.AddressLockCoordinator;
import com.work.txpipeline.core.support.RetryPolicy;
import com.work.txpipeline.domain.Allocation;
import com.work.txpipeline.domain.BuiltCall;
import com.work.txpipeline.domain.IntentRegistration;
import com.work.txpipeline.domain.IntentRequest;
import com.work.txpipeline.domain.IntentStatus;
import com.work.txpipeline.domain.IntentStatusView;
import com.work.txpipeline.repository.entity.TxIntentEntity;
import com.work.txpipeline.repository.entity.TxSendEntity;
import com.work.txpipeline.service.allocator.NonceFeeAllocator;
import com.work.txpipeline.service.broadcast.Broadcaster;
import com.work.txpipeline.service.ledger.IntentLedger;
import com.work.txpipeline.support.metrics.PipelineMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Optional;

import static com.work.txpipeline.core.support.ValidationUtils.requireNonNull;

/**
 * 对外门面：注册 -> 分配 -> 广播，以及查询、手动替换、取消。
 *
 * <p>可恢复错误（gas 估算、nonce 冲突、费用不足、锁竞争）在本地有界重试；
 * 超过上限或遇到不可恢复错误时 Intent 进入 FAILED，原因以可读文本记录，原始 RPC 错误只进日志。
 * 交易是否已被节点收到无法确定时（传输层失败）不判失败：Intent 留在 ALLOCATED、nonce 保留，
 * 由 reconciler 的孤儿分配巡检按链上状态收尾。</p>
 */
@Service
public class TxPipelineService {

    private static final Logger log = LoggerFactory.getLogger(TxPipelineService.class);

    private final IntentLedger ledger;
    private final NonceFeeAllocator allocator;
    private final Broadcaster broadcaster;
    private final AddressLockCoordinator lockCoordinator;
    private final TxPipelineProperties props;
    private final RetryPolicy retryPolicy;
    private final PipelineMetrics metrics;

    public TxPipelineService(IntentLedger ledger,
                             NonceFeeAllocator allocator,
                             Broadcaster broadcaster,
                             AddressLockCoordinator lockCoordinator,
                             TxPipelineProperties props,
                             RetryPolicy rpcRetryPolicy,
                             PipelineMetrics metrics) {
        this.ledger = requireNonNull(ledger, "ledger");
        this.allocator = requireNonNull(allocator, "allocator");
        this.broadcaster = requireNonNull(broadcaster, "broadcaster");
        this.lockCoordinator = requireNonNull(lockCoordinator, "lockCoordinator");
        this.props = requireNonNull(props, "props");
        this.retryPolicy = requireNonNull(rpcRetryPolicy, "rpcRetryPolicy");
        this.metrics = requireNonNull(metrics, "metrics");
    }

    /**
     * 幂等入口：相同 intentKey 只会产生一次广播，重复调用直接返回已有 Intent 的状态。
     */
    public IntentStatusView registerIntent(IntentRequest request) {
        IntentRegistration registration = ledger.register(request);
        long intentId = registration.getIntent().getId();
        if (!registration.isDuplicate()) {
            submit(intentId);
        }
        IntentStatusView view = ledger.view(intentId);
        view.setDuplicate(registration.isDuplicate());
        return view;
    }

    /**
     * CREATED（或崩溃后残留的 ALLOCATED）-> SENT。失败时 Intent 以可读原因进入 FAILED
     * （广播结果未知时保持 ALLOCATED），不抛出。
     */
    public void submit(long intentId) {
        TxIntentEntity intent = ledger.require(intentId);
        String address = intent.getSigningAddress();
        BuiltCall call = ledger.builtCall(intent);
        int maxAttempts = Math.max(1, props.getMaxReallocations() + 1);
        double bump = props.getFeeBumpFactor();

        Allocation allocation = null;
        boolean reprice = false;
        RuntimeException last = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                if (allocation == null) {
                    allocation = allocator.allocate(intentId, address);
                } else if (reprice) {
                    allocation = allocator.reprice(intentId, allocation, bump);
                    bump += props.getUnderpricedBumpStep();
                    reprice = false;
                }
                broadcaster.send(intentId, allocation, call);
                return;
            } catch (GasEstimationException | AddressLockTimeoutException e) {
                last = e;
                log.warn("allocation attempt failed intentId={} attempt={}/{} err={}", intentId, attempt, maxAttempts, e.toString());
                retryPolicy.pauseBeforeRetry(attempt);
            } catch (NonceConflictException e) {
                last = e;
                log.warn("nonce conflict intentId={} nonce={} attempt={}/{}, reallocating", intentId, e.getNonce(), attempt, maxAttempts);
                allocation = null;
            } catch (UnderpricedReplacementException e) {
                last = e;
                log.warn("fees rejected intentId={} attempt={}/{} err={}", intentId, attempt, maxAttempts, e.getMessage());
                if (allocation == null) {
                    break;
                }
                reprice = true;
            } catch (BroadcastRejectedException | AuthenticationException e) {
                last = e;
                break;
            } catch (IllegalArgumentException e) {
                // value/data 无法编码成交易，重试无意义
                last = e;
                break;
            } catch (InvalidTransitionException e) {
                // 其他执行者（例如 reconciler 的崩溃恢复）已推进该 Intent
                log.warn("intent moved concurrently intentId={} err={}", intentId, e.getMessage());
                return;
            } catch (TxPipelineException e) {
                last = e;
                break;
            }
        }
        fail(intentId, allocation != null, last);
    }

    /**
     * 放弃一个已分配但无法完成的 Intent（例如崩溃恢复时发现调用参数无法签名）。
     * 交易确定未广播时回退 nonce，再以可读原因进入 FAILED。
     */
    public void abandon(long intentId, RuntimeException cause) {
        fail(intentId, ledger.require(intentId).getAllocatedNonce() != null, cause);
    }

    private void fail(long intentId, boolean allocated, RuntimeException cause) {
        String reason = describe(cause);
        TxIntentEntity intent = ledger.require(intentId);
        boolean holdsNonce = allocated && IntentLedger.statusOf(intent) == IntentStatus.ALLOCATED;
        if (holdsNonce && !definitelyNotBroadcast(cause)) {
            if (ledger.recordUnconfirmedBroadcast(intentId, reason)) {
                log.warn("intent submission unresolved intentId={} reason={} err={}", intentId, reason, String.valueOf(cause));
                metrics.broadcast("unconfirmed");
            } else {
                log.warn("intent moved concurrently after unresolved submission intentId={}", intentId);
            }
            return;
        }
        if (holdsNonce) {
            allocator.release(intentId);
        }
        log.warn("intent submission failed intentId={} reason={} err={}", intentId, reason, String.valueOf(cause));
        ledger.markFailed(intentId, reason);
        metrics.broadcast("failed");
    }

    /**
     * 只有节点明确拒绝、或签名前就失败时才能确定交易没有进入 mempool；其余情况都不能回退 nonce。
     */
    private static boolean definitelyNotBroadcast(RuntimeException cause) {
        if (cause instanceof BroadcastRejectedException) {
            return ((BroadcastRejectedException) cause).isDefinitive();
        }
        return cause instanceof AuthenticationException
                || cause instanceof UnderpricedReplacementException
                || cause instanceof IllegalArgumentException;
    }

    static String describe(RuntimeException cause) {
        if (cause instanceof GasEstimationException) {
            return "gas estimation failed";
        }
        if (cause instanceof NonceConflictException) {
            return "nonce conflict persisted after re-allocation";
        }
        if (cause instanceof UnderpricedReplacementException) {
            return "fees could not be raised enough under the fee cap";
        }
        if (cause instanceof AddressLockTimeoutException) {
            return "signing address busy";
        }
        if (cause instanceof AuthenticationException) {
            return "signing key unavailable";
        }
        if (cause instanceof BroadcastRejectedException) {
            return ((BroadcastRejectedException) cause).isDefinitive()
                    ? "transaction rejected by the network"
                    : "network unavailable";
        }
        if (cause instanceof IllegalArgumentException) {
            return "invalid parameters";
        }
        return "submission failed";
    }

    public IntentStatusView getIntentStatus(long intentId) {
        return ledger.view(intentId);
    }

    public IntentStatusView getIntentStatusByKey(String intentKey) {
        TxIntentEntity intent = ledger.findByKey(intentKey);
        if (intent == null) {
            throw new IntentNotFoundException("intent not found: " + intentKey);
        }
        return ledger.view(intent);
    }

    /**
     * 手动 fee-bump 替换。Intent 必须处于 SENT。
     */
    public IntentStatusView forceReplace(long intentId) {
        TxIntentEntity intent = ledger.require(intentId);
        if (!IntentLedger.statusOf(intent).isInFlight()) {
            throw new InvalidTransitionException(String.format("intent %d cannot be replaced in %s", intentId, intent.getStatus()));
        }
        replace(intentId, "manual");
        return ledger.view(intentId);
    }

    /**
     * 对最新一笔 Send 做 fee-bump 替换；节点认为加价不足时按步长继续加价，有界。
     * 同一 Intent 的替换在 Intent 锁内串行，prior 在锁内读取。
     *
     * @return 新的 Send；nonce 已在链上被消耗时返回 empty（由 reconciler 拿 receipt 收尾）
     */
    public Optional<TxSendEntity> replace(long intentId, String trigger) {
        return lockCoordinator.executeWithIntentLock(intentId, owner -> replaceLatest(intentId, trigger));
    }

    private Optional<TxSendEntity> replaceLatest(long intentId, String trigger) {
        TxIntentEntity intent = ledger.require(intentId);
        TxSendEntity prior = ledger.latestSend(intentId);
        if (prior == null) {
            throw new InvalidTransitionException("intent " + intentId + " has no transaction to replace");
        }
        BuiltCall call = ledger.builtCall(intent);
        double bump = props.getFeeBumpFactor();
        int maxAttempts = Math.max(1, props.getMaxReallocations());
        UnderpricedReplacementException last = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                Allocation allocation = allocator.allocateReplacement(intentId, prior, bump);
                TxSendEntity next = broadcaster.replace(intentId, prior, allocation, call);
                log.info("intent replaced intentId={} trigger={} nonce={} {} -> {}", intentId, trigger,
                        prior.getNonce(), prior.getTxHash(), next.getTxHash());
                return Optional.of(next);
            } catch (UnderpricedReplacementException e) {
                last = e;
                bump += props.getUnderpricedBumpStep();
                log.warn("replacement underpriced intentId={} attempt={}/{} nextBump={}", intentId, attempt, maxAttempts, bump);
            } catch (NonceConflictException e) {
                log.info("replacement skipped, nonce already mined intentId={} nonce={}", intentId, e.getNonce());
                metrics.replacement("nonce_mined");
                return Optional.empty();
            }
        }
        metrics.replacement("underpriced");
        throw last;
    }

    public IntentStatusView cancel(long intentId) {
        ledger.cancel(intentId);
        return ledger.view(intentId);
    }
}
