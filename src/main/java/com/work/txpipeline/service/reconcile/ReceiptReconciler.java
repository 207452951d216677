package com.work.txpipeline.service.reconcile;

import com.work.txpipeline.chain.ChainConnector;
import com.work.txpipeline.chain.TxReceipt;
import com.work.txpipeline.config.TxPipelineProperties;
import com.work.txpipeline.core.exception.BroadcastRejectedException;
import com.work.txpipeline.core.exception.ChainRpcException;
import com.work.txpipeline.core.exception.NonceConflictException;
import com.work.txpipeline.core.exception.ReceiptTimeoutException;
import com.work.txpipeline.core.exception.UnderpricedReplacementException;
import com.work.txpipeline.core.support.RetryPolicy;
import com.work.txpipeline.domain.Allocation;
import com.work.txpipeline.domain.FeeParams;
import com.work.txpipeline.domain.IntentStatus;
import com.work.txpipeline.repository.entity.TxIntentEntity;
import com.work.txpipeline.repository.entity.TxSendEntity;
import com.work.txpipeline.service.TxPipelineService;
import com.work.txpipeline.service.broadcast.Broadcaster;
import com.work.txpipeline.service.broadcast.SignedTransaction;
import com.work.txpipeline.service.ledger.IntentLedger;
import com.work.txpipeline.support.metrics.PipelineMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import javax.annotation.PostConstruct;
import javax.annotation.PreDestroy;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicBoolean;

import static com.work.txpipeline.core.support.ValidationUtils.requireNonNull;

/**
 * 后台对账：
 * - 在途 Send 的 receipt 并行查询，找到即落库并推进 Intent 终态
 * - 超过 stuck-threshold（或链已前进 stuck-blocks 个块）仍无 receipt 的 Intent 自动 fee-bump 替换，次数用尽后 FAILED
 * - 提交后、落库前崩溃或广播结果未知而遗留的 ALLOCATED Intent，按确定性 hash 找回或重新广播
 */
@Service
public class ReceiptReconciler {

    private static final Logger log = LoggerFactory.getLogger(ReceiptReconciler.class);

    static final String NONCE_CONSUMED_REASON = "nonce consumed by a transaction not recorded for this intent";

    private final IntentLedger ledger;
    private final ChainConnector chain;
    private final TxPipelineService pipeline;
    private final Broadcaster broadcaster;
    private final TxPipelineProperties props;
    private final RetryPolicy retryPolicy;
    private final PipelineMetrics metrics;

    private ExecutorService workers;
    private final AtomicBoolean running = new AtomicBoolean(false);

    public ReceiptReconciler(IntentLedger ledger,
                             ChainConnector chain,
                             TxPipelineService pipeline,
                             Broadcaster broadcaster,
                             TxPipelineProperties props,
                             RetryPolicy rpcRetryPolicy,
                             PipelineMetrics metrics) {
        this.ledger = requireNonNull(ledger, "ledger");
        this.chain = requireNonNull(chain, "chain");
        this.pipeline = requireNonNull(pipeline, "pipeline");
        this.broadcaster = requireNonNull(broadcaster, "broadcaster");
        this.props = requireNonNull(props, "props");
        this.retryPolicy = requireNonNull(rpcRetryPolicy, "rpcRetryPolicy");
        this.metrics = requireNonNull(metrics, "metrics");
    }

    @PostConstruct
    public void start() {
        int n = Math.max(1, props.getReceiptWorkers());
        ThreadFactory tf = r -> {
            Thread t = new Thread(r);
            t.setName("receipt-worker-" + t.getId());
            t.setDaemon(true);
            return t;
        };
        this.workers = Executors.newFixedThreadPool(n, tf);
        log.info("ReceiptReconciler started workers={}", n);
    }

    @PreDestroy
    public void stop() {
        if (workers != null) {
            workers.shutdownNow();
        }
    }

    @Scheduled(fixedDelayString = "${txpipeline.reconcile-interval:PT5S}")
    public void poll() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        try {
            reconcileSends();
            recoverOrphanAllocations();
        } finally {
            running.set(false);
        }
    }

    /**
     * 一轮 receipt 对账。返回本轮推进到终态的 Intent 数。
     */
    public int reconcileSends() {
        List<TxSendEntity> pending = ledger.listPendingSends(Math.max(1, props.getReconcileBatchSize()));
        if (pending.isEmpty()) {
            return 0;
        }
        Long head = props.getStuckBlocks() > 0 ? currentBlock() : null;
        Map<String, CompletableFuture<TxReceipt>> lookups = new LinkedHashMap<>();
        Map<Long, List<TxSendEntity>> byIntent = new LinkedHashMap<>();
        for (TxSendEntity s : pending) {
            byIntent.computeIfAbsent(s.getIntentId(), k -> new ArrayList<>()).add(s);
            lookups.computeIfAbsent(s.getTxHash(), h -> CompletableFuture.supplyAsync(
                    () -> retryPolicy.execute("getTransactionReceipt", () -> chain.getTransactionReceipt(h)), workers));
        }

        int finalized = 0;
        for (Map.Entry<Long, List<TxSendEntity>> e : byIntent.entrySet()) {
            long intentId = e.getKey();
            try {
                if (reconcileIntent(intentId, e.getValue(), lookups, head)) {
                    finalized++;
                }
            } catch (RuntimeException ex) {
                log.warn("reconcile failed intentId={} err={}", intentId, ex.toString());
                metrics.receipt("error");
            }
        }
        return finalized;
    }

    private boolean reconcileIntent(long intentId, List<TxSendEntity> sends,
                                    Map<String, CompletableFuture<TxReceipt>> lookups, Long head) {
        boolean lookupFailed = false;
        for (TxSendEntity s : sends) {
            TxReceipt receipt;
            try {
                receipt = lookups.get(s.getTxHash()).get();
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                return false;
            } catch (ExecutionException ee) {
                log.warn("receipt lookup failed intentId={} txHash={} err={}", intentId, s.getTxHash(), String.valueOf(ee.getCause()));
                metrics.receipt("lookup_error");
                lookupFailed = true;
                continue;
            }
            if (receipt != null) {
                IntentStatus status = ledger.recordReceipt(intentId, s, receipt);
                log.info("receipt recorded intentId={} nonce={} txHash={} block={} status={} intent={}",
                        intentId, s.getNonce(), s.getTxHash(), receipt.getBlockNumber(), receipt.getStatus(), status);
                metrics.receipt(receipt.isSuccess() ? "success" : "reverted");
                return true;
            }
        }
        if (lookupFailed) {
            // 节点不可用时不判定卡单，下一轮再看
            return false;
        }
        return handleUnconfirmed(intentId, head);
    }

    /**
     * 本轮的链高度；取不到时返回 null，本轮只按时间判断卡单。
     */
    private Long currentBlock() {
        try {
            return retryPolicy.execute("getLatestBlockNumber", chain::getLatestBlockNumber);
        } catch (ChainRpcException e) {
            log.warn("block number unavailable, stuck check falls back to age err={}", e.getMessage());
            return null;
        }
    }

    /**
     * 所有在途 Send 均无 receipt：卡住则替换；替换次数用尽则以 ReceiptTimeout 失败。
     */
    private boolean handleUnconfirmed(long intentId, Long head) {
        TxIntentEntity intent = ledger.require(intentId);
        if (!IntentLedger.statusOf(intent).isInFlight()) {
            return false;
        }
        TxSendEntity latest = ledger.latestSend(intentId);
        if (latest == null || latest.getSentAt() == null) {
            return false;
        }
        if (!isStuck(latest, head)) {
            return false;
        }

        int replacements = intent.getReplacementCount() == null ? 0 : intent.getReplacementCount();
        if (replacements >= props.getMaxReplacements()) {
            ReceiptTimeoutException timeout = new ReceiptTimeoutException(String.format(
                    "no receipt for nonce %d after %d replacements", latest.getNonce(), replacements));
            log.warn("receipt timeout intentId={} address={} nonce={} txHash={} err={}",
                    intentId, intent.getSigningAddress(), latest.getNonce(), latest.getTxHash(), timeout.getMessage());
            metrics.receipt("timeout");
            return ledger.markFailed(intentId, timeout.getMessage());
        }

        log.info("stuck transaction intentId={} address={} nonce={} txHash={} sentAt={} replacements={}",
                intentId, intent.getSigningAddress(), latest.getNonce(), latest.getTxHash(), latest.getSentAt(), replacements);
        Optional<TxSendEntity> next;
        try {
            next = pipeline.replace(intentId, "stuck");
        } catch (UnderpricedReplacementException e) {
            log.warn("stuck replacement not possible intentId={} nonce={} err={}", intentId, latest.getNonce(), e.getMessage());
            metrics.receipt("replacement_capped");
            return false;
        }
        if (next.isPresent()) {
            metrics.receipt("replaced");
            return false;
        }
        return resolveConsumedNonce(intentId);
    }

    /**
     * 距广播已超过 stuck-threshold，或链已前进 stuck-blocks 个块仍未打包。
     */
    private boolean isStuck(TxSendEntity latest, Long head) {
        Instant stuckAt = latest.getSentAt().plus(props.getStuckThreshold());
        if (!Instant.now().isBefore(stuckAt)) {
            return true;
        }
        return head != null && latest.getSentBlock() != null
                && head - latest.getSentBlock() >= props.getStuckBlocks();
    }

    /**
     * 链上 nonce 已越过本 Intent 的 nonce：再查一遍全部 Send，仍无 receipt 说明被账本外的交易占用。
     */
    private boolean resolveConsumedNonce(long intentId) {
        for (TxSendEntity s : ledger.listSends(intentId)) {
            TxReceipt receipt = retryPolicy.execute("getTransactionReceipt", () -> chain.getTransactionReceipt(s.getTxHash()));
            if (receipt != null) {
                ledger.recordReceipt(intentId, s, receipt);
                metrics.receipt(receipt.isSuccess() ? "success" : "reverted");
                return true;
            }
        }
        log.warn("nonce consumed externally intentId={}", intentId);
        metrics.receipt("nonce_consumed");
        return ledger.markFailed(intentId, NONCE_CONSUMED_REASON);
    }

    /**
     * 处理长时间停留在 ALLOCATED 的 Intent。返回本轮处理的数量。
     */
    public int recoverOrphanAllocations() {
        Instant before = Instant.now().minus(props.getAllocatedOrphanTimeout());
        List<TxIntentEntity> stale = ledger.listStaleAllocated(before, Math.max(1, props.getReconcileBatchSize()));
        int recovered = 0;
        for (TxIntentEntity intent : stale) {
            try {
                recoverOrphan(intent);
                recovered++;
            } catch (RuntimeException e) {
                // 单个 Intent 的异常不影响本批其余 Intent
                log.warn("orphan recovery failed intentId={} err={}", intent.getId(), e.toString());
                metrics.receipt("orphan_error");
            }
        }
        return recovered;
    }

    private void recoverOrphan(TxIntentEntity intent) {
        if (intent.getAllocatedNonce() == null || intent.getMaxFeePerGas() == null || intent.getGasLimit() == null) {
            ledger.markFailed(intent.getId(), "allocation record incomplete");
            return;
        }
        Allocation allocation = new Allocation(intent.getAllocatedNonce(),
                new FeeParams(intent.getMaxFeePerGas(), intent.getMaxPriorityFeePerGas()), intent.getGasLimit());
        // 签名是确定性的：同一分配重建出的交易 hash 与崩溃前广播的那笔相同
        SignedTransaction signed;
        try {
            signed = broadcaster.sign(intent, allocation, ledger.builtCall(intent));
        } catch (IllegalArgumentException e) {
            log.warn("orphan cannot be signed intentId={} nonce={} err={}", intent.getId(), allocation.getNonce(), e.getMessage());
            metrics.receipt("orphan_invalid");
            pipeline.abandon(intent.getId(), e);
            return;
        }
        TxReceipt receipt = retryPolicy.execute("getTransactionReceipt", () -> chain.getTransactionReceipt(signed.getTxHash()));
        if (receipt != null) {
            TxSendEntity adopted = broadcaster.adopt(intent.getId(), allocation, signed);
            ledger.recordReceipt(intent.getId(), adopted, receipt);
            log.info("orphan adopted with receipt intentId={} nonce={} txHash={}", intent.getId(), allocation.getNonce(), signed.getTxHash());
            metrics.receipt("orphan_mined");
            return;
        }
        try {
            broadcaster.send(intent.getId(), allocation, ledger.builtCall(intent));
            log.info("orphan rebroadcast intentId={} nonce={} txHash={}", intent.getId(), allocation.getNonce(), signed.getTxHash());
            metrics.receipt("orphan_resent");
        } catch (NonceConflictException e) {
            log.warn("orphan nonce already used intentId={} nonce={}", intent.getId(), allocation.getNonce());
            ledger.markFailed(intent.getId(), NONCE_CONSUMED_REASON);
        } catch (BroadcastRejectedException e) {
            if (!e.isDefinitive()) {
                throw e;
            }
            log.warn("orphan rejected by node intentId={} nonce={} err={}", intent.getId(), allocation.getNonce(), e.getMessage());
            pipeline.abandon(intent.getId(), e);
        }
    }
}
