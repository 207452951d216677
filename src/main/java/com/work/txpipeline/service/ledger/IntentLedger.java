package com.work.txpipeline.service.ledger;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.work.txpipeline.chain.TxReceipt;
import com.work.txpipeline.config.TxPipelineProperties;
import com.work.txpipeline.core.exception.DuplicateIntentException;
import com.work.txpipeline.core.exception.IntentNotFoundException;
import com.work.txpipeline.core.exception.InvalidTransitionException;
import com.work.txpipeline.core.exception.TxPipelineException;
import com.work.txpipeline.domain.Allocation;
import com.work.txpipeline.domain.BuiltCall;
import com.work.txpipeline.domain.IntentRegistration;
import com.work.txpipeline.domain.IntentRequest;
import com.work.txpipeline.domain.IntentStatus;
import com.work.txpipeline.domain.IntentStatusView;
import com.work.txpipeline.repository.TxLedgerRepository;
import com.work.txpipeline.repository.entity.TxIntentEntity;
import com.work.txpipeline.repository.entity.TxReceiptEntity;
import com.work.txpipeline.repository.entity.TxSendEntity;
import com.work.txpipeline.support.metrics.PipelineMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Isolation;
import org.springframework.transaction.annotation.Transactional;

import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static com.work.txpipeline.core.support.ValidationUtils.requireAddress;
import static com.work.txpipeline.core.support.ValidationUtils.requireHexData;
import static com.work.txpipeline.core.support.ValidationUtils.requireIntentKey;
import static com.work.txpipeline.core.support.ValidationUtils.requireNonNull;
import static com.work.txpipeline.core.support.ValidationUtils.requireWeiValue;

/**
 * Intent 账本：幂等注册、状态机、Send/Receipt 记录。
 *
 * <p>所有状态迁移都是对存储状态的 compare-and-set；多步写入（迁移 + 写 Send、写 Receipt + 改写 replaced_by）
 * 在同一个事务内完成。</p>
 */
@Service
public class IntentLedger {

    private static final Logger log = LoggerFactory.getLogger(IntentLedger.class);

    private static final int MAX_CAS_ATTEMPTS = 3;

    private final TxLedgerRepository repository;
    private final ObjectMapper objectMapper;
    private final TxPipelineProperties props;
    private final PipelineMetrics metrics;

    public IntentLedger(TxLedgerRepository repository, ObjectMapper objectMapper, TxPipelineProperties props, PipelineMetrics metrics) {
        this.repository = requireNonNull(repository, "repository");
        this.objectMapper = requireNonNull(objectMapper, "objectMapper");
        this.props = requireNonNull(props, "props");
        this.metrics = requireNonNull(metrics, "metrics");
    }

    /**
     * 幂等注册：intent_key 已存在时原样返回已有 Intent，本次请求的其他字段被丢弃。
     * 并发注册同一 key 时由唯一约束裁决，失败方拿到胜出方的 Intent。
     */
    public IntentRegistration register(IntentRequest request) {
        requireNonNull(request, "request");
        String intentKey = requireIntentKey(request.getIntentKey());
        String address = requireAddress(request.getSigningAddress(), "signingAddress");
        BuiltCall call = requireNonNull(request.getCall(), "call");
        requireAddress(call.getTo(), "to");
        requireWeiValue(call.getValue(), "value");
        requireHexData(call.getData(), "data");

        TxIntentEntity existing = repository.findIntentByKey(intentKey);
        if (existing != null) {
            log.info("intent already registered intentKey={} id={} status={}", intentKey, existing.getId(), existing.getStatus());
            metrics.intentRegistered("duplicate");
            return new IntentRegistration(existing, true);
        }

        Instant now = Instant.now();
        TxIntentEntity intent = new TxIntentEntity();
        intent.setIntentKey(intentKey);
        intent.setStatus(IntentStatus.CREATED.name());
        intent.setSigningAddress(address);
        intent.setChainId(props.getChainId());
        intent.setBuiltCall(toJson(call));
        intent.setIntentMetadata(request.getMetadata() == null ? null : toJson(request.getMetadata()));
        intent.setCreatedAt(now);
        intent.setUpdatedAt(now);
        try {
            TxIntentEntity stored = repository.insertIntent(intent);
            log.info("intent registered id={} intentKey={} address={}", stored.getId(), intentKey, address);
            metrics.intentRegistered("created");
            return new IntentRegistration(stored, false);
        } catch (DuplicateIntentException e) {
            TxIntentEntity winner = repository.findIntentByKey(intentKey);
            if (winner == null) {
                throw new TxPipelineException("intent vanished after duplicate insert: " + intentKey, e);
            }
            log.info("intent registration lost race intentKey={} winnerId={}", intentKey, winner.getId());
            metrics.intentRegistered("duplicate");
            return new IntentRegistration(winner, true);
        }
    }

    public TxIntentEntity require(long intentId) {
        TxIntentEntity intent = repository.findIntent(intentId);
        if (intent == null) {
            throw new IntentNotFoundException("intent not found: " + intentId);
        }
        return intent;
    }

    public TxIntentEntity findByKey(String intentKey) {
        return repository.findIntentByKey(requireIntentKey(intentKey));
    }

    public BuiltCall builtCall(TxIntentEntity intent) {
        try {
            return objectMapper.readValue(intent.getBuiltCall(), BuiltCall.class);
        } catch (IOException e) {
            throw new TxPipelineException("stored call of intent " + intent.getId() + " is not valid json", e);
        }
    }

    public static IntentStatus statusOf(TxIntentEntity intent) {
        return IntentStatus.valueOf(intent.getStatus());
    }

    /**
     * 状态 compare-and-set。非法迁移、或存储状态已不是 expected，都抛 InvalidTransitionException。
     */
    public void transition(long intentId, IntentStatus expected, IntentStatus next, String reason) {
        if (!expected.canTransitionTo(next)) {
            throw new InvalidTransitionException(String.format("intent %d: %s -> %s is not allowed", intentId, expected, next));
        }
        if (!repository.compareAndSetStatus(intentId, expected, next, reason, Instant.now())) {
            TxIntentEntity current = repository.findIntent(intentId);
            String actual = current == null ? "missing" : current.getStatus();
            throw new InvalidTransitionException(String.format("intent %d: expected %s but was %s", intentId, expected, actual));
        }
        log.info("intent transition id={} {} -> {}{}", intentId, expected, next, reason == null ? "" : " reason=" + reason);
        if (next.isTerminal()) {
            metrics.terminal(next.name());
        }
    }

    /**
     * 从当前状态迁到 FAILED；已是终态时不做任何修改并返回 false。
     */
    public boolean markFailed(long intentId, String reason) {
        for (int i = 0; i < MAX_CAS_ATTEMPTS; i++) {
            IntentStatus current = statusOf(require(intentId));
            if (current.isTerminal()) {
                log.info("intent already terminal, skip fail id={} status={} reason={}", intentId, current, reason);
                return false;
            }
            if (repository.compareAndSetStatus(intentId, current, IntentStatus.FAILED, reason, Instant.now())) {
                log.warn("intent failed id={} from={} reason={}", intentId, current, reason);
                metrics.terminal(IntentStatus.FAILED.name());
                return true;
            }
        }
        throw new InvalidTransitionException("intent " + intentId + " kept changing while marking FAILED");
    }

    /**
     * 广播结果未知（节点可能已收到交易）：Intent 保持 ALLOCATED、nonce 保留，只记下原因，
     * 由孤儿分配巡检按链上状态认领、重发或判定失败。
     *
     * @return false 表示 Intent 已不在 ALLOCATED
     */
    public boolean recordUnconfirmedBroadcast(long intentId, String reason) {
        boolean kept = repository.compareAndSetStatus(intentId, IntentStatus.ALLOCATED, IntentStatus.ALLOCATED, reason, Instant.now());
        if (kept) {
            log.warn("broadcast outcome unknown, nonce kept reserved id={} reason={}", intentId, reason);
        }
        return kept;
    }

    /**
     * 只有尚未分配 nonce 的 Intent 可以取消。
     */
    public void cancel(long intentId) {
        IntentStatus current = statusOf(require(intentId));
        if (current != IntentStatus.CREATED) {
            throw new InvalidTransitionException(String.format("intent %d cannot be cancelled in %s", intentId, current));
        }
        transition(intentId, IntentStatus.CREATED, IntentStatus.FAILED, "cancelled by caller");
    }

    public Long nextNonce(long chainId, String address) {
        return repository.findNextNonce(chainId, address);
    }

    /**
     * 写入分配记录并推进 nonce 游标。必须在签名地址锁内调用。
     *
     * @param previousNonce null 表示首次分配（CREATED -> ALLOCATED），否则为重新分配前的 nonce
     */
    @Transactional(isolation = Isolation.READ_COMMITTED)
    public void recordAllocation(TxIntentEntity intent, Long previousNonce, Allocation allocation) {
        Instant now = Instant.now();
        if (!repository.recordAllocation(intent.getId(), previousNonce, allocation, now)) {
            TxIntentEntity current = repository.findIntent(intent.getId());
            throw new InvalidTransitionException(String.format("intent %d allocation lost: status=%s nonce=%s",
                    intent.getId(), current == null ? "missing" : current.getStatus(),
                    current == null ? null : current.getAllocatedNonce()));
        }
        repository.advanceNonceCursor(intent.getChainId(), intent.getSigningAddress(), allocation.getNonce() + 1, now);
        if (previousNonce == null) {
            log.info("intent transition id={} CREATED -> ALLOCATED nonce={}", intent.getId(), allocation.getNonce());
        }
    }

    /**
     * 放弃一次未广播成功的分配：仅当该 nonce 仍是游标头部时回退游标，避免留下 nonce 空洞。
     */
    public boolean releaseNonce(TxIntentEntity intent, long nonce) {
        boolean released = repository.rollbackNonceCursor(intent.getChainId(), intent.getSigningAddress(), nonce + 1, nonce, Instant.now());
        log.info("nonce release intentId={} address={} nonce={} released={}", intent.getId(), intent.getSigningAddress(), nonce, released);
        return released;
    }

    /**
     * 节点已接受交易后落库：ALLOCATED -> SENT 并写入 Send。同一 hash 重复调用时返回已有记录。
     */
    @Transactional(isolation = Isolation.READ_COMMITTED)
    public TxSendEntity recordSent(long intentId, TxSendEntity send) {
        TxSendEntity existing = repository.findSend(send.getTxHash());
        if (existing != null) {
            if (!existing.getIntentId().equals(intentId)) {
                throw new IllegalStateException("tx " + send.getTxHash() + " belongs to intent " + existing.getIntentId());
            }
            return existing;
        }
        transition(intentId, IntentStatus.ALLOCATED, IntentStatus.SENT, null);
        return repository.insertSend(send);
    }

    /**
     * 替换交易落库：认领 prior（replaced_by 仍为空才成功），写入 next，累加替换次数，Intent 保持 SENT。
     */
    @Transactional(isolation = Isolation.READ_COMMITTED)
    public TxSendEntity recordReplacement(long intentId, TxSendEntity prior, TxSendEntity next, Allocation allocation) {
        IntentStatus status = statusOf(require(intentId));
        if (!status.isInFlight()) {
            throw new InvalidTransitionException(String.format("intent %d: replacement requires SENT but was %s", intentId, status));
        }
        // 先认领旧交易，再插入新交易：(chain, address, nonce) 在未替换的 Send 中唯一
        if (!repository.claimReplacement(prior.getTxHash(), next.getTxHash())) {
            throw new InvalidTransitionException(String.format("intent %d: send %s was already replaced", intentId, prior.getTxHash()));
        }
        TxSendEntity stored = repository.insertSend(next);
        if (!repository.recordReplacement(intentId, allocation, Instant.now())) {
            TxIntentEntity current = repository.findIntent(intentId);
            throw new InvalidTransitionException(String.format("intent %d: replacement requires SENT but was %s",
                    intentId, current == null ? "missing" : current.getStatus()));
        }
        log.info("intent transition id={} SENT -> SENT replaced {} -> {}", intentId, prior.getTxHash(), next.getTxHash());
        return stored;
    }

    /**
     * prior 必须仍是该 Intent 最新且未被替换的 Send，否则替换它会与另一笔替换交易争抢同一个 nonce。
     */
    public TxSendEntity requireLiveSend(long intentId, TxSendEntity prior) {
        TxSendEntity latest = latestSend(intentId);
        if (latest == null || !latest.getTxHash().equals(prior.getTxHash()) || latest.getReplacedBy() != null) {
            throw new InvalidTransitionException(String.format("intent %d: send %s is no longer the live send (latest=%s)",
                    intentId, prior.getTxHash(), latest == null ? null : latest.getTxHash()));
        }
        return latest;
    }

    /**
     * 某笔交易上链：写 receipt，同 Intent 的其他 Send 都指向已上链的那笔，Intent 进入终态。
     *
     * @return Intent 最终状态
     */
    @Transactional(isolation = Isolation.READ_COMMITTED)
    public IntentStatus recordReceipt(long intentId, TxSendEntity mined, TxReceipt receipt) {
        TxReceiptEntity entity = new TxReceiptEntity();
        entity.setTxHash(mined.getTxHash());
        entity.setStatus(receipt.getStatus());
        entity.setBlockNumber(receipt.getBlockNumber());
        entity.setGasUsed(receipt.getGasUsed());
        entity.setEffectiveGasPrice(receipt.getEffectiveGasPrice());
        entity.setMinedAt(Instant.now());
        repository.insertReceipt(entity);

        for (TxSendEntity s : repository.listSends(intentId)) {
            if (!s.getTxHash().equals(mined.getTxHash()) && !mined.getTxHash().equals(s.getReplacedBy())) {
                repository.setReplacedBy(s.getTxHash(), mined.getTxHash());
            }
        }
        if (mined.getReplacedBy() != null) {
            repository.setReplacedBy(mined.getTxHash(), null);
        }

        IntentStatus current = statusOf(require(intentId));
        if (current.isTerminal()) {
            log.warn("receipt for terminal intent id={} status={} txHash={}", intentId, current, mined.getTxHash());
            return current;
        }
        IntentStatus terminal = receipt.isSuccess() ? IntentStatus.CONFIRMED : IntentStatus.FAILED;
        String reason = receipt.isSuccess() ? null : "transaction reverted in block " + receipt.getBlockNumber();
        transition(intentId, current, terminal, reason);
        return terminal;
    }

    public List<TxSendEntity> listSends(long intentId) {
        return repository.listSends(intentId);
    }

    /**
     * 最新一笔 Send；尚未广播时返回 null。
     */
    public TxSendEntity latestSend(long intentId) {
        List<TxSendEntity> sends = repository.listSends(intentId);
        return sends.isEmpty() ? null : sends.get(sends.size() - 1);
    }

    public List<TxSendEntity> listPendingSends(int limit) {
        return repository.listPendingSends(limit);
    }

    public List<TxIntentEntity> listStaleAllocated(Instant before, int limit) {
        return repository.listIntentsUpdatedBefore(IntentStatus.ALLOCATED, before, limit);
    }

    public IntentStatusView view(long intentId) {
        return view(require(intentId));
    }

    public IntentStatusView view(TxIntentEntity intent) {
        IntentStatusView v = new IntentStatusView();
        v.setId(intent.getId());
        v.setIntentKey(intent.getIntentKey());
        v.setStatus(statusOf(intent));
        v.setReason(intent.getLastError());
        v.setSigningAddress(intent.getSigningAddress());
        v.setNonce(intent.getAllocatedNonce());
        v.setReplacementCount(intent.getReplacementCount() == null ? 0 : intent.getReplacementCount());
        v.setCreatedAt(intent.getCreatedAt());
        v.setUpdatedAt(intent.getUpdatedAt());

        List<IntentStatusView.SendView> sends = new ArrayList<>();
        String mined = null;
        String live = null;
        for (TxSendEntity s : repository.listSends(intent.getId())) {
            IntentStatusView.SendView sv = new IntentStatusView.SendView();
            sv.setTxHash(s.getTxHash());
            sv.setNonce(s.getNonce());
            sv.setMaxFeePerGas(s.getMaxFeePerGas());
            sv.setMaxPriorityFeePerGas(s.getMaxPriorityFeePerGas());
            sv.setReplacedBy(s.getReplacedBy());
            sv.setSentAt(s.getSentAt());
            TxReceiptEntity r = repository.findReceipt(s.getTxHash());
            if (r != null) {
                sv.setReceiptStatus(r.getStatus());
                mined = s.getTxHash();
            }
            if (s.getReplacedBy() == null) {
                live = s.getTxHash();
            }
            sends.add(sv);
        }
        v.setSends(sends);
        v.setTxHash(mined != null ? mined : live);
        return v;
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("value is not serializable to json", e);
        }
    }
}
