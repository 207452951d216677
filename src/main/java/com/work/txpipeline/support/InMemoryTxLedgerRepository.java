package com.work.txpipeline.support;

import com.work.txpipeline.core.exception.DuplicateIntentException;
import com.work.txpipeline.domain.Allocation;
import com.work.txpipeline.domain.IntentStatus;
import com.work.txpipeline.repository.TxLedgerRepository;
import com.work.txpipeline.repository.entity.TxIntentEntity;
import com.work.txpipeline.repository.entity.TxReceiptEntity;
import com.work.txpipeline.repository.entity.TxSendEntity;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * 内存版账本，语义与 PostgreSQL 实现一致（唯一约束、条件更新、游标只前进）。
 * 用于单元测试与无数据库的本地运行；所有方法串行执行。
 */
public class InMemoryTxLedgerRepository implements TxLedgerRepository {

    private final AtomicLong intentIds = new AtomicLong();
    private final AtomicLong sendIds = new AtomicLong();
    private final AtomicLong receiptIds = new AtomicLong();

    private final Map<Long, TxIntentEntity> intents = new HashMap<>();
    private final Map<String, Long> intentKeys = new HashMap<>();
    private final Map<String, TxSendEntity> sends = new LinkedHashMap<>();
    private final Map<String, TxReceiptEntity> receipts = new HashMap<>();
    private final Map<String, Long> cursors = new HashMap<>();

    @Override
    public synchronized TxIntentEntity insertIntent(TxIntentEntity intent) {
        if (intentKeys.containsKey(intent.getIntentKey())) {
            throw new DuplicateIntentException(intent.getIntentKey());
        }
        TxIntentEntity stored = copy(intent);
        stored.setId(intentIds.incrementAndGet());
        stored.setReplacementCount(0);
        intents.put(stored.getId(), stored);
        intentKeys.put(stored.getIntentKey(), stored.getId());
        intent.setId(stored.getId());
        intent.setReplacementCount(0);
        return copy(stored);
    }

    @Override
    public synchronized TxIntentEntity findIntent(long intentId) {
        TxIntentEntity e = intents.get(intentId);
        return e == null ? null : copy(e);
    }

    @Override
    public synchronized TxIntentEntity findIntentByKey(String intentKey) {
        Long id = intentKeys.get(intentKey);
        return id == null ? null : copy(intents.get(id));
    }

    @Override
    public synchronized List<TxIntentEntity> listIntentsUpdatedBefore(IntentStatus status, Instant before, int limit) {
        return intents.values().stream()
                .filter(e -> status.name().equals(e.getStatus()) && e.getUpdatedAt().isBefore(before))
                .sorted(Comparator.comparing(TxIntentEntity::getCreatedAt))
                .limit(limit)
                .map(InMemoryTxLedgerRepository::copy)
                .collect(Collectors.toList());
    }

    @Override
    public synchronized boolean compareAndSetStatus(long intentId, IntentStatus expected, IntentStatus next, String lastError, Instant now) {
        TxIntentEntity e = intents.get(intentId);
        if (e == null || !expected.name().equals(e.getStatus())) {
            return false;
        }
        e.setStatus(next.name());
        e.setLastError(lastError);
        e.setUpdatedAt(now);
        return true;
    }

    @Override
    public synchronized boolean recordAllocation(long intentId, Long previousNonce, Allocation a, Instant now) {
        TxIntentEntity e = intents.get(intentId);
        if (e == null) {
            return false;
        }
        if (previousNonce == null) {
            if (!IntentStatus.CREATED.name().equals(e.getStatus())) {
                return false;
            }
            e.setStatus(IntentStatus.ALLOCATED.name());
        } else if (!IntentStatus.ALLOCATED.name().equals(e.getStatus()) || !previousNonce.equals(e.getAllocatedNonce())) {
            return false;
        }
        e.setAllocatedNonce(a.getNonce());
        e.setMaxFeePerGas(a.getFees().getMaxFeePerGas());
        e.setMaxPriorityFeePerGas(a.getFees().getMaxPriorityFeePerGas());
        e.setGasLimit(a.getGasLimit());
        e.setUpdatedAt(now);
        return true;
    }

    @Override
    public synchronized boolean recordReplacement(long intentId, Allocation a, Instant now) {
        TxIntentEntity e = intents.get(intentId);
        if (e == null || !IntentStatus.valueOf(e.getStatus()).isInFlight()) {
            return false;
        }
        e.setStatus(IntentStatus.SENT.name());
        e.setMaxFeePerGas(a.getFees().getMaxFeePerGas());
        e.setMaxPriorityFeePerGas(a.getFees().getMaxPriorityFeePerGas());
        e.setReplacementCount(e.getReplacementCount() + 1);
        e.setUpdatedAt(now);
        return true;
    }

    @Override
    public synchronized Long findNextNonce(long chainId, String address) {
        return cursors.get(chainId + ":" + address);
    }

    @Override
    public synchronized void advanceNonceCursor(long chainId, String address, long nextNonce, Instant now) {
        cursors.merge(chainId + ":" + address, nextNonce, Math::max);
    }

    @Override
    public synchronized boolean rollbackNonceCursor(long chainId, String address, long expectedNext, long newNext, Instant now) {
        String key = chainId + ":" + address;
        Long current = cursors.get(key);
        if (current == null || current != expectedNext) {
            return false;
        }
        cursors.put(key, newNext);
        return true;
    }

    @Override
    public synchronized TxSendEntity insertSend(TxSendEntity send) {
        TxSendEntity existing = sends.get(send.getTxHash());
        if (existing != null) {
            return copy(existing);
        }
        for (TxSendEntity s : sends.values()) {
            if (s.getReplacedBy() == null && send.getReplacedBy() == null
                    && s.getChainId().equals(send.getChainId())
                    && s.getSigningAddress().equals(send.getSigningAddress())
                    && s.getNonce().equals(send.getNonce())) {
                throw new IllegalStateException("live send already exists for nonce " + send.getNonce());
            }
        }
        TxSendEntity stored = copy(send);
        stored.setId(sendIds.incrementAndGet());
        sends.put(stored.getTxHash(), stored);
        send.setId(stored.getId());
        return copy(stored);
    }

    @Override
    public synchronized TxSendEntity findSend(String txHash) {
        TxSendEntity s = sends.get(txHash);
        return s == null ? null : copy(s);
    }

    @Override
    public synchronized List<TxSendEntity> listSends(long intentId) {
        List<TxSendEntity> out = new ArrayList<>();
        for (TxSendEntity s : sends.values()) {
            if (s.getIntentId() == intentId) {
                out.add(copy(s));
            }
        }
        out.sort(Comparator.comparing(TxSendEntity::getId));
        return out;
    }

    @Override
    public synchronized List<TxSendEntity> listPendingSends(int limit) {
        return sends.values().stream()
                .filter(s -> !receipts.containsKey(s.getTxHash()))
                .filter(s -> IntentStatus.valueOf(intents.get(s.getIntentId()).getStatus()).isInFlight())
                .sorted(Comparator.comparing(TxSendEntity::getSentAt))
                .limit(limit)
                .map(InMemoryTxLedgerRepository::copy)
                .collect(Collectors.toList());
    }

    @Override
    public synchronized void setReplacedBy(String txHash, String replacedBy) {
        TxSendEntity s = sends.get(txHash);
        if (s != null) {
            s.setReplacedBy(replacedBy);
        }
    }

    @Override
    public synchronized boolean claimReplacement(String txHash, String replacedBy) {
        TxSendEntity s = sends.get(txHash);
        if (s == null || s.getReplacedBy() != null) {
            return false;
        }
        s.setReplacedBy(replacedBy);
        return true;
    }

    @Override
    public synchronized boolean insertReceipt(TxReceiptEntity receipt) {
        if (receipts.containsKey(receipt.getTxHash())) {
            return false;
        }
        receipt.setId(receiptIds.incrementAndGet());
        receipts.put(receipt.getTxHash(), receipt);
        return true;
    }

    @Override
    public synchronized TxReceiptEntity findReceipt(String txHash) {
        return receipts.get(txHash);
    }

    private static TxIntentEntity copy(TxIntentEntity s) {
        TxIntentEntity e = new TxIntentEntity();
        e.setId(s.getId());
        e.setIntentKey(s.getIntentKey());
        e.setStatus(s.getStatus());
        e.setSigningAddress(s.getSigningAddress());
        e.setChainId(s.getChainId());
        e.setBuiltCall(s.getBuiltCall());
        e.setIntentMetadata(s.getIntentMetadata());
        e.setAllocatedNonce(s.getAllocatedNonce());
        e.setMaxFeePerGas(s.getMaxFeePerGas());
        e.setMaxPriorityFeePerGas(s.getMaxPriorityFeePerGas());
        e.setGasLimit(s.getGasLimit());
        e.setReplacementCount(s.getReplacementCount());
        e.setLastError(s.getLastError());
        e.setCreatedAt(s.getCreatedAt());
        e.setUpdatedAt(s.getUpdatedAt());
        return e;
    }

    private static TxSendEntity copy(TxSendEntity s) {
        TxSendEntity e = new TxSendEntity();
        e.setId(s.getId());
        e.setIntentId(s.getIntentId());
        e.setChainId(s.getChainId());
        e.setSigningAddress(s.getSigningAddress());
        e.setNonce(s.getNonce());
        e.setMaxFeePerGas(s.getMaxFeePerGas());
        e.setMaxPriorityFeePerGas(s.getMaxPriorityFeePerGas());
        e.setGasLimit(s.getGasLimit());
        e.setRawTx(s.getRawTx());
        e.setTxHash(s.getTxHash());
        e.setSentAt(s.getSentAt());
        e.setSentBlock(s.getSentBlock());
        e.setReplacedBy(s.getReplacedBy());
        return e;
    }
}
