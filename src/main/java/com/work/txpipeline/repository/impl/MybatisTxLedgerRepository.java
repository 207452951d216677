package com.work.txpipeline.repository.impl;

import com.work.txpipeline.core.exception.DuplicateIntentException;
import com.work.txpipeline.domain.Allocation;
import com.work.txpipeline.domain.IntentStatus;
import com.work.txpipeline.repository.TxLedgerRepository;
import com.work.txpipeline.repository.entity.TxIntentEntity;
import com.work.txpipeline.repository.entity.TxReceiptEntity;
import com.work.txpipeline.repository.entity.TxSendEntity;
import com.work.txpipeline.repository.mapper.AddressNonceCursorMapper;
import com.work.txpipeline.repository.mapper.TxIntentMapper;
import com.work.txpipeline.repository.mapper.TxReceiptMapper;
import com.work.txpipeline.repository.mapper.TxSendMapper;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

import static com.work.txpipeline.core.support.ValidationUtils.requireNonEmpty;
import static com.work.txpipeline.core.support.ValidationUtils.requireNonNull;

/**
 * 基于 PostgreSQL + MyBatis-Plus 的账本实现。
 *
 * 注意：本类不开启事务，事务边界由 IntentLedger 统一管理。
 */
@Repository
public class MybatisTxLedgerRepository implements TxLedgerRepository {

    private final TxIntentMapper intentMapper;
    private final TxSendMapper sendMapper;
    private final TxReceiptMapper receiptMapper;
    private final AddressNonceCursorMapper cursorMapper;

    public MybatisTxLedgerRepository(TxIntentMapper intentMapper,
                                     TxSendMapper sendMapper,
                                     TxReceiptMapper receiptMapper,
                                     AddressNonceCursorMapper cursorMapper) {
        this.intentMapper = intentMapper;
        this.sendMapper = sendMapper;
        this.receiptMapper = receiptMapper;
        this.cursorMapper = cursorMapper;
    }

    @Override
    public TxIntentEntity insertIntent(TxIntentEntity intent) {
        requireNonNull(intent, "intent");
        requireNonEmpty(intent.getIntentKey(), "intentKey");
        if (intentMapper.insertIfAbsent(intent) == 0) {
            throw new DuplicateIntentException(intent.getIntentKey());
        }
        intent.setReplacementCount(0);
        return intent;
    }

    @Override
    public TxIntentEntity findIntent(long intentId) {
        return intentMapper.selectIntent(intentId);
    }

    @Override
    public TxIntentEntity findIntentByKey(String intentKey) {
        return intentMapper.selectByIntentKey(intentKey);
    }

    @Override
    public List<TxIntentEntity> listIntentsUpdatedBefore(IntentStatus status, Instant before, int limit) {
        return intentMapper.listByStatusUpdatedBefore(status.name(), before, limit);
    }

    @Override
    public boolean compareAndSetStatus(long intentId, IntentStatus expected, IntentStatus next, String lastError, Instant now) {
        return intentMapper.casStatus(intentId, expected.name(), next.name(), lastError, now) == 1;
    }

    @Override
    public boolean recordAllocation(long intentId, Long previousNonce, Allocation a, Instant now) {
        if (previousNonce == null) {
            return intentMapper.recordFirstAllocation(intentId, a.getNonce(), a.getFees().getMaxFeePerGas(),
                    a.getFees().getMaxPriorityFeePerGas(), a.getGasLimit(), now) == 1;
        }
        return intentMapper.recordReallocation(intentId, previousNonce, a.getNonce(), a.getFees().getMaxFeePerGas(),
                a.getFees().getMaxPriorityFeePerGas(), a.getGasLimit(), now) == 1;
    }

    @Override
    public boolean recordReplacement(long intentId, Allocation a, Instant now) {
        return intentMapper.recordReplacement(intentId, a.getFees().getMaxFeePerGas(),
                a.getFees().getMaxPriorityFeePerGas(), now) == 1;
    }

    @Override
    public Long findNextNonce(long chainId, String address) {
        return cursorMapper.selectNextNonce(chainId, address);
    }

    @Override
    public void advanceNonceCursor(long chainId, String address, long nextNonce, Instant now) {
        cursorMapper.advance(chainId, address, nextNonce, now);
    }

    @Override
    public boolean rollbackNonceCursor(long chainId, String address, long expectedNext, long newNext, Instant now) {
        return cursorMapper.rollback(chainId, address, expectedNext, newNext, now) == 1;
    }

    @Override
    public TxSendEntity insertSend(TxSendEntity send) {
        requireNonNull(send, "send");
        if (sendMapper.insertIfAbsent(send) == 0) {
            return sendMapper.selectByTxHash(send.getTxHash());
        }
        return send;
    }

    @Override
    public TxSendEntity findSend(String txHash) {
        return sendMapper.selectByTxHash(txHash);
    }

    @Override
    public List<TxSendEntity> listSends(long intentId) {
        return sendMapper.listByIntentId(intentId);
    }

    @Override
    public List<TxSendEntity> listPendingSends(int limit) {
        return sendMapper.listPending(limit);
    }

    @Override
    public void setReplacedBy(String txHash, String replacedBy) {
        sendMapper.updateReplacedBy(txHash, replacedBy);
    }

    @Override
    public boolean claimReplacement(String txHash, String replacedBy) {
        return sendMapper.claimReplacedBy(txHash, replacedBy) == 1;
    }

    @Override
    public boolean insertReceipt(TxReceiptEntity receipt) {
        return receiptMapper.insertIfAbsent(receipt) == 1;
    }

    @Override
    public TxReceiptEntity findReceipt(String txHash) {
        return receiptMapper.selectByTxHash(txHash);
    }
}
