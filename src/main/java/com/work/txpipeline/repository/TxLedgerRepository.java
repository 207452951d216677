package com.work.txpipeline.repository;

import com.work.txpipeline.domain.Allocation;
import com.work.txpipeline.domain.IntentStatus;
import com.work.txpipeline.repository.entity.TxIntentEntity;
import com.work.txpipeline.repository.entity.TxReceiptEntity;
import com.work.txpipeline.repository.entity.TxSendEntity;

import java.time.Instant;
import java.util.List;

/**
 * 账本持久化抽象：Intent、Send、Receipt 与 nonce 游标。
 *
 * <p>所有更新都是条件更新（compare-and-set），返回 false 表示条件不成立、未写入。
 * 多步写入的事务边界由 IntentLedger 负责。</p>
 */
public interface TxLedgerRepository {

    /**
     * 插入新 Intent 并回填 id。
     *
     * @throws com.work.txpipeline.core.exception.DuplicateIntentException intent_key 已存在
     */
    TxIntentEntity insertIntent(TxIntentEntity intent);

    TxIntentEntity findIntent(long intentId);

    TxIntentEntity findIntentByKey(String intentKey);

    List<TxIntentEntity> listIntentsUpdatedBefore(IntentStatus status, Instant before, int limit);

    /**
     * 状态 compare-and-set，lastError 原样覆盖，null 表示清空。
     */
    boolean compareAndSetStatus(long intentId, IntentStatus expected, IntentStatus next, String lastError, Instant now);

    /**
     * previousNonce 为 null：CREATED -> ALLOCATED；否则在 ALLOCATED 且 allocated_nonce = previousNonce 时改写分配记录。
     */
    boolean recordAllocation(long intentId, Long previousNonce, Allocation allocation, Instant now);

    /**
     * Intent 处于在途状态时记录替换交易的费用并累加替换次数。
     */
    boolean recordReplacement(long intentId, Allocation allocation, Instant now);

    /**
     * @return 下一个可分配的 nonce；从未分配过时返回 null
     */
    Long findNextNonce(long chainId, String address);

    /**
     * 游标只前进：next = max(next, nextNonce)。
     */
    void advanceNonceCursor(long chainId, String address, long nextNonce, Instant now);

    boolean rollbackNonceCursor(long chainId, String address, long expectedNext, long newNext, Instant now);

    /**
     * tx_hash 已存在时不插入，返回已有记录。
     */
    TxSendEntity insertSend(TxSendEntity send);

    TxSendEntity findSend(String txHash);

    /**
     * 按发送顺序。
     */
    List<TxSendEntity> listSends(long intentId);

    List<TxSendEntity> listPendingSends(int limit);

    void setReplacedBy(String txHash, String replacedBy);

    /**
     * 仅当 txHash 尚未被替换时写入 replaced_by。
     *
     * @return false 表示该 Send 不存在或已被另一笔替换
     */
    boolean claimReplacement(String txHash, String replacedBy);

    /**
     * @return false 表示该 hash 的 receipt 已存在
     */
    boolean insertReceipt(TxReceiptEntity receipt);

    TxReceiptEntity findReceipt(String txHash);
}
