package com.work.txpipeline.service.broadcast;

import com.work.txpipeline.chain.ChainConnector;
import com.work.txpipeline.core.exception.BroadcastRejectedException;
import com.work.txpipeline.core.exception.BroadcastRejectedException.Kind;
import com.work.txpipeline.core.exception.ChainRpcException;
import com.work.txpipeline.core.exception.InvalidTransitionException;
import com.work.txpipeline.core.exception.NonceConflictException;
import com.work.txpipeline.core.exception.UnderpricedReplacementException;
import com.work.txpipeline.core.support.RetryPolicy;
import com.work.txpipeline.domain.Allocation;
import com.work.txpipeline.domain.BuiltCall;
import com.work.txpipeline.domain.IntentStatus;
import com.work.txpipeline.repository.entity.TxIntentEntity;
import com.work.txpipeline.repository.entity.TxSendEntity;
import com.work.txpipeline.service.ledger.IntentLedger;
import com.work.txpipeline.support.metrics.PipelineMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.web3j.crypto.Hash;
import org.web3j.crypto.RawTransaction;
import org.web3j.utils.Numeric;

import java.math.BigInteger;
import java.time.Instant;

import static com.work.txpipeline.core.support.ValidationUtils.requireHexData;
import static com.work.txpipeline.core.support.ValidationUtils.requireNonNull;
import static com.work.txpipeline.core.support.ValidationUtils.requireWeiValue;

/**
 * 构建、签名并广播 EIP-1559 交易；节点确认后才写 Send 并推进 Intent。
 *
 * <ul>
 *   <li>already known：视为成功，hash 即签名交易的确定性 hash</li>
 *   <li>nonce too low：{@link NonceConflictException}，由调用方重新分配</li>
 *   <li>underpriced：{@link UnderpricedReplacementException}，由调用方加价</li>
 *   <li>其他：有界重试后抛 {@link BroadcastRejectedException}</li>
 * </ul>
 */
@Service
public class Broadcaster {

    private static final Logger log = LoggerFactory.getLogger(Broadcaster.class);

    private final IntentLedger ledger;
    private final ChainConnector chain;
    private final TransactionSigner signer;
    private final BroadcastErrorClassifier classifier;
    private final RetryPolicy retryPolicy;
    private final PipelineMetrics metrics;

    public Broadcaster(IntentLedger ledger,
                       ChainConnector chain,
                       TransactionSigner signer,
                       BroadcastErrorClassifier classifier,
                       RetryPolicy rpcRetryPolicy,
                       PipelineMetrics metrics) {
        this.ledger = requireNonNull(ledger, "ledger");
        this.chain = requireNonNull(chain, "chain");
        this.signer = requireNonNull(signer, "signer");
        this.classifier = requireNonNull(classifier, "classifier");
        this.retryPolicy = requireNonNull(rpcRetryPolicy, "rpcRetryPolicy")
                .withRetryable(e -> e instanceof BroadcastRejectedException && ((BroadcastRejectedException) e).isRetryable());
        this.metrics = requireNonNull(metrics, "metrics");
    }

    /**
     * 首次广播：Intent 必须处于 ALLOCATED 且分配记录与 allocation 一致。
     */
    public TxSendEntity send(long intentId, Allocation allocation, BuiltCall call) {
        TxIntentEntity intent = ledger.require(intentId);
        IntentStatus status = IntentLedger.statusOf(intent);
        if (status != IntentStatus.ALLOCATED) {
            throw new InvalidTransitionException(String.format("intent %d cannot be sent in %s", intentId, status));
        }
        if (intent.getAllocatedNonce() == null || intent.getAllocatedNonce() != allocation.getNonce()) {
            throw new IllegalStateException("intent " + intentId + " is allocated nonce " + intent.getAllocatedNonce()
                    + ", not " + allocation.getNonce());
        }
        SignedTransaction signed = sign(intent, allocation, call);
        submit(intent, allocation, signed);
        TxSendEntity persisted = ledger.recordSent(intentId, toSend(intent, allocation, signed));
        log.info("broadcast intentId={} address={} nonce={} txHash={} fees={}",
                intentId, intent.getSigningAddress(), allocation.getNonce(), signed.getTxHash(), allocation.getFees());
        metrics.broadcast("sent");
        return persisted;
    }

    /**
     * fee-bump 替换：同 nonce、更高费用。成功后 prior.replaced_by 指向新交易，Intent 保持 SENT。
     */
    public TxSendEntity replace(long intentId, TxSendEntity prior, Allocation allocation, BuiltCall call) {
        TxIntentEntity intent = ledger.require(intentId);
        IntentStatus status = IntentLedger.statusOf(intent);
        if (!status.isInFlight()) {
            throw new InvalidTransitionException(String.format("intent %d cannot be replaced in %s", intentId, status));
        }
        if (prior.getNonce() != allocation.getNonce()) {
            throw new IllegalArgumentException("replacement must reuse nonce " + prior.getNonce());
        }
        // 广播前再确认一次：prior 已被取代时再发一笔只会留下账本外的同 nonce 交易
        ledger.requireLiveSend(intentId, prior);
        SignedTransaction signed = sign(intent, allocation, call);
        submit(intent, allocation, signed);
        TxSendEntity persisted = ledger.recordReplacement(intentId, prior, toSend(intent, allocation, signed), allocation);
        log.info("replacement broadcast intentId={} nonce={} {} -> {} fees={}",
                intentId, allocation.getNonce(), prior.getTxHash(), signed.getTxHash(), allocation.getFees());
        metrics.replacement("sent");
        return persisted;
    }

    /**
     * 登记一笔已在链上/mempool 中的交易（崩溃恢复），不再广播。
     */
    public TxSendEntity adopt(long intentId, Allocation allocation, SignedTransaction signed) {
        TxIntentEntity intent = ledger.require(intentId);
        TxSendEntity persisted = ledger.recordSent(intentId, toSend(intent, allocation, signed));
        log.info("adopted intentId={} nonce={} txHash={}", intentId, allocation.getNonce(), signed.getTxHash());
        metrics.broadcast("adopted");
        return persisted;
    }

    /**
     * 重建与当初完全相同的签名交易，用于按 hash 反查。
     *
     * @throws IllegalArgumentException value 或 data 无法编码进交易
     */
    public SignedTransaction sign(TxIntentEntity intent, Allocation allocation, BuiltCall call) {
        requireWeiValue(call.getValue(), "value");
        requireHexData(call.getData(), "data");
        RawTransaction raw = RawTransaction.createTransaction(
                intent.getChainId(),
                BigInteger.valueOf(allocation.getNonce()),
                BigInteger.valueOf(allocation.getGasLimit()),
                call.getTo(),
                call.valueWei(),
                call.getData(),
                BigInteger.valueOf(allocation.getFees().getMaxPriorityFeePerGas()),
                BigInteger.valueOf(allocation.getFees().getMaxFeePerGas()));
        byte[] signed = signer.sign(intent.getSigningAddress(), raw);
        return new SignedTransaction(signed, Numeric.toHexString(Hash.sha3(signed)));
    }

    public String expectedTxHash(TxIntentEntity intent, Allocation allocation, BuiltCall call) {
        return sign(intent, allocation, call).getTxHash();
    }

    private void submit(TxIntentEntity intent, Allocation allocation, SignedTransaction signed) {
        String hex = Numeric.toHexString(signed.getRaw());
        String ack = retryPolicy.execute("sendRawTransaction", () -> {
            try {
                return chain.sendRawTransaction(hex);
            } catch (ChainRpcException e) {
                return onRejected(intent, allocation, signed, e);
            }
        });
        if (ack != null && !ack.equalsIgnoreCase(signed.getTxHash())) {
            log.warn("node returned unexpected hash intentId={} expected={} actual={}", intent.getId(), signed.getTxHash(), ack);
        }
    }

    private String onRejected(TxIntentEntity intent, Allocation allocation, SignedTransaction signed, ChainRpcException e) {
        if (e.isTransport()) {
            metrics.broadcast("transport_error");
            throw new BroadcastRejectedException(Kind.OTHER, false, "broadcast transport failure", e);
        }
        Kind kind = classifier.classify(e.getMessage());
        log.info("broadcast rejected intentId={} nonce={} txHash={} kind={} err={}",
                intent.getId(), allocation.getNonce(), signed.getTxHash(), kind, e.getMessage());
        switch (kind) {
            case ALREADY_KNOWN:
                metrics.broadcast("already_known");
                return signed.getTxHash();
            case NONCE_TOO_LOW:
                metrics.broadcast("nonce_too_low");
                throw new NonceConflictException("nonce " + allocation.getNonce() + " already used by "
                        + intent.getSigningAddress(), allocation.getNonce());
            case UNDERPRICED:
                metrics.broadcast("underpriced");
                throw new UnderpricedReplacementException("node rejected fees " + allocation.getFees());
            default:
                metrics.broadcast("rejected");
                throw new BroadcastRejectedException(Kind.OTHER, true, "broadcast rejected by node", e);
        }
    }

    private TxSendEntity toSend(TxIntentEntity intent, Allocation allocation, SignedTransaction signed) {
        TxSendEntity send = new TxSendEntity();
        send.setIntentId(intent.getId());
        send.setChainId(intent.getChainId());
        send.setSigningAddress(intent.getSigningAddress());
        send.setNonce(allocation.getNonce());
        send.setMaxFeePerGas(allocation.getFees().getMaxFeePerGas());
        send.setMaxPriorityFeePerGas(allocation.getFees().getMaxPriorityFeePerGas());
        send.setGasLimit(allocation.getGasLimit());
        send.setRawTx(signed.getRaw());
        send.setTxHash(signed.getTxHash());
        send.setSentAt(Instant.now());
        send.setSentBlock(currentBlock());
        return send;
    }

    /**
     * 取不到链高度不影响落库，卡住判断退化为只看时间。
     */
    private Long currentBlock() {
        try {
            return chain.getLatestBlockNumber();
        } catch (ChainRpcException e) {
            log.warn("block number unavailable, send recorded without height err={}", e.getMessage());
            return null;
        }
    }
}
