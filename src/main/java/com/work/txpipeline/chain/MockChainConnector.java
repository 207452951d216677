package com.work.txpipeline.chain;

import com.work.txpipeline.core.exception.ChainRpcException;
import com.work.txpipeline.domain.BuiltCall;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.web3j.crypto.Hash;
import org.web3j.crypto.RawTransaction;
import org.web3j.crypto.SignedRawTransaction;
import org.web3j.crypto.TransactionDecoder;
import org.web3j.crypto.transaction.type.ITransaction;
import org.web3j.crypto.transaction.type.Transaction1559;
import org.web3j.utils.Numeric;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.security.SignatureException;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * 内存版链：解码签名交易，按 EVM 节点的规则返回 already known / nonce too low /
 * replacement transaction underpriced，并支持手动或自动出块。
 *
 * chain.mode=mock 时作为默认实现，便于本地联调。
 */
public class MockChainConnector implements ChainConnector {

    private static final Logger log = LoggerFactory.getLogger(MockChainConnector.class);

    private static final BigDecimal REPLACEMENT_MIN_BUMP = new BigDecimal("1.10");

    private static final class PendingTx {
        final String hash;
        final String from;
        final long nonce;
        final long maxFee;
        final long priorityFee;

        PendingTx(String hash, String from, long nonce, long maxFee, long priorityFee) {
            this.hash = hash;
            this.from = from;
            this.nonce = nonce;
            this.maxFee = maxFee;
            this.priorityFee = priorityFee;
        }
    }

    private final Map<String, Long> minedNonce = new HashMap<>();
    private final Map<String, TreeMap<Long, PendingTx>> pool = new HashMap<>();
    private final Map<String, PendingTx> byHash = new HashMap<>();
    private final Set<String> knownHashes = new HashSet<>();
    private final Map<String, TxReceipt> receipts = new HashMap<>();
    private final Set<String> reverting = new HashSet<>();
    private final Deque<ChainRpcException> scriptedSendErrors = new ArrayDeque<>();

    private long blockNumber = 1L;
    private long baseFeePerGas = 10_000_000_000L;
    private long priorityFeePerGas = 1_500_000_000L;
    private boolean autoMine;
    private boolean failGasEstimation;

    @Override
    public synchronized long getPendingNonce(String address) {
        String key = address.toLowerCase();
        long next = getLatestNonce(key);
        TreeMap<Long, PendingTx> txs = pool.get(key);
        while (txs != null && txs.containsKey(next)) {
            next++;
        }
        return next;
    }

    @Override
    public synchronized long getLatestNonce(String address) {
        Long n = minedNonce.get(address.toLowerCase());
        return n == null ? 0L : n;
    }

    @Override
    public synchronized FeeSuggestion suggestFees() {
        return new FeeSuggestion(baseFeePerGas, priorityFeePerGas);
    }

    @Override
    public synchronized long estimateGas(String from, BuiltCall call) {
        if (failGasEstimation) {
            throw new ChainRpcException("execution reverted", false);
        }
        return call.getData() == null || "0x".equals(call.getData()) ? 21_000L : 100_000L;
    }

    @Override
    public synchronized String sendRawTransaction(String signedTxHex) {
        String hash = Numeric.toHexString(Hash.sha3(Numeric.hexStringToByteArray(signedTxHex)));
        if (knownHashes.contains(hash)) {
            throw new ChainRpcException("already known", false);
        }
        if (!scriptedSendErrors.isEmpty()) {
            throw scriptedSendErrors.poll();
        }
        PendingTx tx = decode(hash, signedTxHex);
        if (tx.nonce < getLatestNonce(tx.from)) {
            throw new ChainRpcException("nonce too low", false);
        }
        TreeMap<Long, PendingTx> txs = pool.computeIfAbsent(tx.from, k -> new TreeMap<>());
        PendingTx existing = txs.get(tx.nonce);
        if (existing != null) {
            if (!atLeastBumped(tx.maxFee, existing.maxFee) || !atLeastBumped(tx.priorityFee, existing.priorityFee)) {
                throw new ChainRpcException("replacement transaction underpriced", false);
            }
            byHash.remove(existing.hash);
            log.info("mock chain replaced {} with {} nonce={}", existing.hash, hash, tx.nonce);
        }
        txs.put(tx.nonce, tx);
        byHash.put(hash, tx);
        knownHashes.add(hash);
        if (autoMine) {
            mine(hash);
        }
        return hash;
    }

    @Override
    public synchronized TxReceipt getTransactionReceipt(String txHash) {
        return receipts.get(txHash);
    }

    @Override
    public synchronized long getLatestBlockNumber() {
        return blockNumber;
    }

    /**
     * 把 mempool 中的某笔交易打包进新区块。
     */
    public synchronized TxReceipt mine(String txHash) {
        PendingTx tx = byHash.remove(txHash);
        if (tx == null) {
            throw new IllegalStateException("not in mempool: " + txHash);
        }
        pool.get(tx.from).remove(tx.nonce);
        minedNonce.merge(tx.from, tx.nonce + 1, Math::max);
        blockNumber++;
        TxReceipt receipt = new TxReceipt(txHash, reverting.contains(txHash) ? 0 : 1, blockNumber, 21_000L,
                baseFeePerGas + Math.max(0L, Math.min(tx.priorityFee, tx.maxFee - baseFeePerGas)));
        receipts.put(txHash, receipt);
        return receipt;
    }

    /**
     * 出一个不含本地址交易的块，用于模拟链在前进而交易迟迟未被打包。
     */
    public synchronized long mineEmptyBlock() {
        return ++blockNumber;
    }

    public synchronized boolean isPending(String txHash) {
        return byHash.containsKey(txHash);
    }

    public synchronized void setAutoMine(boolean autoMine) {
        this.autoMine = autoMine;
    }

    public synchronized void markReverting(String txHash) {
        reverting.add(txHash);
    }

    public synchronized void setChainNonce(String address, long nonce) {
        minedNonce.put(address.toLowerCase(), nonce);
    }

    public synchronized void setFees(long baseFeePerGas, long priorityFeePerGas) {
        this.baseFeePerGas = baseFeePerGas;
        this.priorityFeePerGas = priorityFeePerGas;
    }

    public synchronized void setFailGasEstimation(boolean failGasEstimation) {
        this.failGasEstimation = failGasEstimation;
    }

    /**
     * 下一次 sendRawTransaction 直接抛出该错误。
     */
    public synchronized void failNextSend(ChainRpcException error) {
        scriptedSendErrors.add(error);
    }

    private static boolean atLeastBumped(long next, long prior) {
        return BigDecimal.valueOf(next).compareTo(BigDecimal.valueOf(prior).multiply(REPLACEMENT_MIN_BUMP)) >= 0;
    }

    private static PendingTx decode(String hash, String signedTxHex) {
        RawTransaction raw = TransactionDecoder.decode(signedTxHex);
        if (!(raw instanceof SignedRawTransaction)) {
            throw new ChainRpcException("transaction is not signed", false);
        }
        String from;
        try {
            from = ((SignedRawTransaction) raw).getFrom().toLowerCase();
        } catch (SignatureException e) {
            throw new ChainRpcException("invalid sender", false);
        }
        long maxFee;
        long priorityFee;
        ITransaction tx = raw.getTransaction();
        if (tx instanceof Transaction1559) {
            maxFee = ((Transaction1559) tx).getMaxFeePerGas().longValue();
            priorityFee = ((Transaction1559) tx).getMaxPriorityFeePerGas().longValue();
        } else {
            BigInteger gasPrice = raw.getGasPrice();
            maxFee = gasPrice == null ? 0L : gasPrice.longValue();
            priorityFee = maxFee;
        }
        return new PendingTx(hash, from, raw.getNonce().longValue(), maxFee, priorityFee);
    }
}
