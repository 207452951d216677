package com.work.txpipeline.chain.web3j;

import com.work.txpipeline.chain.ChainConnector;
import com.work.txpipeline.chain.FeeSuggestion;
import com.work.txpipeline.chain.TxReceipt;
import com.work.txpipeline.core.exception.ChainRpcException;
import com.work.txpipeline.domain.BuiltCall;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.core.DefaultBlockParameterName;
import org.web3j.protocol.core.Request;
import org.web3j.protocol.core.Response;
import org.web3j.protocol.core.methods.request.Transaction;
import org.web3j.protocol.core.methods.response.EthBlock;
import org.web3j.protocol.core.methods.response.EthEstimateGas;
import org.web3j.protocol.core.methods.response.EthGasPrice;
import org.web3j.protocol.core.methods.response.EthGetTransactionCount;
import org.web3j.protocol.core.methods.response.EthGetTransactionReceipt;
import org.web3j.protocol.core.methods.response.EthSendTransaction;
import org.web3j.protocol.core.methods.response.TransactionReceipt;
import org.web3j.utils.Numeric;

import java.io.IOException;
import java.math.BigInteger;
import java.util.Optional;

/**
 * 基于 Web3j 的链实现（chain.mode=web3j）。
 */
public class Web3jChainConnector implements ChainConnector {

    private final Web3j web3j;

    public Web3jChainConnector(Web3j web3j) {
        this.web3j = web3j;
    }

    @Override
    public long getPendingNonce(String address) {
        EthGetTransactionCount resp = call("eth_getTransactionCount",
                web3j.ethGetTransactionCount(address, DefaultBlockParameterName.PENDING));
        return resp.getTransactionCount().longValue();
    }

    @Override
    public long getLatestNonce(String address) {
        EthGetTransactionCount resp = call("eth_getTransactionCount",
                web3j.ethGetTransactionCount(address, DefaultBlockParameterName.LATEST));
        return resp.getTransactionCount().longValue();
    }

    /**
     * base fee 取最新区块；priority = eth_gasPrice - baseFee（不低于 0）。
     * 没有 base fee 的旧链按 legacy gasPrice 处理。
     */
    @Override
    public FeeSuggestion suggestFees() {
        EthBlock block = call("eth_getBlockByNumber", web3j.ethGetBlockByNumber(DefaultBlockParameterName.LATEST, false));
        EthGasPrice gasPrice = call("eth_gasPrice", web3j.ethGasPrice());
        long price = gasPrice.getGasPrice().longValue();
        EthBlock.Block b = block.getBlock();
        BigInteger baseFee = b == null ? null : b.getBaseFeePerGas();
        if (baseFee == null) {
            return new FeeSuggestion(price, 0L);
        }
        long base = baseFee.longValue();
        return new FeeSuggestion(base, Math.max(0L, price - base));
    }

    @Override
    public long estimateGas(String from, BuiltCall builtCall) {
        Transaction tx = Transaction.createFunctionCallTransaction(from, null, null, null,
                builtCall.getTo(), builtCall.valueWei(), builtCall.getData());
        EthEstimateGas resp = call("eth_estimateGas", web3j.ethEstimateGas(tx));
        return resp.getAmountUsed().longValue();
    }

    @Override
    public String sendRawTransaction(String signedTxHex) {
        EthSendTransaction resp = call("eth_sendRawTransaction", web3j.ethSendRawTransaction(signedTxHex));
        return resp.getTransactionHash();
    }

    @Override
    public TxReceipt getTransactionReceipt(String txHash) {
        EthGetTransactionReceipt resp = call("eth_getTransactionReceipt", web3j.ethGetTransactionReceipt(txHash));
        Optional<TransactionReceipt> receiptOpt = resp.getTransactionReceipt();
        if (!receiptOpt.isPresent()) {
            return null;
        }
        TransactionReceipt r = receiptOpt.get();
        long effectiveGasPrice = r.getEffectiveGasPrice() == null ? 0L : Numeric.decodeQuantity(r.getEffectiveGasPrice()).longValue();
        return new TxReceipt(txHash, isReceiptSuccess(r) ? 1 : 0, r.getBlockNumber().longValue(),
                r.getGasUsed().longValue(), effectiveGasPrice);
    }

    @Override
    public long getLatestBlockNumber() {
        return call("eth_blockNumber", web3j.ethBlockNumber()).getBlockNumber().longValue();
    }

    private static <T extends Response<?>> T call(String method, Request<?, T> request) {
        T resp;
        try {
            resp = request.send();
        } catch (IOException e) {
            throw new ChainRpcException("rpc transport failure: " + method, e);
        }
        if (resp.hasError()) {
            throw new ChainRpcException(resp.getError().getMessage(), false);
        }
        return resp;
    }

    private static boolean isReceiptSuccess(TransactionReceipt receipt) {
        // 0x1 成功，0x0 失败；拜占庭前的链没有 status 字段
        String status = receipt.getStatus();
        return status == null || !"0x0".equalsIgnoreCase(status);
    }
}
