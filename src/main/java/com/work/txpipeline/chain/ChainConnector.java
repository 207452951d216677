package com.work.txpipeline.chain;

import com.work.txpipeline.domain.BuiltCall;

/**
 * 链交互端口。
 *
 * <p>实现方约定：节点返回的 JSON-RPC error 以 {@code ChainRpcException(message, transport=false)} 抛出，
 * message 保留节点原文以便分类；IO/超时以 {@code transport=true} 抛出。</p>
 */
public interface ChainConnector {

    /**
     * eth_getTransactionCount(pending)。
     */
    long getPendingNonce(String address);

    /**
     * eth_getTransactionCount(latest)：已上链的下一个 nonce。
     */
    long getLatestNonce(String address);

    FeeSuggestion suggestFees();

    long estimateGas(String from, BuiltCall call);

    /**
     * eth_sendRawTransaction，返回节点确认的 tx hash。
     */
    String sendRawTransaction(String signedTxHex);

    /**
     * 返回 null 表示 NotFound（尚未上链）。
     */
    TxReceipt getTransactionReceipt(String txHash);

    long getLatestBlockNumber();
}
