package com.work.txpipeline.repository.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;

import java.time.Instant;

@TableName("tx_sends")
public class TxSendEntity {

    @TableId(type = IdType.AUTO)
    private Long id;

    private Long intentId;

    private Long chainId;

    private String signingAddress;

    private Long nonce;

    private Long maxFeePerGas;

    private Long maxPriorityFeePerGas;

    private Long gasLimit;

    private byte[] rawTx;

    private String txHash;

    private Instant sentAt;

    /**
     * 广播时的链高度；取不到时为 null，只按时间判断是否卡住。
     */
    private Long sentBlock;

    /**
     * 非空表示该笔已被另一笔同 nonce 的交易取代（替换交易，或同 Intent 中已上链的另一笔）。
     */
    private String replacedBy;

    public Long getId() {
        return id;
    }

    public void setId(Long id) {
        this.id = id;
    }

    public Long getIntentId() {
        return intentId;
    }

    public void setIntentId(Long intentId) {
        this.intentId = intentId;
    }

    public Long getChainId() {
        return chainId;
    }

    public void setChainId(Long chainId) {
        this.chainId = chainId;
    }

    public String getSigningAddress() {
        return signingAddress;
    }

    public void setSigningAddress(String signingAddress) {
        this.signingAddress = signingAddress;
    }

    public Long getNonce() {
        return nonce;
    }

    public void setNonce(Long nonce) {
        this.nonce = nonce;
    }

    public Long getMaxFeePerGas() {
        return maxFeePerGas;
    }

    public void setMaxFeePerGas(Long maxFeePerGas) {
        this.maxFeePerGas = maxFeePerGas;
    }

    public Long getMaxPriorityFeePerGas() {
        return maxPriorityFeePerGas;
    }

    public void setMaxPriorityFeePerGas(Long maxPriorityFeePerGas) {
        this.maxPriorityFeePerGas = maxPriorityFeePerGas;
    }

    public Long getGasLimit() {
        return gasLimit;
    }

    public void setGasLimit(Long gasLimit) {
        this.gasLimit = gasLimit;
    }

    public byte[] getRawTx() {
        return rawTx;
    }

    public void setRawTx(byte[] rawTx) {
        this.rawTx = rawTx;
    }

    public String getTxHash() {
        return txHash;
    }

    public void setTxHash(String txHash) {
        this.txHash = txHash;
    }

    public Instant getSentAt() {
        return sentAt;
    }

    public void setSentAt(Instant sentAt) {
        this.sentAt = sentAt;
    }

    public Long getSentBlock() {
        return sentBlock;
    }

    public void setSentBlock(Long sentBlock) {
        this.sentBlock = sentBlock;
    }

    public String getReplacedBy() {
        return replacedBy;
    }

    public void setReplacedBy(String replacedBy) {
        this.replacedBy = replacedBy;
    }
}
