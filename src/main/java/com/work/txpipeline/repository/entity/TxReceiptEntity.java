package com.work.txpipeline.repository.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;

import java.time.Instant;

@TableName("tx_receipts")
public class TxReceiptEntity {

    @TableId(type = IdType.AUTO)
    private Long id;

    private String txHash;

    private Integer status;

    private Long blockNumber;

    private Long gasUsed;

    private Long effectiveGasPrice;

    private Instant minedAt;

    public Long getId() {
        return id;
    }

    public void setId(Long id) {
        this.id = id;
    }

    public String getTxHash() {
        return txHash;
    }

    public void setTxHash(String txHash) {
        this.txHash = txHash;
    }

    public Integer getStatus() {
        return status;
    }

    public void setStatus(Integer status) {
        this.status = status;
    }

    public Long getBlockNumber() {
        return blockNumber;
    }

    public void setBlockNumber(Long blockNumber) {
        this.blockNumber = blockNumber;
    }

    public Long getGasUsed() {
        return gasUsed;
    }

    public void setGasUsed(Long gasUsed) {
        this.gasUsed = gasUsed;
    }

    public Long getEffectiveGasPrice() {
        return effectiveGasPrice;
    }

    public void setEffectiveGasPrice(Long effectiveGasPrice) {
        this.effectiveGasPrice = effectiveGasPrice;
    }

    public Instant getMinedAt() {
        return minedAt;
    }

    public void setMinedAt(Instant minedAt) {
        this.minedAt = minedAt;
    }
}
