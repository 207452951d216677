package com.work.txpipeline.repository.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;

import java.time.Instant;

@TableName("tx_intents")
public class TxIntentEntity {

    @TableId(type = IdType.AUTO)
    private Long id;

    private String intentKey;

    /**
     * {@link com.work.txpipeline.domain.IntentStatus} 的名字。
     */
    private String status;

    private String signingAddress;

    private Long chainId;

    /**
     * BuiltCall 的 JSON。
     */
    private String builtCall;

    private String intentMetadata;

    /**
     * 分配记录：ALLOCATED 之后非空；替换交易时费用字段随之更新为最新一笔的费用。
     */
    private Long allocatedNonce;

    private Long maxFeePerGas;

    private Long maxPriorityFeePerGas;

    private Long gasLimit;

    private Integer replacementCount;

    // 可读的失败原因
    private String lastError;

    private Instant createdAt;

    private Instant updatedAt;

    public Long getId() {
        return id;
    }

    public void setId(Long id) {
        this.id = id;
    }

    public String getIntentKey() {
        return intentKey;
    }

    public void setIntentKey(String intentKey) {
        this.intentKey = intentKey;
    }

    public String getStatus() {
        return status;
    }

    public void setStatus(String status) {
        this.status = status;
    }

    public String getSigningAddress() {
        return signingAddress;
    }

    public void setSigningAddress(String signingAddress) {
        this.signingAddress = signingAddress;
    }

    public Long getChainId() {
        return chainId;
    }

    public void setChainId(Long chainId) {
        this.chainId = chainId;
    }

    public String getBuiltCall() {
        return builtCall;
    }

    public void setBuiltCall(String builtCall) {
        this.builtCall = builtCall;
    }

    public String getIntentMetadata() {
        return intentMetadata;
    }

    public void setIntentMetadata(String intentMetadata) {
        this.intentMetadata = intentMetadata;
    }

    public Long getAllocatedNonce() {
        return allocatedNonce;
    }

    public void setAllocatedNonce(Long allocatedNonce) {
        this.allocatedNonce = allocatedNonce;
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

    public Integer getReplacementCount() {
        return replacementCount;
    }

    public void setReplacementCount(Integer replacementCount) {
        this.replacementCount = replacementCount;
    }

    public String getLastError() {
        return lastError;
    }

    public void setLastError(String lastError) {
        this.lastError = lastError;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }
}
