package com.work.txpipeline.domain;

import java.time.Instant;
import java.util.List;

/**
 * 对外的 Intent 状态视图：只暴露状态与可读原因，不包含原始 RPC 错误。
 */
public class IntentStatusView {

    private Long id;
    private String intentKey;
    private IntentStatus status;
    private String reason;
    private String signingAddress;
    private Long nonce;
    /**
     * 当前有效的交易 hash：已上链的那笔，或尚未被替换的最新一笔。
     */
    private String txHash;
    private int replacementCount;
    private boolean duplicate;
    private Instant createdAt;
    private Instant updatedAt;
    private List<SendView> sends;

    public static class SendView {
        private String txHash;
        private long nonce;
        private long maxFeePerGas;
        private long maxPriorityFeePerGas;
        private String replacedBy;
        private Instant sentAt;
        /**
         * null 表示尚无 receipt；1 成功；0 回滚。
         */
        private Integer receiptStatus;

        public String getTxHash() {
            return txHash;
        }

        public void setTxHash(String txHash) {
            this.txHash = txHash;
        }

        public long getNonce() {
            return nonce;
        }

        public void setNonce(long nonce) {
            this.nonce = nonce;
        }

        public long getMaxFeePerGas() {
            return maxFeePerGas;
        }

        public void setMaxFeePerGas(long maxFeePerGas) {
            this.maxFeePerGas = maxFeePerGas;
        }

        public long getMaxPriorityFeePerGas() {
            return maxPriorityFeePerGas;
        }

        public void setMaxPriorityFeePerGas(long maxPriorityFeePerGas) {
            this.maxPriorityFeePerGas = maxPriorityFeePerGas;
        }

        public String getReplacedBy() {
            return replacedBy;
        }

        public void setReplacedBy(String replacedBy) {
            this.replacedBy = replacedBy;
        }

        public Instant getSentAt() {
            return sentAt;
        }

        public void setSentAt(Instant sentAt) {
            this.sentAt = sentAt;
        }

        public Integer getReceiptStatus() {
            return receiptStatus;
        }

        public void setReceiptStatus(Integer receiptStatus) {
            this.receiptStatus = receiptStatus;
        }
    }

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

    public IntentStatus getStatus() {
        return status;
    }

    public void setStatus(IntentStatus status) {
        this.status = status;
    }

    public String getReason() {
        return reason;
    }

    public void setReason(String reason) {
        this.reason = reason;
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

    public String getTxHash() {
        return txHash;
    }

    public void setTxHash(String txHash) {
        this.txHash = txHash;
    }

    public int getReplacementCount() {
        return replacementCount;
    }

    public void setReplacementCount(int replacementCount) {
        this.replacementCount = replacementCount;
    }

    public boolean isDuplicate() {
        return duplicate;
    }

    public void setDuplicate(boolean duplicate) {
        this.duplicate = duplicate;
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

    public List<SendView> getSends() {
        return sends;
    }

    public void setSends(List<SendView> sends) {
        this.sends = sends;
    }
}
