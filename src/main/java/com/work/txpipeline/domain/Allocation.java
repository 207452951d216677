package com.work.txpipeline.domain;

import static com.work.txpipeline.core.support.ValidationUtils.requireNonNegative;
import static com.work.txpipeline.core.support.ValidationUtils.requireNonNull;

/**
 * 一次分配结果：nonce + 费用 + gas limit。
 */
public final class Allocation {

    private final long nonce;
    private final FeeParams fees;
    private final long gasLimit;

    public Allocation(long nonce, FeeParams fees, long gasLimit) {
        this.nonce = requireNonNegative(nonce, "nonce");
        this.fees = requireNonNull(fees, "fees");
        this.gasLimit = requireNonNegative(gasLimit, "gasLimit");
    }

    public long getNonce() {
        return nonce;
    }

    public FeeParams getFees() {
        return fees;
    }

    public long getGasLimit() {
        return gasLimit;
    }

    public Allocation withFees(FeeParams newFees) {
        return new Allocation(nonce, newFees, gasLimit);
    }

    @Override
    public String toString() {
        return "Allocation{nonce=" + nonce + ", " + fees + ", gasLimit=" + gasLimit + "}";
    }
}
